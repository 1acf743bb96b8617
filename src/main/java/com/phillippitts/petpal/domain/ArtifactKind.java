package com.phillippitts.petpal.domain;

/** Kind of media artifact a downstream pipeline is asked to materialize. */
public enum ArtifactKind {
    CLIP,
    BOOKMARK
}
