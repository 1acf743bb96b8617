/**
 * Detection-to-event pipeline: derivation rules, the flush buffer and batch writer, the sequence
 * matcher that requests clips and the activity rule that requests bookmarks.
 */
package com.phillippitts.petpal.service.events;
