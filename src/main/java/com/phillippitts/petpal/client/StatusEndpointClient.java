package com.phillippitts.petpal.client;

import com.phillippitts.petpal.domain.CommandSnapshot;

import java.util.Optional;

/**
 * Pull backend: reads one command snapshot from the status endpoint.
 */
@FunctionalInterface
public interface StatusEndpointClient {

    /**
     * @return the snapshot, or empty if the request id is unknown or evicted
     */
    Optional<CommandSnapshot> fetch(String requestId);
}
