package com.servicetracker.run;

import com.servicetracker.domain.ResolvedRequest;

import java.util.Optional;

/**
 * Side store of resolved service requests keyed by run id, read later by the run pipeline.
 */
public interface RequestMemory {

    void put(String runId, ResolvedRequest request);

    Optional<ResolvedRequest> get(String runId);

    /** Removes and returns the entry. */
    Optional<ResolvedRequest> take(String runId);
}
