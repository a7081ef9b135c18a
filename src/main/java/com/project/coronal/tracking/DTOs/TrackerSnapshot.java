package com.project.coronal.tracking.DTOs;

import java.util.List;

/**
 * State of the tracker and its registry.
 *
 * @param state            EMPTY, INITIALIZED or TRACKING
 * @param frameCount       frames ingested since start or last reset
 * @param issuedIdentities number of identities ever issued (ids are 0..issuedIdentities-1)
 * @param historySize      frames currently held in the history window
 * @param identities       one entry per issued identity, ordered by id
 */
public record TrackerSnapshot(
        String state,
        long frameCount,
        int issuedIdentities,
        int historySize,
        List<IdentitySummary> identities
) {
    /**
     * @param latest last sighting, {@code null} when released by the retention policy
     */
    public record IdentitySummary(
            int id,
            String color,
            long firstSeenFrame,
            long lastSeenFrame,
            TrackedContourView latest
    ) {}
}
