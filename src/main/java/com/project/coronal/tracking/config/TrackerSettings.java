package com.project.coronal.tracking.config;

/**
 * Tracker tuning that is fixed for the tracker's lifetime.
 *
 * @param historyDepth    number of recent frames retained, at least 2
 * @param polarProjection whether frames are extracted in the pole-rotated grid and
 *                        their label rasters must be mapped back before measuring
 * @param maxIdleFrames   frames after which an unseen identity's last sighting is released;
 *                        0 keeps every sighting
 */
public record TrackerSettings(int historyDepth, boolean polarProjection, int maxIdleFrames) {
    public static final int DEFAULT_HISTORY_DEPTH = 5;

    public TrackerSettings {
        if (historyDepth < 2) {
            throw new IllegalArgumentException("History depth must be at least 2, got " + historyDepth);
        }
        if (maxIdleFrames < 0) {
            throw new IllegalArgumentException("Max idle frames must be non-negative, got " + maxIdleFrames);
        }
    }

    public static TrackerSettings defaults() {
        return new TrackerSettings(DEFAULT_HISTORY_DEPTH, true, 0);
    }
}
