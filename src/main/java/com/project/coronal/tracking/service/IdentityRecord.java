package com.project.coronal.tracking.service;

import com.project.coronal.tracking.model.Contour;

import java.awt.Color;

/** Registry entry for one identity: its colour and most recent sighting. */
public class IdentityRecord {
    private final int id;
    private final Color color;
    private final long firstSeenFrame;
    private long lastSeenFrame;
    private Contour latest;

    IdentityRecord(int id, Color color, long frame, Contour sighting) {
        this.id = id;
        this.color = color;
        this.firstSeenFrame = frame;
        this.lastSeenFrame = frame;
        this.latest = sighting;
    }

    public int getId() { return id; }

    public Color getColor() { return color; }

    public long getFirstSeenFrame() { return firstSeenFrame; }

    public long getLastSeenFrame() { return lastSeenFrame; }

    /** Most recent sighting, or {@code null} once released by the retention policy. */
    public Contour getLatest() { return latest; }

    public boolean isReleased() { return latest == null; }

    void sighted(long frame, Contour sighting) {
        this.lastSeenFrame = frame;
        this.latest = sighting;
    }

    void release() {
        this.latest = null;
    }
}
