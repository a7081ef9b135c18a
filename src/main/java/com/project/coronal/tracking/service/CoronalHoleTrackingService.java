package com.project.coronal.tracking.service;

import com.project.coronal.tracking.DTOs.TrackerSnapshot;
import com.project.coronal.tracking.DTOs.TrackingResult;
import com.project.coronal.tracking.model.Frame;
import com.project.coronal.tracking.model.Raster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Runs one corrected longitude/latitude raster through detection and tracking:
 * rotate the poles onto the equator (when enabled), extract boundaries, ingest the
 * frame. Both grids span the full circle of longitude, so a hole crossing the
 * first/last column is extracted as one contour. Calls are serialized because every
 * frame depends on the identities of the one before it.
 */
@Service
public class CoronalHoleTrackingService {
    private static final Logger log = LoggerFactory.getLogger(CoronalHoleTrackingService.class);

    private final BoundaryExtractor boundaryExtractor;
    private final PolarProjector projector;
    private final CoronalHoleTracker tracker;
    private long nextSequenceNumber;

    public CoronalHoleTrackingService(BoundaryExtractor boundaryExtractor,
                                      PolarProjector projector,
                                      CoronalHoleTracker tracker) {
        this.boundaryExtractor = boundaryExtractor;
        this.projector = projector;
        this.tracker = tracker;
    }

    public synchronized TrackingResult process(Raster lonLatImage, Instant timestamp) {
        long sequence = nextSequenceNumber++;
        log.info("Processing raster #{} ({}x{}) at {}", sequence, lonLatImage.rows(), lonLatImage.cols(), timestamp);

        Raster working = lonLatImage;
        if (tracker.getSettings().polarProjection() && !lonLatImage.isEmpty()) {
            working = projector.forward(lonLatImage);
        }
        Frame frame = boundaryExtractor.extractPeriodic(working, sequence, timestamp);
        return tracker.ingest(frame);
    }

    public synchronized TrackerSnapshot snapshot() {
        return tracker.snapshot();
    }

    public synchronized long getFrameCount() {
        return tracker.getFrameCount();
    }

    public synchronized void reset() {
        tracker.reset();
        nextSequenceNumber = 0;
    }
}
