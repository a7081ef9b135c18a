package com.project.coronal.tracking.service;

import com.project.coronal.tracking.exceptions.TrackingException;
import com.project.coronal.tracking.model.BoundaryPoint;
import com.project.coronal.tracking.model.Contour;
import com.project.coronal.tracking.model.Frame;
import com.project.coronal.tracking.model.Raster;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.Point;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds coronal-hole boundaries in a grayscale raster. Pixels at or below the binary
 * threshold are dark candidates; every exterior boundary of a dark region enclosing
 * more than the area threshold becomes a {@link Contour}. Nested (interior) boundaries
 * are not reported.
 */
@Service
public class BoundaryExtractor {
    private static final Logger log = LoggerFactory.getLogger(BoundaryExtractor.class);

    public static final int DEFAULT_BINARY_THRESHOLD = 55;
    public static final double DEFAULT_AREA_THRESHOLD = 50;

    static {
        try {
            nu.pattern.OpenCV.loadLocally();
            log.info("OpenCV loaded successfully");
        } catch (Exception | UnsatisfiedLinkError e) {
            log.error("Failed to load OpenCV", e);
        }
    }

    private final int binaryThreshold;
    private final double areaThreshold;

    public BoundaryExtractor(@Value("${app.tracking.binary-threshold:55}") int binaryThreshold,
                             @Value("${app.tracking.area-threshold:50}") double areaThreshold) {
        this.binaryThreshold = binaryThreshold;
        this.areaThreshold = areaThreshold;
        log.info("Boundary extraction: binaryThreshold={}, areaThreshold={}", binaryThreshold, areaThreshold);
    }

    public int getBinaryThreshold() { return binaryThreshold; }

    public double getAreaThreshold() { return areaThreshold; }

    /**
     * Extracts one frame. An empty raster or a threshold outside 0-255 gives an empty frame.
     */
    public Frame extract(Raster gray, long sequenceNumber, Instant timestamp) {
        if (!canExtract(gray, sequenceNumber)) {
            return new Frame(sequenceNumber, timestamp, gray.rows(), gray.cols(), List.of());
        }
        List<Contour> kept = new ArrayList<>();
        for (Point[] candidate : findBoundaries(gray, sequenceNumber)) {
            kept.add(new Contour(toBoundary(candidate)));
        }
        log.debug("Frame #{}: {} contours kept", sequenceNumber, kept.size());
        return new Frame(sequenceNumber, timestamp, gray.rows(), gray.cols(), kept);
    }

    /**
     * Extracts one frame of a full-circle spherical raster, where the last column samples
     * the same longitude as the first. A dark region crossing that seam is reported as a
     * single contour: its boundary continues past the last column, with x coordinates up
     * to {@code 2 * (cols - 1)}, instead of being split at the raster edge.
     */
    public Frame extractPeriodic(Raster gray, long sequenceNumber, Instant timestamp) {
        if (gray.cols() < 3 || !canExtract(gray, sequenceNumber)) {
            return extract(gray, sequenceNumber, timestamp);
        }
        int period = gray.cols() - 1;
        Raster wrapped = wrapColumns(gray, period);

        // every region appears twice in the wrapped raster; keep the copy starting in (0, period].
        // A band around the whole circle touches both edges and is kept once.
        List<Contour> kept = new ArrayList<>();
        int duplicates = 0;
        for (Point[] candidate : findBoundaries(wrapped, sequenceNumber)) {
            int minX = Integer.MAX_VALUE, maxX = -1;
            for (Point p : candidate) {
                minX = Math.min(minX, (int) p.x);
                maxX = Math.max(maxX, (int) p.x);
            }
            boolean encircling = minX == 0 && maxX == wrapped.cols() - 1;
            if ((minX >= 1 && minX <= period) || encircling) {
                kept.add(new Contour(toBoundary(candidate)));
            } else {
                duplicates++;
            }
        }
        log.debug("Frame #{}: {} contours kept, {} wrapped duplicates dropped", sequenceNumber, kept.size(), duplicates);
        return new Frame(sequenceNumber, timestamp, gray.rows(), gray.cols(), kept);
    }

    private boolean canExtract(Raster gray, long sequenceNumber) {
        if (gray.isEmpty()) {
            log.debug("Frame #{}: empty raster, no contours", sequenceNumber);
            return false;
        }
        if (binaryThreshold < 0 || binaryThreshold > 255) {
            log.warn("Frame #{}: binary threshold {} outside 0-255, no contours", sequenceNumber, binaryThreshold);
            return false;
        }
        return true;
    }

    /** Exterior boundaries of dark regions enclosing more than the area threshold. */
    private List<Point[]> findBoundaries(Raster gray, long sequenceNumber) {
        Mat image = rasterToMat(gray);
        Mat binary = new Mat();
        Mat hierarchy = new Mat();
        List<MatOfPoint> found = new ArrayList<>();
        try {
            Imgproc.threshold(image, binary, binaryThreshold, 255, Imgproc.THRESH_BINARY);
            Core.bitwise_not(binary, binary);
            Imgproc.findContours(binary, found, hierarchy, Imgproc.RETR_EXTERNAL, Imgproc.CHAIN_APPROX_NONE);

            List<Point[]> kept = new ArrayList<>();
            int discarded = 0;
            for (MatOfPoint candidate : found) {
                if (Imgproc.contourArea(candidate) > areaThreshold) {
                    kept.add(candidate.toArray());
                } else {
                    discarded++;
                }
            }
            log.debug("Frame #{}: {} regions below area threshold discarded", sequenceNumber, discarded);
            return kept;
        } catch (Exception e) {
            log.error("Boundary extraction failed for frame #{}", sequenceNumber, e);
            throw new TrackingException("Boundary extraction failed: " + e.getMessage(), e);
        } finally {
            image.release();
            binary.release();
            hierarchy.release();
            found.forEach(Mat::release);
        }
    }

    /** Two periods side by side: column c holds source column c mod period. */
    private static Raster wrapColumns(Raster gray, int period) {
        int width = 2 * period;
        Raster wrapped = new Raster(gray.rows(), width);
        for (int row = 0; row < gray.rows(); row++) {
            for (int col = 0; col < width; col++) {
                wrapped.set(row, col, gray.get(row, col % period));
            }
        }
        return wrapped;
    }

    private Mat rasterToMat(Raster raster) {
        int[] values = raster.data();
        byte[] pixels = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            pixels[i] = (byte) Math.max(0, Math.min(255, values[i]));
        }
        Mat mat = new Mat(raster.rows(), raster.cols(), CvType.CV_8UC1);
        mat.put(0, 0, pixels);
        return mat;
    }

    private static List<BoundaryPoint> toBoundary(Point[] points) {
        List<BoundaryPoint> boundary = new ArrayList<>(points.length);
        for (Point p : points) {
            boundary.add(new BoundaryPoint((int) p.x, (int) p.y));
        }
        return boundary;
    }
}
