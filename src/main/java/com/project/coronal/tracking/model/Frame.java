package com.project.coronal.tracking.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The contours extracted from one raster. The contour list is fixed; only the
 * contours' identity and feature fields change while the frame is tracked.
 */
public class Frame {
    private final long sequenceNumber;
    private final Instant timestamp;
    private final int rows;
    private final int cols;
    private final List<Contour> contours;

    public Frame(long sequenceNumber, Instant timestamp, int rows, int cols, List<Contour> contours) {
        this.sequenceNumber = sequenceNumber;
        this.timestamp = timestamp;
        this.rows = rows;
        this.cols = cols;
        this.contours = List.copyOf(contours);
    }

    public long getSequenceNumber() { return sequenceNumber; }

    public Instant getTimestamp() { return timestamp; }

    public int getRows() { return rows; }

    public int getCols() { return cols; }

    public List<Contour> getContours() { return contours; }

    public int size() { return contours.size(); }

    public boolean isEmpty() { return contours.isEmpty(); }

    /** Pixel centroids as {x, y} pairs, in contour order. */
    public List<double[]> getCentroids() {
        List<double[]> centroids = new ArrayList<>(contours.size());
        for (Contour c : contours) {
            centroids.add(new double[]{c.getCentroidX(), c.getCentroidY()});
        }
        return centroids;
    }

    @Override
    public String toString() {
        return "Frame[#" + sequenceNumber + ", " + rows + "x" + cols + ", contours=" + contours.size() + "]";
    }
}
