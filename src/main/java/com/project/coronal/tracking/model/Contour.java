package com.project.coronal.tracking.model;

import java.awt.Color;
import java.util.List;

/**
 * One detected coronal hole in one frame.
 *
 * <p>The boundary and its centroid are fixed at extraction. Identity and colour are
 * written by the tracker when the contour is first seen or matched; pixel membership
 * and {@link ContourFeatures} are rewritten by every feature pass.
 */
public class Contour {
    public static final int UNASSIGNED = -1;

    private final List<BoundaryPoint> boundary;
    private final double centroidX;
    private final double centroidY;
    private final double polygonArea;

    private int id = UNASSIGNED;
    private Color color;
    private int[] pixels = new int[0];
    private ContourFeatures features = ContourFeatures.EMPTY;

    public Contour(List<BoundaryPoint> boundary) {
        if (boundary == null || boundary.isEmpty()) {
            throw new IllegalArgumentException("Contour boundary must contain at least one point");
        }
        this.boundary = List.copyOf(boundary);

        // Green's theorem over the closed polygon; same moments as OpenCV computes for a contour.
        double twiceArea = 0, cx = 0, cy = 0;
        int n = this.boundary.size();
        for (int i = 0; i < n; i++) {
            BoundaryPoint a = this.boundary.get(i);
            BoundaryPoint b = this.boundary.get((i + 1) % n);
            double cross = (double) a.x() * b.y() - (double) b.x() * a.y();
            twiceArea += cross;
            cx += (a.x() + b.x()) * cross;
            cy += (a.y() + b.y()) * cross;
        }
        if (Math.abs(twiceArea) < 1e-9) {
            double sx = 0, sy = 0;
            for (BoundaryPoint p : this.boundary) {
                sx += p.x();
                sy += p.y();
            }
            this.centroidX = sx / n;
            this.centroidY = sy / n;
        } else {
            this.centroidX = cx / (3.0 * twiceArea);
            this.centroidY = cy / (3.0 * twiceArea);
        }
        this.polygonArea = Math.abs(twiceArea) / 2.0;
    }

    /** Axis-aligned rectangle traced through the centres of its corner pixels. */
    public static Contour rectangle(int x, int y, int width, int height) {
        return new Contour(List.of(
                new BoundaryPoint(x, y),
                new BoundaryPoint(x, y + height - 1),
                new BoundaryPoint(x + width - 1, y + height - 1),
                new BoundaryPoint(x + width - 1, y)));
    }

    public List<BoundaryPoint> getBoundary() { return boundary; }

    public double getCentroidX() { return centroidX; }

    public double getCentroidY() { return centroidY; }

    /** Area enclosed by the boundary polygon, in pixels. */
    public double getPolygonArea() { return polygonArea; }

    public int getId() { return id; }

    public boolean hasIdentity() { return id != UNASSIGNED; }

    public void setId(int id) {
        if (id < 0) {
            throw new IllegalArgumentException("Identity must be non-negative: " + id);
        }
        this.id = id;
    }

    public Color getColor() { return color; }

    public void setColor(Color color) { this.color = color; }

    /** Flat (row * cols + col) indices into the longitude/latitude raster; a copy. */
    public int[] getPixels() { return pixels.clone(); }

    public ContourFeatures getFeatures() { return features; }

    public void updateFeatures(int[] pixels, ContourFeatures features) {
        this.pixels = pixels.clone();
        this.features = features;
    }

    @Override
    public String toString() {
        return String.format("Contour[id=%d, centroid=(%.1f, %.1f), points=%d]",
                id, centroidX, centroidY, boundary.size());
    }
}
