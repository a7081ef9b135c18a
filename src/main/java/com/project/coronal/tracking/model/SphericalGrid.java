package com.project.coronal.tracking.model;

/**
 * Colatitude/longitude sampling of a rows x cols raster. Row 0 sits at colatitude π
 * and the last row at 0; column 0 at longitude 0 and the last column at 2π.
 */
public final class SphericalGrid {
    private final int rows;
    private final int cols;
    private final double deltaTheta;
    private final double deltaPhi;

    public SphericalGrid(int rows, int cols) {
        if (rows < 2 || cols < 2) {
            throw new IllegalArgumentException("Spherical grid needs at least 2x2 samples, got " + rows + "x" + cols);
        }
        this.rows = rows;
        this.cols = cols;
        this.deltaTheta = Math.PI / (rows - 1);
        this.deltaPhi = 2 * Math.PI / (cols - 1);
    }

    public int rows() { return rows; }

    public int cols() { return cols; }

    public double deltaTheta() { return deltaTheta; }

    public double deltaPhi() { return deltaPhi; }

    public double theta(int row) { return Math.PI - row * deltaTheta; }

    public double phi(int col) { return col * deltaPhi; }

    public double latitude(double row) { return row * deltaTheta - Math.PI / 2; }

    public double longitude(double col) { return col * deltaPhi; }

    /** Solid angle of one pixel in the given row. */
    public double pixelSolidAngle(int row) {
        return Math.sin(theta(row)) * deltaTheta * deltaPhi;
    }

    /** Nearest row for a colatitude, clamped to the grid. */
    public int rowOf(double theta) {
        return clamp((int) Math.round((Math.PI - Math.abs(theta)) / deltaTheta), rows);
    }

    /** Nearest column for a longitude in [0, 2π), clamped to the grid. */
    public int colOf(double phi) {
        return clamp((int) Math.round(phi / deltaPhi), cols);
    }

    private static int clamp(int index, int size) {
        return index < 0 ? 0 : Math.min(index, size - 1);
    }
}
