package com.project.coronal.tracking.model;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Row-major integer grid. Holds grayscale intensities (0-255) for input images and
 * identity labels for rendered frames.
 */
public final class Raster {
    private final int rows;
    private final int cols;
    private final int[] data;

    public Raster(int rows, int cols) {
        this(rows, cols, new int[Math.max(0, rows) * Math.max(0, cols)]);
    }

    public Raster(int rows, int cols, int[] data) {
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException("Raster dimensions must be non-negative: " + rows + "x" + cols);
        }
        if (data == null || data.length != rows * cols) {
            throw new IllegalArgumentException("Raster data length " + (data == null ? "null" : data.length)
                    + " does not match " + rows + "x" + cols);
        }
        this.rows = rows;
        this.cols = cols;
        this.data = data;
    }

    /** Luminance of every pixel (Rec. 709 weights), rounded to 0-255. */
    public static Raster fromImage(BufferedImage image) {
        int w = image.getWidth(), h = image.getHeight();
        int[] argb = new int[w * h];
        image.getRGB(0, 0, w, h, argb, 0, w);
        int[] gray = new int[w * h];
        for (int i = 0; i < argb.length; i++) {
            int p = argb[i];
            int r = (p >> 16) & 0xFF, g = (p >> 8) & 0xFF, b = p & 0xFF;
            gray[i] = (int) Math.round(0.2126 * r + 0.7152 * g + 0.0722 * b);
        }
        return new Raster(h, w, gray);
    }

    public int rows() { return rows; }

    public int cols() { return cols; }

    public boolean isEmpty() { return rows == 0 || cols == 0; }

    public int get(int row, int col) { return data[row * cols + col]; }

    public void set(int row, int col, int value) { data[row * cols + col] = value; }

    public int getAt(int index) { return data[index]; }

    /** Backing array; callers that mutate it mutate the raster. */
    public int[] data() { return data; }

    public Raster copy() { return new Raster(rows, cols, Arrays.copyOf(data, data.length)); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Raster other)) return false;
        return rows == other.rows && cols == other.cols && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + cols) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Raster[" + rows + "x" + cols + "]";
    }
}
