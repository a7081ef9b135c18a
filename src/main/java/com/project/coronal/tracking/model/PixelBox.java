package com.project.coronal.tracking.model;

/** Axis-aligned pixel rectangle, inclusive of its first row and column. */
public record PixelBox(int x, int y, int width, int height) {
    public static final PixelBox EMPTY = new PixelBox(0, 0, 0, 0);

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }
}
