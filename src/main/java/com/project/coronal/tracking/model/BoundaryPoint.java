package com.project.coronal.tracking.model;

/** A boundary vertex in pixel space: x is the column, y the row. */
public record BoundaryPoint(int x, int y) {}
