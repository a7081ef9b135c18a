package com.project.coronal.tracking.service.matching;

/**
 * A surviving pairing between a contour of the newest frame and one of the previous frame.
 *
 * @param currentIndex  index into the newest frame's contour list
 * @param previousIndex index into the previous frame's contour list
 * @param distance      centroid distance in pixels
 */
public record ContourMatch(int currentIndex, int previousIndex, double distance) {}
