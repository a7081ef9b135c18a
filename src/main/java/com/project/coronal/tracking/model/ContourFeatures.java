package com.project.coronal.tracking.model;

/**
 * Measurements of one coronal hole taken from its pixel membership in the
 * longitude/latitude raster.
 *
 * @param pixelCount     number of member pixels
 * @param pixelCentroidX mean member column
 * @param pixelCentroidY mean member row
 * @param longitude      solid-angle weighted centroid longitude, radians in [0, 2π]
 * @param latitude       solid-angle weighted centroid latitude, radians in [-π/2, π/2]
 * @param boundingBox    straight bounding box of the member pixels
 * @param area           solid angle covered by the member pixels, steradians
 * @param boxArea        solid angle covered by the bounding box, steradians
 */
public record ContourFeatures(
        int pixelCount,
        double pixelCentroidX,
        double pixelCentroidY,
        double longitude,
        double latitude,
        PixelBox boundingBox,
        double area,
        double boxArea
) {
    /** Features of a contour whose pixels were entirely overdrawn. */
    public static final ContourFeatures EMPTY =
            new ContourFeatures(0, Double.NaN, Double.NaN, Double.NaN, Double.NaN, PixelBox.EMPTY, 0.0, 0.0);

    public boolean isEmpty() {
        return pixelCount == 0;
    }
}
