package com.project.coronal.tracking.DTOs;

import com.project.coronal.tracking.model.Contour;
import com.project.coronal.tracking.model.ContourFeatures;
import com.project.coronal.tracking.model.PixelBox;

import java.awt.Color;

/** Identity-tagged coronal hole as handed to map building and shown in the result page. */
public record TrackedContourView(
        int id,
        String color,
        int pixelCount,
        double pixelCentroidX,
        double pixelCentroidY,
        double longitudeDeg,
        double latitudeDeg,
        double areaSteradians,
        PixelBox boundingBox,
        double boxAreaSteradians
) {
    public static TrackedContourView of(Contour contour) {
        ContourFeatures f = contour.getFeatures();
        return new TrackedContourView(
                contour.getId(),
                toHex(contour.getColor()),
                f.pixelCount(),
                f.pixelCentroidX(),
                f.pixelCentroidY(),
                Math.toDegrees(f.longitude()),
                Math.toDegrees(f.latitude()),
                f.area(),
                f.boundingBox(),
                f.boxArea());
    }

    public static String toHex(Color color) {
        return color == null ? null : String.format("#%02x%02x%02x", color.getRed(), color.getGreen(), color.getBlue());
    }
}
