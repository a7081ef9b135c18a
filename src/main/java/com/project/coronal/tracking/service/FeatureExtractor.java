package com.project.coronal.tracking.service;

import com.project.coronal.tracking.model.Contour;
import com.project.coronal.tracking.model.ContourFeatures;
import com.project.coronal.tracking.model.PixelBox;
import com.project.coronal.tracking.model.Raster;
import com.project.coronal.tracking.model.SphericalGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Recovers each contour's pixels from a longitude/latitude label raster and measures
 * the coronal hole on the sphere.
 */
@Component
public class FeatureExtractor {
    private static final Logger log = LoggerFactory.getLogger(FeatureExtractor.class);

    /**
     * Overwrites membership and features of every contour. Contours whose label no longer
     * appears in the raster (completely overdrawn) get {@link ContourFeatures#EMPTY}.
     */
    public void update(List<Contour> contours, Raster labels) {
        if (contours.isEmpty()) {
            return;
        }
        SphericalGrid grid = new SphericalGrid(labels.rows(), labels.cols());

        Map<Integer, Accumulator> byLabel = new HashMap<>();
        for (Contour c : contours) {
            byLabel.put(ContourRenderer.labelOf(c.getId()), new Accumulator());
        }

        int cols = labels.cols();
        int[] data = labels.data();
        for (int index = 0; index < data.length; index++) {
            if (data[index] == ContourRenderer.BACKGROUND) continue;
            Accumulator acc = byLabel.get(data[index]);
            if (acc != null) {
                acc.add(index / cols, index % cols, grid);
            }
        }

        for (Contour c : contours) {
            Accumulator acc = byLabel.get(ContourRenderer.labelOf(c.getId()));
            c.updateFeatures(acc.pixels(cols), acc.toFeatures(grid));
            if (acc.count == 0) {
                log.debug("Contour {} has no visible pixels after fill", c.getId());
            }
        }
    }

    private static final class Accumulator {
        private int[] rowsSeen = new int[64];
        private int[] colsSeen = new int[64];
        private int count;
        private long sumRow, sumCol;
        private int minRow = Integer.MAX_VALUE, minCol = Integer.MAX_VALUE;
        private int maxRow = -1, maxCol = -1;
        private double area, weightedLon, weightedLat;

        void add(int row, int col, SphericalGrid grid) {
            if (count == rowsSeen.length) {
                rowsSeen = Arrays.copyOf(rowsSeen, count * 2);
                colsSeen = Arrays.copyOf(colsSeen, count * 2);
            }
            rowsSeen[count] = row;
            colsSeen[count] = col;
            count++;
            sumRow += row;
            sumCol += col;
            minRow = Math.min(minRow, row);
            maxRow = Math.max(maxRow, row);
            minCol = Math.min(minCol, col);
            maxCol = Math.max(maxCol, col);

            double w = grid.pixelSolidAngle(row);
            area += w;
            weightedLon += w * grid.longitude(col);
            weightedLat += w * grid.latitude(row);
        }

        int[] pixels(int cols) {
            int[] flat = new int[count];
            for (int i = 0; i < count; i++) {
                flat[i] = rowsSeen[i] * cols + colsSeen[i];
            }
            return flat;
        }

        ContourFeatures toFeatures(SphericalGrid grid) {
            if (count == 0) {
                return ContourFeatures.EMPTY;
            }
            double centroidX = (double) sumCol / count;
            double centroidY = (double) sumRow / count;

            double lon, lat;
            if (area > 0) {
                lon = weightedLon / area;
                lat = weightedLat / area;
            } else {
                // pole rows only: every pixel has zero solid angle
                lon = grid.longitude(centroidX);
                lat = grid.latitude(centroidY);
            }

            int width = maxCol - minCol + 1;
            double boxArea = 0;
            for (int row = minRow; row <= maxRow; row++) {
                boxArea += grid.pixelSolidAngle(row) * width;
            }
            PixelBox box = new PixelBox(minCol, minRow, width, maxRow - minRow + 1);
            return new ContourFeatures(count, centroidX, centroidY, lon, lat, box, area, boxArea);
        }
    }
}
