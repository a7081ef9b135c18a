package com.project.coronal.tracking.service;

import com.project.coronal.tracking.model.BoundaryPoint;
import com.project.coronal.tracking.model.Contour;
import com.project.coronal.tracking.model.Frame;
import com.project.coronal.tracking.model.Raster;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Draws the filled contours of a frame into a label raster: every pixel covered by a
 * contour holds that contour's identity plus one, uncovered pixels hold
 * {@link #BACKGROUND}. Contours are drawn in list order, so a later contour
 * overwrites an earlier one where they overlap.
 *
 * <p>A contour extracted across the longitude seam of a full-circle raster has x
 * coordinates beyond the last column; the overflowing part is wrapped back onto the
 * start of the row.
 */
@Component
public class ContourRenderer {
    public static final int BACKGROUND = 0;

    private static final int MAX_LABEL = 0xFFFFFF;

    public static int labelOf(int identity) {
        if (identity < 0 || identity >= MAX_LABEL) {
            throw new IllegalArgumentException("Identity " + identity + " cannot be encoded as a label");
        }
        return identity + 1;
    }

    public Raster render(Frame frame) {
        int w = frame.getCols(), h = frame.getRows();
        BufferedImage canvas = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = canvas.createGraphics();
        try {
            graphics.setColor(new Color(BACKGROUND));
            graphics.fillRect(0, 0, w, h);
            for (Contour contour : frame.getContours()) {
                if (!contour.hasIdentity()) {
                    throw new IllegalStateException("Cannot render contour without identity: " + contour);
                }
                graphics.setColor(new Color(labelOf(contour.getId())));
                fill(graphics, contour.getBoundary(), 0);
                if (maxX(contour.getBoundary()) >= w) {
                    fill(graphics, contour.getBoundary(), -(w - 1));
                }
            }
        } finally {
            graphics.dispose();
        }

        int[] rgb = new int[w * h];
        canvas.getRGB(0, 0, w, h, rgb, 0, w);
        for (int i = 0; i < rgb.length; i++) {
            rgb[i] &= 0xFFFFFF;
        }
        return new Raster(h, w, rgb);
    }

    private static int maxX(List<BoundaryPoint> boundary) {
        int max = Integer.MIN_VALUE;
        for (BoundaryPoint p : boundary) {
            max = Math.max(max, p.x());
        }
        return max;
    }

    private static void fill(Graphics2D graphics, List<BoundaryPoint> boundary, int shiftX) {
        int n = boundary.size();
        int[] xs = new int[n];
        int[] ys = new int[n];
        for (int i = 0; i < n; i++) {
            xs[i] = boundary.get(i).x() + shiftX;
            ys[i] = boundary.get(i).y();
        }
        graphics.fillPolygon(xs, ys, n);
        // Java2D leaves the right and bottom edges of a filled polygon unpainted; the
        // boundary pixels themselves belong to the region.
        for (int i = 0; i < n; i++) {
            int next = (i + 1) % n;
            graphics.drawLine(xs[i], ys[i], xs[next], ys[next]);
        }
    }
}
