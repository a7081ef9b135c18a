package com.project.coronal.tracking.service;

import com.project.coronal.tracking.model.Raster;
import com.project.coronal.tracking.model.SphericalGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rotates a longitude/latitude raster by 90° about the x axis so that the polar caps
 * land on the equator of the working grid, and back again.
 *
 * <p>Each output pixel (θ, φ) is converted to Cartesian (x, y, z), rotated, converted back
 * to the source (θ', φ') and filled from the nearest source pixel. Forward sampling uses
 * (x, y, z) → (x, −z, y), the inverse (x, y, z) → (x, z, −y). Resampling is nearest
 * neighbour: several output pixels near a pole can read the same source pixel, so
 * {@code inverse(forward(r))} reproduces {@code r} only away from the poles.
 */
@Service
public class PolarProjector {
    private static final Logger log = LoggerFactory.getLogger(PolarProjector.class);

    private enum Direction { FORWARD, INVERSE }

    private record TableKey(int rows, int cols, Direction direction) {}

    /** Each table holds rows x cols ints; keep only the most recently used ones. */
    public static final int MAX_CACHED_TABLES = 4;

    private final Map<TableKey, int[]> tables = Collections.synchronizedMap(
            new LinkedHashMap<TableKey, int[]>(MAX_CACHED_TABLES * 2, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<TableKey, int[]> eldest) {
                    if (size() > MAX_CACHED_TABLES) {
                        log.debug("Evicting {} projection table for {}x{} raster",
                                eldest.getKey().direction(), eldest.getKey().rows(), eldest.getKey().cols());
                        return true;
                    }
                    return false;
                }
            });

    /** Moves the poles of a longitude/latitude raster onto the equator. */
    public Raster forward(Raster raster) {
        return remap(raster, Direction.FORWARD);
    }

    /** Maps a raster produced in the rotated grid back to longitude/latitude. */
    public Raster inverse(Raster raster) {
        return remap(raster, Direction.INVERSE);
    }

    /** Number of lookup tables currently held. */
    public int cachedTables() {
        return tables.size();
    }

    private Raster remap(Raster source, Direction direction) {
        int[] table = tables.computeIfAbsent(new TableKey(source.rows(), source.cols(), direction), this::buildTable);
        int[] out = new int[table.length];
        for (int i = 0; i < table.length; i++) {
            out[i] = source.getAt(table[i]);
        }
        return new Raster(source.rows(), source.cols(), out);
    }

    private int[] buildTable(TableKey key) {
        SphericalGrid grid = new SphericalGrid(key.rows(), key.cols());
        int[] table = new int[key.rows() * key.cols()];
        double sign = key.direction() == Direction.FORWARD ? 1.0 : -1.0;

        for (int i = 0; i < key.rows(); i++) {
            double sinT = Math.sin(grid.theta(i));
            double cosT = Math.cos(grid.theta(i));
            for (int j = 0; j < key.cols(); j++) {
                double sinP = Math.sin(grid.phi(j));
                double cosP = Math.cos(grid.phi(j));

                double theta = Math.acos(clampUnit(sign * sinT * sinP));
                double phi = Math.atan2(-sign * cosT, sinT * cosP);
                if (phi < 0) {
                    phi += 2 * Math.PI;
                }
                table[i * key.cols() + j] = grid.rowOf(theta) * key.cols() + grid.colOf(phi);
            }
        }
        log.debug("Built {} projection table for {}x{} raster", key.direction(), key.rows(), key.cols());
        return table;
    }

    private static double clampUnit(double v) {
        return v < -1 ? -1 : Math.min(v, 1);
    }
}
