package com.project.coronal.tracking.service.matching;

import java.util.List;
import java.util.Locale;

/**
 * Pairs contours of the newest frame with contours of the previous frame from their
 * centroid distance matrix. No previous index appears in more than one match.
 */
public interface MatchingStrategy {

    /**
     * @param distances non-empty matrix, rows = newest frame, columns = previous frame
     * @return surviving matches
     */
    List<ContourMatch> match(double[][] distances);

    String name();

    /** {@code greedy} or {@code optimal}, case-insensitive. */
    static MatchingStrategy forName(String name) {
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "greedy":
                return new GreedyMatchingStrategy();
            case "optimal":
                return new OptimalMatchingStrategy();
            default:
                throw new IllegalArgumentException("Unknown matching strategy: " + name + " (expected greedy or optimal)");
        }
    }
}
