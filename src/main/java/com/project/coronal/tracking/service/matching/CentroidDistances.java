package com.project.coronal.tracking.service.matching;

import java.util.List;

/** Pairwise Euclidean distances between two centroid lists. */
public final class CentroidDistances {

    private CentroidDistances() {
    }

    /**
     * Rows follow {@code current}, columns follow {@code previous}.
     *
     * @throws IllegalArgumentException if either list is empty
     */
    public static double[][] matrix(List<double[]> current, List<double[]> previous) {
        if (current.isEmpty() || previous.isEmpty()) {
            throw new IllegalArgumentException("Distance matrix needs centroids on both sides (current="
                    + current.size() + ", previous=" + previous.size() + ")");
        }
        double[][] distances = new double[current.size()][previous.size()];
        for (int i = 0; i < current.size(); i++) {
            double[] a = current.get(i);
            for (int j = 0; j < previous.size(); j++) {
                double[] b = previous.get(j);
                distances[i][j] = Math.hypot(a[0] - b[0], a[1] - b[1]);
            }
        }
        return distances;
    }
}
