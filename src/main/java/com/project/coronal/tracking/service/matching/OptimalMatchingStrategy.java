package com.project.coronal.tracking.service.matching;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Minimum total-distance assignment (Hungarian method with row/column potentials).
 * With unequal frame sizes every contour of the smaller side is matched.
 */
public class OptimalMatchingStrategy implements MatchingStrategy {

    @Override
    public List<ContourMatch> match(double[][] distances) {
        int rows = distances.length;
        int cols = distances[0].length;
        boolean transposed = rows > cols;
        double[][] cost = transposed ? transpose(distances) : distances;

        int[] assignment = solve(cost);

        List<ContourMatch> matches = new ArrayList<>();
        for (int i = 0; i < assignment.length; i++) {
            int j = assignment[i];
            int current = transposed ? j : i;
            int previous = transposed ? i : j;
            matches.add(new ContourMatch(current, previous, distances[current][previous]));
        }
        matches.sort(Comparator.comparingDouble(ContourMatch::distance));
        return matches;
    }

    /** Column assigned to each row of an n x m cost matrix with n <= m. */
    private static int[] solve(double[][] cost) {
        int n = cost.length;
        int m = cost[0].length;
        double[] u = new double[n + 1];
        double[] v = new double[m + 1];
        int[] p = new int[m + 1];
        int[] way = new int[m + 1];

        for (int i = 1; i <= n; i++) {
            p[0] = i;
            int j0 = 0;
            double[] minv = new double[m + 1];
            Arrays.fill(minv, Double.POSITIVE_INFINITY);
            boolean[] used = new boolean[m + 1];
            do {
                used[j0] = true;
                int i0 = p[j0];
                double delta = Double.POSITIVE_INFINITY;
                int j1 = 0;
                for (int j = 1; j <= m; j++) {
                    if (used[j]) continue;
                    double cur = cost[i0 - 1][j - 1] - u[i0] - v[j];
                    if (cur < minv[j]) {
                        minv[j] = cur;
                        way[j] = j0;
                    }
                    if (minv[j] < delta) {
                        delta = minv[j];
                        j1 = j;
                    }
                }
                for (int j = 0; j <= m; j++) {
                    if (used[j]) {
                        u[p[j]] += delta;
                        v[j] -= delta;
                    } else {
                        minv[j] -= delta;
                    }
                }
                j0 = j1;
            } while (p[j0] != 0);
            do {
                int j1 = way[j0];
                p[j0] = p[j1];
                j0 = j1;
            } while (j0 != 0);
        }

        int[] assignment = new int[n];
        for (int j = 1; j <= m; j++) {
            if (p[j] != 0) {
                assignment[p[j] - 1] = j - 1;
            }
        }
        return assignment;
    }

    private static double[][] transpose(double[][] matrix) {
        double[][] t = new double[matrix[0].length][matrix.length];
        for (int i = 0; i < matrix.length; i++) {
            for (int j = 0; j < matrix[i].length; j++) {
                t[j][i] = matrix[i][j];
            }
        }
        return t;
    }

    @Override
    public String name() {
        return "optimal";
    }
}
