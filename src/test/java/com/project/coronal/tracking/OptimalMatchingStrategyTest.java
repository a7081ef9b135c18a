package com.project.coronal.tracking;

import com.project.coronal.tracking.service.matching.ContourMatch;
import com.project.coronal.tracking.service.matching.MatchingStrategy;
import com.project.coronal.tracking.service.matching.OptimalMatchingStrategy;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class OptimalMatchingStrategyTest {
    private final OptimalMatchingStrategy strategy = new OptimalMatchingStrategy();

    @Test
    void crossingPaths_resolvedByTotalDistance() {
        double[][] d = {
                {16.0, 4.0},
                {21.0, 1.0}
        };

        List<ContourMatch> matches = strategy.match(d);

        assertThat(matches).containsExactly(
                new ContourMatch(1, 1, 1.0),
                new ContourMatch(0, 0, 16.0));
    }

    @Test
    void rectangularMatrices_matchEveryContourOfTheSmallerSide() {
        double[][] wide = {{3, 1, 2}};
        assertThat(strategy.match(wide)).containsExactly(new ContourMatch(0, 1, 1.0));

        double[][] tall = {{3}, {1}, {2}};
        assertThat(strategy.match(tall)).containsExactly(new ContourMatch(1, 0, 1.0));
    }

    @Test
    void totalCostMatchesBruteForce() {
        Random random = new Random(11);
        for (int trial = 0; trial < 100; trial++) {
            int n = 1 + random.nextInt(5), m = 1 + random.nextInt(5);
            double[][] d = new double[n][m];
            for (int i = 0; i < n; i++)
                for (int j = 0; j < m; j++)
                    d[i][j] = random.nextInt(50);

            List<ContourMatch> matches = strategy.match(d);

            assertThat(matches).hasSize(Math.min(n, m));
            double total = matches.stream().mapToDouble(ContourMatch::distance).sum();
            assertThat(total).isCloseTo(bruteForce(d, 0, new boolean[m], Math.min(n, m)), within(1e-9));
        }
    }

    @Test
    void strategiesResolvedByName() {
        assertThat(MatchingStrategy.forName("Optimal").name()).isEqualTo("optimal");
        assertThat(MatchingStrategy.forName(" greedy ").name()).isEqualTo("greedy");
        assertThatThrownBy(() -> MatchingStrategy.forName("hungarian"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // minimum cost of assigning min(n, m) pairs, rows may be skipped when n > m
    private static double bruteForce(double[][] d, int row, boolean[] used, int remaining) {
        if (remaining == 0) return 0;
        if (row == d.length) return Double.POSITIVE_INFINITY;
        double best = Double.POSITIVE_INFINITY;
        if (d.length - row > remaining) {
            best = bruteForce(d, row + 1, used, remaining);
        }
        for (int j = 0; j < used.length; j++) {
            if (used[j]) continue;
            used[j] = true;
            best = Math.min(best, d[row][j] + bruteForce(d, row + 1, used, remaining - 1));
            used[j] = false;
        }
        return best;
    }
}
