package com.project.coronal.tracking.service.matching;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Nearest-neighbour matching in priority order.
 *
 * <p>Every new contour proposes its nearest previous contour. Proposals are ranked by
 * that distance, closest first (ties keep row order), and accepted in rank order
 * unless the previous contour was already claimed. A rejected contour does not fall
 * back to its second-nearest candidate, so the result is not a minimum-cost assignment.
 */
public class GreedyMatchingStrategy implements MatchingStrategy {

    @Override
    public List<ContourMatch> match(double[][] distances) {
        List<ContourMatch> queue = priorityQueue(distances);

        boolean[] claimed = new boolean[distances[0].length];
        List<ContourMatch> surviving = new ArrayList<>(queue.size());
        for (ContourMatch candidate : queue) {
            if (!claimed[candidate.previousIndex()]) {
                claimed[candidate.previousIndex()] = true;
                surviving.add(candidate);
            }
        }
        return surviving;
    }

    /** One candidate per row: its nearest column, rows ordered by that distance. */
    List<ContourMatch> priorityQueue(double[][] distances) {
        List<ContourMatch> queue = new ArrayList<>(distances.length);
        for (int row = 0; row < distances.length; row++) {
            int best = 0;
            for (int col = 1; col < distances[row].length; col++) {
                if (distances[row][col] < distances[row][best]) {
                    best = col;
                }
            }
            queue.add(new ContourMatch(row, best, distances[row][best]));
        }
        queue.sort(Comparator.comparingDouble(ContourMatch::distance));
        return queue;
    }

    @Override
    public String name() {
        return "greedy";
    }
}
