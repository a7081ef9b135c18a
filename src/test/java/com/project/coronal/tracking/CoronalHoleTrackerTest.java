package com.project.coronal.tracking;

import com.project.coronal.tracking.DTOs.TrackerSnapshot;
import com.project.coronal.tracking.DTOs.TrackingResult;
import com.project.coronal.tracking.config.TrackerSettings;
import com.project.coronal.tracking.model.Contour;
import com.project.coronal.tracking.model.Frame;
import com.project.coronal.tracking.service.ColorGenerator;
import com.project.coronal.tracking.service.CoronalHoleTracker;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.project.coronal.tracking.TrackerFixtures.frame;
import static com.project.coronal.tracking.TrackerFixtures.squareAt;
import static com.project.coronal.tracking.TrackerFixtures.tracker;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CoronalHoleTrackerTest {

    @Test
    void firstFrame_issuesSequentialIdentitiesAndDistinctColours() {
        CoronalHoleTracker tracker = tracker("greedy");
        assertThat(tracker.getState()).isEqualTo(CoronalHoleTracker.State.EMPTY);

        TrackingResult result = tracker.ingest(frame(0, squareAt(10, 10), squareAt(50, 50), squareAt(80, 20)));

        assertThat(tracker.getState()).isEqualTo(CoronalHoleTracker.State.INITIALIZED);
        assertThat(result.matches()).isEmpty();
        assertThat(result.newIdentities()).containsExactly(0, 1, 2);
        assertThat(result.frame().getContours()).extracting(Contour::getId).containsExactly(0, 1, 2);
        Set<Color> colours = result.frame().getContours().stream().map(Contour::getColor).collect(Collectors.toSet());
        assertThat(colours).hasSize(3).doesNotContainNull().doesNotContain(Color.WHITE);
        assertThat(tracker.getRegistry().size()).isEqualTo(3);
        assertThat(tracker.getPreviousFrame()).isNull();
    }

    @Test
    void nearbyContourKeepsIdentity_newContourGetsNextIdentity() {
        CoronalHoleTracker tracker = tracker("greedy");
        Frame a = frame(0, squareAt(10, 10));
        tracker.ingest(a);
        Contour original = a.getContours().get(0);

        Frame b = frame(1, squareAt(12, 11), squareAt(80, 80));
        TrackingResult result = tracker.ingest(b);

        Contour moved = b.getContours().get(0);
        Contour appeared = b.getContours().get(1);
        assertThat(moved.getId()).isEqualTo(original.getId()).isZero();
        assertThat(moved.getColor()).isEqualTo(original.getColor());
        assertThat(appeared.getId()).isEqualTo(1);
        assertThat(appeared.getColor()).isNotNull().isNotEqualTo(original.getColor());
        assertThat(result.newIdentities()).containsExactly(1);
        assertThat(result.matches()).hasSize(1);
        assertThat(result.matches().get(0).distance()).isCloseTo(Math.sqrt(5), within(1e-9));
        assertThat(tracker.getState()).isEqualTo(CoronalHoleTracker.State.TRACKING);
        assertThat(tracker.getRegistry().get(0).getLatest()).isSameAs(moved);
    }

    @Test
    void crossingPaths_greedyFollowsPriorityOrderEvenWhenSuboptimal() {
        CoronalHoleTracker tracker = tracker("greedy");
        tracker.ingest(frame(0, squareAt(20, 50), squareAt(40, 50)));

        Frame next = frame(1, squareAt(36, 50), squareAt(41, 50));
        TrackingResult result = tracker.ingest(next);

        // both propose previous #1; the closer one (41,50) wins, (36,50) becomes new
        assertThat(next.getContours().get(1).getId()).isEqualTo(1);
        assertThat(next.getContours().get(0).getId()).isEqualTo(2);
        assertThat(result.newIdentities()).containsExactly(2);
    }

    @Test
    void crossingPaths_optimalStrategyMinimisesTotalDistance() {
        CoronalHoleTracker tracker = tracker("optimal");
        tracker.ingest(frame(0, squareAt(20, 50), squareAt(40, 50)));

        Frame next = frame(1, squareAt(36, 50), squareAt(41, 50));
        TrackingResult result = tracker.ingest(next);

        assertThat(next.getContours()).extracting(Contour::getId).containsExactly(0, 1);
        assertThat(result.newIdentities()).isEmpty();
    }

    @Test
    void emptyFrames_areNotErrors_andEverythingAfterThemIsNew() {
        CoronalHoleTracker tracker = tracker("greedy");

        TrackingResult first = tracker.ingest(frame(0));
        assertThat(first.newIdentities()).isEmpty();

        tracker.ingest(frame(1, squareAt(30, 30)));
        TrackingResult gap = tracker.ingest(frame(2));
        assertThat(gap.matches()).isEmpty();
        assertThat(gap.newIdentities()).isEmpty();

        TrackingResult back = tracker.ingest(frame(3, squareAt(30, 30)));
        assertThat(back.matches()).isEmpty();
        assertThat(back.newIdentities()).containsExactly(1);
        assertThat(tracker.getFrameCount()).isEqualTo(4);
    }

    @Test
    void history_keepsConfiguredDepthNewestFirst() {
        CoronalHoleTracker tracker = tracker("greedy");
        for (int i = 0; i < 7; i++) {
            tracker.ingest(frame(i, squareAt(20 + i, 20)));
        }

        assertThat(tracker.getHistory()).extracting(Frame::getSequenceNumber).containsExactly(6L, 5L, 4L, 3L, 2L);
        assertThat(tracker.getCurrentFrame().getSequenceNumber()).isEqualTo(6);
        assertThat(tracker.getPreviousFrame().getSequenceNumber()).isEqualTo(5);
        // the square drifted one pixel per frame and kept its identity throughout
        assertThat(tracker.getRegistry().size()).isEqualTo(1);
    }

    @Test
    void identitiesAreDenseMonotonicAndEveryCurrentContourIsTagged() {
        CoronalHoleTracker tracker = tracker("greedy");
        Random random = new Random(3);
        int seen = 0;
        List<Integer> issued = new ArrayList<>();

        for (int f = 0; f < 30; f++) {
            int n = random.nextInt(5);
            Contour[] contours = new Contour[n];
            for (int k = 0; k < n; k++) {
                contours[k] = squareAt(6 + random.nextInt(88), 6 + random.nextInt(88));
            }
            seen += n;
            TrackingResult result = tracker.ingest(frame(f, contours));
            issued.addAll(result.newIdentities());

            Set<Color> colours = new HashSet<>();
            for (Contour c : result.frame().getContours()) {
                assertThat(c.hasIdentity()).isTrue();
                assertThat(c.getColor()).isNotNull();
                assertThat(colours.add(c.getColor())).as("colour unique within frame").isTrue();
            }
        }

        int m = tracker.getRegistry().size();
        assertThat(m).isLessThanOrEqualTo(seen);
        assertThat(issued).hasSize(m).doesNotHaveDuplicates().isSorted();
        assertThat(new TreeSet<>(issued)).containsExactlyElementsOf(
                IntStream.range(0, m).boxed().toList());
    }

    @Test
    void featurePass_populatesMeasurementsOfCurrentFrame() {
        CoronalHoleTracker tracker = tracker("greedy");
        TrackingResult result = tracker.ingest(frame(0, squareAt(30, 40)));

        Contour c = result.frame().getContours().get(0);
        assertThat(c.getFeatures().isEmpty()).isFalse();
        assertThat(c.getFeatures().pixelCentroidX()).isCloseTo(30.0, within(0.5));
        assertThat(c.getFeatures().pixelCentroidY()).isCloseTo(40.0, within(0.5));
        assertThat(c.getFeatures().area()).isPositive();
        assertThat(c.getFeatures().boxArea()).isGreaterThanOrEqualTo(c.getFeatures().area());
        assertThat(c.getPixels()).hasSize(c.getFeatures().pixelCount());
    }

    @Test
    void polarProjectionMode_measuresInLongitudeLatitudeFrame() {
        CoronalHoleTracker tracker = tracker("greedy", new TrackerSettings(5, true, 0));

        TrackingResult result = tracker.ingest(frame(0, squareAt(50, 50)));

        Contour c = result.frame().getContours().get(0);
        assertThat(c.getFeatures().isEmpty()).isFalse();
        assertThat(c.getFeatures().area()).isPositive();
    }

    @Test
    void retention_releasesIdleSightingsButKeepsRecords() {
        CoronalHoleTracker tracker = tracker("greedy", new TrackerSettings(5, false, 1));
        tracker.ingest(frame(0, squareAt(20, 20)));
        tracker.ingest(frame(1, squareAt(70, 70)));   // no distance gate: still identity 0
        tracker.ingest(frame(2));
        tracker.ingest(frame(3));

        TrackerSnapshot snapshot = tracker.snapshot();
        assertThat(snapshot.issuedIdentities()).isEqualTo(1);
        assertThat(snapshot.identities()).hasSize(1);
        assertThat(snapshot.identities().get(0).lastSeenFrame()).isEqualTo(2);
        assertThat(snapshot.identities().get(0).latest()).isNull();
        assertThat(tracker.getRegistry().get(0).isReleased()).isTrue();
    }

    @Test
    void snapshotAndReset() {
        CoronalHoleTracker tracker = tracker("greedy");
        tracker.ingest(frame(0, squareAt(20, 20), squareAt(60, 60)));
        tracker.ingest(frame(1, squareAt(21, 20)));

        TrackerSnapshot snapshot = tracker.snapshot();
        assertThat(snapshot.state()).isEqualTo("TRACKING");
        assertThat(snapshot.frameCount()).isEqualTo(2);
        assertThat(snapshot.issuedIdentities()).isEqualTo(2);
        assertThat(snapshot.historySize()).isEqualTo(2);
        assertThat(snapshot.identities().get(0).latest().pixelCentroidX()).isCloseTo(21.0, within(0.5));
        assertThat(snapshot.identities().get(1).lastSeenFrame()).isEqualTo(1);

        tracker.reset();
        assertThat(tracker.getState()).isEqualTo(CoronalHoleTracker.State.EMPTY);
        TrackingResult again = tracker.ingest(frame(0, squareAt(40, 40)));
        assertThat(again.newIdentities()).containsExactly(0);
    }

    @Test
    void newIdentity_avoidsColourStillHeldByPreviousFrame() {
        ScriptedColors colors = new ScriptedColors(Color.RED, Color.BLUE, Color.BLUE, Color.GREEN);
        CoronalHoleTracker tracker = tracker("greedy", new TrackerSettings(5, false, 0), colors);
        tracker.ingest(frame(0, squareAt(20, 20), squareAt(80, 80)));

        // the blue hole is gone; the newcomer's nearest predecessor is the red one, already claimed
        Frame next = frame(1, squareAt(22, 20), squareAt(20, 45));
        TrackingResult result = tracker.ingest(next);

        assertThat(result.newIdentities()).containsExactly(2);
        Contour newcomer = next.getContours().get(1);
        assertThat(newcomer.getColor()).isEqualTo(Color.GREEN);
        assertThat(colors.lastInUse).contains(Color.RED, Color.BLUE);
    }

    /** Hands out colours in a fixed order, skipping any the tracker reports as in use. */
    private static final class ScriptedColors extends ColorGenerator {
        private final Deque<Color> script;
        private Set<Color> lastInUse = Set.of();

        ScriptedColors(Color... colors) {
            this.script = new ArrayDeque<>(List.of(colors));
        }

        @Override
        public Color next(Set<Color> inUse) {
            lastInUse = Set.copyOf(inUse);
            Color candidate = script.poll();
            while (candidate != null && inUse.contains(candidate)) {
                candidate = script.poll();
            }
            if (candidate == null) {
                throw new IllegalStateException("Colour script exhausted");
            }
            return candidate;
        }
    }
}
