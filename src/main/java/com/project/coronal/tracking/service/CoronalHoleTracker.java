package com.project.coronal.tracking.service;

import com.project.coronal.tracking.DTOs.TrackedContourView;
import com.project.coronal.tracking.DTOs.TrackerSnapshot;
import com.project.coronal.tracking.DTOs.TrackingResult;
import com.project.coronal.tracking.config.TrackerSettings;
import com.project.coronal.tracking.model.Contour;
import com.project.coronal.tracking.model.Frame;
import com.project.coronal.tracking.model.Raster;
import com.project.coronal.tracking.service.matching.CentroidDistances;
import com.project.coronal.tracking.service.matching.ContourMatch;
import com.project.coronal.tracking.service.matching.MatchingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Gives coronal holes a persistent identity across a time-ordered sequence of frames.
 *
 * <p>Each ingested frame becomes the newest entry of a fixed-depth history. Its contours
 * are matched against the previous frame by centroid distance; a matched contour inherits
 * the identity and colour of its partner, every other contour is issued the next
 * identity and a fresh colour. The frame is then rendered into a label raster (mapped
 * back to longitude/latitude when frames come from the pole-rotated grid) and each
 * contour's features are recomputed from it.
 *
 * <p>Not thread-safe: frames must be ingested sequentially.
 */
public class CoronalHoleTracker {
    private static final Logger log = LoggerFactory.getLogger(CoronalHoleTracker.class);

    public enum State { EMPTY, INITIALIZED, TRACKING }

    private final TrackerSettings settings;
    private final MatchingStrategy matchingStrategy;
    private final ColorGenerator colorGenerator;
    private final ContourRenderer renderer;
    private final FeatureExtractor featureExtractor;
    private final PolarProjector projector;

    private final Deque<Frame> history = new ArrayDeque<>();
    private final IdentityRegistry registry;
    private long frameCount;

    public CoronalHoleTracker(TrackerSettings settings,
                              MatchingStrategy matchingStrategy,
                              ColorGenerator colorGenerator,
                              ContourRenderer renderer,
                              FeatureExtractor featureExtractor,
                              PolarProjector projector) {
        this.settings = settings;
        this.matchingStrategy = matchingStrategy;
        this.colorGenerator = colorGenerator;
        this.renderer = renderer;
        this.featureExtractor = featureExtractor;
        this.projector = projector;
        this.registry = new IdentityRegistry(settings.maxIdleFrames());
        log.info("Tracker ready: historyDepth={}, matching={}, polarProjection={}, maxIdleFrames={}",
                settings.historyDepth(), matchingStrategy.name(), settings.polarProjection(), settings.maxIdleFrames());
    }

    public TrackingResult ingest(Frame frame) {
        history.addFirst(frame);
        while (history.size() > settings.historyDepth()) {
            history.removeLast();
        }
        frameCount++;

        Frame previous = getPreviousFrame();
        List<ContourMatch> matches = previous == null ? List.of() : match(frame, previous);

        boolean[] matched = new boolean[frame.size()];
        for (ContourMatch m : matches) {
            Contour current = frame.getContours().get(m.currentIndex());
            Contour old = previous.getContours().get(m.previousIndex());
            current.setId(old.getId());
            current.setColor(old.getColor());
            registry.sighted(current, frameCount);
            matched[m.currentIndex()] = true;
        }

        Set<Color> liveColors = liveColors();
        List<Integer> newIdentities = new ArrayList<>();
        for (int i = 0; i < frame.size(); i++) {
            if (matched[i]) continue;
            Color color = colorGenerator.next(liveColors);
            liveColors.add(color);
            IdentityRecord record = registry.issue(frame.getContours().get(i), color, frameCount);
            newIdentities.add(record.getId());
        }
        registry.releaseIdle(frameCount);

        updateFeatures(frame);

        log.info("Frame #{} ingested as frame {}: {} contours, {} matched, {} new (registry size {})",
                frame.getSequenceNumber(), frameCount, frame.size(), matches.size(), newIdentities.size(),
                registry.size());
        return new TrackingResult(frame, List.copyOf(matches), List.copyOf(newIdentities), frameCount);
    }

    private List<ContourMatch> match(Frame current, Frame previous) {
        if (current.isEmpty() || previous.isEmpty()) {
            log.debug("No candidates: current={} contours, previous={} contours", current.size(), previous.size());
            return List.of();
        }
        double[][] distances = CentroidDistances.matrix(current.getCentroids(), previous.getCentroids());
        log.debug("Distance matrix {}x{}", distances.length, distances[0].length);
        return matchingStrategy.match(distances);
    }

    private void updateFeatures(Frame frame) {
        if (frame.isEmpty()) {
            return;
        }
        Raster labels = renderer.render(frame);
        if (settings.polarProjection()) {
            labels = projector.inverse(labels);
        }
        featureExtractor.update(frame.getContours(), labels);
    }

    private Set<Color> liveColors() {
        Set<Color> colors = new HashSet<>();
        for (Frame f : history) {
            for (Contour c : f.getContours()) {
                if (c.getColor() != null) {
                    colors.add(c.getColor());
                }
            }
        }
        return colors;
    }

    public State getState() {
        if (frameCount == 0) return State.EMPTY;
        return frameCount == 1 ? State.INITIALIZED : State.TRACKING;
    }

    /** Newest frame ({@code p1}), or {@code null} before the first frame. */
    public Frame getCurrentFrame() {
        return history.peekFirst();
    }

    /** Frame before the newest one ({@code p2}), or {@code null}. */
    public Frame getPreviousFrame() {
        if (history.size() < 2) {
            return null;
        }
        Iterator<Frame> it = history.iterator();
        it.next();
        return it.next();
    }

    /** Retained frames, newest first. */
    public List<Frame> getHistory() {
        return List.copyOf(history);
    }

    public long getFrameCount() {
        return frameCount;
    }

    public IdentityRegistry getRegistry() {
        return registry;
    }

    public TrackerSettings getSettings() {
        return settings;
    }

    /** Drops history and registry; the next frame starts again from identity 0. */
    public void reset() {
        history.clear();
        registry.clear();
        frameCount = 0;
        log.info("Tracker reset");
    }

    public TrackerSnapshot snapshot() {
        List<TrackerSnapshot.IdentitySummary> identities = new ArrayList<>(registry.size());
        for (IdentityRecord r : registry.records()) {
            identities.add(new TrackerSnapshot.IdentitySummary(
                    r.getId(),
                    TrackedContourView.toHex(r.getColor()),
                    r.getFirstSeenFrame(),
                    r.getLastSeenFrame(),
                    r.isReleased() ? null : TrackedContourView.of(r.getLatest())));
        }
        return new TrackerSnapshot(getState().name(), frameCount, registry.size(), history.size(), identities);
    }
}
