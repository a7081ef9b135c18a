package com.project.coronal.tracking.config;

import com.project.coronal.tracking.service.ColorGenerator;
import com.project.coronal.tracking.service.ContourRenderer;
import com.project.coronal.tracking.service.CoronalHoleTracker;
import com.project.coronal.tracking.service.FeatureExtractor;
import com.project.coronal.tracking.service.PolarProjector;
import com.project.coronal.tracking.service.matching.MatchingStrategy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the tracker from {@code app.tracking.*} properties.
 */
@Configuration
public class TrackingConfig {

    @Value("${app.tracking.history-depth:5}")
    private int historyDepth;

    @Value("${app.tracking.polar-projection:true}")
    private boolean polarProjection;

    @Value("${app.tracking.max-idle-frames:0}")
    private int maxIdleFrames;

    @Bean
    public TrackerSettings trackerSettings() {
        return new TrackerSettings(historyDepth, polarProjection, maxIdleFrames);
    }

    @Bean
    public MatchingStrategy matchingStrategy(@Value("${app.tracking.matching-strategy:greedy}") String name) {
        return MatchingStrategy.forName(name);
    }

    // negative seed: unseeded
    @Bean
    public ColorGenerator colorGenerator(@Value("${app.tracking.color-seed:-1}") long seed) {
        return seed < 0 ? new ColorGenerator() : new ColorGenerator(seed);
    }

    @Bean
    public CoronalHoleTracker coronalHoleTracker(TrackerSettings settings,
                                                 MatchingStrategy matchingStrategy,
                                                 ColorGenerator colorGenerator,
                                                 ContourRenderer renderer,
                                                 FeatureExtractor featureExtractor,
                                                 PolarProjector projector) {
        return new CoronalHoleTracker(settings, matchingStrategy, colorGenerator, renderer, featureExtractor, projector);
    }
}
