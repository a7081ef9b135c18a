package com.project.coronal.tracking.service;

import com.project.coronal.tracking.exceptions.TrackingException;

import java.awt.Color;
import java.util.Random;
import java.util.Set;

/**
 * Random display colours for new identities. Channels are drawn from [0, 255), so a
 * colour never equals the white canvas background, and a colour already held by a live
 * identity is drawn again.
 */
public class ColorGenerator {
    private static final int CHANNEL_BOUND = 255;
    private static final int MAX_ATTEMPTS = 10_000;

    private final Random random;

    public ColorGenerator() {
        this(new Random());
    }

    public ColorGenerator(long seed) {
        this(new Random(seed));
    }

    ColorGenerator(Random random) {
        this.random = random;
    }

    public Color next(Set<Color> inUse) {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            Color candidate = new Color(
                    random.nextInt(CHANNEL_BOUND),
                    random.nextInt(CHANNEL_BOUND),
                    random.nextInt(CHANNEL_BOUND));
            if (!inUse.contains(candidate)) {
                return candidate;
            }
        }
        throw new TrackingException("No free colour after " + MAX_ATTEMPTS + " attempts ("
                + inUse.size() + " colours in use)");
    }
}
