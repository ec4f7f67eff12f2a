package com.example.rpgcampaign.util;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Source of uniform draws in [0, 1) for attack resolution.
 *
 * The default roller uses {@link ThreadLocalRandom}. A seeded roller produces the
 * same sequence of draws for the same seed and serializes access to its generator.
 */
public class HitRoller {

    private final Random random;

    /** Process-wide randomness, no reproducibility. */
    public HitRoller() {
        this.random = null;
    }

    public HitRoller(long seed) {
        this(new Random(seed));
    }

    public HitRoller(Random random) {
        this.random = random;
    }

    public boolean isSeeded() {
        return random != null;
    }

    /**
     * Draw a value in [0, 1).
     */
    public double nextRoll() {
        if (random == null) {
            return ThreadLocalRandom.current().nextDouble();
        }
        synchronized (random) {
            return random.nextDouble();
        }
    }

    /**
     * A draw succeeds iff it is strictly below the chance.
     */
    public static boolean isHit(double roll, double chance) {
        return roll < chance;
    }
}
