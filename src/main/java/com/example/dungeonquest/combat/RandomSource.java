package com.example.dungeonquest.combat;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Source of the random rolls used by combat (damage spread, flee chance) and exploration.
 * Tests pass a lambda returning fixed values or a seeded source.
 */
@FunctionalInterface
public interface RandomSource {

    /**
     * @return a value in [0.0, 1.0)
     */
    double nextDouble();

    /**
     * A value spread uniformly between min and max.
     */
    default double uniform(double min, double max) {
        return min + (max - min) * nextDouble();
    }

    /**
     * An integer between minInclusive and maxInclusive.
     */
    default int nextInt(int minInclusive, int maxInclusive) {
        int span = maxInclusive - minInclusive + 1;
        int offset = (int) (nextDouble() * span);
        return Math.min(maxInclusive, minInclusive + offset);
    }

    /**
     * Roll against a probability.
     * @return true if the roll is strictly below chance
     */
    default boolean chance(double chance) {
        return nextDouble() < chance;
    }

    /** Non-deterministic source for normal play. */
    static RandomSource threadLocal() {
        return () -> ThreadLocalRandom.current().nextDouble();
    }

    /** Reproducible source: the same seed gives the same sequence of rolls. */
    static RandomSource seeded(long seed) {
        Random random = new Random(seed);
        return random::nextDouble;
    }
}
