package com.system.allocator.schemas.algorithm.Genetic;

import java.util.Random;

/**
 * Random source for a single genetic run.
 * Two instances built from the same seed produce the same sequence, which is what
 * makes a run reproducible. Without a seed the sequence comes from system entropy.
 */
public class SeededRandom {

    private final Random random;
    private final String seed;

    private SeededRandom(Random random, String seed) {
        this.random = random;
        this.seed = seed;
    }

    /**
     * @param seed numeric or free-text seed, null for a non-reproducible source
     */
    public static SeededRandom fromSeed(String seed) {
        if (seed == null || seed.isBlank()) {
            return new SeededRandom(new Random(), null);
        }
        return new SeededRandom(new Random(toLong(seed.trim())), seed.trim());
    }

    public static SeededRandom fromSeed(long seed) {
        return new SeededRandom(new Random(seed), Long.toString(seed));
    }

    // Numeric seeds are used as-is, anything else is folded into 64 bits
    private static long toLong(String seed) {
        try {
            return Long.parseLong(seed);
        } catch (NumberFormatException e) {
            long h = 1125899906842597L;
            for (int i = 0; i < seed.length(); i++) {
                h = 31 * h + seed.charAt(i);
            }
            return h;
        }
    }

    /**
     * Uniform integer in [min, max].
     */
    public int intBetween(int min, int max) {
        if (max < min) {
            throw new IllegalArgumentException("max (" + max + ") is lower than min (" + min + ")");
        }
        return min + random.nextInt(max - min + 1);
    }

    /**
     * Uniform real in [min, max). {@code max} itself is never drawn unless it equals {@code min}.
     */
    public double realBetween(double min, double max) {
        if (max < min) {
            throw new IllegalArgumentException("max (" + max + ") is lower than min (" + min + ")");
        }
        return min + random.nextDouble() * (max - min);
    }

    public boolean isSeeded() {
        return seed != null;
    }

    public String getSeed() {
        return seed;
    }
}
