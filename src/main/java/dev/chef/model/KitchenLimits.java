package dev.chef.model;

/**
 * Safety limits and tuning for running a program.
 */
public record KitchenLimits(
    int maxCallDepth,
    long maxSteps, // 0 = unlimited
    Long seed      // nullable, seeds the shuffle used by Mix
) {
    public static final int DEFAULT_MAX_CALL_DEPTH = 512;
    public static final long DEFAULT_MAX_STEPS = 0;

    public KitchenLimits {
        if (maxCallDepth < 1) {
            throw new IllegalArgumentException("maxCallDepth must be at least 1, got " + maxCallDepth);
        }
        if (maxSteps < 0) {
            throw new IllegalArgumentException("maxSteps must not be negative, got " + maxSteps);
        }
    }

    public static KitchenLimits defaults() {
        return new KitchenLimits(DEFAULT_MAX_CALL_DEPTH, DEFAULT_MAX_STEPS, null);
    }

    public KitchenLimits withMaxCallDepth(int depth) {
        return new KitchenLimits(depth, maxSteps, seed);
    }

    public KitchenLimits withMaxSteps(long steps) {
        return new KitchenLimits(maxCallDepth, steps, seed);
    }

    public KitchenLimits withSeed(Long newSeed) {
        return new KitchenLimits(maxCallDepth, maxSteps, newSeed);
    }
}
