package ai.letitride.simulation;

import java.security.SecureRandom;

/**
 * Derives one independent seed per simulation unit from the run's global seed.
 *
 * <p>Unit {@code i}'s seed is the SplitMix64 output for {@code globalSeed + (i + 1) * gamma}, so it
 * depends only on the global seed and the unit index, never on which worker runs the unit or when.
 */
public final class SeedSequence {
    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private SeedSequence() {
    }

    public static long unitSeed(long globalSeed, int unitIndex) {
        if (unitIndex < 0) {
            throw new IllegalArgumentException("Unit index cannot be negative, got " + unitIndex);
        }
        return mix(globalSeed + GOLDEN_GAMMA * (unitIndex + 1L));
    }

    /**
     * A fresh global seed for runs that did not configure one.
     */
    public static long randomSeed() {
        return new SecureRandom().nextLong();
    }

    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
