package com.knowledge.extraction.glean;

/**
 * Gleaning configuration.
 *
 * @param maxRounds maximum number of continuation rounds per chunk; 0 disables gleaning
 */
public record GleaningConfig(int maxRounds) {

    public static final int DEFAULT_MAX_ROUNDS = 2;

    public GleaningConfig {
        if (maxRounds < 0) {
            throw new IllegalArgumentException("maxRounds must be >= 0");
        }
    }

    public static GleaningConfig defaults() {
        return new GleaningConfig(DEFAULT_MAX_ROUNDS);
    }

    public static GleaningConfig disabled() {
        return new GleaningConfig(0);
    }

    public boolean isEnabled() {
        return maxRounds > 0;
    }
}
