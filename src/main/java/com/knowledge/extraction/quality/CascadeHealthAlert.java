package com.knowledge.extraction.quality;

import java.time.Instant;

/**
 * Raised when too many recent cascades needed the deterministic fallback.
 *
 * @param rank3Share      share of cascades in the window resolved at rank 3
 * @param threshold       configured alert threshold
 * @param cascadesInWindow number of cascades in the window
 * @param timestamp       when the threshold was crossed
 */
public record CascadeHealthAlert(double rank3Share, double threshold, int cascadesInWindow, Instant timestamp) {
}
