package com.knowledge.extraction.invoke;

import com.knowledge.extraction.core.model.CascadeAttempt;

/**
 * Receives every cascade attempt as it is made. Called on worker threads;
 * implementations must be thread-safe and must not block.
 */
@FunctionalInterface
public interface CascadeAttemptListener {

    void onAttempt(CascadeAttempt attempt);
}
