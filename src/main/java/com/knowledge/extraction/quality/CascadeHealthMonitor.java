package com.knowledge.extraction.quality;

import com.knowledge.extraction.core.model.CascadeAttempt;
import com.knowledge.extraction.core.model.ModelDescriptor;
import com.knowledge.extraction.invoke.CascadeAttemptListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Watches the share of cascades that fell through to rank 3 over a sliding
 * window of the most recent attempts.
 *
 * <p>A cascade counts as resolved at rank 3 if any of its attempts in the window
 * has rank 3. An alert fires once when the share rises above the threshold and is
 * re-armed when it drops back. The monitor never blocks the caller beyond a short
 * critical section.</p>
 */
public class CascadeHealthMonitor implements CascadeAttemptListener {
    private static final Logger log = LoggerFactory.getLogger(CascadeHealthMonitor.class);

    private final int windowSize;
    private final double threshold;
    private final int minCascades;
    private final List<Consumer<CascadeHealthAlert>> listeners = new CopyOnWriteArrayList<>();

    private final Deque<CascadeAttempt> window = new ArrayDeque<>();
    // cascadeId -> {attempts in window, rank-3 attempts in window}
    private final Map<String, int[]> cascades = new HashMap<>();
    private int rank3Cascades;
    private boolean alerting;

    public CascadeHealthMonitor(QualityGateConfig config) {
        Objects.requireNonNull(config, "config is required");
        this.windowSize = config.getHealthWindowSize();
        this.threshold = config.getRank3AlertThreshold();
        this.minCascades = config.getMinCascadesForAlert();
    }

    public void addListener(Consumer<CascadeHealthAlert> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener is required"));
    }

    @Override
    public void onAttempt(CascadeAttempt attempt) {
        CascadeHealthAlert alert = null;
        synchronized (this) {
            add(attempt);
            if (window.size() > windowSize) {
                remove(window.removeFirst());
            }
            double share = rank3Share();
            if (!alerting && cascades.size() >= minCascades && share > threshold) {
                alerting = true;
                alert = new CascadeHealthAlert(share, threshold, cascades.size(), Instant.now());
            } else if (alerting && share <= threshold) {
                alerting = false;
                log.info("cascade.health.recovered rank3Share={} threshold={}", share, threshold);
            }
        }
        if (alert != null) {
            log.warn("cascade.health.alert rank3Share={} threshold={} cascades={}",
                    alert.rank3Share(), alert.threshold(), alert.cascadesInWindow());
            for (Consumer<CascadeHealthAlert> listener : listeners) {
                listener.accept(alert);
            }
        }
    }

    /**
     * Share of the cascades currently in the window that reached rank 3.
     */
    public synchronized double rank3Share() {
        return cascades.isEmpty() ? 0.0 : (double) rank3Cascades / cascades.size();
    }

    public synchronized int cascadesInWindow() {
        return cascades.size();
    }

    public synchronized boolean isAlerting() {
        return alerting;
    }

    private void add(CascadeAttempt attempt) {
        window.addLast(attempt);
        int[] counts = cascades.computeIfAbsent(attempt.cascadeId(), k -> new int[2]);
        counts[0]++;
        if (attempt.rank() == ModelDescriptor.FALLBACK_RANK && counts[1]++ == 0) {
            rank3Cascades++;
        }
    }

    private void remove(CascadeAttempt attempt) {
        int[] counts = cascades.get(attempt.cascadeId());
        if (attempt.rank() == ModelDescriptor.FALLBACK_RANK && --counts[1] == 0) {
            rank3Cascades--;
        }
        if (--counts[0] == 0) {
            cascades.remove(attempt.cascadeId());
        }
    }
}
