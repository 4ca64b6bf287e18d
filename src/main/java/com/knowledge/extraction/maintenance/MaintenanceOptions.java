package com.knowledge.extraction.maintenance;

import com.knowledge.extraction.lock.DistributedLock;

import java.util.Objects;

/**
 * Options for a graph consistency maintenance run.
 *
 * @param dryRun    compute the plan without mutating the graph
 * @param batchSize number of mutations per committed batch, 1..500
 * @param lockKey   distributed lock key held for the whole run
 */
public record MaintenanceOptions(boolean dryRun, int batchSize, String lockKey) {

    public static final int DEFAULT_BATCH_SIZE = 500;
    public static final int MAX_BATCH_SIZE = 500;

    public MaintenanceOptions {
        Objects.requireNonNull(lockKey, "lockKey is required");
        if (batchSize < 1 || batchSize > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException("batchSize must be between 1 and " + MAX_BATCH_SIZE
                    + ", got " + batchSize);
        }
    }

    public static MaintenanceOptions defaults() {
        return builder().build();
    }

    public static MaintenanceOptions dryRun(boolean dryRun) {
        return builder().dryRun(dryRun).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean dryRun;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private String lockKey = DistributedLock.GRAPH_WRITE_KEY;

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder lockKey(String lockKey) {
            this.lockKey = lockKey;
            return this;
        }

        public MaintenanceOptions build() {
            return new MaintenanceOptions(dryRun, batchSize, lockKey);
        }
    }
}
