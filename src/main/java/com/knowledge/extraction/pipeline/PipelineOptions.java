package com.knowledge.extraction.pipeline;

import com.knowledge.extraction.lock.DistributedLock;

/**
 * Options for document extraction runs.
 */
public class PipelineOptions {

    private static final int DEFAULT_MAX_WORKERS = 4;
    private static final int DEFAULT_MAX_CONCURRENT_DOCUMENTS = 2;
    private static final int DEFAULT_UPSERT_BATCH_SIZE = 500;

    private final int maxWorkers;
    private final int maxConcurrentDocuments;
    private final int upsertBatchSize;
    private final boolean persistResults;
    private final String lockKey;

    private PipelineOptions(Builder builder) {
        this.maxWorkers = builder.maxWorkers;
        this.maxConcurrentDocuments = builder.maxConcurrentDocuments;
        this.upsertBatchSize = builder.upsertBatchSize;
        this.persistResults = builder.persistResults;
        this.lockKey = builder.lockKey;
    }

    /**
     * Chunk extractions in flight per document.
     */
    public int getMaxWorkers() {
        return maxWorkers;
    }

    /**
     * Documents extracted at the same time by {@code processDocuments}.
     */
    public int getMaxConcurrentDocuments() {
        return maxConcurrentDocuments;
    }

    public int getUpsertBatchSize() {
        return upsertBatchSize;
    }

    /**
     * Whether finished documents are written to graph storage.
     */
    public boolean isPersistResults() {
        return persistResults;
    }

    public String getLockKey() {
        return lockKey;
    }

    public static PipelineOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxWorkers = DEFAULT_MAX_WORKERS;
        private int maxConcurrentDocuments = DEFAULT_MAX_CONCURRENT_DOCUMENTS;
        private int upsertBatchSize = DEFAULT_UPSERT_BATCH_SIZE;
        private boolean persistResults = true;
        private String lockKey = DistributedLock.GRAPH_WRITE_KEY;

        public Builder maxWorkers(int maxWorkers) {
            if (maxWorkers <= 0) {
                throw new IllegalArgumentException("maxWorkers must be > 0");
            }
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder maxConcurrentDocuments(int maxConcurrentDocuments) {
            if (maxConcurrentDocuments <= 0) {
                throw new IllegalArgumentException("maxConcurrentDocuments must be > 0");
            }
            this.maxConcurrentDocuments = maxConcurrentDocuments;
            return this;
        }

        public Builder upsertBatchSize(int upsertBatchSize) {
            if (upsertBatchSize <= 0) {
                throw new IllegalArgumentException("upsertBatchSize must be > 0");
            }
            this.upsertBatchSize = upsertBatchSize;
            return this;
        }

        public Builder persistResults(boolean persistResults) {
            this.persistResults = persistResults;
            return this;
        }

        public Builder lockKey(String lockKey) {
            if (lockKey == null || lockKey.isBlank()) {
                throw new IllegalArgumentException("lockKey must not be blank");
            }
            this.lockKey = lockKey;
            return this;
        }

        public PipelineOptions build() {
            return new PipelineOptions(this);
        }
    }
}
