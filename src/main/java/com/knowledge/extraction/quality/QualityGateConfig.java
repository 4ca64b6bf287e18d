package com.knowledge.extraction.quality;

/**
 * Thresholds of the quality gate and the cascade health monitor.
 */
public class QualityGateConfig {

    private static final double DEFAULT_MIN_ENTITIES_PER_CHUNK = 1.0;
    private static final int DEFAULT_ZERO_RELATION_STREAK_WARNING = 3;
    private static final double DEFAULT_RANK3_ALERT_THRESHOLD = 0.10;
    private static final int DEFAULT_HEALTH_WINDOW_SIZE = 200;
    private static final int DEFAULT_MIN_CASCADES_FOR_ALERT = 20;

    private final double minEntitiesPerChunk;
    private final int zeroRelationStreakWarning;
    private final double rank3AlertThreshold;
    private final int healthWindowSize;
    private final int minCascadesForAlert;

    private QualityGateConfig(Builder builder) {
        this.minEntitiesPerChunk = builder.minEntitiesPerChunk;
        this.zeroRelationStreakWarning = builder.zeroRelationStreakWarning;
        this.rank3AlertThreshold = builder.rank3AlertThreshold;
        this.healthWindowSize = builder.healthWindowSize;
        this.minCascadesForAlert = builder.minCascadesForAlert;
    }

    /**
     * Hard stop: a document is aborted once its running entities-per-chunk falls below this.
     */
    public double getMinEntitiesPerChunk() {
        return minEntitiesPerChunk;
    }

    /**
     * Soft warning: consecutive zero-relation chunks that trigger a warning.
     */
    public int getZeroRelationStreakWarning() {
        return zeroRelationStreakWarning;
    }

    /**
     * Share of cascades resolved at rank 3 above which an alert is raised.
     */
    public double getRank3AlertThreshold() {
        return rank3AlertThreshold;
    }

    /**
     * Number of most recent cascade attempts the health monitor looks at.
     */
    public int getHealthWindowSize() {
        return healthWindowSize;
    }

    /**
     * Cascades that must be in the window before an alert can fire.
     */
    public int getMinCascadesForAlert() {
        return minCascadesForAlert;
    }

    public static QualityGateConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double minEntitiesPerChunk = DEFAULT_MIN_ENTITIES_PER_CHUNK;
        private int zeroRelationStreakWarning = DEFAULT_ZERO_RELATION_STREAK_WARNING;
        private double rank3AlertThreshold = DEFAULT_RANK3_ALERT_THRESHOLD;
        private int healthWindowSize = DEFAULT_HEALTH_WINDOW_SIZE;
        private int minCascadesForAlert = DEFAULT_MIN_CASCADES_FOR_ALERT;

        public Builder minEntitiesPerChunk(double minEntitiesPerChunk) {
            if (minEntitiesPerChunk < 0.0) {
                throw new IllegalArgumentException("minEntitiesPerChunk must be >= 0");
            }
            this.minEntitiesPerChunk = minEntitiesPerChunk;
            return this;
        }

        public Builder zeroRelationStreakWarning(int zeroRelationStreakWarning) {
            if (zeroRelationStreakWarning <= 0) {
                throw new IllegalArgumentException("zeroRelationStreakWarning must be positive");
            }
            this.zeroRelationStreakWarning = zeroRelationStreakWarning;
            return this;
        }

        public Builder rank3AlertThreshold(double rank3AlertThreshold) {
            if (rank3AlertThreshold < 0.0 || rank3AlertThreshold > 1.0) {
                throw new IllegalArgumentException("rank3AlertThreshold must be between 0.0 and 1.0");
            }
            this.rank3AlertThreshold = rank3AlertThreshold;
            return this;
        }

        public Builder healthWindowSize(int healthWindowSize) {
            if (healthWindowSize <= 0) {
                throw new IllegalArgumentException("healthWindowSize must be positive");
            }
            this.healthWindowSize = healthWindowSize;
            return this;
        }

        public Builder minCascadesForAlert(int minCascadesForAlert) {
            if (minCascadesForAlert <= 0) {
                throw new IllegalArgumentException("minCascadesForAlert must be positive");
            }
            this.minCascadesForAlert = minCascadesForAlert;
            return this;
        }

        public QualityGateConfig build() {
            return new QualityGateConfig(this);
        }
    }
}
