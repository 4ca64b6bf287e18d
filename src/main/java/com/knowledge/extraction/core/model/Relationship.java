package com.knowledge.extraction.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A directed relationship between two extracted entities.
 *
 * <p>Endpoints are the surface names as extracted; they are normalized through
 * {@link CanonicalKeys} when keyed. The type may be null until the graph
 * consistency maintenance has run over the persisted relation.</p>
 */
public final class Relationship {

    private final String id;
    private final String sourceEntityRef;
    private final String targetEntityRef;
    private final String type;
    private final String description;
    private final double confidence;
    private final Set<String> sourceChunkIds;
    private final boolean unresolvedReference;

    private Relationship(Builder builder) {
        this.id = builder.id;
        this.sourceEntityRef = builder.sourceEntityRef.trim();
        this.targetEntityRef = builder.targetEntityRef.trim();
        this.type = builder.type;
        this.description = builder.description != null ? builder.description : "";
        this.confidence = builder.confidence;
        this.sourceChunkIds = Collections.unmodifiableSet(new LinkedHashSet<>(builder.sourceChunkIds));
        this.unresolvedReference = builder.unresolvedReference;
    }

    public String getId() {
        return id;
    }

    public String getSourceEntityRef() {
        return sourceEntityRef;
    }

    public String getTargetEntityRef() {
        return targetEntityRef;
    }

    public String getType() {
        return type;
    }

    public String getDescription() {
        return description;
    }

    public double getConfidence() {
        return confidence;
    }

    public Set<String> getSourceChunkIds() {
        return sourceChunkIds;
    }

    /**
     * True when an endpoint did not match any entity known at extraction time.
     */
    public boolean isUnresolvedReference() {
        return unresolvedReference;
    }

    public String getMergeKey() {
        return CanonicalKeys.relationKey(sourceEntityRef, targetEntityRef, type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Relationship that = (Relationship) o;
        return Double.compare(that.confidence, confidence) == 0
                && unresolvedReference == that.unresolvedReference
                && Objects.equals(id, that.id)
                && Objects.equals(sourceEntityRef, that.sourceEntityRef)
                && Objects.equals(targetEntityRef, that.targetEntityRef)
                && Objects.equals(type, that.type)
                && Objects.equals(description, that.description)
                && Objects.equals(sourceChunkIds, that.sourceChunkIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, sourceEntityRef, targetEntityRef, type, description, confidence,
                sourceChunkIds, unresolvedReference);
    }

    @Override
    public String toString() {
        return "Relationship{" +
                "id='" + id + '\'' +
                ", source='" + sourceEntityRef + '\'' +
                ", target='" + targetEntityRef + '\'' +
                ", type='" + type + '\'' +
                ", confidence=" + confidence +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Relationship relationship) {
        return new Builder()
                .id(relationship.id)
                .sourceEntityRef(relationship.sourceEntityRef)
                .targetEntityRef(relationship.targetEntityRef)
                .type(relationship.type)
                .description(relationship.description)
                .confidence(relationship.confidence)
                .sourceChunkIds(relationship.sourceChunkIds)
                .unresolvedReference(relationship.unresolvedReference);
    }

    public static class Builder {
        private String id;
        private String sourceEntityRef;
        private String targetEntityRef;
        private String type;
        private String description;
        private double confidence = 0.5;
        private final Set<String> sourceChunkIds = new LinkedHashSet<>();
        private boolean unresolvedReference;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sourceEntityRef(String sourceEntityRef) {
            this.sourceEntityRef = sourceEntityRef;
            return this;
        }

        public Builder targetEntityRef(String targetEntityRef) {
            this.targetEntityRef = targetEntityRef;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder sourceChunkId(String chunkId) {
            if (chunkId != null) {
                this.sourceChunkIds.add(chunkId);
            }
            return this;
        }

        public Builder sourceChunkIds(Collection<String> chunkIds) {
            this.sourceChunkIds.clear();
            if (chunkIds != null) {
                this.sourceChunkIds.addAll(chunkIds);
            }
            return this;
        }

        public Builder unresolvedReference(boolean unresolvedReference) {
            this.unresolvedReference = unresolvedReference;
            return this;
        }

        public Relationship build() {
            Objects.requireNonNull(sourceEntityRef, "sourceEntityRef is required");
            Objects.requireNonNull(targetEntityRef, "targetEntityRef is required");
            if (type != null && type.isBlank()) {
                type = null;
            }
            if (confidence < 0.0 || confidence > 1.0) {
                throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
            }
            return new Relationship(this);
        }
    }
}
