package com.knowledge.extraction.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * An entity extracted from one or more text chunks.
 *
 * <p>Instances are immutable. The id stays null until the entity has been through
 * its first merge; merging produces new instances.</p>
 */
public final class Entity {
    private final String id;
    private final String name;
    private final String canonicalKey;
    private final String type;
    private final String description;
    private final double confidence;
    private final Set<String> sourceChunkIds;

    private Entity(Builder builder) {
        this.id = builder.id;
        this.name = builder.name.trim();
        this.canonicalKey = CanonicalKeys.entityKey(builder.name);
        this.type = builder.type;
        this.description = builder.description != null ? builder.description : "";
        this.confidence = builder.confidence;
        this.sourceChunkIds = Collections.unmodifiableSet(new LinkedHashSet<>(builder.sourceChunkIds));
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getCanonicalKey() {
        return canonicalKey;
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

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return Double.compare(entity.confidence, confidence) == 0
                && Objects.equals(id, entity.id)
                && Objects.equals(name, entity.name)
                && Objects.equals(type, entity.type)
                && Objects.equals(description, entity.description)
                && Objects.equals(sourceChunkIds, entity.sourceChunkIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, type, description, confidence, sourceChunkIds);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", confidence=" + confidence +
                ", chunks=" + sourceChunkIds +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Entity entity) {
        return new Builder()
                .id(entity.id)
                .name(entity.name)
                .type(entity.type)
                .description(entity.description)
                .confidence(entity.confidence)
                .sourceChunkIds(entity.sourceChunkIds);
    }

    public static class Builder {
        private String id;
        private String name;
        private String type;
        private String description;
        private double confidence = 1.0;
        private final Set<String> sourceChunkIds = new LinkedHashSet<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
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

        public Entity build() {
            Objects.requireNonNull(name, "name is required");
            if (name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            if (type == null || type.isBlank()) {
                type = "UNKNOWN";
            }
            if (confidence < 0.0 || confidence > 1.0) {
                throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
            }
            return new Entity(this);
        }
    }
}
