package com.knowledge.graph.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A node of a user's knowledge graph: a person, concept, named entity or source.
 * Instances are immutable snapshots of stored state; mutations go through the store.
 */
public class Entity {
    public static final int MAX_NOTES = 100;
    public static final double DEFAULT_SALIENCE = 0.5;

    private final String entityKey;
    private final String userId;
    private final NodeType type;
    private final String name;
    private final String normalizedName;
    private final String canonicalName;
    private final String description;
    private final float[] embedding;
    private final List<Note> notes;
    private final double salience;
    private final EntityState state;
    private final long accessCount;
    private final long recallFrequency;
    private final Instant lastAccessedAt;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Entity(Builder builder) {
        this.entityKey = builder.entityKey;
        this.userId = builder.userId;
        this.type = builder.type;
        this.name = builder.name;
        this.normalizedName = builder.normalizedName;
        this.canonicalName = builder.canonicalName != null ? builder.canonicalName : builder.name;
        this.description = builder.description;
        this.embedding = builder.embedding;
        this.notes = Collections.unmodifiableList(capNotes(builder.notes));
        this.salience = builder.salience;
        this.state = builder.state != null ? builder.state : EntityState.CANDIDATE;
        this.accessCount = builder.accessCount;
        this.recallFrequency = builder.recallFrequency;
        this.lastAccessedAt = builder.lastAccessedAt;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    private static List<Note> capNotes(List<Note> notes) {
        if (notes.size() <= MAX_NOTES) {
            return new ArrayList<>(notes);
        }
        // keep the newest
        return new ArrayList<>(notes.subList(notes.size() - MAX_NOTES, notes.size()));
    }

    public String getEntityKey() {
        return entityKey;
    }

    public String getUserId() {
        return userId;
    }

    public NodeType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    public String getDescription() {
        return description;
    }

    public float[] getEmbedding() {
        return embedding;
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    public List<Note> getNotes() {
        return notes;
    }

    public double getSalience() {
        return salience;
    }

    public EntityState getState() {
        return state;
    }

    public long getAccessCount() {
        return accessCount;
    }

    public long getRecallFrequency() {
        return recallFrequency;
    }

    public Instant getLastAccessedAt() {
        return lastAccessedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Returns a builder pre-populated with this entity's state.
     */
    public Builder toBuilder() {
        return new Builder()
                .entityKey(entityKey)
                .userId(userId)
                .type(type)
                .name(name)
                .normalizedName(normalizedName)
                .canonicalName(canonicalName)
                .description(description)
                .embedding(embedding)
                .notes(notes)
                .salience(salience)
                .state(state)
                .accessCount(accessCount)
                .recallFrequency(recallFrequency)
                .lastAccessedAt(lastAccessedAt)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return Objects.equals(entityKey, entity.entityKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityKey);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "entityKey='" + entityKey + '\'' +
                ", type=" + type +
                ", name='" + name + '\'' +
                ", salience=" + salience +
                ", state=" + state +
                ", accessCount=" + accessCount +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String entityKey;
        private String userId;
        private NodeType type;
        private String name;
        private String normalizedName;
        private String canonicalName;
        private String description;
        private float[] embedding;
        private List<Note> notes = new ArrayList<>();
        private double salience = DEFAULT_SALIENCE;
        private EntityState state;
        private long accessCount;
        private long recallFrequency;
        private Instant lastAccessedAt;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder entityKey(String entityKey) {
            this.entityKey = entityKey;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder type(NodeType type) {
            this.type = type;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder normalizedName(String normalizedName) {
            this.normalizedName = normalizedName;
            return this;
        }

        public Builder canonicalName(String canonicalName) {
            this.canonicalName = canonicalName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder embedding(float[] embedding) {
            this.embedding = embedding == null ? null : Arrays.copyOf(embedding, embedding.length);
            return this;
        }

        public Builder notes(List<Note> notes) {
            this.notes = notes == null ? new ArrayList<>() : new ArrayList<>(notes);
            return this;
        }

        public Builder addNote(Note note) {
            this.notes.add(note);
            return this;
        }

        public Builder salience(double salience) {
            this.salience = salience;
            return this;
        }

        public Builder state(EntityState state) {
            this.state = state;
            return this;
        }

        public Builder accessCount(long accessCount) {
            this.accessCount = accessCount;
            return this;
        }

        public Builder recallFrequency(long recallFrequency) {
            this.recallFrequency = recallFrequency;
            return this;
        }

        public Builder lastAccessedAt(Instant lastAccessedAt) {
            this.lastAccessedAt = lastAccessedAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Entity build() {
            Objects.requireNonNull(entityKey, "entityKey is required");
            Objects.requireNonNull(userId, "userId is required");
            Objects.requireNonNull(type, "type is required");
            Objects.requireNonNull(name, "name is required");
            if (salience < 0.0 || salience > 1.0) {
                throw new IllegalArgumentException("Salience must be between 0.0 and 1.0");
            }
            return new Entity(this);
        }
    }
}
