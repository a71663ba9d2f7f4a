package com.knowledge.graph.resolve;

import com.knowledge.graph.core.model.Entity;
import com.knowledge.graph.core.model.Mention;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Per-call state shared by the resolver tiers. The mention's embedding is computed at
 * most once, and only if a tier asks for it.
 */
public class ResolutionContext {

    private final Mention mention;
    private final String normalizedName;
    private final String entityKey;
    private final Supplier<float[]> embedder;
    private float[] embedding;
    private boolean embeddingResolved;

    public ResolutionContext(Mention mention, String normalizedName, String entityKey, Supplier<float[]> embedder) {
        this.mention = mention;
        this.normalizedName = normalizedName;
        this.entityKey = entityKey;
        this.embedder = embedder;
        if (mention.hasEmbedding()) {
            this.embedding = mention.embedding();
            this.embeddingResolved = true;
        }
    }

    public Mention mention() {
        return mention;
    }

    public String normalizedName() {
        return normalizedName;
    }

    public String entityKey() {
        return entityKey;
    }

    /**
     * The mention's embedding, computing it on first use.
     */
    public Optional<float[]> embedding() {
        if (!embeddingResolved) {
            embeddingResolved = true;
            float[] computed = embedder != null ? embedder.get() : null;
            embedding = computed != null && computed.length > 0 ? computed : null;
        }
        return Optional.ofNullable(embedding);
    }

    /**
     * The embedding if one was supplied or already computed; never triggers a computation.
     */
    public float[] knownEmbedding() {
        return embeddingResolved ? embedding : null;
    }

    /**
     * Checks that a stored node really belongs to this mention's key space.
     *
     * @throws DataIntegrityException if user, type or normalized name disagree
     */
    public void verifyOwnership(Entity stored) {
        if (!stored.getEntityKey().equals(entityKey)) {
            return;
        }
        boolean sameUser = stored.getUserId().equals(mention.userId());
        boolean sameType = stored.getType() == mention.type();
        boolean sameName = stored.getNormalizedName() == null || stored.getNormalizedName().equals(normalizedName);
        if (!sameUser || !sameType || !sameName) {
            throw new DataIntegrityException(entityKey,
                    "Entity key " + entityKey + " is held by an unrelated node (type=" + stored.getType()
                            + ", normalizedName='" + stored.getNormalizedName() + "')");
        }
    }
}
