package com.knowledge.graph.core.model;

import java.util.Objects;

/**
 * A freshly extracted name that needs to be mapped onto a graph entity.
 *
 * @param name        surface form as extracted
 * @param type        node type the extractor assigned
 * @param userId      owner of the graph the mention belongs to
 * @param embedding   optional embedding of the mention, may be null
 * @param contextText optional surrounding text, handed to disambiguation
 */
public record Mention(
        String name,
        NodeType type,
        String userId,
        float[] embedding,
        String contextText
) {
    public Mention {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(userId, "userId is required");
    }

    public static Mention of(String name, NodeType type, String userId) {
        return new Mention(name, type, userId, null, null);
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    public Mention withEmbedding(float[] vector) {
        return new Mention(name, type, userId, vector, contextText);
    }
}
