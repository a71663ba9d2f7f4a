package com.knowledge.graph.rest.dto;

import com.knowledge.graph.core.model.Mention;
import com.knowledge.graph.core.model.NodeType;

/**
 * Request DTO for resolving a single mention. {@code type} is a graph label
 * ("Concept") or enum name ("CONCEPT").
 */
public record ResolveRequest(
        String name,
        String type,
        String userId,
        float[] embedding,
        String contextText
) {
    public ResolveRequest {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type is required");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
    }

    public Mention toMention() {
        return new Mention(name, NodeType.fromLabel(type), userId, embedding, contextText);
    }
}
