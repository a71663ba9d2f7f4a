package com.knowledge.graph.rest.dto;

import com.knowledge.graph.core.model.ResolutionResult;

/**
 * Response DTO for a resolved mention.
 */
public record ResolveResponse(
        String entityKey,
        double confidence,
        boolean isNew,
        String tier,
        String matchedName
) {
    public static ResolveResponse from(ResolutionResult result) {
        return new ResolveResponse(result.entityKey(), result.confidence(), result.isNew(),
                result.tier().name(), result.matchedName());
    }
}
