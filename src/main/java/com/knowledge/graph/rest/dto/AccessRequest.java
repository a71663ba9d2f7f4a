package com.knowledge.graph.rest.dto;

import java.util.List;

/**
 * Request DTO for recording access to one or more entities.
 */
public record AccessRequest(List<String> entityKeys) {
    public AccessRequest {
        if (entityKeys == null || entityKeys.isEmpty()) {
            throw new IllegalArgumentException("entityKeys must not be empty");
        }
        if (entityKeys.stream().anyMatch(k -> k == null || k.isBlank())) {
            throw new IllegalArgumentException("entityKeys must not contain blank keys");
        }
        entityKeys = List.copyOf(entityKeys);
    }
}
