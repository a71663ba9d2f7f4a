package com.knowledge.graph.resolve;

/**
 * A node stored under an entity key does not belong to the mention that produced the
 * key (different normalized name, type or user). The operation is aborted rather
 * than overwriting the stored node.
 */
public class DataIntegrityException extends RuntimeException {

    private final String entityKey;

    public DataIntegrityException(String entityKey, String message) {
        super(message);
        this.entityKey = entityKey;
    }

    public String getEntityKey() {
        return entityKey;
    }
}
