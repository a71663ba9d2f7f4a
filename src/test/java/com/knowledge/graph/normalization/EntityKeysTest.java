package com.knowledge.graph.normalization;

import com.knowledge.graph.core.model.NodeType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EntityKeys Tests")
class EntityKeysTest {

    @Test
    @DisplayName("Key is deterministic for the same name, type and user")
    void deterministic() {
        assertEquals(EntityKeys.entityKey("Startups", NodeType.CONCEPT, "u1"),
                EntityKeys.entityKey("startup", NodeType.CONCEPT, "u1"));
    }

    @Test
    @DisplayName("Key is scoped to the user")
    void userScoped() {
        assertNotEquals(EntityKeys.entityKey("startup", NodeType.CONCEPT, "u1"),
                EntityKeys.entityKey("startup", NodeType.CONCEPT, "u2"));
    }

    @Test
    @DisplayName("Key is scoped to the node type")
    void typeScoped() {
        assertNotEquals(EntityKeys.entityKey("Mercury", NodeType.CONCEPT, "u1"),
                EntityKeys.entityKey("Mercury", NodeType.NAMED_ENTITY, "u1"));
    }

    @Test
    @DisplayName("Key is a lowercase hex SHA-256 digest")
    void sha256Hex() {
        String key = EntityKeys.entityKey("Alice", NodeType.PERSON, "u1");
        assertEquals(64, key.length());
        assertTrue(key.matches("[0-9a-f]{64}"));
    }

    @Test
    @DisplayName("keyForNormalized agrees with entityKey")
    void normalizedVariantAgrees() {
        String normalized = EntityNameNormalizer.normalize("Machine Learning");
        assertEquals(EntityKeys.entityKey("Machine Learning", NodeType.CONCEPT, "u1"),
                EntityKeys.keyForNormalized(normalized, NodeType.CONCEPT, "u1"));
    }
}
