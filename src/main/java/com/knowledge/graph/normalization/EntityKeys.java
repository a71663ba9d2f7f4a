package com.knowledge.graph.normalization;

import com.knowledge.graph.core.model.NodeType;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.Objects;

/**
 * Derives stable entity keys.
 *
 * <p>{@code entityKey = sha256Hex(normalize(name) + type + userId)}. Two mentions that
 * normalize identically share a key for the same type and user, and different users
 * never share a key for the same name.</p>
 */
public final class EntityKeys {

    private EntityKeys() {
    }

    public static String entityKey(String name, NodeType type, String userId) {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(userId, "userId is required");
        return keyForNormalized(EntityNameNormalizer.normalize(name), type, userId);
    }

    /**
     * Key for a name that has already been normalized.
     */
    public static String keyForNormalized(String normalizedName, NodeType type, String userId) {
        return DigestUtils.sha256Hex(normalizedName + type.getLabel() + userId);
    }
}
