package com.knowledge.graph.graph;

import com.knowledge.graph.core.model.NodeType;
import com.knowledge.graph.salience.SalienceRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Cypher statements for the knowledge graph. Node labels and relationship types are
 * spliced into the text only from {@link NodeType} or validated identifiers; every
 * other value is a parameter.
 *
 * <p>Stored node properties: {@code entity_key, user_id, node_type, name,
 * normalized_name, canonical_name, canonical_name_lower, description, embedding,
 * notes, salience, state, access_count, recall_frequency, last_accessed_at,
 * created_at, updated_at}. Timestamps are epoch milliseconds.</p>
 */
public class CypherExecutor {
    private static final Logger log = LoggerFactory.getLogger(CypherExecutor.class);

    static final String NODE_TYPES = "['Person', 'Concept', 'Entity', 'Source']";

    static final String ENTITY_COLUMNS = """
            n.entity_key AS entity_key, n.user_id AS user_id, n.node_type AS node_type,
            n.name AS name, n.normalized_name AS normalized_name, n.canonical_name AS canonical_name,
            n.description AS description, n.embedding AS embedding, n.notes AS notes,
            n.salience AS salience, n.state AS state, n.access_count AS access_count,
            n.recall_frequency AS recall_frequency, n.last_accessed_at AS last_accessed_at,
            n.created_at AS created_at, n.updated_at AS updated_at""";

    private final GraphConnection connection;

    public CypherExecutor(GraphConnection connection) {
        this.connection = connection;
    }

    public GraphConnection getConnection() {
        return connection;
    }

    /**
     * Cosine similarity between {@code vectorExpr} and {@code $embedding}, as a Cypher
     * expression over already-bound variables.
     */
    static String cosine(String vectorExpr) {
        return """
                CASE WHEN reduce(a = 0.0, x IN %1$s | a + x * x) = 0.0
                       OR reduce(b = 0.0, y IN $embedding | b + y * y) = 0.0 THEN 0.0
                     ELSE reduce(dot = 0.0, i IN range(0, size(%1$s) - 1) | dot + %1$s[i] * $embedding[i])
                          / (sqrt(reduce(a = 0.0, x IN %1$s | a + x * x))
                             * sqrt(reduce(b = 0.0, y IN $embedding | b + y * y)))
                END""".formatted(vectorExpr);
    }

    // ========== Lookup ==========

    public List<Map<String, Object>> findNodeByKey(String entityKey) {
        String query = """
                MATCH (n {entity_key: $entityKey})
                RETURN %s
                LIMIT 1
                """.formatted(ENTITY_COLUMNS);
        return connection.query(query, Map.of("entityKey", entityKey));
    }

    public List<Map<String, Object>> findPersonByCanonicalName(String canonicalNameLower, String userId) {
        String query = """
                MATCH (n:Person)
                WHERE n.user_id = $userId
                  AND n.canonical_name_lower = $canonicalNameLower
                RETURN %s
                LIMIT 1
                """.formatted(ENTITY_COLUMNS);
        return connection.query(query, Map.of(
                "canonicalNameLower", canonicalNameLower,
                "userId", userId
        ));
    }

    public List<Map<String, Object>> findAlias(String normalizedName, NodeType type, String userId) {
        String query = """
                MATCH (a:Alias {normalized_name: $normalizedName, type: $type, user_id: $userId})
                RETURN a.name AS name, a.normalized_name AS normalized_name, a.type AS type,
                       a.entity_key AS entity_key, a.user_id AS user_id
                LIMIT 1
                """;
        return connection.query(query, Map.of(
                "normalizedName", normalizedName,
                "type", type.getLabel(),
                "userId", userId
        ));
    }

    public List<Map<String, Object>> findByNormalizedNameContainment(String normalizedName, NodeType type,
                                                                    String userId) {
        String query = """
                MATCH (n:%s)
                WHERE n.user_id = $userId
                  AND n.normalized_name <> ''
                  AND (n.normalized_name CONTAINS $normalizedName OR $normalizedName CONTAINS n.normalized_name)
                RETURN %s
                LIMIT 50
                """.formatted(type.getLabel(), ENTITY_COLUMNS);
        return connection.query(query, Map.of(
                "normalizedName", normalizedName,
                "userId", userId
        ));
    }

    public List<Map<String, Object>> findNodesOfType(NodeType type, String userId, int limit) {
        String query = """
                MATCH (n:%s)
                WHERE n.user_id = $userId
                RETURN %s
                LIMIT $limit
                """.formatted(type.getLabel(), ENTITY_COLUMNS);
        return connection.query(query, Map.of("userId", userId, "limit", limit));
    }

    // ========== Search ==========

    public List<Map<String, Object>> vectorSearch(float[] embedding, double threshold, String userId, int limit) {
        String query = """
                MATCH (n)
                WHERE n.user_id = $userId
                  AND n.node_type IN %s
                  AND n.embedding IS NOT NULL
                  AND size(n.embedding) = size($embedding)
                WITH n, %s AS similarity
                WHERE similarity >= $threshold
                RETURN n.entity_key AS entity_key, n.node_type AS node_type, similarity,
                       n.name AS name, n.description AS description, n.notes AS notes
                ORDER BY similarity DESC
                LIMIT $limit
                """.formatted(NODE_TYPES, cosine("n.embedding"));
        return connection.query(query, Map.of(
                "embedding", embedding,
                "threshold", threshold,
                "userId", userId,
                "limit", limit
        ));
    }

    public List<Map<String, Object>> vectorSearchByType(float[] embedding, NodeType type, String userId, int limit) {
        String query = """
                MATCH (n:%s)
                WHERE n.user_id = $userId
                  AND n.embedding IS NOT NULL
                  AND size(n.embedding) = size($embedding)
                WITH n, %s AS similarity
                RETURN n.entity_key AS entity_key, n.node_type AS node_type, similarity,
                       n.name AS name, n.description AS description, n.notes AS notes
                ORDER BY similarity DESC
                LIMIT $limit
                """.formatted(type.getLabel(), cosine("n.embedding"));
        return connection.query(query, Map.of(
                "embedding", embedding,
                "userId", userId,
                "limit", limit
        ));
    }

    /**
     * Names of text-matchable nodes; scoring happens in the caller.
     */
    public List<Map<String, Object>> findTextMatchCandidates(String userId, int limit) {
        String query = """
                MATCH (n)
                WHERE n.user_id = $userId
                  AND n.node_type IN ['Person', 'Concept', 'Entity']
                RETURN n.entity_key AS entity_key, n.node_type AS node_type, n.name AS name,
                       n.canonical_name AS canonical_name, n.description AS description, n.notes AS notes
                LIMIT $limit
                """;
        return connection.query(query, Map.of("userId", userId, "limit", limit));
    }

    public List<Map<String, Object>> relationshipSearch(float[] embedding, double threshold, String userId, int limit) {
        String query = """
                MATCH (a)-[r]->(b)
                WHERE a.user_id = $userId
                  AND r.description_embedding IS NOT NULL
                  AND size(r.description_embedding) = size($embedding)
                WITH a, b, %s AS similarity
                WHERE similarity >= $threshold
                RETURN a.entity_key AS from_key, a.node_type AS from_type, a.name AS from_name,
                       a.description AS from_description,
                       b.entity_key AS to_key, b.node_type AS to_type, b.name AS to_name,
                       b.description AS to_description, similarity
                ORDER BY similarity DESC
                LIMIT $limit
                """.formatted(cosine("r.description_embedding"));
        return connection.query(query, Map.of(
                "embedding", embedding,
                "threshold", threshold,
                "userId", userId,
                "limit", limit
        ));
    }

    // ========== Expansion ==========

    public List<Map<String, Object>> findNodeProperties(Collection<String> entityKeys) {
        String query = """
                MATCH (n)
                WHERE n.entity_key IN $entityKeys
                RETURN n.entity_key AS entity_key, n.node_type AS node_type, properties(n) AS properties
                """;
        return connection.query(query, Map.of("entityKeys", List.copyOf(entityKeys)));
    }

    /**
     * Edges touching any seed, including edges among seeds and to the owner.
     */
    public List<Map<String, Object>> findIncidentEdges(Collection<String> entityKeys, String userId, int limit) {
        String query = """
                MATCH (a)-[r]->(b)
                WHERE a.user_id = $userId
                  AND (a.entity_key IN $entityKeys OR b.entity_key IN $entityKeys)
                  AND type(r) <> 'ALIAS_OF'
                RETURN a.entity_key AS from_key, b.entity_key AS to_key, type(r) AS relationship_type,
                       r.attitude AS attitude, r.proximity AS proximity, r.description AS description,
                       r.notes AS notes, r.relevance AS relevance,
                       r.created_at AS created_at, r.updated_at AS updated_at
                LIMIT $limit
                """;
        return connection.query(query, Map.of(
                "entityKeys", List.copyOf(entityKeys),
                "userId", userId,
                "limit", limit
        ));
    }

    // ========== Salience ==========

    public List<Map<String, Object>> findSalience(Collection<String> entityKeys) {
        String query = """
                UNWIND $entityKeys AS key
                MATCH (n {entity_key: key})
                RETURN n.entity_key AS entity_key, coalesce(n.salience, 0.5) AS salience
                """;
        return connection.query(query, Map.of("entityKeys", List.copyOf(entityKeys)));
    }

    /**
     * Counts an access on every listed node in one statement. Counters, salience and
     * state change together per node, so concurrent callers never lose an update.
     */
    public void incrementAccess(Collection<String> entityKeys, double delta, long now) {
        String query = """
                UNWIND $entityKeys AS key
                MATCH (n {entity_key: key})
                WITH n, coalesce(n.access_count, 0) + 1 AS accessCount, coalesce(n.salience, 0.5) + $delta AS raised
                SET n.access_count = accessCount,
                    n.recall_frequency = coalesce(n.recall_frequency, 0) + 1,
                    n.last_accessed_at = $now,
                    n.updated_at = $now,
                    n.salience = CASE WHEN raised > 1.0 THEN 1.0 WHEN raised < 0.0 THEN 0.0 ELSE raised END,
                    n.state = CASE
                        WHEN accessCount >= $coreThreshold OR n.state = 'core' THEN 'core'
                        WHEN accessCount >= $activeThreshold THEN 'active'
                        ELSE coalesce(n.state, 'candidate')
                    END
                """;
        connection.execute(query, Map.of(
                "entityKeys", List.copyOf(entityKeys),
                "delta", delta,
                "now", now,
                "coreThreshold", SalienceRules.CORE_THRESHOLD,
                "activeThreshold", SalienceRules.ACTIVE_THRESHOLD
        ));
        log.debug("salience.access nodes={} delta={}", entityKeys.size(), delta);
    }

    public void adjustSalience(Collection<String> entityKeys, double delta, long now) {
        String query = """
                UNWIND $entityKeys AS key
                MATCH (n {entity_key: key})
                WITH n, coalesce(n.salience, 0.5) + $delta AS adjusted
                SET n.salience = CASE WHEN adjusted > 1.0 THEN 1.0 WHEN adjusted < 0.0 THEN 0.0 ELSE adjusted END,
                    n.updated_at = $now
                """;
        connection.execute(query, Map.of(
                "entityKeys", List.copyOf(entityKeys),
                "delta", delta,
                "now", now
        ));
        log.debug("salience.adjust nodes={} delta={}", entityKeys.size(), delta);
    }

    // ========== Mutations ==========

    /**
     * Creates the node when its key is new. {@code created} is true only for the call
     * whose creation id was written.
     */
    public List<Map<String, Object>> mergeNode(NodeType type, Map<String, Object> fields, String creationId,
                                               long now) {
        String query = """
                MERGE (n:%s {entity_key: $entityKey})
                ON CREATE SET n.user_id = $userId,
                              n.node_type = $nodeType,
                              n.name = $name,
                              n.normalized_name = $normalizedName,
                              n.canonical_name = $canonicalName,
                              n.canonical_name_lower = $canonicalNameLower,
                              n.description = $description,
                              n.embedding = $embedding,
                              n.notes = [],
                              n.salience = $salience,
                              n.state = $state,
                              n.access_count = 0,
                              n.recall_frequency = 0,
                              n.created_at = $now,
                              n.updated_at = $now,
                              n.creation_id = $creationId
                RETURN %s, n.creation_id = $creationId AS created
                """.formatted(type.getLabel(), ENTITY_COLUMNS);
        Map<String, Object> params = new HashMap<>(fields);
        params.put("nodeType", type.getLabel());
        params.put("creationId", creationId);
        params.put("now", now);
        return connection.query(query, params);
    }

    public void mergeAlias(String name, String normalizedName, NodeType type, String entityKey, String userId,
                           long now) {
        String query = """
                MATCH (e {entity_key: $entityKey})
                MERGE (a:Alias {normalized_name: $normalizedName, type: $type, user_id: $userId})
                ON CREATE SET a.name = $name, a.entity_key = $entityKey, a.created_at = $now
                MERGE (a)-[:ALIAS_OF]->(e)
                """;
        Map<String, Object> params = new HashMap<>();
        params.put("name", name);
        params.put("normalizedName", normalizedName);
        params.put("type", type.getLabel());
        params.put("entityKey", entityKey);
        params.put("userId", userId);
        params.put("now", now);
        connection.execute(query, params);
        log.debug("Merged alias '{}' for entity {}", normalizedName, entityKey);
    }

    /**
     * Merges an edge keyed by (from, to, type). Null fields keep their stored value and
     * notes are merged as a set, so retries are harmless.
     */
    public void mergeEdge(String relationshipType, Map<String, Object> fields, long now) {
        InputSanitizer.validateRelationshipType(relationshipType);
        String query = """
                MATCH (a {entity_key: $fromKey}), (b {entity_key: $toKey})
                MERGE (a)-[r:%s]->(b)
                ON CREATE SET r.created_at = $now
                SET r.updated_at = $now,
                    r.attitude = coalesce($attitude, r.attitude),
                    r.proximity = coalesce($proximity, r.proximity),
                    r.description = coalesce($description, r.description),
                    r.relevance = coalesce($relevance, r.relevance),
                    r.description_embedding = coalesce($descriptionEmbedding, r.description_embedding),
                    r.notes = coalesce(r.notes, []) + [x IN $notes WHERE NOT x IN coalesce(r.notes, [])]
                """.formatted(relationshipType);
        Map<String, Object> params = new HashMap<>(fields);
        params.put("now", now);
        connection.execute(query, params);
        log.debug("Merged edge {} -[{}]-> {}", fields.get("fromKey"), relationshipType, fields.get("toKey"));
    }

    public void appendNote(String entityKey, String encodedNote, int maxNotes, long now) {
        String query = """
                MATCH (n {entity_key: $entityKey})
                WITH n, coalesce(n.notes, []) + [$note] AS notes
                SET n.notes = CASE WHEN size(notes) > $maxNotes THEN notes[(size(notes) - $maxNotes)..] ELSE notes END,
                    n.updated_at = $now
                """;
        connection.execute(query, Map.of(
                "entityKey", entityKey,
                "note", encodedNote,
                "maxNotes", maxNotes,
                "now", now
        ));
    }
}
