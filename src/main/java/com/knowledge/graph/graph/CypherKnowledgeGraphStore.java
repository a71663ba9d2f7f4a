package com.knowledge.graph.graph;

import com.knowledge.graph.core.model.Alias;
import com.knowledge.graph.core.model.Edge;
import com.knowledge.graph.core.model.Entity;
import com.knowledge.graph.core.model.EntityState;
import com.knowledge.graph.core.model.ExpandedGraph;
import com.knowledge.graph.core.model.GraphNode;
import com.knowledge.graph.core.model.NodeType;
import com.knowledge.graph.core.model.Note;
import com.knowledge.graph.core.model.SearchHit;
import com.knowledge.graph.salience.SalienceUpdate;
import com.knowledge.graph.similarity.TextMatchScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * {@link KnowledgeGraphStore} over a Cypher {@link GraphConnection}.
 * Any failure of the underlying connection surfaces as {@link GraphStoreException}.
 */
public class CypherKnowledgeGraphStore implements KnowledgeGraphStore {
    private static final Logger log = LoggerFactory.getLogger(CypherKnowledgeGraphStore.class);

    static final int VECTOR_SEARCH_LIMIT = 20;
    static final int TEXT_CANDIDATE_LIMIT = 1000;
    static final int RELATIONSHIP_SEARCH_LIMIT = 20;

    private final CypherExecutor executor;
    private final TextMatchScorer textMatchScorer = new TextMatchScorer();
    private final Clock clock;

    public CypherKnowledgeGraphStore(GraphConnection connection) {
        this(new CypherExecutor(connection), Clock.systemUTC());
    }

    public CypherKnowledgeGraphStore(CypherExecutor executor, Clock clock) {
        this.executor = executor;
        this.clock = clock;
    }

    // ========== Lookup ==========

    @Override
    public Optional<Entity> findByEntityKey(String entityKey) {
        return call("findByEntityKey", () -> first(executor.findNodeByKey(entityKey)).map(this::mapToEntity));
    }

    @Override
    public Optional<Entity> findPersonByCanonicalName(String canonicalName, String userId) {
        String lower = canonicalName.toLowerCase(Locale.ROOT).trim();
        return call("findPersonByCanonicalName",
                () -> first(executor.findPersonByCanonicalName(lower, userId)).map(this::mapToEntity));
    }

    @Override
    public Optional<Alias> findAlias(String normalizedName, NodeType type, String userId) {
        return call("findAlias", () -> first(executor.findAlias(normalizedName, type, userId))
                .map(row -> decodeRow("alias", () -> new Alias(
                        (String) row.get("name"),
                        (String) row.get("normalized_name"),
                        NodeType.fromLabel((String) row.get("type")),
                        (String) row.get("entity_key"),
                        (String) row.get("user_id")))));
    }

    @Override
    public List<Entity> findByNormalizedNameContainment(String normalizedName, NodeType type, String userId) {
        return call("findByNormalizedNameContainment", () ->
                executor.findByNormalizedNameContainment(normalizedName, type, userId).stream()
                        .map(this::mapToEntity)
                        .toList());
    }

    @Override
    public List<Entity> findFuzzyNameCandidates(String normalizedName, NodeType type, String userId, int limit) {
        return call("findFuzzyNameCandidates", () ->
                executor.findNodesOfType(type, userId, limit).stream()
                        .map(this::mapToEntity)
                        .toList());
    }

    // ========== Search ==========

    @Override
    public List<SearchHit> vectorSearch(float[] queryEmbedding, double threshold, String userId) {
        return call("vectorSearch", () ->
                executor.vectorSearch(queryEmbedding, threshold, userId, VECTOR_SEARCH_LIMIT).stream()
                        .map(row -> mapToHit(row, "similarity"))
                        .toList());
    }

    @Override
    public List<SearchHit> vectorSearchByType(float[] queryEmbedding, NodeType type, String userId, int limit) {
        return call("vectorSearchByType", () ->
                executor.vectorSearchByType(queryEmbedding, type, userId, limit).stream()
                        .map(row -> mapToHit(row, "similarity"))
                        .toList());
    }

    @Override
    public List<SearchHit> fuzzyTextMatch(String text, String userId) {
        return call("fuzzyTextMatch", () -> {
            List<SearchHit> hits = new ArrayList<>();
            for (Map<String, Object> row : executor.findTextMatchCandidates(userId, TEXT_CANDIDATE_LIMIT)) {
                double score = Math.max(
                        textMatchScorer.compute(text, (String) row.get("name")),
                        textMatchScorer.compute(text, (String) row.get("canonical_name")));
                if (textMatchScorer.isMatch(score)) {
                    hits.add(mapToHit(row, null).withScore(score));
                }
            }
            hits.sort(Comparator.comparingDouble(SearchHit::score).reversed());
            return hits;
        });
    }

    @Override
    public List<SearchHit> findNodesViaRelationshipSearch(float[] queryEmbedding, double threshold, String userId) {
        return call("findNodesViaRelationshipSearch", () -> {
            Map<String, SearchHit> byKey = new LinkedHashMap<>();
            for (Map<String, Object> row : executor.relationshipSearch(
                    queryEmbedding, threshold, userId, RELATIONSHIP_SEARCH_LIMIT)) {
                double similarity = toDouble(row.get("similarity"), 0.0);
                for (String side : List.of("from", "to")) {
                    SearchHit hit = decodeRow("relationship endpoint", () -> new SearchHit(
                            (String) row.get(side + "_key"),
                            NodeType.fromLabel((String) row.get(side + "_type")),
                            similarity,
                            (String) row.get(side + "_name"),
                            (String) row.get(side + "_description"),
                            List.of()));
                    byKey.merge(hit.entityKey(), hit, (a, b) -> a.score() >= b.score() ? a : b);
                }
            }
            return List.copyOf(byKey.values());
        });
    }

    @Override
    public ExpandedGraph expandGraph(List<String> entityKeys, String userId) {
        if (entityKeys.isEmpty()) {
            return ExpandedGraph.empty();
        }
        return call("expandGraph", () -> {
            List<Edge> edges = executor.findIncidentEdges(entityKeys, userId, ExpansionAssembler.MAX_INCIDENT_EDGES)
                    .stream()
                    .map(this::mapToEdge)
                    .toList();
            return ExpansionAssembler.assemble(entityKeys, edges, keys ->
                    executor.findNodeProperties(keys).stream()
                            .map(this::mapToGraphNode)
                            .toList());
        });
    }

    // ========== Salience ==========

    @Override
    public Map<String, Double> calculateSalience(Collection<String> entityKeys) {
        if (entityKeys.isEmpty()) {
            return Map.of();
        }
        return call("calculateSalience", () -> {
            Map<String, Double> salience = new HashMap<>();
            for (Map<String, Object> row : executor.findSalience(entityKeys)) {
                salience.put((String) row.get("entity_key"), toDouble(row.get("salience"), Entity.DEFAULT_SALIENCE));
            }
            return salience;
        });
    }

    @Override
    public void applySalienceUpdate(Collection<String> entityKeys, SalienceUpdate update) {
        if (entityKeys.isEmpty()) {
            return;
        }
        long now = clock.millis();
        call("applySalienceUpdate", () -> {
            if (update.countAccess()) {
                executor.incrementAccess(entityKeys, update.delta(), now);
            } else {
                executor.adjustSalience(entityKeys, update.delta(), now);
            }
            return null;
        });
    }

    // ========== Mutations ==========

    @Override
    public EntityUpsert upsertEntity(Entity entity) {
        Map<String, Object> fields = new HashMap<>();
        fields.put("entityKey", entity.getEntityKey());
        fields.put("userId", entity.getUserId());
        fields.put("name", entity.getName());
        fields.put("normalizedName", entity.getNormalizedName());
        fields.put("canonicalName", entity.getCanonicalName());
        fields.put("canonicalNameLower", entity.getCanonicalName() != null
                ? entity.getCanonicalName().toLowerCase(Locale.ROOT).trim() : null);
        fields.put("description", entity.getDescription());
        fields.put("embedding", entity.getEmbedding());
        fields.put("salience", entity.getSalience());
        fields.put("state", entity.getState().getValue());

        String creationId = UUID.randomUUID().toString();
        return call("upsertEntity", () -> {
            Map<String, Object> row = first(executor.mergeNode(entity.getType(), fields, creationId, clock.millis()))
                    .orElseThrow(() -> new GraphStoreException(
                            "Upsert returned no node for key " + entity.getEntityKey()));
            boolean created = Boolean.TRUE.equals(row.get("created"));
            return new EntityUpsert(mapToEntity(row), created);
        });
    }

    @Override
    public void upsertAlias(Alias alias) {
        call("upsertAlias", () -> {
            executor.mergeAlias(alias.name(), alias.normalizedName(), alias.type(), alias.entityKey(),
                    alias.userId(), clock.millis());
            return null;
        });
    }

    @Override
    public void upsertEdge(Edge edge, float[] descriptionEmbedding) {
        Map<String, Object> fields = new HashMap<>();
        fields.put("fromKey", edge.fromKey());
        fields.put("toKey", edge.toKey());
        fields.put("attitude", edge.attitude());
        fields.put("proximity", edge.proximity());
        fields.put("description", edge.description());
        fields.put("relevance", edge.relevance());
        fields.put("descriptionEmbedding", descriptionEmbedding);
        fields.put("notes", edge.notes());
        call("upsertEdge", () -> {
            executor.mergeEdge(edge.relationshipType(), fields, clock.millis());
            return null;
        });
    }

    @Override
    public void appendNote(String entityKey, Note note) {
        String encoded = NoteCodec.encode(note);
        call("appendNote", () -> {
            executor.appendNote(entityKey, encoded, Entity.MAX_NOTES, clock.millis());
            return null;
        });
    }

    // ========== Mapping ==========

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (GraphStoreException | IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("store.failed operation={} error={}", operation, e.getMessage(), e);
            throw new GraphStoreException("Graph store operation '" + operation + "' failed: " + e.getMessage(), e);
        }
    }

    /**
     * Runs a row mapping. Stored data that does not decode (an unknown node type, a value
     * out of range, a column of the wrong type) is a store fault, not a caller error.
     */
    private static <T> T decodeRow(String kind, Supplier<T> mapping) {
        try {
            return mapping.get();
        } catch (IllegalArgumentException | ClassCastException | NullPointerException e) {
            throw new GraphStoreException("Malformed " + kind + " row: " + e.getMessage(), e);
        }
    }

    private static Optional<Map<String, Object>> first(List<Map<String, Object>> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    Entity mapToEntity(Map<String, Object> row) {
        return decodeRow("entity", () -> buildEntity(row));
    }

    private Entity buildEntity(Map<String, Object> row) {
        Instant now = clock.instant();
        List<Note> notes = NoteCodec.decodeAll(row.get("notes")).stream()
                .filter(note -> !note.isExpired(now))
                .toList();
        return Entity.builder()
                .entityKey((String) row.get("entity_key"))
                .userId((String) row.get("user_id"))
                .type(NodeType.fromLabel((String) row.get("node_type")))
                .name((String) row.get("name"))
                .normalizedName((String) row.get("normalized_name"))
                .canonicalName((String) row.get("canonical_name"))
                .description((String) row.get("description"))
                .embedding(toVector(row.get("embedding")))
                .notes(notes)
                .salience(toDouble(row.get("salience"), Entity.DEFAULT_SALIENCE))
                .state(EntityState.fromValue((String) row.get("state")))
                .accessCount(toLong(row.get("access_count")))
                .recallFrequency(toLong(row.get("recall_frequency")))
                .lastAccessedAt(toInstant(row.get("last_accessed_at")))
                .createdAt(toInstant(row.get("created_at")))
                .updatedAt(toInstant(row.get("updated_at")))
                .build();
    }

    private SearchHit mapToHit(Map<String, Object> row, String scoreColumn) {
        return decodeRow("search hit", () -> buildHit(row, scoreColumn));
    }

    private SearchHit buildHit(Map<String, Object> row, String scoreColumn) {
        List<String> notes = NoteCodec.decodeAll(row.get("notes")).stream()
                .map(Note::content)
                .toList();
        return new SearchHit(
                (String) row.get("entity_key"),
                NodeType.fromLabel((String) row.get("node_type")),
                scoreColumn != null ? toDouble(row.get(scoreColumn), 0.0) : 0.0,
                (String) row.get("name"),
                (String) row.get("description"),
                notes);
    }

    private Edge mapToEdge(Map<String, Object> row) {
        return decodeRow("edge", () -> buildEdge(row));
    }

    private Edge buildEdge(Map<String, Object> row) {
        List<String> notes = new ArrayList<>();
        if (row.get("notes") instanceof List<?> list) {
            list.stream().filter(n -> n != null).forEach(n -> notes.add(n.toString()));
        }
        Object relevance = row.get("relevance");
        return new Edge(
                (String) row.get("from_key"),
                (String) row.get("to_key"),
                (String) row.get("relationship_type"),
                toInteger(row.get("attitude")),
                toInteger(row.get("proximity")),
                (String) row.get("description"),
                notes,
                relevance instanceof Number n ? n.doubleValue() : null,
                toInstant(row.get("created_at")),
                toInstant(row.get("updated_at")));
    }

    private GraphNode mapToGraphNode(Map<String, Object> row) {
        return decodeRow("node", () -> buildGraphNode(row));
    }

    @SuppressWarnings("unchecked")
    private GraphNode buildGraphNode(Map<String, Object> row) {
        Object properties = row.get("properties");
        Map<String, Object> props = properties instanceof Map<?, ?> map
                ? NodePropertyFilter.filter((Map<String, Object>) map)
                : Map.of();
        return new GraphNode(
                (String) row.get("entity_key"),
                NodeType.fromLabel((String) row.get("node_type")),
                props);
    }

    private static float[] toVector(Object value) {
        if (!(value instanceof List<?> list) || list.isEmpty()) {
            return null;
        }
        float[] vector = new float[list.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = ((Number) list.get(i)).floatValue();
        }
        return vector;
    }

    private static double toDouble(Object value, double fallback) {
        return value instanceof Number n ? n.doubleValue() : fallback;
    }

    private static long toLong(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }

    private static Integer toInteger(Object value) {
        return value instanceof Number n ? n.intValue() : null;
    }

    private static Instant toInstant(Object value) {
        return value instanceof Number n ? Instant.ofEpochMilli(n.longValue()) : null;
    }
}
