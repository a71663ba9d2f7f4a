package com.knowledge.graph.graph;

import com.knowledge.graph.core.model.Alias;
import com.knowledge.graph.core.model.Edge;
import com.knowledge.graph.core.model.Entity;
import com.knowledge.graph.core.model.ExpandedGraph;
import com.knowledge.graph.core.model.GraphNode;
import com.knowledge.graph.core.model.NodeType;
import com.knowledge.graph.core.model.Note;
import com.knowledge.graph.core.model.SearchHit;
import com.knowledge.graph.salience.SalienceRules;
import com.knowledge.graph.salience.SalienceUpdate;
import com.knowledge.graph.similarity.CosineSimilarity;
import com.knowledge.graph.similarity.TextMatchScorer;

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
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Thread-safe in-memory {@link KnowledgeGraphStore}. Per-node updates run inside
 * {@link ConcurrentHashMap#compute}, so each one is atomic for its node.
 *
 * <p>Suitable for embedded use and tests; nothing is persisted.</p>
 */
public class InMemoryKnowledgeGraphStore implements KnowledgeGraphStore {

    private final Map<String, Entity> nodes = new ConcurrentHashMap<>();
    private final Map<String, Alias> aliases = new ConcurrentHashMap<>();
    private final Map<String, StoredEdge> edges = new ConcurrentHashMap<>();
    private final TextMatchScorer textMatchScorer = new TextMatchScorer();
    private final Clock clock;

    public InMemoryKnowledgeGraphStore() {
        this(Clock.systemUTC());
    }

    public InMemoryKnowledgeGraphStore(Clock clock) {
        this.clock = clock;
    }

    private record StoredEdge(Edge edge, float[] descriptionEmbedding) {
    }

    /**
     * Stores a node as given, replacing any node under the same key. For seeding.
     */
    public void save(Entity entity) {
        nodes.put(entity.getEntityKey(), entity);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public List<Alias> aliases() {
        return List.copyOf(aliases.values());
    }

    // ========== Lookup ==========

    @Override
    public Optional<Entity> findByEntityKey(String entityKey) {
        return Optional.ofNullable(nodes.get(entityKey)).map(this::withoutExpiredNotes);
    }

    @Override
    public Optional<Entity> findPersonByCanonicalName(String canonicalName, String userId) {
        String wanted = canonicalName.toLowerCase(Locale.ROOT).trim();
        return ofUser(userId, NodeType.PERSON).stream()
                .filter(e -> e.getCanonicalName() != null
                        && e.getCanonicalName().toLowerCase(Locale.ROOT).trim().equals(wanted))
                .findFirst();
    }

    @Override
    public Optional<Alias> findAlias(String normalizedName, NodeType type, String userId) {
        return Optional.ofNullable(aliases.get(aliasKey(normalizedName, type, userId)));
    }

    @Override
    public List<Entity> findByNormalizedNameContainment(String normalizedName, NodeType type, String userId) {
        return ofUser(userId, type).stream()
                .filter(e -> e.getNormalizedName() != null && !e.getNormalizedName().isEmpty())
                .filter(e -> e.getNormalizedName().contains(normalizedName)
                        || normalizedName.contains(e.getNormalizedName()))
                .toList();
    }

    @Override
    public List<Entity> findFuzzyNameCandidates(String normalizedName, NodeType type, String userId, int limit) {
        return ofUser(userId, type).stream().limit(limit).toList();
    }

    // ========== Search ==========

    @Override
    public List<SearchHit> vectorSearch(float[] queryEmbedding, double threshold, String userId) {
        return nodes.values().stream()
                .filter(e -> e.getUserId().equals(userId) && e.hasEmbedding())
                .map(e -> toHit(e, CosineSimilarity.compute(queryEmbedding, e.getEmbedding())))
                .filter(hit -> hit.score() >= threshold)
                .sorted(Comparator.comparingDouble(SearchHit::score).reversed())
                .limit(CypherKnowledgeGraphStore.VECTOR_SEARCH_LIMIT)
                .toList();
    }

    @Override
    public List<SearchHit> vectorSearchByType(float[] queryEmbedding, NodeType type, String userId, int limit) {
        return ofUser(userId, type).stream()
                .filter(Entity::hasEmbedding)
                .map(e -> toHit(e, CosineSimilarity.compute(queryEmbedding, e.getEmbedding())))
                .sorted(Comparator.comparingDouble(SearchHit::score).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public List<SearchHit> fuzzyTextMatch(String text, String userId) {
        List<SearchHit> hits = new ArrayList<>();
        for (Entity entity : nodes.values()) {
            if (!entity.getUserId().equals(userId) || entity.getType() == NodeType.SOURCE) {
                continue;
            }
            double score = Math.max(
                    textMatchScorer.compute(text, entity.getName()),
                    textMatchScorer.compute(text, entity.getCanonicalName()));
            if (textMatchScorer.isMatch(score)) {
                hits.add(toHit(entity, score));
            }
        }
        hits.sort(Comparator.comparingDouble(SearchHit::score).reversed());
        return hits;
    }

    @Override
    public List<SearchHit> findNodesViaRelationshipSearch(float[] queryEmbedding, double threshold, String userId) {
        Map<String, SearchHit> byKey = new LinkedHashMap<>();
        for (StoredEdge stored : edges.values()) {
            Entity from = nodes.get(stored.edge().fromKey());
            Entity to = nodes.get(stored.edge().toKey());
            if (from == null || to == null || !from.getUserId().equals(userId)
                    || stored.descriptionEmbedding() == null) {
                continue;
            }
            double similarity = CosineSimilarity.compute(queryEmbedding, stored.descriptionEmbedding());
            if (similarity < threshold) {
                continue;
            }
            for (Entity endpoint : List.of(from, to)) {
                byKey.merge(endpoint.getEntityKey(), toHit(endpoint, similarity),
                        (a, b) -> a.score() >= b.score() ? a : b);
            }
        }
        return byKey.values().stream()
                .sorted(Comparator.comparingDouble(SearchHit::score).reversed())
                .toList();
    }

    @Override
    public ExpandedGraph expandGraph(List<String> entityKeys, String userId) {
        if (entityKeys.isEmpty()) {
            return ExpandedGraph.empty();
        }
        List<Edge> incident = edges.values().stream()
                .map(StoredEdge::edge)
                .filter(e -> entityKeys.contains(e.fromKey()) || entityKeys.contains(e.toKey()))
                .filter(e -> {
                    Entity from = nodes.get(e.fromKey());
                    return from != null && from.getUserId().equals(userId);
                })
                .limit(ExpansionAssembler.MAX_INCIDENT_EDGES)
                .toList();
        return ExpansionAssembler.assemble(entityKeys, incident, keys -> keys.stream()
                .map(nodes::get)
                .filter(e -> e != null)
                .map(this::toGraphNode)
                .toList());
    }

    // ========== Salience ==========

    @Override
    public Map<String, Double> calculateSalience(Collection<String> entityKeys) {
        Map<String, Double> salience = new HashMap<>();
        for (String key : entityKeys) {
            Entity entity = nodes.get(key);
            if (entity != null) {
                salience.put(key, entity.getSalience());
            }
        }
        return salience;
    }

    @Override
    public void applySalienceUpdate(Collection<String> entityKeys, SalienceUpdate update) {
        Instant now = clock.instant();
        for (String key : entityKeys) {
            nodes.computeIfPresent(key, (k, current) -> SalienceRules.apply(current, update, now));
        }
    }

    // ========== Mutations ==========

    @Override
    public EntityUpsert upsertEntity(Entity entity) {
        AtomicBoolean created = new AtomicBoolean(false);
        Instant now = clock.instant();
        Entity stored = nodes.computeIfAbsent(entity.getEntityKey(), key -> {
            created.set(true);
            return entity.toBuilder().createdAt(now).updatedAt(now).build();
        });
        return new EntityUpsert(stored, created.get());
    }

    @Override
    public void upsertAlias(Alias alias) {
        if (!nodes.containsKey(alias.entityKey())) {
            return;
        }
        // first mapping wins
        aliases.putIfAbsent(aliasKey(alias.normalizedName(), alias.type(), alias.userId()), alias);
    }

    @Override
    public void upsertEdge(Edge edge, float[] descriptionEmbedding) {
        if (!nodes.containsKey(edge.fromKey()) || !nodes.containsKey(edge.toKey())) {
            return;
        }
        Instant now = clock.instant();
        edges.compute(edge.identity(), (key, existing) -> {
            if (existing == null) {
                Edge created = new Edge(edge.fromKey(), edge.toKey(), edge.relationshipType(), edge.attitude(),
                        edge.proximity(), edge.description(), edge.notes(), edge.relevance(),
                        edge.createdAt() != null ? edge.createdAt() : now,
                        edge.updatedAt() != null ? edge.updatedAt() : now);
                return new StoredEdge(created, descriptionEmbedding);
            }
            Edge old = existing.edge();
            List<String> notes = new ArrayList<>(old.notes());
            edge.notes().stream().filter(n -> !notes.contains(n)).forEach(notes::add);
            Edge merged = new Edge(old.fromKey(), old.toKey(), old.relationshipType(),
                    edge.attitude() != null ? edge.attitude() : old.attitude(),
                    edge.proximity() != null ? edge.proximity() : old.proximity(),
                    edge.description() != null ? edge.description() : old.description(),
                    notes,
                    edge.relevance() != null ? edge.relevance() : old.relevance(),
                    old.createdAt(),
                    now);
            return new StoredEdge(merged,
                    descriptionEmbedding != null ? descriptionEmbedding : existing.descriptionEmbedding());
        });
    }

    @Override
    public void appendNote(String entityKey, Note note) {
        Instant now = clock.instant();
        nodes.computeIfPresent(entityKey, (key, current) -> current.toBuilder()
                .addNote(note)
                .updatedAt(now)
                .build());
    }

    // ========== Helpers ==========

    private List<Entity> ofUser(String userId, NodeType type) {
        return nodes.values().stream()
                .filter(e -> e.getUserId().equals(userId) && e.getType() == type)
                .sorted(Comparator.comparing(Entity::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();
    }

    private Entity withoutExpiredNotes(Entity entity) {
        Instant now = clock.instant();
        if (entity.getNotes().stream().noneMatch(n -> n.isExpired(now))) {
            return entity;
        }
        return entity.toBuilder()
                .notes(entity.getNotes().stream().filter(n -> !n.isExpired(now)).toList())
                .build();
    }

    private static String aliasKey(String normalizedName, NodeType type, String userId) {
        return normalizedName + "|" + type.getLabel() + "|" + userId;
    }

    private static SearchHit toHit(Entity entity, double score) {
        return new SearchHit(entity.getEntityKey(), entity.getType(), score, entity.getName(),
                entity.getDescription(), entity.getNotes().stream().map(Note::content).toList());
    }

    private GraphNode toGraphNode(Entity entity) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("entity_key", entity.getEntityKey());
        properties.put("user_id", entity.getUserId());
        properties.put("node_type", entity.getType().getLabel());
        properties.put("name", entity.getName());
        properties.put("normalized_name", entity.getNormalizedName());
        properties.put("canonical_name", entity.getCanonicalName());
        properties.put("description", entity.getDescription());
        properties.put("embedding", entity.getEmbedding());
        properties.put("notes", entity.getNotes().stream().map(Note::content).collect(Collectors.toList()));
        properties.put("salience", entity.getSalience());
        properties.put("state", entity.getState().getValue());
        properties.put("access_count", entity.getAccessCount());
        properties.put("recall_frequency", entity.getRecallFrequency());
        properties.put("created_at", entity.getCreatedAt().toEpochMilli());
        properties.put("updated_at", entity.getUpdatedAt().toEpochMilli());
        return new GraphNode(entity.getEntityKey(), entity.getType(), NodePropertyFilter.filter(properties));
    }
}
