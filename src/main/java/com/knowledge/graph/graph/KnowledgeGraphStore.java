package com.knowledge.graph.graph;

import com.knowledge.graph.core.model.Alias;
import com.knowledge.graph.core.model.Edge;
import com.knowledge.graph.core.model.Entity;
import com.knowledge.graph.core.model.ExpandedGraph;
import com.knowledge.graph.core.model.NodeType;
import com.knowledge.graph.core.model.Note;
import com.knowledge.graph.core.model.SearchHit;
import com.knowledge.graph.salience.SalienceUpdate;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Query and mutation capabilities of the knowledge graph store. Every read is scoped
 * to one user; every mutation is an idempotent upsert or an atomic per-node update.
 *
 * <p>Implementations report connectivity or query failures as
 * {@link GraphStoreException}.</p>
 */
public interface KnowledgeGraphStore {

    // ========== Lookup ==========

    Optional<Entity> findByEntityKey(String entityKey);

    /**
     * Case-insensitive canonical name match among the user's Person nodes.
     */
    Optional<Entity> findPersonByCanonicalName(String canonicalName, String userId);

    Optional<Alias> findAlias(String normalizedName, NodeType type, String userId);

    /**
     * Same-type nodes whose normalized name contains, or is contained in, the given one.
     */
    List<Entity> findByNormalizedNameContainment(String normalizedName, NodeType type, String userId);

    /**
     * Same-type nodes whose name or canonical name may be within edit distance of the
     * given normalized name. Implementations may over-approximate; callers re-score.
     */
    List<Entity> findFuzzyNameCandidates(String normalizedName, NodeType type, String userId, int limit);

    // ========== Search ==========

    /**
     * Nodes of any type whose embedding has cosine similarity at least {@code threshold}
     * with the query embedding, highest first.
     */
    List<SearchHit> vectorSearch(float[] queryEmbedding, double threshold, String userId);

    /**
     * Top {@code limit} nodes of one type by cosine similarity, highest first.
     */
    List<SearchHit> vectorSearchByType(float[] queryEmbedding, NodeType type, String userId, int limit);

    /**
     * Nodes whose names fuzzily match the text, scored in [0, 1].
     */
    List<SearchHit> fuzzyTextMatch(String text, String userId);

    /**
     * Endpoints of relationships whose description embedding is at least
     * {@code threshold} similar to the query embedding.
     */
    List<SearchHit> findNodesViaRelationshipSearch(float[] queryEmbedding, double threshold, String userId);

    /**
     * Bounded one-hop expansion around the given seed keys.
     */
    ExpandedGraph expandGraph(List<String> entityKeys, String userId);

    // ========== Salience ==========

    /**
     * Current salience for each key that exists. Missing keys are absent from the result.
     */
    Map<String, Double> calculateSalience(Collection<String> entityKeys);

    default Optional<Double> calculateSalience(String entityKey) {
        return Optional.ofNullable(calculateSalience(List.of(entityKey)).get(entityKey));
    }

    /**
     * Applies one update to every listed node as a single atomic bulk operation.
     */
    void applySalienceUpdate(Collection<String> entityKeys, SalienceUpdate update);

    default void incrementAccess(String entityKey) {
        applySalienceUpdate(List.of(entityKey), SalienceUpdate.access());
    }

    default void batchIncrementAccess(Collection<String> entityKeys) {
        applySalienceUpdate(entityKeys, SalienceUpdate.access());
    }

    // ========== Mutations ==========

    /**
     * Creates the node if no node holds its key, otherwise leaves the stored fields
     * untouched. Concurrent calls for the same key yield one node.
     */
    EntityUpsert upsertEntity(Entity entity);

    void upsertAlias(Alias alias);

    /**
     * Merges an edge keyed by (from, to, type), refreshing its mutable fields.
     *
     * @param descriptionEmbedding embedding of the edge description for relationship
     *                             search, may be null
     */
    void upsertEdge(Edge edge, float[] descriptionEmbedding);

    /**
     * Appends a note, dropping the oldest beyond {@link Entity#MAX_NOTES}.
     */
    void appendNote(String entityKey, Note note);
}
