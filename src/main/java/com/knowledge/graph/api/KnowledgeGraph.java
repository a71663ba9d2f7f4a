package com.knowledge.graph.api;

import com.knowledge.graph.core.model.Edge;
import com.knowledge.graph.core.model.Entity;
import com.knowledge.graph.core.model.MatchTier;
import com.knowledge.graph.core.model.Mention;
import com.knowledge.graph.core.model.NodeType;
import com.knowledge.graph.core.model.Note;
import com.knowledge.graph.core.model.ResolutionResult;
import com.knowledge.graph.graph.CypherKnowledgeGraphStore;
import com.knowledge.graph.graph.EntityUpsert;
import com.knowledge.graph.graph.FalkorDBConnection;
import com.knowledge.graph.graph.GraphConnection;
import com.knowledge.graph.graph.InputSanitizer;
import com.knowledge.graph.graph.KnowledgeGraphStore;
import com.knowledge.graph.llm.Disambiguator;
import com.knowledge.graph.llm.EmbeddingProvider;
import com.knowledge.graph.llm.NoOpDisambiguator;
import com.knowledge.graph.llm.NoOpEmbeddingProvider;
import com.knowledge.graph.metrics.MetricsService;
import com.knowledge.graph.metrics.NoOpMetricsService;
import com.knowledge.graph.normalization.EntityKeys;
import com.knowledge.graph.normalization.EntityNameNormalizer;
import com.knowledge.graph.resolve.MentionResolver;
import com.knowledge.graph.resolve.ResolverOptions;
import com.knowledge.graph.retrieval.ExploreRequest;
import com.knowledge.graph.retrieval.ExploreResult;
import com.knowledge.graph.retrieval.RetrievalOptions;
import com.knowledge.graph.retrieval.RetrievalOrchestrator;
import com.knowledge.graph.salience.SalienceTracker;
import com.knowledge.graph.tracing.NoOpTracingService;
import com.knowledge.graph.tracing.Span;
import com.knowledge.graph.tracing.SpanNames;
import com.knowledge.graph.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point: resolves mentions to stable entities, explores the graph and
 * records access.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (KnowledgeGraph graph = KnowledgeGraph.builder()
 *         .falkorDB("localhost", 6379, "knowledge")
 *         .embeddingProvider(new OllamaEmbeddingProvider(ollama, "nomic-embed-text"))
 *         .build()) {
 *
 *     ResolutionResult ml = graph.resolve(Mention.of("Machine learning", NodeType.CONCEPT, "u1"));
 *
 *     ExploreResult result = graph.explore(ExploreRequest.builder("u1")
 *             .query("machine learning", 0.7)
 *             .build());
 * }
 * </pre>
 */
public class KnowledgeGraph implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeGraph.class);

    static final int DEFAULT_WORKER_THREADS = 8;

    private static final double SOURCE_CONFIDENCE = 1.0;

    private final KnowledgeGraphStore store;
    private final GraphConnection connection;
    private final boolean ownsConnection;
    private final EmbeddingProvider embeddingProvider;
    private final MentionResolver resolver;
    private final RetrievalOrchestrator orchestrator;
    private final SalienceTracker salienceTracker;
    private final TracingService tracingService;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    private KnowledgeGraph(Builder builder) {
        this.connection = builder.connection;
        this.ownsConnection = builder.ownsConnection;
        if (builder.store != null) {
            this.store = builder.store;
        } else if (connection != null) {
            if (builder.createIndexes) {
                connection.createIndexes();
            }
            this.store = new CypherKnowledgeGraphStore(connection);
        } else {
            throw new IllegalStateException("Either a graph connection or a store is required");
        }

        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        this.embeddingProvider = builder.embeddingProvider != null
                ? builder.embeddingProvider : new NoOpEmbeddingProvider();
        Disambiguator disambiguator = builder.disambiguator != null
                ? builder.disambiguator : new NoOpDisambiguator();

        this.ownsExecutor = builder.executor == null;
        this.executor = builder.executor != null
                ? builder.executor : Executors.newFixedThreadPool(builder.workerThreads);

        this.salienceTracker = new SalienceTracker(store, metricsService);
        this.resolver = new MentionResolver(store,
                MentionResolver.defaultStrategies(store, disambiguator, builder.resolverOptions, metricsService, executor),
                embeddingProvider, builder.resolverOptions, metricsService, tracingService, executor);
        this.orchestrator = new RetrievalOrchestrator(store, embeddingProvider, salienceTracker,
                builder.retrievalOptions, metricsService, tracingService, executor);

        log.info("knowledgeGraph.initialized store={} embedder={} disambiguator={}",
                store.getClass().getSimpleName(), embeddingProvider.getProviderName(),
                disambiguator.getProviderName());
    }

    // ========== Resolution ==========

    /**
     * Maps a mention onto an existing entity, or creates one.
     *
     * @throws com.knowledge.graph.graph.GraphStoreException    if the store fails
     * @throws com.knowledge.graph.resolve.DataIntegrityException if the key is held by an unrelated node
     */
    public ResolutionResult resolve(Mention mention) {
        return resolver.resolve(mention);
    }

    public ResolutionResult resolve(String name, NodeType type, String userId) {
        return resolve(Mention.of(name, type, userId));
    }

    // ========== Retrieval ==========

    public ExploreResult explore(ExploreRequest request) {
        return orchestrator.explore(request);
    }

    // ========== Access ==========

    public void recordAccess(String entityKey) {
        try (Span span = tracingService.startSpan(SpanNames.RECORD_ACCESS)) {
            span.setAttribute("nodes", 1L);
            salienceTracker.incrementAccess(entityKey);
        }
    }

    public void recordAccess(Collection<String> entityKeys) {
        try (Span span = tracingService.startSpan(SpanNames.RECORD_ACCESS)) {
            span.setAttribute("nodes", entityKeys.size());
            salienceTracker.batchIncrementAccess(entityKeys);
        }
    }

    /**
     * Adds {@code delta} to salience without counting an access; decay jobs pass a
     * negative delta.
     */
    public void adjustSalience(String entityKey, double delta) {
        salienceTracker.applyDelta(entityKey, delta);
    }

    // ========== Mutations ==========

    public void appendNote(String entityKey, String content, String addedBy) {
        appendNote(entityKey, Note.of(content, addedBy));
    }

    public void appendNote(String entityKey, Note note) {
        InputSanitizer.validateText(note.content());
        store.appendNote(entityKey, note);
    }

    /**
     * Creates or refreshes an edge. A description is embedded for relationship search
     * when an embedder is available; an embedding failure stores the edge without one.
     */
    public void upsertEdge(Edge edge) {
        InputSanitizer.validateRelationshipType(edge.relationshipType());
        if (edge.description() != null) {
            InputSanitizer.validateText(edge.description());
        }
        store.upsertEdge(edge, embedDescription(edge.description()));
    }

    /**
     * Records a provenance source and links it to every entity it mentions.
     *
     * <p>Sources are keyed directly by name and never go through the resolver tiers, so
     * two ingestion units with similar names stay separate nodes. Recording the same
     * name again reuses its node.</p>
     *
     * @return the source node, with {@code isNew} set when this call created it
     */
    public ResolutionResult recordSource(String sourceName, String userId, List<String> mentionedEntityKeys) {
        InputSanitizer.validateEntityName(sourceName);
        InputSanitizer.validateUserId(userId);
        String normalized = EntityNameNormalizer.normalize(sourceName);
        Entity candidate = Entity.builder()
                .entityKey(EntityKeys.keyForNormalized(normalized, NodeType.SOURCE, userId))
                .userId(userId)
                .type(NodeType.SOURCE)
                .name(sourceName)
                .normalizedName(normalized)
                .canonicalName(sourceName)
                .build();
        EntityUpsert upsert = store.upsertEntity(candidate);
        ResolutionResult source = upsert.created()
                ? ResolutionResult.created(upsert.entity(), SOURCE_CONFIDENCE)
                : ResolutionResult.matched(upsert.entity(), SOURCE_CONFIDENCE, MatchTier.EXACT_KEY);
        Instant now = Instant.now();
        for (String target : mentionedEntityKeys) {
            store.upsertEdge(new Edge(source.entityKey(), target, Edge.MENTIONS,
                    null, null, null, List.of(), null, now, now), null);
        }
        log.debug("source.recorded entityKey={} mentions={}", source.entityKey(), mentionedEntityKeys.size());
        return source;
    }

    private float[] embedDescription(String description) {
        if (description == null || description.isBlank()) {
            return null;
        }
        try {
            float[] embedding = embeddingProvider.embed(description);
            return embedding != null && embedding.length > 0 ? embedding : null;
        } catch (RuntimeException e) {
            log.warn("edge.embedding.failed error={}", e.getMessage());
            return null;
        }
    }

    public KnowledgeGraphStore getStore() {
        return store;
    }

    public SalienceTracker getSalienceTracker() {
        return salienceTracker;
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        if (ownsConnection && connection != null) {
            try {
                connection.close();
            } catch (RuntimeException e) {
                log.warn("Error closing connection", e);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private GraphConnection connection;
        private boolean ownsConnection = false;
        private KnowledgeGraphStore store;
        private EmbeddingProvider embeddingProvider;
        private Disambiguator disambiguator;
        private MetricsService metricsService;
        private TracingService tracingService;
        private ResolverOptions resolverOptions = ResolverOptions.defaults();
        private RetrievalOptions retrievalOptions = RetrievalOptions.defaults();
        private ExecutorService executor;
        private int workerThreads = DEFAULT_WORKER_THREADS;
        private boolean createIndexes = true;

        /**
         * Sets the graph connection to use. The caller keeps ownership.
         */
        public Builder graphConnection(GraphConnection connection) {
            this.connection = connection;
            this.ownsConnection = false;
            return this;
        }

        /**
         * Creates a FalkorDB connection owned by the built instance.
         */
        public Builder falkorDB(String host, int port, String graphName) {
            this.connection = new FalkorDBConnection(host, port, graphName);
            this.ownsConnection = true;
            return this;
        }

        /**
         * Uses a store directly, bypassing the Cypher layer.
         */
        public Builder store(KnowledgeGraphStore store) {
            this.store = store;
            return this;
        }

        public Builder embeddingProvider(EmbeddingProvider embeddingProvider) {
            this.embeddingProvider = embeddingProvider;
            return this;
        }

        public Builder disambiguator(Disambiguator disambiguator) {
            this.disambiguator = disambiguator;
            return this;
        }

        /**
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Defaults to {@link NoOpTracingService} if not set.
         */
        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder resolverOptions(ResolverOptions resolverOptions) {
            this.resolverOptions = resolverOptions;
            return this;
        }

        public Builder retrievalOptions(RetrievalOptions retrievalOptions) {
            this.retrievalOptions = retrievalOptions;
            return this;
        }

        /**
         * Uses a caller-owned executor for gather tasks, embedding and disambiguation
         * calls. Without one, a fixed pool is created and shut down on close.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            if (workerThreads <= 0) {
                throw new IllegalArgumentException("workerThreads must be positive");
            }
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder createIndexes(boolean createIndexes) {
            this.createIndexes = createIndexes;
            return this;
        }

        public KnowledgeGraph build() {
            if (connection == null && store == null) {
                throw new IllegalStateException("Graph connection or store is required");
            }
            return new KnowledgeGraph(this);
        }
    }
}
