package com.knowledge.graph.cdi;

import com.knowledge.graph.api.KnowledgeGraph;
import com.knowledge.graph.llm.CacheConfig;
import com.knowledge.graph.llm.CachingEmbeddingProvider;
import com.knowledge.graph.llm.EmbeddingProvider;
import com.knowledge.graph.llm.OllamaClient;
import com.knowledge.graph.llm.OllamaDisambiguator;
import com.knowledge.graph.llm.OllamaEmbeddingProvider;
import com.knowledge.graph.metrics.MicrometerMetricsService;
import com.knowledge.graph.resolve.ResolverOptions;
import com.knowledge.graph.retrieval.RetrievalOptions;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * CDI producer that wires a {@link KnowledgeGraph} from MicroProfile Config properties.
 *
 * <pre>
 * knowledge-graph:
 *   falkordb:
 *     host: localhost
 *     port: 6379
 *     graph-name: knowledge
 *   ollama:
 *     enabled: true
 *     base-url: http://localhost:11434
 * </pre>
 *
 * <p>A {@link MeterRegistry} bean, when the container has one, receives the library's
 * metrics.</p>
 */
@ApplicationScoped
public class KnowledgeGraphProducer {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeGraphProducer.class);

    // ── FalkorDB ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "knowledge-graph.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "knowledge-graph.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "knowledge-graph.falkordb.graph-name", defaultValue = "knowledge")
    String falkordbGraphName;

    // ── Resolution ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "knowledge-graph.resolve.auto-resolve-threshold", defaultValue = "0.92")
    double autoResolveThreshold;

    @Inject
    @ConfigProperty(name = "knowledge-graph.resolve.disambiguation-threshold", defaultValue = "0.85")
    double disambiguationThreshold;

    @Inject
    @ConfigProperty(name = "knowledge-graph.resolve.disambiguation-top-k", defaultValue = "5")
    int disambiguationTopK;

    // ── Retrieval ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "knowledge-graph.explore.top-k", defaultValue = "50")
    int exploreTopK;

    @Inject
    @ConfigProperty(name = "knowledge-graph.explore.signal-timeout-millis", defaultValue = "5000")
    long signalTimeoutMillis;

    @Inject
    @ConfigProperty(name = "knowledge-graph.explore.max-edges", defaultValue = "10")
    int maxEdges;

    @Inject
    @ConfigProperty(name = "knowledge-graph.worker-threads", defaultValue = "8")
    int workerThreads;

    // ── Embedding cache ───────────────────────────────────────

    @Inject
    @ConfigProperty(name = "knowledge-graph.embedding-cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "knowledge-graph.embedding-cache.max-size", defaultValue = "10000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "knowledge-graph.embedding-cache.ttl-seconds", defaultValue = "3600")
    int cacheTtlSeconds;

    // ── Ollama ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "knowledge-graph.ollama.enabled", defaultValue = "false")
    boolean ollamaEnabled;

    @Inject
    @ConfigProperty(name = "knowledge-graph.ollama.base-url", defaultValue = OllamaClient.DEFAULT_BASE_URL)
    String ollamaBaseUrl;

    @Inject
    @ConfigProperty(name = "knowledge-graph.ollama.embedding-model", defaultValue = OllamaEmbeddingProvider.DEFAULT_MODEL)
    String embeddingModel;

    @Inject
    @ConfigProperty(name = "knowledge-graph.ollama.disambiguation-model", defaultValue = OllamaDisambiguator.DEFAULT_MODEL)
    String disambiguationModel;

    @Inject
    @ConfigProperty(name = "knowledge-graph.ollama.timeout-seconds", defaultValue = "30")
    int ollamaTimeoutSeconds;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public KnowledgeGraph knowledgeGraph() {
        log.info("Producing KnowledgeGraph: falkordb={}:{}/{}", falkordbHost, falkordbPort, falkordbGraphName);

        KnowledgeGraph.Builder builder = KnowledgeGraph.builder()
                .falkorDB(falkordbHost, falkordbPort, falkordbGraphName)
                .workerThreads(workerThreads)
                .resolverOptions(resolverOptions())
                .retrievalOptions(retrievalOptions());

        if (ollamaEnabled) {
            OllamaClient client = new OllamaClient(ollamaBaseUrl, Duration.ofSeconds(ollamaTimeoutSeconds));
            builder.embeddingProvider(embeddingProvider(new OllamaEmbeddingProvider(client, embeddingModel)))
                    .disambiguator(new OllamaDisambiguator(client, disambiguationModel));
            log.info("Ollama enabled: baseUrl={} embeddingModel={} disambiguationModel={}",
                    ollamaBaseUrl, embeddingModel, disambiguationModel);
        } else {
            log.info("Ollama disabled; vector resolution and semantic explore are inactive");
        }

        if (meterRegistry != null && meterRegistry.isResolvable()) {
            builder.metricsService(new MicrometerMetricsService(meterRegistry.get()));
        }
        return builder.build();
    }

    public void closeKnowledgeGraph(@Disposes KnowledgeGraph graph) {
        log.info("Closing KnowledgeGraph");
        graph.close();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    ResolverOptions resolverOptions() {
        return ResolverOptions.builder()
                .autoResolveThreshold(autoResolveThreshold)
                .disambiguationThreshold(disambiguationThreshold)
                .disambiguationTopK(disambiguationTopK)
                .build();
    }

    EmbeddingProvider embeddingProvider(EmbeddingProvider delegate) {
        CacheConfig cacheConfig = new CacheConfig(cacheMaxSize, cacheTtlSeconds, cacheEnabled);
        return cacheConfig.enabled() ? new CachingEmbeddingProvider(delegate, cacheConfig) : delegate;
    }

    RetrievalOptions retrievalOptions() {
        return RetrievalOptions.builder()
                .topK(exploreTopK)
                .signalTimeout(Duration.ofMillis(signalTimeoutMillis))
                .maxEdges(maxEdges)
                .build();
    }
}
