package com.knowledge.graph.resolve;

import com.knowledge.graph.core.model.Alias;
import com.knowledge.graph.core.model.Entity;
import com.knowledge.graph.core.model.MatchTier;
import com.knowledge.graph.core.model.Mention;
import com.knowledge.graph.core.model.ResolutionResult;
import com.knowledge.graph.graph.EntityUpsert;
import com.knowledge.graph.graph.GraphStoreException;
import com.knowledge.graph.graph.InputSanitizer;
import com.knowledge.graph.graph.KnowledgeGraphStore;
import com.knowledge.graph.llm.Disambiguator;
import com.knowledge.graph.llm.EmbeddingProvider;
import com.knowledge.graph.logging.LogContext;
import com.knowledge.graph.metrics.MetricsService;
import com.knowledge.graph.normalization.EntityKeys;
import com.knowledge.graph.normalization.EntityNameNormalizer;
import com.knowledge.graph.tracing.Span;
import com.knowledge.graph.tracing.SpanNames;
import com.knowledge.graph.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Maps a mention onto a stable graph entity.
 *
 * <p>Strategies run in order and the first match wins; later, more expensive tiers
 * (vector search, disambiguation) never run once an earlier tier matched. When no tier
 * matches, the entity is created through an upsert keyed by entity key, so repeated or
 * concurrent attempts for the same normalized name collapse into one node.</p>
 *
 * <p>When the resolved entity's stored name differs from the mention, an alias is
 * recorded. Store failures propagate as {@link GraphStoreException}; a node under the
 * key that belongs to a different mention raises {@link DataIntegrityException}.</p>
 */
public class MentionResolver {
    private static final Logger log = LoggerFactory.getLogger(MentionResolver.class);

    private final KnowledgeGraphStore store;
    private final List<MatchStrategy> strategies;
    private final EmbeddingProvider embeddingProvider;
    private final ResolverOptions options;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final ExecutorService executor;

    public MentionResolver(KnowledgeGraphStore store, List<MatchStrategy> strategies,
                           EmbeddingProvider embeddingProvider, ResolverOptions options,
                           MetricsService metrics, TracingService tracing, ExecutorService executor) {
        this.store = store;
        this.strategies = List.copyOf(strategies);
        this.embeddingProvider = embeddingProvider;
        this.options = options;
        this.metrics = metrics;
        this.tracing = tracing;
        this.executor = executor;
    }

    /**
     * The standard tier order: exact key, person canonical name, alias, vector
     * similarity, fuzzy text.
     */
    public static List<MatchStrategy> defaultStrategies(KnowledgeGraphStore store,
                                                        Disambiguator disambiguator,
                                                        ResolverOptions options, MetricsService metrics,
                                                        ExecutorService executor) {
        return List.of(
                new ExactKeyStrategy(store),
                new PersonCanonicalNameStrategy(store),
                new AliasStrategy(store),
                new VectorSimilarityStrategy(store, disambiguator, options, metrics, executor),
                new FuzzyTextStrategy(store, options));
    }

    public List<MatchStrategy> getStrategies() {
        return strategies;
    }

    public ResolutionResult resolve(Mention mention) {
        InputSanitizer.validateEntityName(mention.name());
        InputSanitizer.validateUserId(mention.userId());
        String normalized = EntityNameNormalizer.normalize(mention.name());
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Entity name has no word characters: '" + mention.name() + "'");
        }
        String entityKey = EntityKeys.keyForNormalized(normalized, mention.type(), mention.userId());
        ResolutionContext context = new ResolutionContext(mention, normalized, entityKey, embedder(mention));

        long start = System.nanoTime();
        try (LogContext ignored = LogContext.forResolution(mention.userId(), mention.type().getLabel());
             Span span = tracing.startSpan(SpanNames.RESOLVE, Map.of("nodeType", mention.type().getLabel()))) {
            try {
                ResolutionResult result = runTiers(context);
                span.setAttribute("tier", result.tier().name());
                span.setAttribute("confidence", result.confidence());
                span.setStatus(Span.SpanStatus.OK);
                metrics.recordResolution(mention.type(), result.tier(), Duration.ofNanos(System.nanoTime() - start));
                log.info("mention.resolved name='{}' entityKey={} tier={} confidence={} isNew={}",
                        mention.name(), result.entityKey(), result.tier(), result.confidence(), result.isNew());
                return result;
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                log.error("mention.resolve.failed name='{}' error={}", mention.name(), e.getMessage());
                throw e;
            }
        }
    }

    private ResolutionResult runTiers(ResolutionContext context) {
        for (MatchStrategy strategy : strategies) {
            Optional<StrategyMatch> match = strategy.tryMatch(context);
            if (match.isPresent()) {
                StrategyMatch m = match.get();
                log.debug("tier.matched strategy={} entityKey={}", strategy.getName(), m.entity().getEntityKey());
                recordAliasIfRenamed(context, m.entity());
                return ResolutionResult.matched(m.entity(), m.confidence(), m.tier());
            }
        }
        return create(context);
    }

    private ResolutionResult create(ResolutionContext context) {
        Mention mention = context.mention();
        Entity candidate = Entity.builder()
                .entityKey(context.entityKey())
                .userId(mention.userId())
                .type(mention.type())
                .name(mention.name())
                .normalizedName(context.normalizedName())
                .canonicalName(mention.name())
                .embedding(context.knownEmbedding())
                .build();

        EntityUpsert upsert = store.upsertEntity(candidate);
        context.verifyOwnership(upsert.entity());
        if (!upsert.created()) {
            // another caller created it between our lookup and the upsert
            log.debug("entity.create.collapsed entityKey={}", context.entityKey());
            recordAliasIfRenamed(context, upsert.entity());
            return ResolutionResult.matched(upsert.entity(), ResolutionConfidence.EXACT_KEY,
                    MatchTier.EXACT_KEY);
        }
        metrics.incrementEntityCreated(mention.type());
        return ResolutionResult.created(upsert.entity(), ResolutionConfidence.CREATED);
    }

    private void recordAliasIfRenamed(ResolutionContext context, Entity entity) {
        Mention mention = context.mention();
        if (entity.getName().equals(mention.name())) {
            return;
        }
        store.upsertAlias(new Alias(mention.name(), context.normalizedName(), mention.type(),
                entity.getEntityKey(), mention.userId()));
        metrics.incrementAliasRecorded(mention.type());
        log.debug("alias.recorded alias='{}' entityKey={}", mention.name(), entity.getEntityKey());
    }

    /**
     * Lazily embeds the mention name. Embedding failures skip the vector tier rather than
     * failing resolution; only store failures are fatal.
     */
    private Supplier<float[]> embedder(Mention mention) {
        if (embeddingProvider == null || !options.isEmbedMissingMentions()) {
            return null;
        }
        return () -> {
            try {
                return CompletableFuture.supplyAsync(() -> embeddingProvider.embed(mention.name()), executor)
                        .orTimeout(options.getEmbeddingTimeout().toMillis(), TimeUnit.MILLISECONDS)
                        .join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("embedding.failed name='{}' error={}", mention.name(), cause.toString());
                return null;
            }
        };
    }
}
