package com.knowledge.graph.resolve;

import com.knowledge.graph.core.model.Entity;
import com.knowledge.graph.core.model.MatchTier;
import com.knowledge.graph.core.model.SearchHit;
import com.knowledge.graph.fusion.FusionConstants;
import com.knowledge.graph.fusion.RankedCandidate;
import com.knowledge.graph.fusion.RankingSignal;
import com.knowledge.graph.fusion.ReciprocalRankFusion;
import com.knowledge.graph.fusion.RrfResult;
import com.knowledge.graph.fusion.SignalBoost;
import com.knowledge.graph.graph.KnowledgeGraphStore;
import com.knowledge.graph.llm.DisambiguationRequest;
import com.knowledge.graph.llm.DisambiguationResult;
import com.knowledge.graph.llm.Disambiguator;
import com.knowledge.graph.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Tier 4: embedding similarity among the user's nodes of the same type.
 *
 * <ul>
 *   <li>top similarity above the auto-resolve threshold: resolve, confidence scaled
 *       into [0.92, 0.96]</li>
 *   <li>above the disambiguation threshold: ask the {@link Disambiguator} to pick among
 *       the top matches; a confirmation resolves with confidence 0.88</li>
 *   <li>otherwise, or when the disambiguator rejects, fails or times out: fall through</li>
 * </ul>
 */
public class VectorSimilarityStrategy implements MatchStrategy {
    private static final Logger log = LoggerFactory.getLogger(VectorSimilarityStrategy.class);

    private final KnowledgeGraphStore store;
    private final Disambiguator disambiguator;
    private final ResolverOptions options;
    private final MetricsService metrics;
    private final ExecutorService executor;

    public VectorSimilarityStrategy(KnowledgeGraphStore store, Disambiguator disambiguator,
                                    ResolverOptions options, MetricsService metrics, ExecutorService executor) {
        this.store = store;
        this.disambiguator = disambiguator;
        this.options = options;
        this.metrics = metrics;
        this.executor = executor;
    }

    @Override
    public Optional<StrategyMatch> tryMatch(ResolutionContext context) {
        Optional<float[]> embedding = context.embedding();
        if (embedding.isEmpty()) {
            return Optional.empty();
        }

        List<SearchHit> hits = store.vectorSearchByType(embedding.get(), context.mention().type(),
                context.mention().userId(), options.getVectorSearchLimit());
        if (hits.isEmpty()) {
            return Optional.empty();
        }

        List<SearchHit> ranked = rank(hits);
        SearchHit top = ranked.get(0);
        log.debug("vector.top mention='{}' candidate='{}' similarity={}",
                context.mention().name(), top.name(), top.score());

        if (top.score() > options.getAutoResolveThreshold()) {
            double confidence = ResolutionConfidence.scaleVector(top.score(), options.getAutoResolveThreshold());
            return store.findByEntityKey(top.entityKey())
                    .map(entity -> new StrategyMatch(entity, confidence, MatchTier.VECTOR));
        }
        if (top.score() > options.getDisambiguationThreshold()) {
            List<SearchHit> candidates = ranked.stream()
                    .filter(hit -> hit.score() > options.getDisambiguationThreshold())
                    .limit(options.getDisambiguationTopK())
                    .toList();
            return disambiguate(context, candidates);
        }
        return Optional.empty();
    }

    /**
     * Orders hits through rank fusion over the single embedding signal, which keeps
     * tier 4 on the same ranking path as retrieval.
     */
    private List<SearchHit> rank(List<SearchHit> hits) {
        List<RankedCandidate<SearchHit>> candidates = hits.stream()
                .map(hit -> new RankedCandidate<>(hit.entityKey(), hit.score(), hit))
                .toList();
        RankingSignal<SearchHit> signal = RankingSignal.sortedByScore(SignalBoost.EMBEDDING, candidates);
        return ReciprocalRankFusion.combine(List.of(signal), FusionConstants.DEFAULT_K,
                        options.getVectorSearchLimit(), SignalBoost.COMMON)
                .stream()
                .map(RrfResult::data)
                .toList();
    }

    private Optional<StrategyMatch> disambiguate(ResolutionContext context, List<SearchHit> candidates) {
        DisambiguationRequest request = new DisambiguationRequest(context.mention(), candidates);
        DisambiguationResult result;
        try {
            result = disambiguator.disambiguateAsync(request, executor)
                    .orTimeout(options.getDisambiguationTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                log.warn("disambiguation.timeout mention='{}' timeoutMs={}",
                        context.mention().name(), options.getDisambiguationTimeout().toMillis());
            } else {
                log.warn("disambiguation.failed mention='{}' error={}", context.mention().name(), cause.getMessage());
            }
            metrics.incrementDisambiguation(false);
            return Optional.empty();
        }

        boolean confirmed = result.isMatch()
                && candidates.stream().anyMatch(hit -> hit.entityKey().equals(result.matchedEntityKey()));
        metrics.incrementDisambiguation(confirmed);
        if (!confirmed) {
            log.debug("disambiguation.rejected mention='{}' reasoning='{}'",
                    context.mention().name(), result.reasoning());
            return Optional.empty();
        }

        Optional<Entity> entity = store.findByEntityKey(result.matchedEntityKey());
        return entity.map(e -> new StrategyMatch(e, ResolutionConfidence.DISAMBIGUATED, MatchTier.DISAMBIGUATED));
    }

    @Override
    public String getName() {
        return "vector";
    }
}
