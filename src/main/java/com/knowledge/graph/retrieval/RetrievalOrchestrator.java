package com.knowledge.graph.retrieval;

import com.knowledge.graph.core.model.Entity;
import com.knowledge.graph.core.model.ExpandedGraph;
import com.knowledge.graph.core.model.NodeType;
import com.knowledge.graph.core.model.SearchHit;
import com.knowledge.graph.fusion.RankedCandidate;
import com.knowledge.graph.fusion.RankingSignal;
import com.knowledge.graph.fusion.ReciprocalRankFusion;
import com.knowledge.graph.fusion.RrfResult;
import com.knowledge.graph.fusion.SignalBoost;
import com.knowledge.graph.graph.InputSanitizer;
import com.knowledge.graph.graph.KnowledgeGraphStore;
import com.knowledge.graph.llm.EmbeddingProvider;
import com.knowledge.graph.logging.LogContext;
import com.knowledge.graph.metrics.MetricsService;
import com.knowledge.graph.salience.SalienceTracker;
import com.knowledge.graph.tracing.Span;
import com.knowledge.graph.tracing.SpanNames;
import com.knowledge.graph.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Explore: ranked, salience-weighted retrieval followed by a one-hop expansion.
 *
 * <ol>
 *   <li>Gather. Vector search per query, fuzzy match per text and, optionally,
 *       relationship search per query run concurrently. Each task has its own
 *       deadline; a task that fails or times out contributes nothing.</li>
 *   <li>Fuse. The {@value #SIGNAL_EMBEDDING}, {@value #SIGNAL_FUZZY} and
 *       {@value #SIGNAL_RELATIONSHIP} signals go through rank fusion without boosts.</li>
 *   <li>Score. {@code combined = similarity + salience}, sorted descending.</li>
 *   <li>Select. Per-type caps, concatenated in cap order.</li>
 *   <li>Expand. One hop around the selected seeds, top edges only.</li>
 * </ol>
 *
 * <p>Selected seeds are counted as accessed afterwards; a failure there is logged and
 * does not fail the call.</p>
 */
public class RetrievalOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(RetrievalOrchestrator.class);

    public static final String SIGNAL_EMBEDDING = SignalBoost.EMBEDDING;
    public static final String SIGNAL_FUZZY = SignalBoost.FUZZY_MATCH;
    public static final String SIGNAL_RELATIONSHIP = "relationship";

    private final KnowledgeGraphStore store;
    private final EmbeddingProvider embeddingProvider;
    private final SalienceTracker salienceTracker;
    private final GraphExpander expander;
    private final RetrievalOptions options;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final ExecutorService executor;

    public RetrievalOrchestrator(KnowledgeGraphStore store, EmbeddingProvider embeddingProvider,
                                 SalienceTracker salienceTracker, RetrievalOptions options,
                                 MetricsService metrics, TracingService tracing, ExecutorService executor) {
        this.store = store;
        this.embeddingProvider = embeddingProvider;
        this.salienceTracker = salienceTracker;
        this.expander = new GraphExpander(store, options.getMaxEdges());
        this.options = options;
        this.metrics = metrics;
        this.tracing = tracing;
        this.executor = executor;
    }

    /**
     * @throws IllegalArgumentException if the request has neither queries nor text matches
     */
    public ExploreResult explore(ExploreRequest request) {
        if (!request.hasCriteria()) {
            throw new IllegalArgumentException("explore requires at least one query or text match");
        }
        InputSanitizer.validateUserId(request.userId());

        long start = System.nanoTime();
        try (LogContext ignored = LogContext.forExplore(request.userId());
             Span span = tracing.startSpan(SpanNames.EXPLORE)) {
            span.setAttribute("queries", request.queries().size());
            span.setAttribute("textMatches", request.textMatches().size());

            List<RankingSignal<SearchHit>> signals = gather(request);
            List<RrfResult<SearchHit>> fused = ReciprocalRankFusion.combine(
                    signals, options.getK(), options.getTopK(), List.of());
            metrics.recordFusedCandidates(fused.size());

            List<ScoredNode> scored = score(fused);
            List<ScoredNode> seeds = select(scored);
            List<String> seedKeys = seeds.stream().map(ScoredNode::entityKey).toList();

            ExpandedGraph graph;
            try (Span expandSpan = tracing.startSpan(SpanNames.EXPLORE_EXPAND)) {
                expandSpan.setAttribute("seeds", seedKeys.size());
                graph = expander.expand(seedKeys, request.userId());
            }

            if (options.isRecordAccess()) {
                recordAccess(seedKeys);
            }

            ExploreExplanations explanations = request.returnExplanations()
                    ? explain(signals, fused, seeds) : null;
            span.setAttribute("seeds", seeds.size());
            span.setStatus(Span.SpanStatus.OK);
            log.info("explore.completed fused={} seeds={} nodes={} edges={}",
                    fused.size(), seeds.size(), graph.nodes().size(), graph.edges().size());
            return new ExploreResult(seeds, graph.nodes(), graph.edges(), graph.neighbors(), explanations);
        } finally {
            metrics.recordExploreDuration(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    // ========== Gather ==========

    private List<RankingSignal<SearchHit>> gather(ExploreRequest request) {
        String userId = request.userId();
        List<CompletableFuture<List<SearchHit>>> embeddingTasks = new ArrayList<>();
        List<CompletableFuture<List<SearchHit>>> fuzzyTasks = new ArrayList<>();
        List<CompletableFuture<List<SearchHit>>> relationshipTasks = new ArrayList<>();

        try (Span span = tracing.startSpan(SpanNames.EXPLORE_GATHER)) {
            for (QueryInput query : request.queries()) {
                CompletableFuture<float[]> embedding =
                        CompletableFuture.supplyAsync(() -> embeddingProvider.embed(query.query()), executor);

                embeddingTasks.add(guard(SIGNAL_EMBEDDING, embedding.thenApplyAsync(vector -> isEmpty(vector)
                        ? List.<SearchHit>of()
                        : store.vectorSearch(vector, query.threshold(), userId), executor)));

                if (request.searchRelationships()) {
                    relationshipTasks.add(guard(SIGNAL_RELATIONSHIP, embedding.thenApplyAsync(vector -> isEmpty(vector)
                            ? List.<SearchHit>of()
                            : store.findNodesViaRelationshipSearch(vector, query.threshold(), userId).stream()
                                    .map(hit -> hit.withScore(options.getRelationshipScore()))
                                    .toList(), executor)));
                }
            }
            for (String text : request.textMatches()) {
                fuzzyTasks.add(guard(SIGNAL_FUZZY,
                        CompletableFuture.supplyAsync(() -> store.fuzzyTextMatch(text, userId), executor)));
            }

            List<CompletableFuture<List<SearchHit>>> all = new ArrayList<>(embeddingTasks);
            all.addAll(fuzzyTasks);
            all.addAll(relationshipTasks);
            CompletableFuture.allOf(all.toArray(new CompletableFuture[0])).join();
            span.setAttribute("tasks", all.size());
        }

        List<RankingSignal<SearchHit>> signals = new ArrayList<>();
        signals.add(toSignal(SIGNAL_EMBEDDING, embeddingTasks));
        signals.add(toSignal(SIGNAL_FUZZY, fuzzyTasks));
        if (request.searchRelationships()) {
            signals.add(toSignal(SIGNAL_RELATIONSHIP, relationshipTasks));
        }
        return signals;
    }

    private static boolean isEmpty(float[] vector) {
        return vector == null || vector.length == 0;
    }

    /**
     * Bounds a gather task by the signal deadline and turns any failure into an empty
     * contribution.
     */
    private CompletableFuture<List<SearchHit>> guard(String signal, CompletableFuture<List<SearchHit>> task) {
        return task
                .orTimeout(options.getSignalTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(failure -> {
                    Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                            ? failure.getCause() : failure;
                    if (cause instanceof TimeoutException) {
                        cause = new UpstreamTimeoutException(signal, options.getSignalTimeout(), cause);
                    }
                    log.warn("explore.signal.degraded signal={} error={}", signal, cause.getMessage());
                    metrics.incrementSignalFailure(signal);
                    return List.of();
                });
    }

    /**
     * Merges the task results of one signal, keeping the best score per node.
     */
    private static RankingSignal<SearchHit> toSignal(String name, List<CompletableFuture<List<SearchHit>>> tasks) {
        Map<String, SearchHit> best = new LinkedHashMap<>();
        for (CompletableFuture<List<SearchHit>> task : tasks) {
            for (SearchHit hit : task.join()) {
                best.merge(hit.entityKey(), hit, (a, b) -> b.score() > a.score() ? b : a);
            }
        }
        List<RankedCandidate<SearchHit>> candidates = best.values().stream()
                .map(hit -> new RankedCandidate<>(hit.entityKey(), hit.score(), hit))
                .toList();
        return RankingSignal.sortedByScore(name, candidates);
    }

    // ========== Score & select ==========

    private List<ScoredNode> score(List<RrfResult<SearchHit>> fused) {
        if (fused.isEmpty()) {
            return List.of();
        }
        Map<String, Double> salience = salienceTracker.currentSalience(
                fused.stream().map(RrfResult::id).toList());
        List<ScoredNode> scored = new ArrayList<>(fused.size());
        for (RrfResult<SearchHit> result : fused) {
            double nodeSalience = salience.getOrDefault(result.id(), Entity.DEFAULT_SALIENCE);
            scored.add(ScoredNode.of(result.data(), result.similarity(), nodeSalience, result.matchedSignals()));
        }
        scored.sort(Comparator.comparingDouble(ScoredNode::combinedScore).reversed());
        return scored;
    }

    private List<ScoredNode> select(List<ScoredNode> scored) {
        List<ScoredNode> seeds = new ArrayList<>();
        for (Map.Entry<NodeType, Integer> cap : options.getTypeCaps().entrySet()) {
            scored.stream()
                    .filter(node -> node.type() == cap.getKey())
                    .limit(cap.getValue())
                    .forEach(seeds::add);
        }
        return seeds;
    }

    private void recordAccess(List<String> seedKeys) {
        try {
            salienceTracker.batchIncrementAccess(seedKeys);
        } catch (RuntimeException e) {
            log.warn("explore.access.failed seeds={} error={}", seedKeys.size(), e.getMessage());
        }
    }

    private static ExploreExplanations explain(List<RankingSignal<SearchHit>> signals,
                                               List<RrfResult<SearchHit>> fused, List<ScoredNode> seeds) {
        Map<String, Integer> hits = new LinkedHashMap<>();
        Set<String> unique = new LinkedHashSet<>();
        for (RankingSignal<SearchHit> signal : signals) {
            hits.put(signal.name(), signal.size());
            signal.candidates().forEach(c -> unique.add(c.id()));
        }
        Map<NodeType, Integer> selected = new LinkedHashMap<>();
        for (ScoredNode seed : seeds) {
            selected.merge(seed.type(), 1, Integer::sum);
        }
        return new ExploreExplanations(hits, unique.size(), fused.size(), selected);
    }
}
