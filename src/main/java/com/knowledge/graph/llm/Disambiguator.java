package com.knowledge.graph.llm;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * External judge that decides whether a mention names one of several close matches.
 * Typically backed by a language model.
 */
public interface Disambiguator {

    /**
     * Picks the match the mention refers to, or rejects them all.
     */
    DisambiguationResult disambiguate(DisambiguationRequest request);

    default CompletableFuture<DisambiguationResult> disambiguateAsync(DisambiguationRequest request,
                                                                     Executor executor) {
        return CompletableFuture.supplyAsync(() -> disambiguate(request), executor);
    }

    String getProviderName();

    boolean isAvailable();
}
