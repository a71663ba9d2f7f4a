package com.knowledge.graph.llm;

import com.knowledge.graph.core.model.SearchHit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link Disambiguator} that asks an Ollama model to pick one numbered match or none.
 *
 * <p>Expected reply format:</p>
 * <pre>
 * MATCH: [number or NONE]
 * CONFIDENCE: [0.0-1.0]
 * REASONING: [text]
 * </pre>
 * Unparseable replies count as a rejection.
 */
public class OllamaDisambiguator implements Disambiguator {
    private static final Logger log = LoggerFactory.getLogger(OllamaDisambiguator.class);

    public static final String DEFAULT_MODEL = "llama3.2";

    private static final Pattern MATCH_PATTERN = Pattern.compile("(?i)MATCH:\\s*(NONE|\\d+)");
    private static final Pattern CONFIDENCE_PATTERN = Pattern.compile("(?i)CONFIDENCE:\\s*([0-9]*\\.?[0-9]+)");
    private static final Pattern REASONING_PATTERN = Pattern.compile("(?is)REASONING:\\s*(.+)$");

    private final OllamaClient client;
    private final String model;

    public OllamaDisambiguator(OllamaClient client, String model) {
        this.client = client;
        this.model = model != null ? model : DEFAULT_MODEL;
    }

    @Override
    public DisambiguationResult disambiguate(DisambiguationRequest request) {
        if (request.topMatches().isEmpty()) {
            return DisambiguationResult.rejected("No matches to compare");
        }
        log.info("disambiguation.requested mention='{}' type={} matches={}",
                request.candidate().name(), request.candidate().type(), request.topMatches().size());
        try {
            String reply = client.generate(model, buildPrompt(request));
            return parseReply(reply, request.topMatches());
        } catch (IOException e) {
            log.error("disambiguation.failed mention='{}' error={}", request.candidate().name(), e.getMessage(), e);
            return DisambiguationResult.rejected("LLM call failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DisambiguationResult.rejected("Interrupted");
        }
    }

    String buildPrompt(DisambiguationRequest request) {
        StringBuilder prompt = new StringBuilder();
        String type = request.candidate().type().getLabel().toLowerCase(Locale.ROOT);
        prompt.append("Decide whether the ").append(type).append(" mention below refers to one of the ")
                .append("existing entries.\n\n");
        prompt.append("Mention: \"").append(request.candidate().name()).append("\"\n");
        if (request.candidate().contextText() != null && !request.candidate().contextText().isBlank()) {
            prompt.append("Context: ").append(request.candidate().contextText()).append("\n");
        }
        prompt.append("\nExisting entries:\n");
        List<SearchHit> matches = request.topMatches();
        for (int i = 0; i < matches.size(); i++) {
            SearchHit hit = matches.get(i);
            prompt.append(i + 1).append(". ").append(hit.name());
            if (hit.description() != null && !hit.description().isBlank()) {
                prompt.append(" (").append(hit.description()).append(")");
            }
            prompt.append("\n");
        }
        prompt.append("\nRespond in this exact format:\n");
        prompt.append("MATCH: [entry number, or NONE]\n");
        prompt.append("CONFIDENCE: [0.0-1.0]\n");
        prompt.append("REASONING: [one sentence]\n");
        return prompt.toString();
    }

    DisambiguationResult parseReply(String reply, List<SearchHit> matches) {
        if (reply == null) {
            return DisambiguationResult.rejected("Empty reply");
        }
        String reasoning = find(REASONING_PATTERN, reply);
        String match = find(MATCH_PATTERN, reply);
        if (match == null || match.equalsIgnoreCase("NONE")) {
            return DisambiguationResult.rejected(reasoning);
        }

        int index = Integer.parseInt(match) - 1;
        if (index < 0 || index >= matches.size()) {
            log.warn("disambiguation.invalidIndex index={} matches={}", index + 1, matches.size());
            return DisambiguationResult.rejected("Reply named a non-existent entry");
        }

        double confidence = 0.5;
        String rawConfidence = find(CONFIDENCE_PATTERN, reply);
        if (rawConfidence != null) {
            confidence = Double.parseDouble(rawConfidence);
            if (confidence > 1.0 && confidence <= 100.0) {
                confidence = confidence / 100.0;
            }
            confidence = Math.max(0.0, Math.min(1.0, confidence));
        }
        return DisambiguationResult.confirmed(matches.get(index).entityKey(), confidence, reasoning);
    }

    private static String find(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1).trim() : null;
    }

    @Override
    public String getProviderName() {
        return "Ollama/" + model;
    }

    @Override
    public boolean isAvailable() {
        return client.isAvailable();
    }
}
