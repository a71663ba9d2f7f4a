package com.knowledge.graph.retrieval;

import com.knowledge.graph.core.model.Edge;
import com.knowledge.graph.core.model.GraphNode;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders an {@link ExploreResult} as markdown for a language-model context window.
 * Entity keys are shortened to their first {@value #SHORT_KEY_LENGTH} characters.
 */
public final class ExploreResultFormatter {

    public static final int SHORT_KEY_LENGTH = 12;
    static final int MAX_NOTES_PER_NODE = 5;

    private ExploreResultFormatter() {
    }

    public static String format(ExploreResult result) {
        if (result.isEmpty()) {
            return "No matching knowledge found.\n";
        }
        Map<String, String> names = new HashMap<>();
        for (GraphNode node : result.nodes()) {
            names.put(node.entityKey(), node.name());
        }
        for (ScoredNode seed : result.seeds()) {
            names.putIfAbsent(seed.entityKey(), seed.name());
        }

        StringBuilder sb = new StringBuilder();
        sb.append("## Relevant knowledge\n\n");
        for (ScoredNode seed : result.seeds()) {
            sb.append("### ").append(seed.name() != null ? seed.name() : shortKey(seed.entityKey()))
                    .append(" [").append(seed.type().getLabel()).append(' ')
                    .append(shortKey(seed.entityKey())).append("]\n");
            sb.append("- salience: ").append(String.format(Locale.ROOT, "%.2f", seed.salience()))
                    .append(", score: ").append(String.format(Locale.ROOT, "%.3f", seed.combinedScore()))
                    .append('\n');
            if (seed.description() != null && !seed.description().isBlank()) {
                sb.append("- ").append(seed.description()).append('\n');
            }
            List<String> notes = seed.notes();
            for (String note : notes.subList(Math.max(0, notes.size() - MAX_NOTES_PER_NODE), notes.size())) {
                sb.append("  - note: ").append(note).append('\n');
            }
            sb.append('\n');
        }

        if (!result.edges().isEmpty()) {
            sb.append("## Relationships\n\n");
            for (Edge edge : result.edges()) {
                sb.append("- ").append(label(names, edge.fromKey()))
                        .append(" -[").append(edge.relationshipType()).append("]-> ")
                        .append(label(names, edge.toKey()));
                if (edge.description() != null && !edge.description().isBlank()) {
                    sb.append(": ").append(edge.description());
                }
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    public static String shortKey(String entityKey) {
        return entityKey.length() <= SHORT_KEY_LENGTH ? entityKey : entityKey.substring(0, SHORT_KEY_LENGTH);
    }

    private static String label(Map<String, String> names, String key) {
        String name = names.get(key);
        return name != null ? name + " (" + shortKey(key) + ")" : shortKey(key);
    }
}
