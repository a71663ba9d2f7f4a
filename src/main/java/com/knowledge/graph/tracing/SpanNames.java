package com.knowledge.graph.tracing;

/**
 * Operation names used for spans.
 */
public final class SpanNames {

    public static final String RESOLVE = "knowledge.resolve";
    public static final String EXPLORE = "knowledge.explore";
    public static final String EXPLORE_GATHER = "knowledge.explore.gather";
    public static final String EXPLORE_EXPAND = "knowledge.explore.expand";
    public static final String RECORD_ACCESS = "knowledge.access";

    private SpanNames() {
    }
}
