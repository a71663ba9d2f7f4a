package com.knowledge.graph.graph;

/**
 * The graph store could not be reached or rejected an operation.
 * During resolution this is fatal: callers must not read it as "no match".
 */
public class GraphStoreException extends RuntimeException {

    public GraphStoreException(String message) {
        super(message);
    }

    public GraphStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
