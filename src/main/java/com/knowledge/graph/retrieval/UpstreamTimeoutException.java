package com.knowledge.graph.retrieval;

import java.time.Duration;

/**
 * A gather-phase signal did not answer within its deadline. Raised for logging only;
 * the signal degrades to empty and the explore call continues.
 */
public class UpstreamTimeoutException extends RuntimeException {

    private final String signal;

    public UpstreamTimeoutException(String signal, Duration timeout, Throwable cause) {
        super("Signal '" + signal + "' timed out after " + timeout.toMillis() + "ms", cause);
        this.signal = signal;
    }

    public String getSignal() {
        return signal;
    }
}
