package com.ivamare.pgmq.model;

/**
 * Where the long-poll wait loop runs.
 */
public enum PollStrategy {

    /** Delegate to {@code pgmq.read_with_poll}; the store holds the connection while waiting. */
    NATIVE,

    /** Repeat {@code pgmq.read} from the client, pausing between attempts. */
    CLIENT
}
