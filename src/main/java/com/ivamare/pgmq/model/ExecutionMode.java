package com.ivamare.pgmq.model;

/**
 * How a client talks to PostgreSQL. Chosen once per client instance.
 */
public enum ExecutionMode {

    /** JDBC on the calling thread. */
    BLOCKING,

    /** R2DBC on a single scheduler owned by the client; callers block until each call resolves. */
    SUSPENDING
}
