package com.ivamare.pgmq.statement;

/**
 * The store-side primitive a {@link PgmqStatement} invokes.
 */
public enum PgmqFunction {

    CREATE_EXTENSION,
    CREATE_PARTMAN_EXTENSION,
    CREATE,
    CREATE_UNLOGGED,
    CREATE_PARTITIONED,
    DROP_QUEUE,
    LIST_QUEUES,
    VALIDATE_QUEUE_NAME,
    SEND,
    SEND_BATCH,
    READ,
    READ_WITH_POLL,
    POP,
    SET_VT,
    DELETE,
    DELETE_BATCH,
    ARCHIVE,
    ARCHIVE_BATCH,
    READ_ARCHIVE,
    PURGE_QUEUE,
    METRICS,
    METRICS_ALL
}
