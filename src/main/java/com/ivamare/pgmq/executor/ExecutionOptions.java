package com.ivamare.pgmq.executor;

/**
 * Per-call execution settings.
 *
 * @param autocommit commit the work before returning; ignored when a session is supplied
 * @param session caller-managed transaction scope, or null to let the executor open its own
 */
public record ExecutionOptions(boolean autocommit, PgmqSession session) {

    /** Auto-commit in an executor-owned transaction. */
    public static final ExecutionOptions DEFAULT = new ExecutionOptions(true, null);

    public static ExecutionOptions inSession(PgmqSession session) {
        return new ExecutionOptions(false, session);
    }

    public boolean hasSession() {
        return session != null;
    }

    public ExecutionOptions withAutocommit(boolean autocommit) {
        return new ExecutionOptions(autocommit, session);
    }
}
