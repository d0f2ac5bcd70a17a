package com.tracelake.query;

/**
 * A query could not be answered.
 *
 * The {@link FailureKind} tells callers whether to fix the request, wait for an
 * engine or re-run after the dataset changed. The engine and SQL text are set
 * when an engine was involved.
 */
public class QueryExecutionException extends RuntimeException {

    public enum FailureKind {
        /** partition files the manifest lists cannot be found */
        NO_DATA,
        /** no engine able to answer the request can run */
        ENGINE_UNAVAILABLE,
        /** the request names a filter, grouping or limit the query cannot accept */
        INVALID_FILTER,
        /** the engine ran the query and failed */
        ENGINE_FAILURE
    }

    private final FailureKind kind;
    private final String engine;
    private final String query;

    public QueryExecutionException(String message, FailureKind kind, String engine) {
        this(message, kind, engine, null, null);
    }

    public QueryExecutionException(String message, FailureKind kind, String engine, Throwable cause) {
        this(message, kind, engine, null, cause);
    }

    public QueryExecutionException(String message, FailureKind kind, String engine, String query, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.engine = engine;
        this.query = query;
    }

    public FailureKind getKind() {
        return kind;
    }

    public String getEngine() {
        return engine;
    }

    public String getQuery() {
        return query;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (engine != null) {
            sb.append(" [Engine: ").append(engine).append("]");
        }
        if (query != null) {
            sb.append(" [Query: ").append(query).append("]");
        }
        return sb.toString();
    }
}
