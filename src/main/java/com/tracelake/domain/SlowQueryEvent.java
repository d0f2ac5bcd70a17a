package com.tracelake.domain;

/**
 * Slow operation reported by the database profiler.
 */
public final class SlowQueryEvent extends NormalizedEvent {

    private final String queryHash;
    private final String database;
    private final String collection;
    private final String namespace;
    private final String planSummary;
    private final String queryText;
    private final String operation;
    private final String connectionId;
    private final String username;
    private final long durationMs;
    private final long docsExamined;
    private final long docsReturned;
    private final long keysExamined;

    private SlowQueryEvent(Builder b) {
        super(b.recordKey, b.timestamp, b.tsEpoch, b.span, b.lineNumber, b.sample);
        this.queryHash = b.queryHash;
        this.database = b.database;
        this.collection = b.collection;
        this.namespace = b.namespace;
        this.planSummary = b.planSummary;
        this.queryText = b.queryText;
        this.operation = b.operation;
        this.connectionId = b.connectionId;
        this.username = b.username;
        this.durationMs = b.durationMs;
        this.docsExamined = b.docsExamined;
        this.docsReturned = b.docsReturned;
        this.keysExamined = b.keysExamined;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public EventKind getKind() {
        return EventKind.SLOW_QUERY;
    }

    @Override
    public long estimateBytes() {
        return baseEstimate() + 48 + size(queryHash) + size(database) + size(collection)
            + size(namespace) + size(planSummary) + size(queryText) + size(operation)
            + size(connectionId) + size(username);
    }

    public String getQueryHash() {
        return queryHash;
    }

    public String getDatabase() {
        return database;
    }

    public String getCollection() {
        return collection;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getPlanSummary() {
        return planSummary;
    }

    public String getQueryText() {
        return queryText;
    }

    public String getOperation() {
        return operation;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public String getUsername() {
        return username;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public long getDocsExamined() {
        return docsExamined;
    }

    public long getDocsReturned() {
        return docsReturned;
    }

    public long getKeysExamined() {
        return keysExamined;
    }

    public static final class Builder {
        private String recordKey;
        private String timestamp;
        private long tsEpoch;
        private RawSpan span;
        private long lineNumber;
        private String sample;
        private String queryHash;
        private String database;
        private String collection;
        private String namespace;
        private String planSummary;
        private String queryText;
        private String operation;
        private String connectionId;
        private String username;
        private long durationMs;
        private long docsExamined;
        private long docsReturned;
        private long keysExamined;

        private Builder() {
        }

        public Builder recordKey(String recordKey) {
            this.recordKey = recordKey;
            return this;
        }

        public Builder timestamp(String timestamp, long tsEpoch) {
            this.timestamp = timestamp;
            this.tsEpoch = tsEpoch;
            return this;
        }

        public Builder span(RawSpan span, long lineNumber) {
            this.span = span;
            this.lineNumber = lineNumber;
            return this;
        }

        public Builder sample(String sample) {
            this.sample = sample;
            return this;
        }

        public Builder queryHash(String queryHash) {
            this.queryHash = queryHash;
            return this;
        }

        public Builder namespace(String database, String collection, String namespace) {
            this.database = database;
            this.collection = collection;
            this.namespace = namespace;
            return this;
        }

        public Builder planSummary(String planSummary) {
            this.planSummary = planSummary;
            return this;
        }

        public Builder queryText(String queryText) {
            this.queryText = queryText;
            return this;
        }

        public Builder operation(String operation) {
            this.operation = operation;
            return this;
        }

        public Builder connectionId(String connectionId) {
            this.connectionId = connectionId;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder durationMs(long durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public Builder docsExamined(long docsExamined) {
            this.docsExamined = docsExamined;
            return this;
        }

        public Builder docsReturned(long docsReturned) {
            this.docsReturned = docsReturned;
            return this;
        }

        public Builder keysExamined(long keysExamined) {
            this.keysExamined = keysExamined;
            return this;
        }

        public SlowQueryEvent build() {
            return new SlowQueryEvent(this);
        }
    }
}
