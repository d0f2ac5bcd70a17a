package com.tracelake.domain;

/**
 * Authentication attempt logged by the ACCESS component.
 */
public final class AuthEvent extends NormalizedEvent {

    public static final String RESULT_SUCCESS = "success";
    public static final String RESULT_FAILURE = "failure";

    private final String user;
    private final String database;
    private final String mechanism;
    private final String result;
    private final String connectionId;
    private final String remoteAddress;
    private final String appName;
    private final String error;

    private AuthEvent(Builder b) {
        super(b.recordKey, b.timestamp, b.tsEpoch, b.span, b.lineNumber, b.sample);
        this.user = b.user;
        this.database = b.database;
        this.mechanism = b.mechanism;
        this.result = b.result;
        this.connectionId = b.connectionId;
        this.remoteAddress = b.remoteAddress;
        this.appName = b.appName;
        this.error = b.error;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public EventKind getKind() {
        return EventKind.AUTH;
    }

    @Override
    public long estimateBytes() {
        return baseEstimate() + size(user) + size(database) + size(mechanism) + size(result)
            + size(connectionId) + size(remoteAddress) + size(appName) + size(error);
    }

    public String getUser() {
        return user;
    }

    public String getDatabase() {
        return database;
    }

    public String getMechanism() {
        return mechanism;
    }

    public String getResult() {
        return result;
    }

    public boolean isFailure() {
        return RESULT_FAILURE.equals(result);
    }

    public String getConnectionId() {
        return connectionId;
    }

    public String getRemoteAddress() {
        return remoteAddress;
    }

    public String getAppName() {
        return appName;
    }

    public String getError() {
        return error;
    }

    public static final class Builder {
        private String recordKey;
        private String timestamp;
        private long tsEpoch;
        private RawSpan span;
        private long lineNumber;
        private String sample;
        private String user;
        private String database;
        private String mechanism;
        private String result;
        private String connectionId;
        private String remoteAddress;
        private String appName;
        private String error;

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

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder database(String database) {
            this.database = database;
            return this;
        }

        public Builder mechanism(String mechanism) {
            this.mechanism = mechanism;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder connectionId(String connectionId) {
            this.connectionId = connectionId;
            return this;
        }

        public Builder remoteAddress(String remoteAddress) {
            this.remoteAddress = remoteAddress;
            return this;
        }

        public Builder appName(String appName) {
            this.appName = appName;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public AuthEvent build() {
            return new AuthEvent(this);
        }
    }
}
