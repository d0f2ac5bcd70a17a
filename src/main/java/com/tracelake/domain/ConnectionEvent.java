package com.tracelake.domain;

/**
 * Connection lifecycle event (accepted or ended).
 */
public final class ConnectionEvent extends NormalizedEvent {

    public static final String EVENT_ACCEPTED = "accepted";
    public static final String EVENT_ENDED = "ended";

    private final String event;
    private final String connectionId;
    private final String remoteAddress;
    private final Integer connectionCount;
    private final String appName;
    private final String driver;

    private ConnectionEvent(Builder b) {
        super(b.recordKey, b.timestamp, b.tsEpoch, b.span, b.lineNumber, b.sample);
        this.event = b.event;
        this.connectionId = b.connectionId;
        this.remoteAddress = b.remoteAddress;
        this.connectionCount = b.connectionCount;
        this.appName = b.appName;
        this.driver = b.driver;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public EventKind getKind() {
        return EventKind.CONNECTION;
    }

    @Override
    public long estimateBytes() {
        return baseEstimate() + 8 + size(event) + size(connectionId) + size(remoteAddress)
            + size(appName) + size(driver);
    }

    public String getEvent() {
        return event;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public String getRemoteAddress() {
        return remoteAddress;
    }

    public Integer getConnectionCount() {
        return connectionCount;
    }

    public String getAppName() {
        return appName;
    }

    public String getDriver() {
        return driver;
    }

    public static final class Builder {
        private String recordKey;
        private String timestamp;
        private long tsEpoch;
        private RawSpan span;
        private long lineNumber;
        private String sample;
        private String event;
        private String connectionId;
        private String remoteAddress;
        private Integer connectionCount;
        private String appName;
        private String driver;

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

        public Builder event(String event) {
            this.event = event;
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

        public Builder connectionCount(Integer connectionCount) {
            this.connectionCount = connectionCount;
            return this;
        }

        public Builder appName(String appName) {
            this.appName = appName;
            return this;
        }

        public Builder driver(String driver) {
            this.driver = driver;
            return this;
        }

        public ConnectionEvent build() {
            return new ConnectionEvent(this);
        }
    }
}
