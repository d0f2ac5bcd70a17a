package com.tracelake.ingestion;

import java.util.Collections;
import java.util.Map;

/**
 * An ingest run aborted on a structural failure (schema violation, I/O,
 * timeout or cancel). The dataset was rolled back to its previous manifest.
 */
public class IngestFailedException extends RuntimeException {

    private final String ingestId;
    private final Map<String, Map<String, Long>> counters;

    public IngestFailedException(String message, String ingestId,
                                 Map<String, Map<String, Long>> counters, Throwable cause) {
        super(message, cause);
        this.ingestId = ingestId;
        this.counters = counters == null ? Collections.emptyMap() : counters;
    }

    public String getIngestId() {
        return ingestId;
    }

    /**
     * Normalizer counters at the moment of the failure, keyed by kind
     */
    public Map<String, Map<String, Long>> getCounters() {
        return counters;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (ingestId != null) {
            sb.append(" [Ingest: ").append(ingestId).append("]");
        }
        if (getCause() != null) {
            sb.append(" [Cause: ").append(getCause().getMessage()).append("]");
        }
        return sb.toString();
    }
}
