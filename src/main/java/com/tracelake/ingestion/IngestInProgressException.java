package com.tracelake.ingestion;

/**
 * Another ingest holds the dataset lock. The request is rejected without any
 * change to the dataset.
 */
public class IngestInProgressException extends RuntimeException {

    private final LockInfo holder;

    public IngestInProgressException(String message, LockInfo holder) {
        super(message);
        this.holder = holder;
    }

    public LockInfo getHolder() {
        return holder;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (holder != null) {
            sb.append(" [Holder: ").append(holder.getIngestId())
              .append(" pid ").append(holder.getPid())
              .append(" on ").append(holder.getHost()).append("]");
        }
        return sb.toString();
    }
}
