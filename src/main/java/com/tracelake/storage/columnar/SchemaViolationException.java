package com.tracelake.storage.columnar;

import com.tracelake.domain.EventKind;

/**
 * A chunk does not match its kind's declared partition schema.
 * Fatal to the current ingest.
 */
public class SchemaViolationException extends RuntimeException {

    private final EventKind kind;
    private final String column;

    public SchemaViolationException(String message, EventKind kind, String column) {
        super(message);
        this.kind = kind;
        this.column = column;
    }

    public SchemaViolationException(String message, EventKind kind, String column, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.column = column;
    }

    public EventKind getKind() {
        return kind;
    }

    public String getColumn() {
        return column;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (kind != null) {
            sb.append(" [Kind: ").append(kind.getValue()).append("]");
        }
        if (column != null) {
            sb.append(" [Column: ").append(column).append("]");
        }
        return sb.toString();
    }
}
