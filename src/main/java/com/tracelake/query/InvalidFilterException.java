package com.tracelake.query;

/**
 * A query request names a filter, grouping or limit the query cannot accept
 */
public class InvalidFilterException extends QueryExecutionException {

    private final String field;

    public InvalidFilterException(String message, String field) {
        super(message, FailureKind.INVALID_FILTER, null);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (field != null) {
            sb.append(" [Field: ").append(field).append("]");
        }
        return sb.toString();
    }
}
