package com.tracelake.query;

/**
 * The analytical engine is unavailable and the fallback engine cannot answer
 * the request (for example percentiles). Never replaced by an approximate answer.
 */
public class DegradedModeException extends QueryExecutionException {

    private final String feature;

    public DegradedModeException(String message, String feature, String engine, Throwable cause) {
        super(message, FailureKind.ENGINE_UNAVAILABLE, engine, cause);
        this.feature = feature;
    }

    public String getFeature() {
        return feature;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (feature != null) {
            sb.append(" [Feature: ").append(feature).append("]");
        }
        return sb.toString();
    }
}
