package com.anomalyplatform.common.exception;

/**
 * A collaborator fetch failed or timed out for one entity.
 */
public class DataSourceUnavailableException extends RuntimeException {
    private final String source;
    private final String entity;

    public DataSourceUnavailableException(String source, String entity, Throwable cause) {
        super(source + " unavailable for " + entity
            + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
        this.source = source;
        this.entity = entity;
    }

    public String getSource() {
        return source;
    }

    public String getEntity() {
        return entity;
    }
}
