package com.tony.fantasyAnalytics.exception;

/**
 * Données historiques ou de la saison courante absentes.
 */
public class DataUnavailableException extends PipelineException {

    public DataUnavailableException(PipelineStage stage, String message) {
        super(stage, message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "ERR-DATA-001";
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
