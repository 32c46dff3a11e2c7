package com.tony.fantasyAnalytics.exception;

/**
 * Échec d'une source externe (HTTP, fichier). Un nouvel essai peut réussir.
 */
public class DataAcquisitionException extends PipelineException {

    public DataAcquisitionException(PipelineStage stage, String message, Throwable cause) {
        super(stage, message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "ERR-IO-001";
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
