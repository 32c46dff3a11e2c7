package com.tony.fantasyAnalytics.exception;

/**
 * Aucun exemple d'entraînement : aucun modèle ne doit être persisté.
 */
public class InsufficientDataException extends PipelineException {

    public InsufficientDataException(String message) {
        super(PipelineStage.TRAIN, message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "ERR-DATA-002";
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
