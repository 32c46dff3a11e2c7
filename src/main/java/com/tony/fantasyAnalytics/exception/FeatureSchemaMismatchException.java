package com.tony.fantasyAnalytics.exception;

/**
 * Le modèle a été entraîné sur un autre schéma de features que celui du pipeline courant.
 */
public class FeatureSchemaMismatchException extends PipelineException {

    public FeatureSchemaMismatchException(String message) {
        super(PipelineStage.PREDICT, message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "ERR-MODEL-002";
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
