package com.tony.fantasyAnalytics.exception;

public class ArtifactUnavailableException extends PipelineException {

    public ArtifactUnavailableException(String message) {
        super(PipelineStage.PREDICT, message);
    }

    public ArtifactUnavailableException(String message, Throwable cause) {
        super(PipelineStage.PREDICT, message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "ERR-MODEL-001";
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
