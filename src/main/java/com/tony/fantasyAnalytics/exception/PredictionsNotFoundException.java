package com.tony.fantasyAnalytics.exception;

public class PredictionsNotFoundException extends PipelineException {

    public PredictionsNotFoundException(String message) {
        super(PipelineStage.QUERY, message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "ERR-QUERY-001";
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
