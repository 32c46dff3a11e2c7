package com.tony.fantasyAnalytics.exception;

import lombok.Getter;

/**
 * Racine des erreurs du pipeline. Porte un code, l'étape concernée et si un nouvel essai a un sens
 * (I/O externe) ou non (données insuffisantes, schéma incompatible).
 */
@Getter
public abstract class PipelineException extends RuntimeException {
    private final String errorCode;
    private final PipelineStage stage;

    protected PipelineException(PipelineStage stage, String message) {
        super(message);
        this.stage = stage;
        this.errorCode = getDefaultErrorCode();
    }

    protected PipelineException(PipelineStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.errorCode = getDefaultErrorCode();
    }

    protected abstract String getDefaultErrorCode();

    public abstract boolean isRetryable();
}
