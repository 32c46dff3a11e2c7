package com.tony.fantasyAnalytics.exception;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<Map<String, Object>> handlePipelineException(PipelineException ex) {
        HttpStatus status = resolveStatus(ex);
        if (status.is5xxServerError()) {
            log.error("❌ [{}] {} : {}", ex.getStage(), ex.getErrorCode(), ex.getMessage(), ex);
        } else {
            log.warn("⚠️ [{}] {} : {}", ex.getStage(), ex.getErrorCode(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(body(ex.getErrorCode(), ex.getMessage(), ex.getStage(), ex.isRetryable()));
    }

    @ExceptionHandler({ConstraintViolationException.class, MethodArgumentTypeMismatchException.class,
            IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        log.warn("Requête invalide : {}", ex.getMessage());
        return ResponseEntity.badRequest().body(body("ERR-REQ-001", ex.getMessage(), null, false));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("❌ Erreur inattendue", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("ERR-SYS-001", "Erreur technique : " + ex.getMessage(), null, false));
    }

    static HttpStatus resolveStatus(PipelineException ex) {
        if (ex instanceof PredictionsNotFoundException) return HttpStatus.NOT_FOUND;
        if (ex instanceof ArtifactUnavailableException) return HttpStatus.NOT_FOUND;
        if (ex instanceof FeatureSchemaMismatchException) return HttpStatus.CONFLICT;
        if (ex instanceof InsufficientDataException || ex instanceof DataUnavailableException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        if (ex.isRetryable()) return HttpStatus.SERVICE_UNAVAILABLE;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private Map<String, Object> body(String code, String message, PipelineStage stage, boolean retryable) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("errorCode", code);
        body.put("error", message);
        body.put("stage", stage);
        body.put("retryable", retryable);
        return body;
    }
}
