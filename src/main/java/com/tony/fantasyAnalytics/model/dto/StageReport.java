package com.tony.fantasyAnalytics.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tony.fantasyAnalytics.exception.PipelineException;
import com.tony.fantasyAnalytics.exception.PipelineStage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Résultat d'une étape du pipeline. Un échec est une valeur, pas une exception remontée à l'appelant.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StageReport {
    private PipelineStage stage;
    private boolean success;
    private String message;
    private String errorCode;
    private boolean retryable;
    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();
    @Builder.Default
    private LocalDateTime finishedAt = LocalDateTime.now();

    public static StageReport ok(PipelineStage stage, String message, Map<String, Object> details) {
        return StageReport.builder()
                .stage(stage)
                .success(true)
                .message(message)
                .details(new LinkedHashMap<>(details))
                .build();
    }

    public static StageReport failed(PipelineException e) {
        return StageReport.builder()
                .stage(e.getStage())
                .success(false)
                .message(e.getMessage())
                .errorCode(e.getErrorCode())
                .retryable(e.isRetryable())
                .build();
    }

    // Erreur non prévue : on la classe en non-retryable
    public static StageReport unexpected(PipelineStage stage, Exception e) {
        return StageReport.builder()
                .stage(stage)
                .success(false)
                .message("Erreur inattendue : " + e.getMessage())
                .errorCode("ERR-SYS-001")
                .retryable(false)
                .build();
    }
}
