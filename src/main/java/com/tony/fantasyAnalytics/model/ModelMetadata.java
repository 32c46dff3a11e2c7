package com.tony.fantasyAnalytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ModelMetadata {
    private LocalDateTime trainedAt;
    private String modelType;

    // Contrat de features : version + hash des noms, et l'époque utilisée pour years_since_epoch
    private String schemaVersion;
    private String schemaHash;
    private int epochYear;

    private int trainingSamples;
    private int heldOutSamples;
    private int featureCount;
    private ModelMetrics metrics;

    @Builder.Default
    private List<TransitionProvenance> provenanceSample = new ArrayList<>();
}
