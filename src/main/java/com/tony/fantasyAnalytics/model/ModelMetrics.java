package com.tony.fantasyAnalytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ModelMetrics {
    private double mse;
    private double rmse;
    private double r2;

    // Une entrée par feature, dans l'ordre du schéma
    @Builder.Default
    private Map<String, Double> featureImportance = new LinkedHashMap<>();

    // Vrai si le jeu était trop petit pour un split train/test (évaluation sur l'échantillon d'entraînement)
    private boolean evaluatedInSample;
}
