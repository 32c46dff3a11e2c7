package com.tony.fantasyAnalytics.model.dto;

import com.tony.fantasyAnalytics.model.ModelArtifact;

import java.time.LocalDateTime;

public record ArtifactSummary(String artifactKey, LocalDateTime createdAt, String modelType,
                              String schemaVersion, int trainingSamples, int featureCount, boolean latest) {

    public static ArtifactSummary of(ModelArtifact artifact, String latestKey) {
        return new ArtifactSummary(artifact.getArtifactKey(), artifact.getCreatedAt(), artifact.getModelType(),
                artifact.getSchemaVersion(), artifact.getTrainingSamples(), artifact.getFeatureCount(),
                artifact.getArtifactKey().equals(latestKey));
    }
}
