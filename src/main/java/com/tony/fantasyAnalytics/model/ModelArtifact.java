package com.tony.fantasyAnalytics.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;

/**
 * Artefact immuable d'un modèle entraîné (jamais modifié, seulement remplacé via le pointeur "latest").
 * {@link Persistable} : save() fait toujours un INSERT, une clé déjà prise échoue au lieu d'être fusionnée.
 */
@Entity
@Table(name = "model_artifact")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class ModelArtifact implements Persistable<String> {

    // Ex: fantasy_predictor_20241017_083015_123
    @Id
    @Column(name = "artifact_key", length = 80, updatable = false)
    private String artifactKey;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false, updatable = false)
    private String modelType;

    @Column(nullable = false, updatable = false)
    private String schemaVersion;

    @Column(nullable = false, updatable = false)
    private int trainingSamples;

    @Column(nullable = false, updatable = false)
    private int featureCount;

    @Lob
    @Column(nullable = false, updatable = false)
    private byte[] payload;

    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private String metadataJson;

    @Transient
    @Getter(AccessLevel.NONE)
    private boolean persisted;

    @Override
    public String getId() {
        return artifactKey;
    }

    @Override
    public boolean isNew() {
        return !persisted;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.persisted = true;
    }
}
