package com.tony.fantasyAnalytics.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tony.fantasyAnalytics.exception.ArtifactUnavailableException;
import com.tony.fantasyAnalytics.ml.ModelCodec;
import com.tony.fantasyAnalytics.ml.RegressionModel;
import com.tony.fantasyAnalytics.ml.TrainedModel;
import com.tony.fantasyAnalytics.model.LatestModelPointer;
import com.tony.fantasyAnalytics.model.ModelArtifact;
import com.tony.fantasyAnalytics.model.ModelMetadata;
import com.tony.fantasyAnalytics.repository.LatestModelPointerRepository;
import com.tony.fantasyAnalytics.repository.ModelArtifactRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Frontière de persistance des modèles : save(model) -> clé, load(clé) -> modèle, et pointeur "latest".
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModelArtifactService {

    private static final String KEY_PREFIX = "fantasy_predictor_";
    private static final DateTimeFormatter KEY_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final ModelArtifactRepository artifactRepository;
    private final LatestModelPointerRepository pointerRepository;
    private final ModelCodec modelCodec;
    private final ObjectMapper objectMapper;

    /**
     * Persiste un artefact immuable puis fait pointer "latest" dessus (dernier écrivain gagnant).
     */
    @Transactional
    public String save(TrainedModel trained) {
        ModelMetadata metadata = trained.metadata();
        LocalDateTime createdAt = metadata.getTrainedAt() != null ? metadata.getTrainedAt() : LocalDateTime.now();
        String key = uniqueKey(createdAt);

        ModelArtifact artifact;
        try {
            artifact = ModelArtifact.builder()
                    .artifactKey(key)
                    .createdAt(createdAt)
                    .modelType(trained.model().modelType())
                    .schemaVersion(metadata.getSchemaVersion())
                    .trainingSamples(metadata.getTrainingSamples())
                    .featureCount(metadata.getFeatureCount())
                    .payload(modelCodec.encode(trained.model()))
                    .metadataJson(objectMapper.writeValueAsString(metadata))
                    .build();
        } catch (IOException e) {
            throw new IllegalStateException("Sérialisation du modèle impossible", e);
        }
        artifactRepository.save(artifact);

        LatestModelPointer pointer = pointerRepository.findById(LatestModelPointer.SINGLETON_ID)
                .orElseGet(LatestModelPointer::new);
        pointer.setArtifactKey(key);
        pointer.setLastUpdated(LocalDateTime.now());
        pointerRepository.save(pointer);

        log.info("💾 Modèle sauvegardé : {} ({} échantillons, {} features)", key,
                metadata.getTrainingSamples(), metadata.getFeatureCount());
        return key;
    }

    // Deux entraînements dans la même milliseconde : suffixe _1, _2... (un artefact n'est jamais écrasé)
    private String uniqueKey(LocalDateTime createdAt) {
        String base = KEY_PREFIX + createdAt.format(KEY_FORMAT);
        String key = base;
        for (int i = 1; artifactRepository.existsById(key); i++) {
            key = base + "_" + i;
        }
        return key;
    }

    @Transactional(readOnly = true)
    public TrainedModel load(String artifactKey) {
        ModelArtifact artifact = artifactRepository.findById(artifactKey)
                .orElseThrow(() -> new ArtifactUnavailableException("Modèle introuvable : " + artifactKey));
        ModelMetadata metadata = readMetadata(artifact);
        try {
            RegressionModel model = modelCodec.decode(artifact.getModelType(), artifact.getPayload());
            return new TrainedModel(model, metadata);
        } catch (IOException e) {
            throw new ArtifactUnavailableException("Artefact illisible : " + artifactKey, e);
        }
    }

    @Transactional(readOnly = true)
    public TrainedModel loadLatest() {
        return load(latestKey());
    }

    public String latestKey() {
        return pointerRepository.findById(LatestModelPointer.SINGLETON_ID)
                .map(LatestModelPointer::getArtifactKey)
                .filter(k -> !k.isBlank())
                .orElseThrow(() -> new ArtifactUnavailableException(
                        "Aucun modèle entraîné. Lancez d'abord l'entraînement (POST /api/v1/admin/train)."));
    }

    public String latestKeyOrNull() {
        return pointerRepository.findById(LatestModelPointer.SINGLETON_ID)
                .map(LatestModelPointer::getArtifactKey)
                .orElse(null);
    }

    @Transactional(readOnly = true)
    public ModelMetadata latestMetadata() {
        ModelArtifact artifact = artifactRepository.findById(latestKey())
                .orElseThrow(() -> new ArtifactUnavailableException("Le pointeur latest référence un artefact absent."));
        return readMetadata(artifact);
    }

    public List<ModelArtifact> listArtifacts() {
        return artifactRepository.findAllByOrderByCreatedAtDesc();
    }

    public ModelMetadata readMetadata(ModelArtifact artifact) {
        try {
            return objectMapper.readValue(artifact.getMetadataJson(), ModelMetadata.class);
        } catch (JsonProcessingException e) {
            throw new ArtifactUnavailableException("Métadonnées illisibles : " + artifact.getArtifactKey(), e);
        }
    }
}
