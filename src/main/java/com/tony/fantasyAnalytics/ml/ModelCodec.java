package com.tony.fantasyAnalytics.ml;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tony.fantasyAnalytics.ml.forest.RandomForestRegressor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * (Dé)sérialisation JSON des modèles. Le type est porté à part (colonne modelType de l'artefact).
 */
@Component
@RequiredArgsConstructor
public class ModelCodec {

    private final ObjectMapper objectMapper;

    public byte[] encode(RegressionModel model) throws IOException {
        return objectMapper.writeValueAsBytes(model);
    }

    public RegressionModel decode(String modelType, byte[] payload) throws IOException {
        if (RandomForestRegressor.MODEL_TYPE.equals(modelType)) {
            return objectMapper.readValue(payload, RandomForestRegressor.class);
        }
        throw new IOException("Type de modèle non supporté : " + modelType);
    }
}
