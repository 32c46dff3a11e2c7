package com.tony.fantasyAnalytics.config;

import com.tony.fantasyAnalytics.feature.AttributeEstimator;
import com.tony.fantasyAnalytics.feature.IdentityStableAttributeEstimator;
import com.tony.fantasyAnalytics.feature.RandomAttributeEstimator;
import com.tony.fantasyAnalytics.ml.RegressionModelFactory;
import com.tony.fantasyAnalytics.ml.forest.RandomForestRegressor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.SynchronizedRandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class PipelineConfig {

    @Bean
    public AttributeEstimator attributeEstimator(PipelineProperties properties) {
        if (properties.getAttributeMode() == PipelineProperties.AttributeMode.RANDOM) {
            log.warn("🎲 Estimation d'âge en mode RANDOM : un même joueur peut changer d'âge entre entraînement et prédiction.");
            return new RandomAttributeEstimator(properties, new Well19937c());
        }
        return new IdentityStableAttributeEstimator(properties);
    }

    /**
     * Source d'aléa de la prédiction (variance par poste, confiance). Non seedée : bruit volontaire.
     * Partagée entre le job et l'API admin : Well19937c n'est pas thread-safe, d'où l'enveloppe synchronisée.
     */
    @Bean
    public RandomGenerator predictionRandom() {
        return new SynchronizedRandomGenerator(new Well19937c());
    }

    @Bean
    public RegressionModelFactory regressionModelFactory(PipelineProperties properties) {
        PipelineProperties.Forest forest = properties.getForest();
        return () -> new RandomForestRegressor(
                forest.getTrees(), forest.getMaxDepth(), forest.getMinSamplesSplit(),
                forest.getMinSamplesLeaf(), forest.getSeed());
    }
}
