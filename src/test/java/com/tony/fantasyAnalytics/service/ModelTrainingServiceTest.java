package com.tony.fantasyAnalytics.service;

import com.tony.fantasyAnalytics.config.PipelineProperties;
import com.tony.fantasyAnalytics.exception.InsufficientDataException;
import com.tony.fantasyAnalytics.feature.FeatureBuilder;
import com.tony.fantasyAnalytics.feature.FeatureSchema;
import com.tony.fantasyAnalytics.feature.TrainingExample;
import com.tony.fantasyAnalytics.feature.TransitionExtractor;
import com.tony.fantasyAnalytics.ml.TrainedModel;
import com.tony.fantasyAnalytics.ml.forest.RandomForestRegressor;
import com.tony.fantasyAnalytics.model.AttributeEstimate;
import com.tony.fantasyAnalytics.model.ModelMetrics;
import com.tony.fantasyAnalytics.model.Position;
import com.tony.fantasyAnalytics.model.SeasonRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ModelTrainingServiceTest {

    private PipelineProperties properties;
    private ModelTrainingService trainingService;
    private TransitionExtractor extractor;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        // Petit jeu de données : on autorise des feuilles d'un seul exemple
        properties.getForest().setTrees(20);
        properties.getForest().setMinSamplesSplit(2);
        properties.getForest().setMinSamplesLeaf(1);
        PipelineProperties.Forest f = properties.getForest();
        trainingService = new ModelTrainingService(properties,
                () -> new RandomForestRegressor(f.getTrees(), f.getMaxDepth(), f.getMinSamplesSplit(), f.getMinSamplesLeaf(), f.getSeed()));
        extractor = new TransitionExtractor(new FeatureBuilder(properties, (name, pos) -> AttributeEstimate.fromAge(27)));
    }

    private List<SeasonRecord> threePlayersThreeYears() {
        return List.of(
                new SeasonRecord("Alpha", Position.QB, "BUF", 300.0, 2021),
                new SeasonRecord("Alpha", Position.QB, "BUF", 320.0, 2022),
                new SeasonRecord("Alpha", Position.QB, "BUF", 310.0, 2023),
                new SeasonRecord("Bravo", Position.RB, "SF", 200.0, 2021),
                new SeasonRecord("Bravo", Position.RB, "SF", 180.0, 2022),
                new SeasonRecord("Bravo", Position.RB, "NYJ", 150.0, 2023),
                new SeasonRecord("Charlie", Position.WR, "MIA", 150.0, 2021),
                new SeasonRecord("Charlie", Position.WR, "MIA", 210.0, 2022),
                new SeasonRecord("Charlie", Position.WR, "MIA", 230.0, 2023));
    }

    @Test
    @DisplayName("Aucun exemple -> InsufficientDataException")
    void emptyExamplesAreRejected() {
        assertThatThrownBy(() -> trainingService.train(List.of()))
                .isInstanceOf(InsufficientDataException.class)
                .extracting("errorCode").isEqualTo("ERR-DATA-002");
    }

    @Test
    void trainsOnSmallHistoryWithFiniteMetrics() {
        List<TrainingExample> examples = extractor.extract(threePlayersThreeYears());
        assertThat(examples).hasSize(6);

        TrainedModel trained = trainingService.train(examples);
        ModelMetrics metrics = trained.metadata().getMetrics();

        assertThat(metrics.getMse()).isFinite().isGreaterThanOrEqualTo(0.0);
        assertThat(metrics.getRmse()).isCloseTo(Math.sqrt(metrics.getMse()), within(1e-9));
        assertThat(metrics.getR2()).isFinite();
        assertThat(metrics.isEvaluatedInSample()).isFalse();

        assertThat(metrics.getFeatureImportance()).hasSize(12);
        assertThat(metrics.getFeatureImportance().keySet()).containsExactlyElementsOf(FeatureSchema.V2_EXTENDED.featureNames());
        double total = metrics.getFeatureImportance().values().stream().mapToDouble(Double::doubleValue).sum();
        assertThat(total).isCloseTo(1.0, within(1e-9));

        // ceil(6 * 0.2) = 2 exemples écartés
        assertThat(trained.metadata().getTrainingSamples()).isEqualTo(6);
        assertThat(trained.metadata().getHeldOutSamples()).isEqualTo(2);
        assertThat(trained.metadata().getFeatureCount()).isEqualTo(12);
        assertThat(trained.metadata().getSchemaHash()).isEqualTo(FeatureSchema.V2_EXTENDED.schemaHash());
        assertThat(trained.metadata().getEpochYear()).isEqualTo(2019);
        assertThat(trained.metadata().getProvenanceSample()).hasSize(6);
        assertThat(trained.model().featureCount()).isEqualTo(12);
    }

    @Test
    void trainingIsReproducibleWithSameSeed() {
        List<TrainingExample> examples = extractor.extract(threePlayersThreeYears());

        ModelMetrics first = trainingService.train(examples).metadata().getMetrics();
        ModelMetrics second = trainingService.train(examples).metadata().getMetrics();

        assertThat(second.getMse()).isEqualTo(first.getMse());
        assertThat(second.getFeatureImportance()).isEqualTo(first.getFeatureImportance());
    }

    @Test
    @DisplayName("Un seul exemple : évaluation sur l'échantillon d'entraînement")
    void singleExampleIsEvaluatedInSample() {
        List<TrainingExample> examples = extractor.extract(List.of(
                new SeasonRecord("Solo", Position.TE, "KC", 100.0, 2022),
                new SeasonRecord("Solo", Position.TE, "KC", 120.0, 2023)));

        TrainedModel trained = trainingService.train(examples);

        assertThat(trained.metadata().getMetrics().isEvaluatedInSample()).isTrue();
        assertThat(trained.metadata().getHeldOutSamples()).isZero();
        assertThat(trained.metadata().getMetrics().getR2()).isEqualTo(1.0);
        assertThat(trained.model().predict(examples.get(0).features().values())).isEqualTo(120.0);
    }

    @Test
    void mixedSchemasAreRejected() {
        List<TrainingExample> v2 = extractor.extract(threePlayersThreeYears());
        properties.setFeatureSchema(FeatureSchema.V1_BASE);
        List<TrainingExample> v1 = extractor.extract(threePlayersThreeYears());

        List<TrainingExample> mixed = new ArrayList<>(v2);
        mixed.addAll(v1);
        assertThatThrownBy(() -> trainingService.train(mixed)).isInstanceOf(IllegalStateException.class);
    }
}
