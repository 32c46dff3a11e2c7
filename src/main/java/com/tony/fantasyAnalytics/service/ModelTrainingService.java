package com.tony.fantasyAnalytics.service;

import com.tony.fantasyAnalytics.config.PipelineProperties;
import com.tony.fantasyAnalytics.exception.InsufficientDataException;
import com.tony.fantasyAnalytics.feature.FeatureSchema;
import com.tony.fantasyAnalytics.feature.TrainingExample;
import com.tony.fantasyAnalytics.ml.FitSummary;
import com.tony.fantasyAnalytics.ml.RegressionMetrics;
import com.tony.fantasyAnalytics.ml.RegressionModel;
import com.tony.fantasyAnalytics.ml.RegressionModelFactory;
import com.tony.fantasyAnalytics.ml.TrainedModel;
import com.tony.fantasyAnalytics.model.ModelMetadata;
import com.tony.fantasyAnalytics.model.ModelMetrics;
import com.tony.fantasyAnalytics.model.TransitionProvenance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.util.MathArrays;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class ModelTrainingService {

    private static final int PROVENANCE_SAMPLE_SIZE = 10;

    private final PipelineProperties properties;
    private final RegressionModelFactory modelFactory;

    /**
     * Split 80/20 (seedé), fit du régresseur, évaluation sur la partie écartée.
     * Aucun exemple -> InsufficientDataException : l'appelant ne doit rien persister.
     */
    public TrainedModel train(List<TrainingExample> examples) {
        if (examples == null || examples.isEmpty()) {
            throw new InsufficientDataException("Aucun exemple d'entraînement : il faut au moins un joueur avec deux saisons consécutives.");
        }

        FeatureSchema schema = examples.get(0).features().schema();
        for (TrainingExample ex : examples) {
            if (ex.features().schema() != schema) {
                throw new IllegalStateException("Exemples construits avec des schémas différents ("
                        + schema.version() + " / " + ex.features().schema().version() + ")");
            }
        }

        int n = examples.size();
        double[][] x = new double[n][];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = examples.get(i).features().values();
            y[i] = examples.get(i).label();
        }

        // --- SPLIT TRAIN / TEST ---
        int[] order = MathArrays.natural(n);
        MathArrays.shuffle(order, new Well19937c(properties.getForest().getSeed()));
        int testSize = (int) Math.ceil(n * properties.getForest().getTestFraction());
        boolean inSample = n - testSize < 1 || testSize == 0;

        int[] trainIdx;
        int[] testIdx;
        if (inSample) {
            log.warn("⚠️ Seulement {} exemple(s) : entraînement et évaluation sur le même échantillon.", n);
            trainIdx = order;
            testIdx = order;
        } else {
            testIdx = Arrays.copyOfRange(order, 0, testSize);
            trainIdx = Arrays.copyOfRange(order, testSize, n);
        }

        RegressionModel model = modelFactory.create();
        log.info("🧠 Entraînement {} sur {} exemples ({} train / {} test), schéma {}",
                model.modelType(), n, trainIdx.length, testIdx.length, schema.version());

        FitSummary fit = model.fit(select(x, trainIdx), select(y, trainIdx));

        double[] yTest = select(y, testIdx);
        double[] yPred = model.predict(select(x, testIdx));
        double mse = RegressionMetrics.mse(yTest, yPred);
        double r2 = RegressionMetrics.r2(yTest, yPred);

        Map<String, Double> importance = new LinkedHashMap<>();
        double[] importances = fit.featureImportances();
        for (int f = 0; f < schema.size(); f++) {
            importance.put(schema.featureNames().get(f), importances[f]);
        }

        ModelMetrics metrics = ModelMetrics.builder()
                .mse(mse)
                .rmse(Math.sqrt(mse))
                .r2(r2)
                .featureImportance(importance)
                .evaluatedInSample(inSample)
                .build();

        List<TransitionProvenance> sample = examples.stream()
                .limit(PROVENANCE_SAMPLE_SIZE)
                .map(TrainingExample::provenance)
                .toList();

        ModelMetadata metadata = ModelMetadata.builder()
                .trainedAt(LocalDateTime.now())
                .modelType(model.modelType())
                .schemaVersion(schema.version())
                .schemaHash(schema.schemaHash())
                .epochYear(properties.getEpochYear())
                .trainingSamples(n)
                .heldOutSamples(inSample ? 0 : testIdx.length)
                .featureCount(schema.size())
                .metrics(metrics)
                .provenanceSample(sample)
                .build();

        log.info("✅ Modèle entraîné : MSE {} | RMSE {} | R² {}",
                String.format("%.2f", mse), String.format("%.2f", Math.sqrt(mse)), String.format("%.3f", r2));
        return new TrainedModel(model, metadata);
    }

    private static double[][] select(double[][] x, int[] idx) {
        double[][] out = new double[idx.length][];
        for (int i = 0; i < idx.length; i++) out[i] = x[idx[i]];
        return out;
    }

    private static double[] select(double[] y, int[] idx) {
        double[] out = new double[idx.length];
        for (int i = 0; i < idx.length; i++) out[i] = y[idx[i]];
        return out;
    }
}
