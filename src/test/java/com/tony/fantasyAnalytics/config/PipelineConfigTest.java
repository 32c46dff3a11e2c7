package com.tony.fantasyAnalytics.config;

import com.tony.fantasyAnalytics.feature.IdentityStableAttributeEstimator;
import com.tony.fantasyAnalytics.feature.RandomAttributeEstimator;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.SynchronizedRandomGenerator;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineConfigTest {

    private final PipelineConfig config = new PipelineConfig();

    @Test
    void predictionRandomIsSafeToShareAcrossThreads() throws Exception {
        RandomGenerator random = config.predictionRandom();
        assertThat(random).isInstanceOf(SynchronizedRandomGenerator.class);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<Boolean>> draws = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                draws.add(pool.submit(() -> {
                    for (int i = 0; i < 10_000; i++) {
                        double d = random.nextDouble();
                        if (d < 0.0 || d >= 1.0) return false;
                    }
                    return true;
                }));
            }
            for (Future<Boolean> draw : draws) {
                assertThat(draw.get()).isTrue();
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void attributeModeSelectsEstimator() {
        PipelineProperties properties = new PipelineProperties();
        assertThat(config.attributeEstimator(properties)).isInstanceOf(IdentityStableAttributeEstimator.class);

        properties.setAttributeMode(PipelineProperties.AttributeMode.RANDOM);
        assertThat(config.attributeEstimator(properties)).isInstanceOf(RandomAttributeEstimator.class);
    }
}
