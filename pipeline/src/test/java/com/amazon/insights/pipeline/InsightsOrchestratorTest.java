/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.insights.pipeline;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.amazon.insights.errors.DimensionMismatchException;
import com.amazon.insights.errors.InsightsPipelineException;
import com.amazon.insights.errors.InsufficientDataException;
import com.amazon.insights.errors.ModelNotTrainedException;
import com.amazon.insights.networks.ModelLifecycle;
import com.amazon.insights.networks.TrainingConfig;
import com.amazon.insights.networks.store.InMemoryModelStore;
import com.amazon.insights.returntypes.FeatureMatrix;
import com.amazon.insights.returntypes.TrendDirection;
import com.amazon.insights.testutils.ClusteredRecordData;
import com.amazon.insights.testutils.EngagementData;
import com.amazon.insights.testutils.SeasonalSeriesData;

public class InsightsOrchestratorTest {

    private static final TrainingConfig QUICK = TrainingConfig.builder().epochs(100).learningRate(0.01)
            .validationSplit(0).build();

    private static final TrainingConfig BRIEF = TrainingConfig.builder().epochs(3).build();

    private InMemoryModelStore store;
    private InsightsOrchestrator orchestrator;

    @BeforeEach
    public void setUp() {
        store = new InMemoryModelStore();
        orchestrator = InsightsOrchestrator.builder().modelStore(store).horizon(3).build();
    }

    @AfterEach
    public void tearDown() {
        orchestrator.close();
    }

    private static <T extends Throwable> T assertStageFailure(Class<T> cause, CompletableFuture<?> future) {
        CompletionException exception = assertThrows(CompletionException.class, future::join);
        InsightsPipelineException pipelineException = assertInstanceOf(InsightsPipelineException.class,
                exception.getCause());
        return assertInstanceOf(cause, pipelineException.getCause());
    }

    @Test
    public void testDefaults() {
        try (InsightsOrchestrator plain = InsightsOrchestrator.builder().build()) {
            assertEquals(12, plain.getPeriod());
            assertEquals(12, plain.getLagWindow());
            assertEquals(1, plain.getHorizon());
            assertFalse(plain.isScalingEnabled());
            assertInstanceOf(InMemoryModelStore.class, plain.getModelStore());
            assertEquals(ModelLifecycle.UNINITIALIZED, plain.getForecaster().getLifecycle());
        }
        assertThrows(IllegalArgumentException.class, () -> InsightsOrchestrator.builder().horizon(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> InsightsOrchestrator.builder().minConfidence(0.9).maxConfidence(0.5).build());
        assertThrows(IllegalArgumentException.class, () -> InsightsOrchestrator.builder().threadPoolSize(0).build());
    }

    @Test
    public void testForecast() {
        double[] series = new SeasonalSeriesData(100, 1, 10, 12, 0.5).generate(48, 1);
        ForecastResult result = orchestrator.generateForecast(series, TrainingConfig.builder().epochs(50).build())
                .join();

        assertEquals(3, result.getPredictions().length);
        for (double prediction : result.getPredictions()) {
            assertTrue(Double.isFinite(prediction));
        }
        assertEquals(48, result.getDecomposition().getLength());
        assertEquals(12, result.getDecomposition().getSeasonalPattern().length);
        assertTrue(result.getMetrics().getLoss() >= 0);
        assertTrue(result.getMetrics().getValidationLoss().isPresent());
        assertEquals(TrendDirection.of(series), result.getTrendDirection());
        assertTrue(result.getResidualVariance() < 50);
        assertEquals(InsightsOrchestrator.DEFAULT_MAX_CONFIDENCE, result.getConfidence());
        assertEquals(ModelLifecycle.TRAINED, orchestrator.getForecaster().getLifecycle());
    }

    @Test
    public void testNoisySeriesHasLowConfidence() {
        double[] series = new SeasonalSeriesData(1000, 0, 0, 12, 200).generate(48, 8);
        ForecastResult result = orchestrator.generateForecast(series, BRIEF).join();
        assertTrue(result.getResidualVariance() > InsightsOrchestrator.DEFAULT_CONFIDENCE_SCALE);
        assertEquals(InsightsOrchestrator.DEFAULT_MIN_CONFIDENCE, result.getConfidence());
    }

    @ParameterizedTest
    @CsvSource({ "0,0.95", "100,0.95", "5000,0.5", "8000,0.2", "9500,0.1", "20000,0.1" })
    public void testConfidence(double variance, double expected) {
        assertEquals(expected, orchestrator.confidence(variance), 1e-12);
    }

    @Test
    public void testScaledForecast() {
        double[] series = new SeasonalSeriesData(5000, 20, 800, 12, 10).generate(60, 3);
        try (InsightsOrchestrator scaled = InsightsOrchestrator.builder().scalingEnabled(true).build()) {
            double prediction = scaled.generateForecast(series, QUICK).join().getPredictions()[0];
            double min = Double.MAX_VALUE;
            double max = -Double.MAX_VALUE;
            for (double value : series) {
                min = Math.min(min, value);
                max = Math.max(max, value);
            }
            double range = max - min;
            assertTrue(min - range < prediction && prediction < max + range, "prediction " + prediction);
        }
    }

    @Test
    public void testShortSeries() {
        InsufficientDataException cause = assertStageFailure(InsufficientDataException.class,
                orchestrator.generateForecast(new double[10], BRIEF));
        assertEquals(24, cause.getRequired());
        assertEquals(10, cause.getActual());
        assertEquals(ModelLifecycle.UNINITIALIZED, orchestrator.getForecaster().getLifecycle());

        try (InsightsOrchestrator shortPeriod = InsightsOrchestrator.builder().period(2).build()) {
            InsufficientDataException lagCause = assertStageFailure(InsufficientDataException.class,
                    shortPeriod.generateForecast(new double[12], BRIEF));
            assertEquals(13, lagCause.getRequired());
        }
    }

    @Test
    public void testAnomalyReport() {
        double[][] records = ClusteredRecordData.ellipse(100, 0.5, 0.5, 0.1, 0.02, new double[] { 0.99, 0.01 });
        AnomalyReport report = orchestrator.generateAnomalyReport(records, QUICK).join();

        FeatureMatrix matrix = FeatureMatrix.of(records);
        assertArrayEquals(orchestrator.getAnomalyDetector().detect(matrix).join(), report.getAnomalies());
        assertArrayEquals(orchestrator.getAnomalyDetector().scores(matrix).join(), report.getScores(), 0.0);
        assertEquals(orchestrator.getAnomalyDetector().getThreshold(), report.getThreshold());
        assertTrue(report.getAnomalies()[100]);
        assertEquals(1, report.anomalyCount());
    }

    /**
     * runs queued tasks in submission order on the calling thread, including the
     * tasks that finished tasks enqueue
     */
    private static void drain(Queue<Runnable> queue) {
        Runnable task;
        while ((task = queue.poll()) != null) {
            task.run();
        }
    }

    @Test
    public void testInterleavedAnomalyReports() {
        double[][] first = ClusteredRecordData.ellipse(100, 0.5, 0.5, 0.1, 0.02, new double[] { 0.99, 0.01 });
        double[][] second = ClusteredRecordData.ellipse(100, 0.2, 0.7, 0.05, 0.05, new double[] { 0.01, 0.01 });

        Queue<Runnable> queue = new ArrayDeque<>();
        Executor fifo = queue::add;
        AnomalyReport interleaved;
        try (InsightsOrchestrator shared = InsightsOrchestrator.builder().executor(fifo).randomSeed(13).build()) {
            CompletableFuture<AnomalyReport> firstReport = shared.generateAnomalyReport(first, QUICK);
            CompletableFuture<AnomalyReport> secondReport = shared.generateAnomalyReport(second, QUICK);
            drain(queue);
            interleaved = firstReport.join();
            assertTrue(secondReport.isDone());
        }

        AnomalyReport alone;
        try (InsightsOrchestrator single = InsightsOrchestrator.builder().executor(fifo).randomSeed(13).build()) {
            CompletableFuture<AnomalyReport> report = single.generateAnomalyReport(first, QUICK);
            drain(queue);
            alone = report.join();
        }

        assertEquals(alone.getThreshold(), interleaved.getThreshold(), 1e-12);
        assertArrayEquals(alone.getScores(), interleaved.getScores(), 1e-12);
        assertArrayEquals(alone.getAnomalies(), interleaved.getAnomalies());
        for (int i = 0; i < interleaved.getScores().length; i++) {
            assertEquals(interleaved.getScores()[i] > interleaved.getThreshold(), interleaved.getAnomalies()[i]);
        }
    }

    @Test
    public void testInterleavedForecasts() {
        double[] first = new SeasonalSeriesData(100, 1, 10, 12, 0.5).generate(48, 1);
        double[] second = new SeasonalSeriesData(5000, -20, 800, 12, 10).generate(48, 2);

        Queue<Runnable> queue = new ArrayDeque<>();
        Executor fifo = queue::add;
        ForecastResult interleaved;
        try (InsightsOrchestrator shared = InsightsOrchestrator.builder().executor(fifo).randomSeed(13).horizon(3)
                .build()) {
            CompletableFuture<ForecastResult> firstForecast = shared.generateForecast(first, BRIEF);
            CompletableFuture<ForecastResult> secondForecast = shared.generateForecast(second, BRIEF);
            drain(queue);
            interleaved = firstForecast.join();
            assertTrue(secondForecast.isDone());
        }

        ForecastResult alone;
        try (InsightsOrchestrator single = InsightsOrchestrator.builder().executor(fifo).randomSeed(13).horizon(3)
                .build()) {
            CompletableFuture<ForecastResult> forecast = single.generateForecast(first, BRIEF);
            drain(queue);
            alone = forecast.join();
        }

        assertArrayEquals(alone.getPredictions(), interleaved.getPredictions(), 1e-9);
        assertEquals(alone.getMetrics().getLoss(), interleaved.getMetrics().getLoss(), 1e-9);
    }

    @Test
    public void testEngagement() {
        EngagementData data = new EngagementData(60, 4);
        FeatureMatrix features = FeatureMatrix.of(data.getFeatures());
        assertStageFailure(ModelNotTrainedException.class, orchestrator.predictEngagement(features));

        assertTrue(orchestrator.trainEngagementModel(features, data.getLabels(), BRIEF).join().getAccuracy()
                .isPresent());
        double[] probabilities = orchestrator.predictEngagement(features).join();
        assertEquals(60, probabilities.length);

        FeatureMatrix wide = FeatureMatrix.of(new double[][] { { 0.1, 0.2, 0.3, 0.4, 0.5 } });
        assertStageFailure(DimensionMismatchException.class, orchestrator.predictEngagement(wide));
    }

    @Test
    public void testSaveAndRestore() {
        double[] series = new SeasonalSeriesData(100, 1, 10, 12, 0.5).generate(36, 2);
        orchestrator.generateForecast(series, BRIEF).join();
        EngagementData data = new EngagementData(40, 6);
        FeatureMatrix features = FeatureMatrix.of(data.getFeatures());
        orchestrator.trainEngagementModel(features, data.getLabels(), BRIEF).join();

        assertEquals(2, orchestrator.saveModels("tenant").join());
        assertTrue(store.contains("tenant/forecaster"));
        assertTrue(store.contains("tenant/engagement-classifier"));
        assertFalse(store.contains("tenant/anomaly-detector"));

        try (InsightsOrchestrator restored = InsightsOrchestrator.builder().modelStore(store).build()) {
            assertEquals(0, restored.restoreModels("other").join());
            assertEquals(2, restored.restoreModels("tenant").join());
            assertEquals(ModelLifecycle.TRAINED, restored.getForecaster().getLifecycle());
            assertEquals(ModelLifecycle.UNINITIALIZED, restored.getAnomalyDetector().getLifecycle());
            assertArrayEquals(orchestrator.predictEngagement(features).join(),
                    restored.predictEngagement(features).join(), 1e-12);
        }
    }

    @Test
    public void testClose() {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            InsightsOrchestrator shared = InsightsOrchestrator.builder().executor(pool).build();
            shared.close();
            assertTrue(shared.isClosed());
            assertFalse(pool.isShutdown());
            assertEquals(ModelLifecycle.RELEASED, shared.getForecaster().getLifecycle());
            assertEquals(ModelLifecycle.RELEASED, shared.getEngagementClassifier().getLifecycle());
            assertThrows(IllegalStateException.class, () -> shared.generateForecast(new double[48], BRIEF));
            assertThrows(IllegalStateException.class, () -> shared.saveModels("tenant"));
            shared.close();
        } finally {
            pool.shutdown();
        }
    }
}
