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

package com.amazon.insights.networks;

import static com.amazon.insights.networks.TestUtils.EPSILON;
import static com.amazon.insights.networks.TestUtils.assertFailsWith;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.insights.errors.DimensionMismatchException;
import com.amazon.insights.errors.ModelNotTrainedException;
import com.amazon.insights.errors.TrainingFailedException;
import com.amazon.insights.preprocessor.LagWindowFeatures;
import com.amazon.insights.returntypes.FeatureMatrix;
import com.amazon.insights.testutils.SeasonalSeriesData;

public class RegressionForecasterTest {

    private static final int WINDOW = 12;

    private double[] series;
    private FeatureMatrix features;
    private double[] labels;
    private RegressionForecaster forecaster;

    @BeforeEach
    public void setUp() {
        series = new SeasonalSeriesData(0.5, 0, 0.4, 12, 0).generate(60, 0);
        features = LagWindowFeatures.features(series, WINDOW);
        labels = LagWindowFeatures.labels(series, WINDOW);
        forecaster = RegressionForecaster.builder().randomSeed(17).build();
    }

    @AfterEach
    public void tearDown() {
        forecaster.close();
    }

    @Test
    public void testNew() {
        assertEquals(ModelLifecycle.UNINITIALIZED, forecaster.getLifecycle());
        assertEquals(0, forecaster.getFeatureDimension());
        assertEquals(17, forecaster.getRandomSeed());
        assertEquals(RegressionForecaster.DEFAULT_DROPOUT_RATE, forecaster.getDropoutRate());
        assertThrows(IllegalArgumentException.class, () -> RegressionForecaster.builder().dropoutRate(1).build());
    }

    @Test
    public void testTrainAndPredict() {
        TrainingConfig config = TrainingConfig.builder().epochs(200).learningRate(0.01).validationSplit(0.2)
                .batchSize(16).build();
        ModelMetrics metrics = forecaster.train(features, labels, config).join();
        assertEquals(ModelLifecycle.TRAINED, forecaster.getLifecycle());
        assertEquals(WINDOW, forecaster.getFeatureDimension());
        assertTrue(metrics.getLoss() >= 0);
        assertTrue(metrics.getValidationLoss().isPresent());
        assertFalse(metrics.getAccuracy().isPresent());

        double[] predictions = forecaster.predict(features).join();
        assertEquals(features.rows(), predictions.length);
        for (double prediction : predictions) {
            assertTrue(Double.isFinite(prediction));
        }

        try (RegressionForecaster brief = RegressionForecaster.builder().randomSeed(17).build()) {
            TrainingConfig once = TrainingConfig.builder().epochs(1).learningRate(0.01).validationSplit(0.2)
                    .batchSize(16).build();
            ModelMetrics briefMetrics = brief.train(features, labels, once).join();
            assertTrue(metrics.getLoss() < briefMetrics.getLoss());
        }
    }

    @Test
    public void testNoValidationRows() {
        ModelMetrics metrics = forecaster.train(features, labels, TrainingConfig.builder().epochs(2)
                .validationSplit(0).build()).join();
        assertFalse(metrics.getValidationLoss().isPresent());
        assertFalse(metrics.getValidationAccuracy().isPresent());
    }

    @Test
    public void testNotTrained() {
        assertFailsWith(ModelNotTrainedException.class, forecaster.predict(features));
        forecaster.initialize(WINDOW).join();
        assertEquals(ModelLifecycle.INITIALIZED, forecaster.getLifecycle());
        assertEquals(WINDOW, forecaster.getFeatureDimension());
        assertFailsWith(ModelNotTrainedException.class, forecaster.predict(features));
        assertFailsWith(ModelNotTrainedException.class, forecaster.forecast(new double[WINDOW], 1));
    }

    @Test
    public void testDimensionMismatch() {
        forecaster.train(features, labels, TrainingConfig.builder().epochs(2).build()).join();
        FeatureMatrix narrow = FeatureMatrix.ofRow(new double[10]);
        DimensionMismatchException exception = assertFailsWith(DimensionMismatchException.class,
                forecaster.predict(narrow));
        assertEquals(WINDOW, exception.getExpected());
        assertEquals(10, exception.getActual());

        FeatureMatrix narrowFeatures = LagWindowFeatures.features(series, 10);
        double[] narrowLabels = LagWindowFeatures.labels(series, 10);
        assertFailsWith(DimensionMismatchException.class,
                forecaster.train(narrowFeatures, narrowLabels, TrainingConfig.defaults()));
        assertFailsWith(DimensionMismatchException.class, forecaster.forecast(new double[10], 2));
        assertFailsWith(DimensionMismatchException.class, forecaster.initialize(10));
        assertEquals(ModelLifecycle.TRAINED, forecaster.getLifecycle());
    }

    @Test
    public void testLabelMismatch() {
        double[] shortLabels = new double[labels.length - 1];
        assertFailsWith(DimensionMismatchException.class,
                forecaster.train(features, shortLabels, TrainingConfig.defaults()));
        assertEquals(ModelLifecycle.UNINITIALIZED, forecaster.getLifecycle());
    }

    @Test
    public void testDeterminism() {
        TrainingConfig config = TrainingConfig.builder().epochs(20).learningRate(0.01).build();
        try (RegressionForecaster first = RegressionForecaster.builder().randomSeed(5).build();
                RegressionForecaster second = RegressionForecaster.builder().randomSeed(5).build()) {
            ModelMetrics firstMetrics = first.train(features, labels, config).join();
            ModelMetrics secondMetrics = second.train(features, labels, config).join();
            assertEquals(firstMetrics.getLoss(), secondMetrics.getLoss(), 1e-6);
            assertEquals(firstMetrics.getValidationLoss().get(), secondMetrics.getValidationLoss().get(), 1e-6);
            assertArrayEquals(first.predict(features).join(), second.predict(features).join(), 1e-6);
        }
    }

    @Test
    public void testForecast() {
        forecaster.train(features, labels, TrainingConfig.builder().epochs(10).build()).join();
        double[] window = LagWindowFeatures.latestWindow(series, WINDOW);
        double[] forecast = forecaster.forecast(window, 3).join();
        assertEquals(3, forecast.length);

        double first = forecaster.predict(FeatureMatrix.ofRow(window)).join()[0];
        assertEquals(first, forecast[0], EPSILON);
        double[] advanced = LagWindowFeatures.advance(window, first);
        double second = forecaster.predict(FeatureMatrix.ofRow(advanced)).join()[0];
        assertEquals(second, forecast[1], EPSILON);

        assertThrows(IllegalArgumentException.class, () -> forecaster.forecast(window, 0));
    }

    @Test
    public void testFailedTrainingKeepsParameters() {
        forecaster.train(features, labels, TrainingConfig.builder().epochs(5).build()).join();
        double[] before = forecaster.predict(features).join();

        double[] huge = new double[labels.length];
        Arrays.fill(huge, 1e200);
        assertFailsWith(TrainingFailedException.class,
                forecaster.train(features, huge, TrainingConfig.builder().epochs(3).build()));
        assertEquals(ModelLifecycle.TRAINED, forecaster.getLifecycle());
        assertArrayEquals(before, forecaster.predict(features).join(), EPSILON);
    }

    @Test
    public void testFailedFirstTrainingLeavesModelUninitialized() {
        double[] huge = new double[labels.length];
        Arrays.fill(huge, 1e200);
        assertFailsWith(TrainingFailedException.class,
                forecaster.train(features, huge, TrainingConfig.builder().epochs(3).build()));
        assertEquals(ModelLifecycle.UNINITIALIZED, forecaster.getLifecycle());
        assertEquals(0, forecaster.getFeatureDimension());

        // any width is accepted again
        FeatureMatrix narrow = LagWindowFeatures.features(series, 10);
        forecaster.train(narrow, LagWindowFeatures.labels(series, 10), TrainingConfig.builder().epochs(2).build())
                .join();
        assertEquals(10, forecaster.getFeatureDimension());

        try (RegressionForecaster initialized = RegressionForecaster.builder().build()) {
            initialized.initialize(WINDOW).join();
            assertFailsWith(TrainingFailedException.class,
                    initialized.train(features, huge, TrainingConfig.builder().epochs(3).build()));
            assertEquals(ModelLifecycle.INITIALIZED, initialized.getLifecycle());
            assertEquals(WINDOW, initialized.getFeatureDimension());
        }
    }

    @Test
    public void testTrainAndForecast() {
        TrainingConfig config = TrainingConfig.builder().epochs(10).build();
        double[] window = LagWindowFeatures.latestWindow(series, WINDOW);
        ForecastRun run = forecaster.trainAndForecast(features, labels, window, 3, config).join();
        assertEquals(3, run.getPredictions().length);
        assertTrue(run.getMetrics().getLoss() >= 0);
        assertArrayEquals(forecaster.forecast(window, 3).join(), run.getPredictions(), EPSILON);

        try (RegressionForecaster separate = RegressionForecaster.builder().randomSeed(17).build()) {
            separate.train(features, labels, config).join();
            assertArrayEquals(separate.forecast(window, 3).join(), run.getPredictions(), 1e-9);
        }
    }

    @Test
    public void testTrainAndForecastChecksWindowFirst() {
        assertFailsWith(DimensionMismatchException.class,
                forecaster.trainAndForecast(features, labels, new double[10], 2, TrainingConfig.defaults()));
        assertEquals(ModelLifecycle.UNINITIALIZED, forecaster.getLifecycle());
        assertThrows(IllegalArgumentException.class,
                () -> forecaster.trainAndForecast(features, labels, new double[WINDOW], 0, TrainingConfig.defaults()));
    }

    @Test
    public void testClose() {
        forecaster.train(features, labels, TrainingConfig.builder().epochs(2).build()).join();
        forecaster.close();
        assertEquals(ModelLifecycle.RELEASED, forecaster.getLifecycle());
        assertFailsWith(IllegalStateException.class, forecaster.predict(features));
        assertFailsWith(IllegalStateException.class, forecaster.train(features, labels, TrainingConfig.defaults()));
        forecaster.close();
    }

    @Test
    public void testSerializedCalls() {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try (RegressionForecaster shared = RegressionForecaster.builder().executor(pool).build();
                RegressionForecaster other = RegressionForecaster.builder().executor(pool).build()) {
            TrainingConfig config = TrainingConfig.builder().epochs(5).build();
            shared.train(features, labels, config).join();

            List<CompletableFuture<?>> futures = new ArrayList<>();
            futures.add(other.train(features, labels, config));
            for (int i = 0; i < 8; i++) {
                futures.add(shared.predict(features));
                if (i % 4 == 0) {
                    futures.add(shared.train(features, labels, config));
                }
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            assertEquals(ModelLifecycle.TRAINED, shared.getLifecycle());
            assertEquals(ModelLifecycle.TRAINED, other.getLifecycle());
        } finally {
            pool.shutdown();
        }
    }
}
