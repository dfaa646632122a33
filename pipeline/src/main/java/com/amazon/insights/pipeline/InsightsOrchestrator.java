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

import static com.amazon.insights.CommonUtils.checkArgument;
import static com.amazon.insights.CommonUtils.checkNotNull;
import static com.amazon.insights.CommonUtils.checkState;
import static com.amazon.insights.CommonUtils.clamp;
import static com.amazon.insights.CommonUtils.variance;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

import lombok.extern.slf4j.Slf4j;

import com.amazon.insights.config.TrendEdgeMethod;
import com.amazon.insights.decomposition.Decomposition;
import com.amazon.insights.decomposition.TimeSeriesDecomposer;
import com.amazon.insights.engagement.EngagementFeatures;
import com.amazon.insights.errors.InsightsPipelineException;
import com.amazon.insights.networks.AutoencoderAnomalyDetector;
import com.amazon.insights.networks.EngagementClassifier;
import com.amazon.insights.networks.ModelLifecycle;
import com.amazon.insights.networks.ModelMetrics;
import com.amazon.insights.networks.NetworkModel;
import com.amazon.insights.networks.RegressionForecaster;
import com.amazon.insights.networks.TrainingConfig;
import com.amazon.insights.networks.store.InMemoryModelStore;
import com.amazon.insights.networks.store.ModelStore;
import com.amazon.insights.preprocessor.LagWindowFeatures;
import com.amazon.insights.preprocessor.MinMaxScaler;
import com.amazon.insights.returntypes.FeatureMatrix;
import com.amazon.insights.returntypes.TrendDirection;
import com.amazon.insights.statistics.OutlierFence;

/**
 * Composes decomposition, forecasting, anomaly detection and engagement
 * classification over raw arrays and assembles the results.
 *
 * The orchestrator owns one instance of each model. Calls that reach the same
 * model are serialized by that model; calls on different models may run at the
 * same time. A forecast or anomaly report trains its model and uses it in one
 * model call, so concurrent requests never mix one request's training with
 * another's predictions; the model keeps whichever training ran last. Every
 * failure completes the returned future with an
 * {@link InsightsPipelineException} whose cause is the error of the component
 * that failed.
 *
 * <pre>
 * try (InsightsOrchestrator orchestrator = InsightsOrchestrator.builder().horizon(3).build()) {
 *     ForecastResult result = orchestrator.generateForecast(monthlyExpenses, TrainingConfig.defaults()).join();
 * }
 * </pre>
 */
@Slf4j
public class InsightsOrchestrator implements AutoCloseable {

    public static final int DEFAULT_HORIZON = 1;

    public static final double DEFAULT_CONFIDENCE_SCALE = 10000;

    public static final double DEFAULT_MIN_CONFIDENCE = 0.1;

    public static final double DEFAULT_MAX_CONFIDENCE = 0.95;

    public static final boolean DEFAULT_SCALING_ENABLED = false;

    public static final int DEFAULT_THREAD_POOL_SIZE = 3;

    public static final String FORECASTER_KEY = "forecaster";

    public static final String ANOMALY_DETECTOR_KEY = "anomaly-detector";

    public static final String ENGAGEMENT_CLASSIFIER_KEY = "engagement-classifier";

    private final int period;

    private final int lagWindow;

    private final int horizon;

    private final double confidenceScale;

    private final double minConfidence;

    private final double maxConfidence;

    private final boolean scalingEnabled;

    private final TimeSeriesDecomposer decomposer;

    private final RegressionForecaster forecaster;

    private final AutoencoderAnomalyDetector anomalyDetector;

    private final EngagementClassifier engagementClassifier;

    private final ModelStore modelStore;

    private final Executor executor;

    // the pool created by the orchestrator itself, shut down on close
    private final Optional<ExecutorService> ownedPool;

    private volatile boolean closed = false;

    protected InsightsOrchestrator(Builder<?> builder) {
        checkArgument(builder.period > 0, "period must be positive");
        checkArgument(builder.lagWindow > 0, "lag window must be positive");
        checkArgument(builder.horizon > 0, "horizon must be positive");
        checkArgument(builder.confidenceScale > 0, "confidence scale must be positive");
        checkArgument(0 <= builder.minConfidence && builder.minConfidence <= builder.maxConfidence
                && builder.maxConfidence <= 1, "confidence bounds must satisfy 0 <= min <= max <= 1");
        checkArgument(builder.threadPoolSize.orElse(1) > 0, "thread pool size must be positive");

        period = builder.period;
        lagWindow = builder.lagWindow;
        horizon = builder.horizon;
        confidenceScale = builder.confidenceScale;
        minConfidence = builder.minConfidence;
        maxConfidence = builder.maxConfidence;
        scalingEnabled = builder.scalingEnabled;
        decomposer = new TimeSeriesDecomposer(builder.trendEdgeMethod);
        modelStore = builder.modelStore.orElseGet(InMemoryModelStore::new);

        if (builder.executor.isPresent()) {
            executor = builder.executor.get();
            ownedPool = Optional.empty();
        } else {
            ExecutorService pool = Executors
                    .newFixedThreadPool(builder.threadPoolSize.orElse(DEFAULT_THREAD_POOL_SIZE));
            executor = pool;
            ownedPool = Optional.of(pool);
        }

        forecaster = RegressionForecaster.builder().executor(executor).randomSeed(builder.randomSeed).build();
        anomalyDetector = AutoencoderAnomalyDetector.builder().executor(executor).randomSeed(builder.randomSeed)
                .outlierFenceMultiplier(builder.outlierFenceMultiplier).build();
        engagementClassifier = EngagementClassifier.builder().executor(executor).randomSeed(builder.randomSeed)
                .build();
    }

    /**
     * @return a new InsightsOrchestrator builder.
     */
    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * Decomposes the series, trains the forecaster on its lag windows and
     * predicts the next {@code horizon} values from the latest window.
     *
     * @param series the observations, one per period step, oldest first
     * @param config the forecaster's hyperparameters
     * @return the predictions with the decomposition, training metrics, a
     *         confidence score and the recent trend direction
     */
    public CompletableFuture<ForecastResult> generateForecast(double[] series, TrainingConfig config) {
        checkNotNull(series, "series must not be null");
        checkNotNull(config, "config must not be null");
        checkOpen();
        double[] observations = series.clone();

        return run("decomposition", () -> decomposer.decompose(observations, period))
                .thenCompose(decomposition -> run("feature preparation", () -> new LagInputs(observations))
                        .thenCompose(inputs -> stage("forecasting",
                                forecaster.trainAndForecast(inputs.features, inputs.labels, inputs.window, horizon,
                                        config))
                                .thenApply(forecast -> assemble(observations, decomposition, inputs,
                                        forecast.getMetrics(), forecast.getPredictions()))));
    }

    /**
     * Trains the anomaly detector on the records and reports which of them it
     * flags.
     *
     * @param records rows scaled into [0,1]
     * @param config  the detector's hyperparameters
     * @return flags, reconstruction errors and the threshold of this training run
     */
    public CompletableFuture<AnomalyReport> generateAnomalyReport(FeatureMatrix records, TrainingConfig config) {
        checkNotNull(records, "records must not be null");
        checkNotNull(config, "config must not be null");
        checkOpen();
        return stage("anomaly detection", anomalyDetector.trainAndDetect(records, config))
                .thenApply(detection -> new AnomalyReport(detection.getAnomalies(), detection.getScores(),
                        detection.getThreshold()));
    }

    public CompletableFuture<AnomalyReport> generateAnomalyReport(double[][] records, TrainingConfig config) {
        checkNotNull(records, "records must not be null");
        return generateAnomalyReport(FeatureMatrix.of(records), config);
    }

    /**
     * @param features engagement rows of {@link EngagementFeatures#DIMENSIONS}
     *                 columns
     * @param labels   1 for members who engaged, 0 otherwise
     * @param config   the classifier's hyperparameters
     * @return the training metrics
     */
    public CompletableFuture<ModelMetrics> trainEngagementModel(FeatureMatrix features, double[] labels,
            TrainingConfig config) {
        checkNotNull(features, "features must not be null");
        checkNotNull(labels, "labels must not be null");
        checkNotNull(config, "config must not be null");
        checkOpen();
        return stage("engagement training", engagementClassifier.train(features, labels, config));
    }

    public CompletableFuture<double[]> predictEngagement(FeatureMatrix features) {
        checkNotNull(features, "features must not be null");
        checkOpen();
        return stage("engagement prediction", engagementClassifier.predict(features));
    }

    public CompletableFuture<double[]> predictEngagement(EngagementFeatures... members) {
        checkNotNull(members, "members must not be null");
        checkOpen();
        return stage("engagement prediction", engagementClassifier.predict(members));
    }

    /**
     * Writes every trained model to the model store under
     * {@code <keyPrefix>/<model>}. Untrained models are skipped.
     *
     * @param keyPrefix the prefix of the keys
     * @return the number of models written
     */
    public CompletableFuture<Integer> saveModels(String keyPrefix) {
        checkNotNull(keyPrefix, "key prefix must not be null");
        checkOpen();
        CompletableFuture<Integer> forecasterSaved = save(forecaster, key(keyPrefix, FORECASTER_KEY));
        CompletableFuture<Integer> detectorSaved = save(anomalyDetector, key(keyPrefix, ANOMALY_DETECTOR_KEY));
        CompletableFuture<Integer> classifierSaved = save(engagementClassifier,
                key(keyPrefix, ENGAGEMENT_CLASSIFIER_KEY));
        return forecasterSaved.thenCombine(detectorSaved, Integer::sum).thenCombine(classifierSaved, Integer::sum);
    }

    /**
     * Restores each model stored under {@code <keyPrefix>/<model>}. Models with
     * no entry keep their current state.
     *
     * @param keyPrefix the prefix of the keys
     * @return the number of models restored
     */
    public CompletableFuture<Integer> restoreModels(String keyPrefix) {
        checkNotNull(keyPrefix, "key prefix must not be null");
        checkOpen();
        CompletableFuture<Integer> forecasterRestored = restore(forecaster, key(keyPrefix, FORECASTER_KEY));
        CompletableFuture<Integer> detectorRestored = restore(anomalyDetector,
                key(keyPrefix, ANOMALY_DETECTOR_KEY));
        CompletableFuture<Integer> classifierRestored = restore(engagementClassifier,
                key(keyPrefix, ENGAGEMENT_CLASSIFIER_KEY));
        return forecasterRestored.thenCombine(detectorRestored, Integer::sum).thenCombine(classifierRestored,
                Integer::sum);
    }

    /**
     * Releases the models and shuts down the pool the orchestrator created. Work
     * already submitted to the pool is allowed to finish.
     */
    @Override
    public void close() {
        closed = true;
        forecaster.close();
        anomalyDetector.close();
        engagementClassifier.close();
        ownedPool.ifPresent(ExecutorService::shutdown);
        log.debug("closed insights orchestrator");
    }

    public boolean isClosed() {
        return closed;
    }

    public RegressionForecaster getForecaster() {
        return forecaster;
    }

    public AutoencoderAnomalyDetector getAnomalyDetector() {
        return anomalyDetector;
    }

    public EngagementClassifier getEngagementClassifier() {
        return engagementClassifier;
    }

    public ModelStore getModelStore() {
        return modelStore;
    }

    public int getPeriod() {
        return period;
    }

    public int getLagWindow() {
        return lagWindow;
    }

    public int getHorizon() {
        return horizon;
    }

    public boolean isScalingEnabled() {
        return scalingEnabled;
    }

    /**
     * maps the residual variance onto a confidence score; the score is 1 for a
     * perfect fit before clamping and falls linearly with the variance
     *
     * @param residualVariance the population variance of the residual
     * @return the clamped confidence
     */
    double confidence(double residualVariance) {
        return clamp(1 - residualVariance / confidenceScale, minConfidence, maxConfidence);
    }

    private ForecastResult assemble(double[] series, Decomposition decomposition, LagInputs inputs,
            ModelMetrics metrics, double[] predictions) {
        double variance = variance(decomposition.getResidual());
        double[] values = inputs.scaler.map(scaler -> scaler.inverseTransform(predictions)).orElse(predictions);
        ForecastResult result = new ForecastResult(values, confidence(variance), variance, decomposition, metrics,
                TrendDirection.of(series));
        log.info("forecast {} values from {} observations, confidence {}, trend {}", values.length, series.length,
                result.getConfidence(), result.getTrendDirection());
        return result;
    }

    private CompletableFuture<Integer> save(NetworkModel<?> model, String key) {
        if (model.getLifecycle() != ModelLifecycle.TRAINED) {
            log.debug("skipping untrained model for key {}", key);
            return CompletableFuture.completedFuture(0);
        }
        return stage("model persistence", model.save(modelStore, key)).thenApply(ignored -> 1);
    }

    private CompletableFuture<Integer> restore(NetworkModel<?> model, String key) {
        return run("model lookup", () -> {
            try {
                return modelStore.contains(key);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }).thenCompose(present -> {
            if (!present) {
                log.debug("no stored model under key {}", key);
                return CompletableFuture.completedFuture(0);
            }
            return stage("model restore", model.restore(modelStore, key)).thenApply(ignored -> 1);
        });
    }

    private static String key(String prefix, String model) {
        return prefix + "/" + model;
    }

    private void checkOpen() {
        checkState(!closed, "insights orchestrator has been closed");
    }

    private <T> CompletableFuture<T> run(String stage, Supplier<T> task) {
        return stage(stage, CompletableFuture.supplyAsync(task, executor));
    }

    /**
     * attributes a failure of one component to the stage that called it
     */
    static <T> CompletableFuture<T> stage(String stage, CompletableFuture<T> future) {
        return future.handle((value, error) -> {
            if (error != null) {
                throw new InsightsPipelineException(stage, unwrap(error));
            }
            return value;
        });
    }

    static Throwable unwrap(Throwable error) {
        Throwable answer = error;
        while (answer instanceof CompletionException && answer.getCause() != null) {
            answer = answer.getCause();
        }
        return answer;
    }

    /**
     * lag windows of the series, on the unit scale when scaling is enabled
     */
    private class LagInputs {

        final Optional<MinMaxScaler> scaler;
        final FeatureMatrix features;
        final double[] labels;
        final double[] window;

        LagInputs(double[] series) {
            scaler = scalingEnabled ? Optional.of(MinMaxScaler.fitted(series)) : Optional.empty();
            double[] values = scaler.map(s -> s.transform(series)).orElse(series);
            features = LagWindowFeatures.features(values, lagWindow);
            labels = LagWindowFeatures.labels(values, lagWindow);
            window = LagWindowFeatures.latestWindow(values, lagWindow);
        }
    }

    public static class Builder<T extends Builder<T>> {

        private int period = TimeSeriesDecomposer.DEFAULT_PERIOD;
        private int lagWindow = LagWindowFeatures.DEFAULT_WINDOW;
        private int horizon = DEFAULT_HORIZON;
        private double confidenceScale = DEFAULT_CONFIDENCE_SCALE;
        private double minConfidence = DEFAULT_MIN_CONFIDENCE;
        private double maxConfidence = DEFAULT_MAX_CONFIDENCE;
        private double outlierFenceMultiplier = OutlierFence.DEFAULT_MULTIPLIER;
        private boolean scalingEnabled = DEFAULT_SCALING_ENABLED;
        private TrendEdgeMethod trendEdgeMethod = TimeSeriesDecomposer.DEFAULT_TREND_EDGE_METHOD;
        private long randomSeed = NetworkModel.DEFAULT_RANDOM_SEED;
        private Optional<Executor> executor = Optional.empty();
        private Optional<Integer> threadPoolSize = Optional.empty();
        private Optional<ModelStore> modelStore = Optional.empty();

        public T period(int period) {
            this.period = period;
            return (T) this;
        }

        public T lagWindow(int lagWindow) {
            this.lagWindow = lagWindow;
            return (T) this;
        }

        public T horizon(int horizon) {
            this.horizon = horizon;
            return (T) this;
        }

        public T confidenceScale(double confidenceScale) {
            this.confidenceScale = confidenceScale;
            return (T) this;
        }

        public T minConfidence(double minConfidence) {
            this.minConfidence = minConfidence;
            return (T) this;
        }

        public T maxConfidence(double maxConfidence) {
            this.maxConfidence = maxConfidence;
            return (T) this;
        }

        public T outlierFenceMultiplier(double outlierFenceMultiplier) {
            this.outlierFenceMultiplier = outlierFenceMultiplier;
            return (T) this;
        }

        public T scalingEnabled(boolean scalingEnabled) {
            this.scalingEnabled = scalingEnabled;
            return (T) this;
        }

        public T trendEdgeMethod(TrendEdgeMethod trendEdgeMethod) {
            this.trendEdgeMethod = trendEdgeMethod;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return (T) this;
        }

        /**
         * @param executor runs all model work; the caller keeps ownership and the
         *                 orchestrator never shuts it down
         */
        public T executor(Executor executor) {
            this.executor = Optional.of(checkNotNull(executor, "executor must not be null"));
            return (T) this;
        }

        /**
         * size of the pool the orchestrator creates when no executor is given
         */
        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }

        public T modelStore(ModelStore modelStore) {
            this.modelStore = Optional.of(checkNotNull(modelStore, "model store must not be null"));
            return (T) this;
        }

        public InsightsOrchestrator build() {
            return new InsightsOrchestrator(this);
        }
    }
}
