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

import static com.amazon.insights.CommonUtils.checkArgument;
import static com.amazon.insights.CommonUtils.checkDimension;
import static com.amazon.insights.CommonUtils.checkNotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import lombok.extern.slf4j.Slf4j;

import org.deeplearning4j.nn.conf.MultiLayerConfiguration;
import org.deeplearning4j.nn.conf.NeuralNetConfiguration;
import org.deeplearning4j.nn.conf.inputs.InputType;
import org.deeplearning4j.nn.conf.layers.DenseLayer;
import org.deeplearning4j.nn.conf.layers.OutputLayer;
import org.deeplearning4j.nn.weights.WeightInit;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.nd4j.linalg.learning.config.Adam;
import org.nd4j.linalg.lossfunctions.LossFunctions;

import com.amazon.insights.networks.state.AutoencoderState;
import com.amazon.insights.returntypes.FeatureMatrix;
import com.amazon.insights.statistics.OutlierFence;

/**
 * Flags records that the network reconstructs poorly. The encoder narrows a
 * record of width d to d/2 and then d/4 units (never fewer than one), the
 * decoder mirrors it back to d units with a sigmoid output, so records must be
 * scaled into [0,1] before use, for example with
 * {@link com.amazon.insights.preprocessor.MinMaxScaler#scaleColumns}.
 *
 * The error of a record is the mean squared difference between the record and
 * its reconstruction. Each training run sets the threshold to the outlier fence
 * {@code Q3 + k * (Q3 - Q1)} of the errors of the training records; a record is
 * anomalous when its error is strictly above the threshold.
 */
@Slf4j
public class AutoencoderAnomalyDetector extends NetworkModel<AutoencoderState> {

    // index of the bottleneck layer, the last encoder layer
    private static final int ENCODER_OUTPUT_LAYER = 1;

    private double outlierFenceMultiplier;

    private double threshold;

    private double[] trainingErrors;

    protected AutoencoderAnomalyDetector(Builder builder) {
        super(builder, "autoencoder anomaly detector", AutoencoderState.class);
        checkFenceMultiplier(builder.outlierFenceMultiplier);
        this.outlierFenceMultiplier = builder.outlierFenceMultiplier;
    }

    /**
     * @return a new AutoencoderAnomalyDetector builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    static int halfWidth(int dimension) {
        return Math.max(1, dimension / 2);
    }

    static int quarterWidth(int dimension) {
        return Math.max(1, dimension / 4);
    }

    @Override
    protected MultiLayerConfiguration configuration(int dimension) {
        int half = halfWidth(dimension);
        int quarter = quarterWidth(dimension);
        return new NeuralNetConfiguration.Builder().seed(randomSeed).weightInit(WeightInit.XAVIER)
                .updater(new Adam(TrainingConfig.DEFAULT_LEARNING_RATE)).dataType(DataType.DOUBLE).list()
                .layer(new DenseLayer.Builder().nIn(dimension).nOut(half).activation(Activation.RELU).build())
                .layer(new DenseLayer.Builder().nIn(half).nOut(quarter).activation(Activation.RELU).build())
                .layer(new DenseLayer.Builder().nIn(quarter).nOut(half).activation(Activation.RELU).build())
                .layer(new OutputLayer.Builder(LossFunctions.LossFunction.MSE).nIn(half).nOut(dimension)
                        .activation(Activation.SIGMOID).build())
                .setInputType(InputType.feedForward(dimension)).build();
    }

    @Override
    protected AutoencoderState newState() {
        return new AutoencoderState();
    }

    @Override
    protected void writeState(AutoencoderState state) {
        state.setThreshold(threshold);
        state.setOutlierFenceMultiplier(outlierFenceMultiplier);
        state.setTrainingErrors(trainingErrors.clone());
    }

    @Override
    protected void checkRestorable(AutoencoderState state) {
        checkFenceMultiplier(state.getOutlierFenceMultiplier());
        checkArgument(state.getTrainingErrors() != null, "stored training errors are missing");
        checkArgument(Double.isFinite(state.getThreshold()), "stored threshold must be finite");
    }

    @Override
    protected void readState(AutoencoderState state) {
        threshold = state.getThreshold();
        outlierFenceMultiplier = state.getOutlierFenceMultiplier();
        trainingErrors = state.getTrainingErrors().clone();
    }

    /**
     * Trains the network to reproduce the records and derives the threshold from
     * the reconstruction errors of all supplied records.
     *
     * @param data   records scaled into [0,1]
     * @param config the hyperparameters
     * @return the final-epoch reconstruction metrics
     */
    public CompletableFuture<ModelMetrics> train(FeatureMatrix data, TrainingConfig config) {
        checkNotNull(data, "data must not be null");
        return submit(() -> trainLocked(data, config));
    }

    /**
     * Trains on the records and flags them against the threshold of that same
     * run, as one call: no other call on this model runs in between.
     *
     * @param data   records scaled into [0,1]
     * @param config the hyperparameters
     * @return the metrics, the reconstruction error and flag of every record, and
     *         the threshold
     */
    public CompletableFuture<DetectionRun> trainAndDetect(FeatureMatrix data, TrainingConfig config) {
        checkNotNull(data, "data must not be null");
        return submit(() -> {
            ModelMetrics metrics = trainLocked(data, config);
            double[] scores = trainingErrors.clone();
            return new DetectionRun(metrics, scores, OutlierFence.exceeds(scores, threshold), threshold);
        });
    }

    private ModelMetrics trainLocked(FeatureMatrix data, TrainingConfig config) {
        ModelMetrics metrics = fit(data, data.toArray(), config, false);
        double[] errors = reconstructionErrors(data);
        trainingErrors = errors;
        threshold = OutlierFence.threshold(errors, outlierFenceMultiplier);
        log.info("{} threshold {} from {} training errors", modelName, threshold, errors.length);
        return metrics;
    }

    /**
     * @param data records of the trained width
     * @return the reconstruction error of each record
     */
    public CompletableFuture<double[]> scores(FeatureMatrix data) {
        checkNotNull(data, "data must not be null");
        return submit(() -> reconstructionErrors(data));
    }

    /**
     * @param data records of the trained width
     * @return true for each record whose error exceeds the threshold
     */
    public CompletableFuture<boolean[]> detect(FeatureMatrix data) {
        checkNotNull(data, "data must not be null");
        return submit(() -> OutlierFence.exceeds(reconstructionErrors(data), threshold));
    }

    /**
     * @param data records of the trained width
     * @return the bottleneck activations, one row of width
     *         {@code max(1, d/4)} per record
     */
    public CompletableFuture<double[][]> encode(FeatureMatrix data) {
        checkNotNull(data, "data must not be null");
        return submit(() -> {
            checkReady(data);
            INDArray input = Nd4j.create(data.toArray());
            List<INDArray> activations = null;
            try {
                activations = network.feedForward(input, false);
                // the first entry is the input itself
                return activations.get(ENCODER_OUTPUT_LAYER + 1).toDoubleMatrix();
            } finally {
                if (activations != null) {
                    release(activations.toArray(new INDArray[0]));
                }
                release(input);
            }
        });
    }

    /**
     * @return the threshold of the last training run
     */
    public double getThreshold() {
        return locked(() -> {
            checkTrained();
            return threshold;
        });
    }

    public double getOutlierFenceMultiplier() {
        return locked(() -> outlierFenceMultiplier);
    }

    /**
     * Moves the fence. A trained model recomputes its threshold from the errors
     * of its last training run; the network is not retrained. A larger
     * multiplier never lowers the threshold.
     *
     * @param multiplier the new multiple of the interquartile range, at least 0
     */
    public void setOutlierFenceMultiplier(double multiplier) {
        checkFenceMultiplier(multiplier);
        locked(() -> {
            outlierFenceMultiplier = multiplier;
            if (trainingErrors != null && lifecycle == ModelLifecycle.TRAINED) {
                threshold = OutlierFence.threshold(trainingErrors, multiplier);
            }
            return null;
        });
    }

    private void checkReady(FeatureMatrix data) {
        checkTrained();
        checkDimension(featureDimension, data.width(), modelName + " record width");
    }

    private double[] reconstructionErrors(FeatureMatrix data) {
        checkReady(data);
        INDArray input = Nd4j.create(data.toArray());
        INDArray reconstruction = null;
        INDArray squared = null;
        INDArray errors = null;
        try {
            reconstruction = network.output(input, false);
            squared = reconstruction.sub(input);
            squared.muli(squared);
            errors = squared.mean(1);
            return errors.toDoubleVector();
        } finally {
            release(errors, squared, reconstruction, input);
        }
    }

    private static void checkFenceMultiplier(double multiplier) {
        checkArgument(multiplier >= 0 && Double.isFinite(multiplier), "outlier fence multiplier must be non-negative");
    }

    public static class Builder extends NetworkModel.Builder<Builder> {

        private double outlierFenceMultiplier = OutlierFence.DEFAULT_MULTIPLIER;

        public Builder outlierFenceMultiplier(double outlierFenceMultiplier) {
            this.outlierFenceMultiplier = outlierFenceMultiplier;
            return this;
        }

        public AutoencoderAnomalyDetector build() {
            return new AutoencoderAnomalyDetector(this);
        }
    }
}
