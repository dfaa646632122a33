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
import static com.amazon.insights.CommonUtils.checkFinite;
import static com.amazon.insights.CommonUtils.checkNotNull;

import java.util.concurrent.CompletableFuture;

import org.deeplearning4j.nn.conf.MultiLayerConfiguration;
import org.deeplearning4j.nn.conf.NeuralNetConfiguration;
import org.deeplearning4j.nn.conf.inputs.InputType;
import org.deeplearning4j.nn.conf.layers.DenseLayer;
import org.deeplearning4j.nn.conf.layers.DropoutLayer;
import org.deeplearning4j.nn.conf.layers.OutputLayer;
import org.deeplearning4j.nn.weights.WeightInit;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.learning.config.Adam;
import org.nd4j.linalg.lossfunctions.LossFunctions;

import com.amazon.insights.networks.state.NetworkModelState;
import com.amazon.insights.preprocessor.LagWindowFeatures;
import com.amazon.insights.returntypes.FeatureMatrix;

/**
 * Predicts the next value of a series from a lag window of its previous
 * values. The network is two ReLU layers of 64 and 32 units with dropout
 * between them and a single linear output, trained on mean squared error with
 * Adam.
 *
 * <pre>
 * RegressionForecaster forecaster = RegressionForecaster.builder().randomSeed(7).build();
 * forecaster.train(features, labels, TrainingConfig.defaults()).join();
 * double[] next = forecaster.forecast(LagWindowFeatures.latestWindow(series, 12), 3).join();
 * </pre>
 */
public class RegressionForecaster extends NetworkModel<NetworkModelState> {

    public static final int FIRST_HIDDEN_UNITS = 64;

    public static final int SECOND_HIDDEN_UNITS = 32;

    /**
     * Fraction of the first hidden layer's activations dropped during training.
     */
    public static final double DEFAULT_DROPOUT_RATE = 0.2;

    private final double dropoutRate;

    protected RegressionForecaster(Builder builder) {
        super(builder, "regression forecaster", NetworkModelState.class);
        checkArgument(0 <= builder.dropoutRate && builder.dropoutRate < 1, "dropout rate must be in [0,1)");
        this.dropoutRate = builder.dropoutRate;
    }

    /**
     * @return a new RegressionForecaster builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    protected MultiLayerConfiguration configuration(int featureDimension) {
        NeuralNetConfiguration.ListBuilder list = new NeuralNetConfiguration.Builder().seed(randomSeed)
                .weightInit(WeightInit.XAVIER).updater(new Adam(TrainingConfig.DEFAULT_LEARNING_RATE))
                .dataType(DataType.DOUBLE).list();
        list.layer(new DenseLayer.Builder().nIn(featureDimension).nOut(FIRST_HIDDEN_UNITS)
                .activation(Activation.RELU).build());
        if (dropoutRate > 0) {
            // the builder takes the probability of keeping an activation
            list.layer(new DropoutLayer.Builder(1 - dropoutRate).build());
        }
        list.layer(new DenseLayer.Builder().nIn(FIRST_HIDDEN_UNITS).nOut(SECOND_HIDDEN_UNITS)
                .activation(Activation.RELU).build());
        list.layer(new OutputLayer.Builder(LossFunctions.LossFunction.MSE).nIn(SECOND_HIDDEN_UNITS).nOut(1)
                .activation(Activation.IDENTITY).build());
        return list.setInputType(InputType.feedForward(featureDimension)).build();
    }

    @Override
    protected NetworkModelState newState() {
        return new NetworkModelState();
    }

    /**
     * Fits the network to the rows and labels; an uninitialized model takes the
     * width of the rows.
     *
     * @param features lag windows, one per row
     * @param labels   the value following each window
     * @param config   the hyperparameters
     * @return the final-epoch metrics; the future fails with
     *         {@link com.amazon.insights.errors.DimensionMismatchException} when
     *         the widths or the label count do not match
     */
    public CompletableFuture<ModelMetrics> train(FeatureMatrix features, double[] labels, TrainingConfig config) {
        checkNotNull(features, "features must not be null");
        checkNotNull(labels, "labels must not be null");
        return submit(() -> {
            features.checkAligned(labels);
            return fit(features, column(labels), config, false);
        });
    }

    /**
     * @param features rows of the width the model was trained on
     * @return one prediction per row
     */
    public CompletableFuture<double[]> predict(FeatureMatrix features) {
        checkNotNull(features, "features must not be null");
        return submit(() -> firstColumn(outputLocked(features)));
    }

    /**
     * Predicts several steps ahead by feeding each prediction back into the lag
     * window as the most recent observation.
     *
     * @param window  the latest lag window, most recent value first
     * @param horizon the number of steps to predict
     * @return the predictions in time order
     */
    public CompletableFuture<double[]> forecast(double[] window, int horizon) {
        checkNotNull(window, "window must not be null");
        checkArgument(horizon > 0, "horizon must be positive");
        double[] start = window.clone();
        return submit(() -> forecastLocked(start, horizon));
    }

    /**
     * Trains on the rows and labels and forecasts from the window with the
     * resulting network, as one call: no other call on this model runs in
     * between. The window width is checked before training starts.
     *
     * @param features lag windows, one per row
     * @param labels   the value following each window
     * @param window   the latest lag window, most recent value first
     * @param horizon  the number of steps to predict
     * @param config   the hyperparameters
     * @return the final-epoch metrics and the predictions in time order
     */
    public CompletableFuture<ForecastRun> trainAndForecast(FeatureMatrix features, double[] labels, double[] window,
            int horizon, TrainingConfig config) {
        checkNotNull(features, "features must not be null");
        checkNotNull(labels, "labels must not be null");
        checkNotNull(window, "window must not be null");
        checkArgument(horizon > 0, "horizon must be positive");
        double[] start = window.clone();
        return submit(() -> {
            features.checkAligned(labels);
            checkDimension(features.width(), start.length, modelName + " feature width");
            checkFinite(start, "window values must be finite");
            ModelMetrics metrics = fit(features, column(labels), config, false);
            return new ForecastRun(metrics, forecastLocked(start, horizon));
        });
    }

    private double[] forecastLocked(double[] start, int horizon) {
        checkTrained();
        checkDimension(featureDimension, start.length, modelName + " feature width");
        checkFinite(start, "window values must be finite");
        double[] answer = new double[horizon];
        double[] current = start;
        for (int step = 0; step < horizon; step++) {
            answer[step] = outputLocked(new double[][] { current })[0][0];
            current = LagWindowFeatures.advance(current, answer[step]);
        }
        return answer;
    }

    public double getDropoutRate() {
        return dropoutRate;
    }

    static double[] firstColumn(double[][] matrix) {
        double[] answer = new double[matrix.length];
        for (int i = 0; i < matrix.length; i++) {
            answer[i] = matrix[i][0];
        }
        return answer;
    }

    public static class Builder extends NetworkModel.Builder<Builder> {

        private double dropoutRate = DEFAULT_DROPOUT_RATE;

        public Builder dropoutRate(double dropoutRate) {
            this.dropoutRate = dropoutRate;
            return this;
        }

        public RegressionForecaster build() {
            return new RegressionForecaster(this);
        }
    }
}
