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

import java.util.concurrent.CompletableFuture;

import org.deeplearning4j.nn.conf.MultiLayerConfiguration;
import org.deeplearning4j.nn.conf.NeuralNetConfiguration;
import org.deeplearning4j.nn.conf.inputs.InputType;
import org.deeplearning4j.nn.conf.layers.DenseLayer;
import org.deeplearning4j.nn.conf.layers.OutputLayer;
import org.deeplearning4j.nn.weights.WeightInit;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.learning.config.Adam;
import org.nd4j.linalg.lossfunctions.LossFunctions;

import com.amazon.insights.engagement.EngagementFeatures;
import com.amazon.insights.networks.state.NetworkModelState;
import com.amazon.insights.returntypes.FeatureMatrix;

/**
 * Estimates the likelihood that a member engages, from the four features of
 * {@link EngagementFeatures}. Two ReLU layers of 16 and 8 units feed a sigmoid
 * output trained on binary cross-entropy.
 */
public class EngagementClassifier extends NetworkModel<NetworkModelState> {

    public static final int INPUT_WIDTH = EngagementFeatures.DIMENSIONS;

    public static final int FIRST_HIDDEN_UNITS = 16;

    public static final int SECOND_HIDDEN_UNITS = 8;

    protected EngagementClassifier(Builder builder) {
        super(builder, "engagement classifier", NetworkModelState.class);
    }

    /**
     * @return a new EngagementClassifier builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    public CompletableFuture<Void> initialize() {
        return initialize(INPUT_WIDTH);
    }

    @Override
    protected void checkSupportedDimension(int featureDimension) {
        checkDimension(INPUT_WIDTH, featureDimension, modelName + " feature width");
    }

    @Override
    protected MultiLayerConfiguration configuration(int featureDimension) {
        return new NeuralNetConfiguration.Builder().seed(randomSeed).weightInit(WeightInit.XAVIER)
                .updater(new Adam(TrainingConfig.DEFAULT_LEARNING_RATE)).dataType(DataType.DOUBLE).list()
                .layer(new DenseLayer.Builder().nIn(featureDimension).nOut(FIRST_HIDDEN_UNITS)
                        .activation(Activation.RELU).build())
                .layer(new DenseLayer.Builder().nIn(FIRST_HIDDEN_UNITS).nOut(SECOND_HIDDEN_UNITS)
                        .activation(Activation.RELU).build())
                .layer(new OutputLayer.Builder(LossFunctions.LossFunction.XENT).nIn(SECOND_HIDDEN_UNITS).nOut(1)
                        .activation(Activation.SIGMOID).build())
                .setInputType(InputType.feedForward(featureDimension)).build();
    }

    @Override
    protected NetworkModelState newState() {
        return new NetworkModelState();
    }

    /**
     * @param features engagement feature rows, four columns each
     * @param labels   1 for members who engaged, 0 otherwise
     * @param config   the hyperparameters
     * @return metrics including training accuracy, and validation accuracy when
     *         rows were held out
     */
    public CompletableFuture<ModelMetrics> train(FeatureMatrix features, double[] labels, TrainingConfig config) {
        checkNotNull(features, "features must not be null");
        checkNotNull(labels, "labels must not be null");
        return submit(() -> {
            features.checkAligned(labels);
            for (double label : labels) {
                checkArgument(label == 0 || label == 1, "labels must be 0 or 1");
            }
            return fit(features, column(labels), config, true);
        });
    }

    /**
     * @param features engagement feature rows
     * @return the probability of engagement for each row
     */
    public CompletableFuture<double[]> predict(FeatureMatrix features) {
        checkNotNull(features, "features must not be null");
        return submit(() -> RegressionForecaster.firstColumn(outputLocked(features)));
    }

    public CompletableFuture<double[]> predict(EngagementFeatures... members) {
        checkNotNull(members, "members must not be null");
        checkArgument(members.length > 0, "at least one member is required");
        double[][] rows = new double[members.length][];
        for (int i = 0; i < members.length; i++) {
            rows[i] = checkNotNull(members[i], "members must not be null").toArray();
        }
        return predict(FeatureMatrix.of(rows));
    }

    public static class Builder extends NetworkModel.Builder<Builder> {

        public EngagementClassifier build() {
            return new EngagementClassifier(this);
        }
    }
}
