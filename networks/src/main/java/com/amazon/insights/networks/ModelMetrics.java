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

import java.util.Optional;

/**
 * Final-epoch figures of a training run. The validation values are absent when
 * the split left no row to validate on; accuracies are only reported by
 * classifiers.
 */
public class ModelMetrics {

    private final double loss;

    private final Double validationLoss;

    private final Double accuracy;

    private final Double validationAccuracy;

    public ModelMetrics(double loss, Double validationLoss, Double accuracy, Double validationAccuracy) {
        checkArgument(loss >= 0, "loss must be non-negative");
        checkArgument(validationLoss == null || validationLoss >= 0, "validation loss must be non-negative");
        checkArgument(accuracy == null || (0 <= accuracy && accuracy <= 1), "accuracy must be in [0,1]");
        checkArgument(validationAccuracy == null || (0 <= validationAccuracy && validationAccuracy <= 1),
                "validation accuracy must be in [0,1]");
        this.loss = loss;
        this.validationLoss = validationLoss;
        this.accuracy = accuracy;
        this.validationAccuracy = validationAccuracy;
    }

    public double getLoss() {
        return loss;
    }

    public Optional<Double> getValidationLoss() {
        return Optional.ofNullable(validationLoss);
    }

    public Optional<Double> getAccuracy() {
        return Optional.ofNullable(accuracy);
    }

    public Optional<Double> getValidationAccuracy() {
        return Optional.ofNullable(validationAccuracy);
    }

    @Override
    public String toString() {
        return "ModelMetrics{loss=" + loss + ", validationLoss=" + validationLoss + ", accuracy=" + accuracy
                + ", validationAccuracy=" + validationAccuracy + "}";
    }
}
