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

import lombok.Getter;

import com.amazon.insights.decomposition.Decomposition;
import com.amazon.insights.networks.ModelMetrics;
import com.amazon.insights.returntypes.TrendDirection;

/**
 * The outcome of one forecasting run over a series.
 */
@Getter
public class ForecastResult {

    /**
     * the predicted values after the end of the series, in time order
     */
    private final double[] predictions;

    /**
     * a coarse score in [minConfidence, maxConfidence] that falls as the residual
     * variance of the decomposition grows
     */
    private final double confidence;

    // population variance of the decomposition residual
    private final double residualVariance;

    private final Decomposition decomposition;

    private final ModelMetrics metrics;

    private final TrendDirection trendDirection;

    public ForecastResult(double[] predictions, double confidence, double residualVariance,
            Decomposition decomposition, ModelMetrics metrics, TrendDirection trendDirection) {
        this.predictions = predictions;
        this.confidence = confidence;
        this.residualVariance = residualVariance;
        this.decomposition = decomposition;
        this.metrics = metrics;
        this.trendDirection = trendDirection;
    }

    public double[] getPredictions() {
        return predictions.clone();
    }
}
