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

package com.amazon.insights.decomposition;

import static com.amazon.insights.CommonUtils.checkArgument;
import static com.amazon.insights.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * The additive split of a series into trend, a repeating seasonal pattern and
 * the residual. For every index i,
 * {@code trend[i] + seasonalPattern[i % period] + residual[i]} equals the
 * original observation up to round-off.
 */
public class Decomposition {

    private final double[] trend;

    private final double[] seasonalPattern;

    private final double[] residual;

    public Decomposition(double[] trend, double[] seasonalPattern, double[] residual) {
        checkNotNull(trend, "trend must not be null");
        checkNotNull(seasonalPattern, "seasonal pattern must not be null");
        checkNotNull(residual, "residual must not be null");
        checkArgument(trend.length == residual.length, "trend and residual must have equal length");
        checkArgument(seasonalPattern.length > 0 && seasonalPattern.length <= trend.length,
                "incorrect seasonal pattern length");
        this.trend = Arrays.copyOf(trend, trend.length);
        this.seasonalPattern = Arrays.copyOf(seasonalPattern, seasonalPattern.length);
        this.residual = Arrays.copyOf(residual, residual.length);
    }

    public int getPeriod() {
        return seasonalPattern.length;
    }

    public int getLength() {
        return trend.length;
    }

    public double[] getTrend() {
        return Arrays.copyOf(trend, trend.length);
    }

    /**
     * @return the seasonal component expanded to the length of the series
     */
    public double[] getSeasonal() {
        double[] seasonal = new double[trend.length];
        for (int i = 0; i < seasonal.length; i++) {
            seasonal[i] = seasonalPattern[i % seasonalPattern.length];
        }
        return seasonal;
    }

    /**
     * @return one value per phase of the period
     */
    public double[] getSeasonalPattern() {
        return Arrays.copyOf(seasonalPattern, seasonalPattern.length);
    }

    public double[] getResidual() {
        return Arrays.copyOf(residual, residual.length);
    }

    /**
     * @return trend plus seasonal plus residual at each index
     */
    public double[] reconstruct() {
        double[] answer = new double[trend.length];
        for (int i = 0; i < answer.length; i++) {
            answer[i] = trend[i] + seasonalPattern[i % seasonalPattern.length] + residual[i];
        }
        return answer;
    }
}
