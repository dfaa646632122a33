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
import static com.amazon.insights.CommonUtils.checkFinite;
import static com.amazon.insights.CommonUtils.checkNotNull;
import static java.lang.Math.max;
import static java.lang.Math.min;

import com.amazon.insights.config.TrendEdgeMethod;
import com.amazon.insights.errors.InsufficientDataException;

/**
 * Classical additive decomposition: a centered moving average gives the trend,
 * the phase-wise mean of the detrended series gives the seasonal pattern, and
 * what is left is the residual.
 *
 * The moving average for index i covers {@code [i - period/2, i + period/2]}.
 * Near the ends of the series the window shrinks according to the
 * {@link TrendEdgeMethod}, so every index has a trend value.
 *
 * Instances hold no state besides the edge policy and can be shared.
 */
public class TimeSeriesDecomposer {

    public static final int DEFAULT_PERIOD = 12;

    public static final TrendEdgeMethod DEFAULT_TREND_EDGE_METHOD = TrendEdgeMethod.SYMMETRIC;

    private final TrendEdgeMethod trendEdgeMethod;

    public TimeSeriesDecomposer() {
        this(DEFAULT_TREND_EDGE_METHOD);
    }

    public TimeSeriesDecomposer(TrendEdgeMethod trendEdgeMethod) {
        this.trendEdgeMethod = checkNotNull(trendEdgeMethod, "trend edge method must not be null");
    }

    public Decomposition decompose(double[] series) {
        return decompose(series, DEFAULT_PERIOD);
    }

    /**
     * @param series the observations, one per period step, oldest first
     * @param period the length of the seasonal cycle
     * @return the decomposition
     * @throws InsufficientDataException if the series holds fewer than two full
     *                                   periods
     */
    public Decomposition decompose(double[] series, int period) {
        checkNotNull(series, "series must not be null");
        checkArgument(period > 0, "period must be positive");
        if (series.length < 2 * period) {
            throw new InsufficientDataException("decomposition needs two full periods", 2 * period, series.length);
        }
        checkFinite(series, "series values must be finite");

        double[] trend = movingAverage(series, period);
        double[] detrended = new double[series.length];
        for (int i = 0; i < series.length; i++) {
            detrended[i] = series[i] - trend[i];
        }
        double[] pattern = seasonalPattern(detrended, period);
        double[] residual = new double[series.length];
        for (int i = 0; i < series.length; i++) {
            residual[i] = detrended[i] - pattern[i % period];
        }
        return new Decomposition(trend, pattern, residual);
    }

    double[] movingAverage(double[] series, int period) {
        int n = series.length;
        int half = period / 2;
        double[] answer = new double[n];
        for (int i = 0; i < n; i++) {
            int start;
            int end;
            if (trendEdgeMethod == TrendEdgeMethod.SYMMETRIC) {
                int radius = min(half, min(i, n - 1 - i));
                start = i - radius;
                end = i + radius;
            } else {
                start = max(0, i - half);
                end = min(n - 1, i + half);
            }
            double sum = 0;
            for (int j = start; j <= end; j++) {
                sum += series[j];
            }
            answer[i] = sum / (end - start + 1);
        }
        return answer;
    }

    static double[] seasonalPattern(double[] detrended, int period) {
        double[] sums = new double[period];
        int[] counts = new int[period];
        for (int i = 0; i < detrended.length; i++) {
            sums[i % period] += detrended[i];
            ++counts[i % period];
        }
        for (int p = 0; p < period; p++) {
            sums[p] /= counts[p];
        }
        return sums;
    }

    public TrendEdgeMethod getTrendEdgeMethod() {
        return trendEdgeMethod;
    }
}
