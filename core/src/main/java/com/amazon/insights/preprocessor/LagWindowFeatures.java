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

package com.amazon.insights.preprocessor;

import static com.amazon.insights.CommonUtils.checkArgument;
import static com.amazon.insights.CommonUtils.checkFinite;
import static com.amazon.insights.CommonUtils.checkNotNull;

import java.util.Arrays;

import com.amazon.insights.errors.InsufficientDataException;
import com.amazon.insights.returntypes.FeatureMatrix;

/**
 * Sliding lag windows over a series. The row built for index {@code i} holds
 * the observations {@code i-1, i-2, ..., i-window} in that order (the most
 * recent lag first) and its label is the observation at {@code i}. Only
 * indices with a full history produce rows, so a series of length n yields
 * {@code n - window} rows.
 */
public class LagWindowFeatures {

    public static final int DEFAULT_WINDOW = 12;

    private LagWindowFeatures() {
    }

    /**
     * @param series the observations, oldest first
     * @param window the number of lags in each row
     * @return one row per index with a full history
     * @throws InsufficientDataException if no index has a full history
     */
    public static FeatureMatrix features(double[] series, int window) {
        check(series, window);
        double[][] rows = new double[series.length - window][window];
        for (int i = window; i < series.length; i++) {
            for (int lag = 1; lag <= window; lag++) {
                rows[i - window][lag - 1] = series[i - lag];
            }
        }
        return FeatureMatrix.of(rows);
    }

    /**
     * @param series the observations, oldest first
     * @param window the number of lags in each row
     * @return the observations following each lag window, aligned with
     *         {@link #features(double[], int)}
     */
    public static double[] labels(double[] series, int window) {
        check(series, window);
        return Arrays.copyOfRange(series, window, series.length);
    }

    /**
     * the lag window ending at the last observation, which is the input needed to
     * predict the value after the end of the series
     *
     * @param series the observations, oldest first
     * @param window the number of lags
     * @return the last {@code window} observations, most recent first
     */
    public static double[] latestWindow(double[] series, int window) {
        checkNotNull(series, "series must not be null");
        checkArgument(window > 0, "window must be positive");
        if (series.length < window) {
            throw new InsufficientDataException("lag window needs a full history", window, series.length);
        }
        double[] answer = new double[window];
        for (int lag = 1; lag <= window; lag++) {
            answer[lag - 1] = series[series.length - lag];
        }
        return answer;
    }

    /**
     * moves a lag window one step forward
     *
     * @param window the current window, most recent first
     * @param next   the observation that follows the window
     * @return a new window starting with {@code next}, the oldest lag dropped
     */
    public static double[] advance(double[] window, double next) {
        checkNotNull(window, "window must not be null");
        double[] answer = new double[window.length];
        answer[0] = next;
        System.arraycopy(window, 0, answer, 1, window.length - 1);
        return answer;
    }

    private static void check(double[] series, int window) {
        checkNotNull(series, "series must not be null");
        checkArgument(window > 0, "window must be positive");
        if (series.length < window + 1) {
            throw new InsufficientDataException("lag features need at least one full window plus a label",
                    window + 1, series.length);
        }
        checkFinite(series, "series values must be finite");
    }
}
