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
import static com.amazon.insights.CommonUtils.checkState;

/**
 * Maps values linearly onto [0,1] using the minimum and maximum seen by
 * {@link #fit(double[])}. A constant sample maps every value to 0, and the
 * inverse of a constant fit returns the constant.
 *
 * The autoencoder expects records in [0,1]; callers scale each column with
 * one of these before training and scoring.
 */
public class MinMaxScaler {

    private double min;

    private double max;

    private boolean fitted = false;

    public static MinMaxScaler fitted(double[] values) {
        MinMaxScaler scaler = new MinMaxScaler();
        scaler.fit(values);
        return scaler;
    }

    public void fit(double[] values) {
        checkNotNull(values, "values must not be null");
        checkArgument(values.length > 0, "cannot fit an empty sample");
        checkFinite(values, "values must be finite");
        double low = values[0];
        double high = values[0];
        for (double value : values) {
            low = Math.min(low, value);
            high = Math.max(high, value);
        }
        min = low;
        max = high;
        fitted = true;
    }

    public double transform(double value) {
        checkState(fitted, "scaler has not been fit");
        double range = max - min;
        return (range == 0) ? 0 : (value - min) / range;
    }

    public double[] transform(double[] values) {
        checkNotNull(values, "values must not be null");
        double[] answer = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            answer[i] = transform(values[i]);
        }
        return answer;
    }

    public double inverseTransform(double value) {
        checkState(fitted, "scaler has not been fit");
        return value * (max - min) + min;
    }

    public double[] inverseTransform(double[] values) {
        checkNotNull(values, "values must not be null");
        double[] answer = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            answer[i] = inverseTransform(values[i]);
        }
        return answer;
    }

    /**
     * scales each column of a matrix independently into [0,1]
     *
     * @param records rectangular data, one record per row
     * @return a new matrix with every column scaled by its own min and max
     */
    public static double[][] scaleColumns(double[][] records) {
        checkNotNull(records, "records must not be null");
        checkArgument(records.length > 0, "at least one record is required");
        int width = records[0].length;
        double[][] answer = new double[records.length][width];
        double[] column = new double[records.length];
        for (int j = 0; j < width; j++) {
            for (int i = 0; i < records.length; i++) {
                checkArgument(records[i].length == width, "ragged records");
                column[i] = records[i][j];
            }
            MinMaxScaler scaler = fitted(column);
            for (int i = 0; i < records.length; i++) {
                answer[i][j] = scaler.transform(column[i]);
            }
        }
        return answer;
    }

    public boolean isFitted() {
        return fitted;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }
}
