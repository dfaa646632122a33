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

package com.amazon.insights.anomalydetection;

import static com.amazon.insights.CommonUtils.checkArgument;
import static com.amazon.insights.CommonUtils.checkFinite;
import static com.amazon.insights.CommonUtils.checkNotNull;

import com.amazon.insights.errors.InsufficientDataException;
import com.amazon.insights.errors.ModelNotTrainedException;
import com.amazon.insights.statistics.Deviation;

/**
 * A univariate baseline: a value is anomalous when it lies more than a given
 * number of standard deviations from the mean of the fitted sample. It needs
 * no training beyond one pass over the data and is a useful sanity check next
 * to the autoencoder.
 */
public class ZScoreAnomalyDetector {

    public static final double DEFAULT_Z_THRESHOLD = 2.5;

    private Deviation deviation;

    public void fit(double[] values) {
        checkNotNull(values, "values must not be null");
        if (values.length == 0) {
            throw new InsufficientDataException("z-score needs a sample", 1, 0);
        }
        checkFinite(values, "values must be finite");
        Deviation fresh = new Deviation();
        for (double value : values) {
            fresh.update(value);
        }
        deviation = fresh;
    }

    /**
     * @param value the value to score
     * @return the absolute z-score; when the fitted sample is constant the mean
     *         scores 0 and any other value scores positive infinity
     */
    public double score(double value) {
        if (deviation == null) {
            throw new ModelNotTrainedException("z-score detector");
        }
        double distance = Math.abs(value - deviation.getMean());
        double std = deviation.getDeviation();
        if (std == 0) {
            return (distance == 0) ? 0 : Double.POSITIVE_INFINITY;
        }
        return distance / std;
    }

    public double[] scores(double[] values) {
        checkNotNull(values, "values must not be null");
        double[] answer = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            answer[i] = score(values[i]);
        }
        return answer;
    }

    public boolean[] detect(double[] values) {
        return detect(values, DEFAULT_Z_THRESHOLD);
    }

    public boolean[] detect(double[] values, double zThreshold) {
        checkArgument(zThreshold > 0, "threshold must be positive");
        double[] scores = scores(values);
        boolean[] answer = new boolean[scores.length];
        for (int i = 0; i < scores.length; i++) {
            answer[i] = scores[i] > zThreshold;
        }
        return answer;
    }

    public double getMean() {
        if (deviation == null) {
            throw new ModelNotTrainedException("z-score detector");
        }
        return deviation.getMean();
    }

    public double getStandardDeviation() {
        if (deviation == null) {
            throw new ModelNotTrainedException("z-score detector");
        }
        return deviation.getDeviation();
    }
}
