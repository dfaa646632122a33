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

package com.amazon.insights.statistics;

import static com.amazon.insights.CommonUtils.checkArgument;
import static com.amazon.insights.CommonUtils.checkNotNull;

import java.util.Arrays;

import com.amazon.insights.errors.InsufficientDataException;

/**
 * The interquartile outlier fence. Values above {@code Q3 + k * (Q3 - Q1)} are
 * outliers; the classic choice is {@code k = 1.5}.
 *
 * The quartiles are read directly from the sorted values at positions
 * {@code floor(0.25 * n)} and {@code floor(0.75 * n)}, without interpolation.
 */
public class OutlierFence {

    public static final double DEFAULT_MULTIPLIER = 1.5;

    private OutlierFence() {
    }

    /**
     * @param values a non-empty array of values
     * @return the pair {Q1, Q3}
     */
    public static double[] quartiles(double[] values) {
        checkNotNull(values, "values must not be null");
        if (values.length == 0) {
            throw new InsufficientDataException("quartiles of an empty sample", 1, 0);
        }
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        int n = sorted.length;
        return new double[] { sorted[(int) Math.floor(n * 0.25)], sorted[(int) Math.floor(n * 0.75)] };
    }

    public static double threshold(double[] values) {
        return threshold(values, DEFAULT_MULTIPLIER);
    }

    /**
     * @param values     the sample defining the fence
     * @param multiplier the multiple of the interquartile range above Q3
     * @return the fence; since Q3 &ge; Q1 the fence never decreases as the
     *         multiplier grows
     */
    public static double threshold(double[] values, double multiplier) {
        checkArgument(multiplier >= 0 && Double.isFinite(multiplier), "multiplier must be a non-negative number");
        double[] quartiles = quartiles(values);
        return quartiles[1] + multiplier * (quartiles[1] - quartiles[0]);
    }

    /**
     * @param values    the values to test
     * @param threshold the fence
     * @return flags, true where the value strictly exceeds the fence
     */
    public static boolean[] exceeds(double[] values, double threshold) {
        checkNotNull(values, "values must not be null");
        boolean[] flags = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            flags[i] = values[i] > threshold;
        }
        return flags;
    }
}
