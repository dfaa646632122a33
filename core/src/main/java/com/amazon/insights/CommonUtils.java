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

package com.amazon.insights;

import java.util.Objects;

import com.amazon.insights.errors.DimensionMismatchException;
import com.amazon.insights.statistics.Deviation;

/** A collection of common utility functions. */
public class CommonUtils {

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is
     *                  false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * Throws a {@link DimensionMismatchException} if two widths disagree.
     *
     * @param expected the width fixed earlier, for example at model
     *                 initialization
     * @param actual   the width of the data being supplied now
     * @param what     a short description used in the message
     */
    public static void checkDimension(int expected, int actual, String what) {
        if (expected != actual) {
            throw new DimensionMismatchException(what, expected, actual);
        }
    }

    /**
     * Throws an {@link IllegalArgumentException} if any value is NaN or infinite.
     *
     * @param values  the values to test
     * @param message the error message
     */
    public static void checkFinite(double[] values, String message) {
        checkNotNull(values, message);
        for (double value : values) {
            checkArgument(Double.isFinite(value), message);
        }
    }

    /**
     * population variance of the values, i.e., the mean of squared distances
     * from the mean
     *
     * @param values the values
     * @return the variance, 0 for an empty array
     */
    public static double variance(double[] values) {
        checkNotNull(values, "values must not be null");
        if (values.length == 0) {
            return 0;
        }
        Deviation deviation = new Deviation();
        for (double value : values) {
            deviation.update(value);
        }
        return deviation.getVariance();
    }

    public static double mean(double[] values) {
        checkNotNull(values, "values must not be null");
        checkArgument(values.length > 0, "mean of an empty array");
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    public static double clamp(double value, double lower, double upper) {
        checkArgument(lower <= upper, "incorrect bounds");
        return Math.max(lower, Math.min(upper, value));
    }

    public static double[][] deepCopy(double[][] matrix) {
        checkNotNull(matrix, "matrix must not be null");
        double[][] copy = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            copy[i] = matrix[i].clone();
        }
        return copy;
    }
}
