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

package com.amazon.insights.returntypes;

import static com.amazon.insights.CommonUtils.checkArgument;
import static com.amazon.insights.CommonUtils.checkNotNull;

/**
 * Coarse direction of the recent movement of a series.
 */
public enum TrendDirection {

    INCREASING, DECREASING, STABLE;

    public static final int DEFAULT_RECENT_WINDOW = 3;

    public static final double DEFAULT_TOLERANCE = 0.1;

    /**
     * compares the mean of the last window of observations to the mean of the
     * window before it; a change of more than the tolerance (as a fraction of the
     * older mean) in either direction is a trend
     *
     * @param series    the observations, oldest first
     * @param window    the number of observations in each of the two windows
     * @param tolerance the relative band considered stable
     * @return the direction, STABLE when fewer than two full windows exist
     */
    public static TrendDirection of(double[] series, int window, double tolerance) {
        checkNotNull(series, "series must not be null");
        checkArgument(window > 0, "window must be positive");
        checkArgument(tolerance >= 0, "tolerance must be non-negative");
        if (series.length < 2 * window) {
            return STABLE;
        }
        double recent = 0;
        double older = 0;
        for (int i = 0; i < window; i++) {
            recent += series[series.length - 1 - i];
            older += series[series.length - 1 - window - i];
        }
        return compare(recent / window, older / window, tolerance);
    }

    /**
     * @param recent    the recent level
     * @param older     the level it is compared against
     * @param tolerance the relative band around the older level considered
     *                  stable
     * @return the direction of the move from older to recent
     */
    public static TrendDirection compare(double recent, double older, double tolerance) {
        checkArgument(tolerance >= 0, "tolerance must be non-negative");
        if (recent > older * (1 + tolerance)) {
            return INCREASING;
        } else if (recent < older * (1 - tolerance)) {
            return DECREASING;
        }
        return STABLE;
    }

    public static TrendDirection of(double[] series) {
        return of(series, DEFAULT_RECENT_WINDOW, DEFAULT_TOLERANCE);
    }
}
