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

package com.amazon.insights.config;

/**
 * How the centered moving average behind a trend estimate treats the first and
 * last half-window of a series, where a full window does not fit.
 */
public enum TrendEdgeMethod {

    /**
     * shrink the window equally on both sides so it stays centered on the point;
     * the first and last points are their own trend, and a linear series is
     * reproduced exactly
     */
    SYMMETRIC,
    /**
     * clip the window at the array bounds and keep the other side at full
     * length; the edge estimates lean towards the interior of the series
     */
    TRUNCATED;
}
