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

package com.amazon.insights.planning;

import java.time.Month;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Getter;

import com.amazon.insights.returntypes.TrendDirection;

@Getter
@AllArgsConstructor
public class MaintenancePatterns {

    private final long averageCost;

    // jobs per year, rounded to 2 decimals
    private final double frequency;

    // rounded total cost per calendar month, over all years
    private final Map<Month, Long> monthlyTotals;

    private final TrendDirection costTrend;
}
