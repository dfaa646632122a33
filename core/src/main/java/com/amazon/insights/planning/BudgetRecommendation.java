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

import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class BudgetRecommendation {

    // suggested amount per category, in first-seen order
    private final Map<String, Long> categoryBudgets;

    // categories whose spending alone exceeds the high spending share
    private final List<String> highSpendingCategories;

    // share of the budget spent, capped at 1 and rounded to 2 decimals
    private final double efficiencyScore;

    private final boolean excellentAdherence;
}
