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

import static com.amazon.insights.CommonUtils.checkArgument;
import static com.amazon.insights.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a budget across spending categories in proportion to what each
 * category actually cost, and points out the categories that take too large a
 * part of the budget.
 */
public class BudgetRecommender {

    /**
     * A category spending more than this fraction of the whole budget is a
     * savings opportunity.
     */
    public static final double DEFAULT_HIGH_SPENDING_SHARE = 0.3;

    public static final double DEFAULT_EXCELLENT_EFFICIENCY = 0.9;

    private final double highSpendingShare;

    private final double excellentEfficiency;

    public BudgetRecommender() {
        this(DEFAULT_HIGH_SPENDING_SHARE, DEFAULT_EXCELLENT_EFFICIENCY);
    }

    public BudgetRecommender(double highSpendingShare, double excellentEfficiency) {
        checkArgument(0 < highSpendingShare && highSpendingShare <= 1, "high spending share must be in (0,1]");
        checkArgument(0 <= excellentEfficiency && excellentEfficiency <= 1, "excellent efficiency must be in [0,1]");
        this.highSpendingShare = highSpendingShare;
        this.excellentEfficiency = excellentEfficiency;
    }

    /**
     * @param expenses    the spending of the period, in any order
     * @param totalBudget the budget of the period, at least 0
     * @return the recommendation; a budget of 0 gives an efficiency of 0 and
     *         spending of 0 gives every category a budget of 0
     */
    public BudgetRecommendation recommend(List<Expense> expenses, double totalBudget) {
        checkNotNull(expenses, "expenses must not be null");
        checkArgument(totalBudget >= 0 && Double.isFinite(totalBudget), "total budget must be non-negative");

        Map<String, Double> totals = new LinkedHashMap<>();
        double totalExpenses = 0;
        for (Expense expense : expenses) {
            checkNotNull(expense, "expense must not be null");
            totals.merge(expense.getCategory(), expense.getAmount(), Double::sum);
            totalExpenses += expense.getAmount();
        }

        double efficiency = (totalBudget > 0) ? round(Math.min(1, totalExpenses / totalBudget)) : 0;
        Map<String, Long> budgets = new LinkedHashMap<>();
        List<String> highSpending = new ArrayList<>();
        for (Map.Entry<String, Double> entry : totals.entrySet()) {
            double amount = entry.getValue();
            long budget = (totalExpenses > 0) ? Math.round(amount / totalExpenses * totalBudget) : 0;
            budgets.put(entry.getKey(), budget);
            if (amount > highSpendingShare * totalBudget) {
                highSpending.add(entry.getKey());
            }
        }
        return new BudgetRecommendation(Collections.unmodifiableMap(budgets),
                Collections.unmodifiableList(highSpending), efficiency, efficiency > excellentEfficiency);
    }

    static double round(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
