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

import lombok.Getter;

/**
 * One spending entry of a budget period.
 */
@Getter
public class Expense {

    private final String category;

    private final double amount;

    public Expense(String category, double amount) {
        checkNotNull(category, "category must not be null");
        checkArgument(amount >= 0 && Double.isFinite(amount), "amount must be non-negative");
        this.category = category;
        this.amount = amount;
    }
}
