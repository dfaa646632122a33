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

import java.time.LocalDate;

import lombok.Getter;

@Getter
public class MaintenanceRecord {

    private final LocalDate date;

    private final double amount;

    // free text such as "plumbing" or "elevator"
    private final String type;

    public MaintenanceRecord(LocalDate date, double amount, String type) {
        checkNotNull(date, "date must not be null");
        checkNotNull(type, "type must not be null");
        checkArgument(amount >= 0 && Double.isFinite(amount), "amount must be non-negative");
        this.date = date;
        this.amount = amount;
        this.type = type;
    }
}
