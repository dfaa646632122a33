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

package com.amazon.insights.engagement;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Summary of a member's payment history as produced by
 * {@link PaymentRiskAnalyzer}. All values are rounded to two decimals.
 */
@Getter
@AllArgsConstructor
public class PaymentBehavior {

    // fraction of bills paid
    private final double reliability;

    // mean delay of paid bills past their due date, in days
    private final double averagePaymentDelay;

    // paid bills per month of history
    private final double paymentFrequency;

    // in [0,1], higher is riskier
    private final double riskScore;
}
