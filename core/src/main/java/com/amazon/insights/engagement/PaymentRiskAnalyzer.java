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

import static com.amazon.insights.CommonUtils.checkArgument;
import static com.amazon.insights.CommonUtils.checkNotNull;

/**
 * Scores the risk that a member pays late or not at all. Reliability weighs 70%
 * and the mean delay, capped at one month, weighs 30%.
 */
public class PaymentRiskAnalyzer {

    public static final double DEFAULT_RELIABILITY_WEIGHT = 0.7;

    public static final double DEFAULT_DELAY_WEIGHT = 0.3;

    public static final double DELAY_HORIZON_DAYS = 30;

    public static final double DEFAULT_RISK_CUTOFF = 0.3;

    /**
     * @param totalBills   number of bills issued
     * @param paymentDelays one entry per paid bill, the days between due date and
     *                     payment; early payments count as 0
     * @return the behavior summary; no bills at all is the riskiest case
     */
    public PaymentBehavior analyze(int totalBills, double[] paymentDelays) {
        checkNotNull(paymentDelays, "payment delays must not be null");
        checkArgument(totalBills >= 0, "bill count must be non-negative");
        checkArgument(paymentDelays.length <= totalBills, "more payments than bills");
        if (totalBills == 0) {
            return new PaymentBehavior(0, 0, 0, 1);
        }
        int paid = paymentDelays.length;
        double reliability = paid / (double) totalBills;
        double delay = 0;
        for (double value : paymentDelays) {
            delay += Math.max(0, value);
        }
        delay = (paid > 0) ? delay / paid : 0;
        double monthsActive = Math.max(1, totalBills / 12.0);
        double frequency = paid / monthsActive;
        double risk = (1 - reliability) * DEFAULT_RELIABILITY_WEIGHT
                + Math.min(1, delay / DELAY_HORIZON_DAYS) * DEFAULT_DELAY_WEIGHT;
        return new PaymentBehavior(round(reliability), round(delay), round(frequency), round(risk));
    }

    public boolean isAtRisk(PaymentBehavior behavior) {
        return checkNotNull(behavior, "behavior must not be null").getRiskScore() > DEFAULT_RISK_CUTOFF;
    }

    static double round(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
