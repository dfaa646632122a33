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
 * A fixed weighted sum of the engagement features on a 0 to 100 scale. It is
 * the hand-tuned counterpart of the engagement classifier and also provides
 * labels for it when no observed outcome exists.
 */
public class EngagementScorer {

    public static final double DEFAULT_PAYMENT_WEIGHT = 40;

    public static final double DEFAULT_NOTICE_WEIGHT = 30;

    public static final double DEFAULT_PROFILE_WEIGHT = 20;

    public static final double DEFAULT_ACTIVITY_WEIGHT = 10;

    private final double[] weights;

    public EngagementScorer() {
        this(DEFAULT_PAYMENT_WEIGHT, DEFAULT_NOTICE_WEIGHT, DEFAULT_PROFILE_WEIGHT, DEFAULT_ACTIVITY_WEIGHT);
    }

    public EngagementScorer(double paymentWeight, double noticeWeight, double profileWeight, double activityWeight) {
        weights = new double[] { paymentWeight, noticeWeight, profileWeight, activityWeight };
        double total = 0;
        for (double weight : weights) {
            checkArgument(weight >= 0, "weights must be non-negative");
            total += weight;
        }
        checkArgument(Math.abs(total - 100) < 1e-9, "weights must add up to 100");
    }

    /**
     * @param features the member's features
     * @return the score in [0,100], rounded to two decimals
     */
    public double score(EngagementFeatures features) {
        checkNotNull(features, "features must not be null");
        double[] values = features.toArray();
        double sum = 0;
        for (int i = 0; i < values.length; i++) {
            sum += weights[i] * values[i];
        }
        return Math.round(sum * 100) / 100.0;
    }

    public EngagementLevel level(EngagementFeatures features) {
        return EngagementLevel.of(score(features));
    }
}
