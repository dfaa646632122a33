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

import lombok.Getter;

/**
 * The four normalized signals describing how engaged a member is. Each lies in
 * [0,1]; {@link #toArray()} gives the input row of the engagement classifier.
 */
@Getter
public class EngagementFeatures {

    public static final int DIMENSIONS = 4;

    // used when there is nothing to measure, e.g. no bills issued yet
    public static final double NEUTRAL_RATIO = 0.5;

    public static final double RECENCY_HORIZON_DAYS = 30;

    private final double paymentReliability;

    private final double noticeReadRatio;

    private final double profileCompleteness;

    private final double activityRecency;

    public EngagementFeatures(double paymentReliability, double noticeReadRatio, double profileCompleteness,
            double activityRecency) {
        checkUnit(paymentReliability, "payment reliability");
        checkUnit(noticeReadRatio, "notice read ratio");
        checkUnit(profileCompleteness, "profile completeness");
        checkUnit(activityRecency, "activity recency");
        this.paymentReliability = paymentReliability;
        this.noticeReadRatio = noticeReadRatio;
        this.profileCompleteness = profileCompleteness;
        this.activityRecency = activityRecency;
    }

    /**
     * derives the features from raw counts
     *
     * @param paidBills         bills paid by the member
     * @param totalBills        bills issued to the member
     * @param readNotices       notices the member has read
     * @param totalNotices      notices addressed to the member
     * @param completedFields   profile fields filled in
     * @param totalFields       profile fields that exist
     * @param daysSinceLastLogin days since the member last logged in
     * @return the features
     */
    public static EngagementFeatures fromCounts(int paidBills, int totalBills, int readNotices, int totalNotices,
            int completedFields, int totalFields, double daysSinceLastLogin) {
        checkArgument(0 <= paidBills && paidBills <= totalBills, "incorrect bill counts");
        checkArgument(0 <= readNotices && readNotices <= totalNotices, "incorrect notice counts");
        checkArgument(0 <= completedFields && completedFields <= totalFields && totalFields > 0,
                "incorrect profile field counts");
        checkArgument(daysSinceLastLogin >= 0, "days since last login must be non-negative");
        double reliability = (totalBills > 0) ? paidBills / (double) totalBills : NEUTRAL_RATIO;
        double reads = (totalNotices > 0) ? readNotices / (double) totalNotices : NEUTRAL_RATIO;
        double completeness = completedFields / (double) totalFields;
        double recency = Math.max(0, 1 - daysSinceLastLogin / RECENCY_HORIZON_DAYS);
        return new EngagementFeatures(reliability, reads, completeness, recency);
    }

    public double[] toArray() {
        return new double[] { paymentReliability, noticeReadRatio, profileCompleteness, activityRecency };
    }

    private static void checkUnit(double value, String name) {
        checkArgument(0 <= value && value <= 1, name + " must be in [0,1]");
    }
}
