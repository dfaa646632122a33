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

public enum EngagementLevel {

    HIGH, MEDIUM, LOW;

    public static final double HIGH_SCORE = 80;

    public static final double MEDIUM_SCORE = 60;

    /**
     * @param score an engagement score in [0,100]
     * @return HIGH from 80, MEDIUM from 60, LOW below
     */
    public static EngagementLevel of(double score) {
        if (score >= HIGH_SCORE) {
            return HIGH;
        } else if (score >= MEDIUM_SCORE) {
            return MEDIUM;
        }
        return LOW;
    }
}
