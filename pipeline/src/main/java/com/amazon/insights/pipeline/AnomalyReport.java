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

package com.amazon.insights.pipeline;

import lombok.Getter;

@Getter
public class AnomalyReport {

    private final boolean[] anomalies;

    // reconstruction error of each record
    private final double[] scores;

    private final double threshold;

    public AnomalyReport(boolean[] anomalies, double[] scores, double threshold) {
        this.anomalies = anomalies;
        this.scores = scores;
        this.threshold = threshold;
    }

    public int anomalyCount() {
        int count = 0;
        for (boolean anomaly : anomalies) {
            if (anomaly) {
                ++count;
            }
        }
        return count;
    }

    public double[] getScores() {
        return scores.clone();
    }

    public boolean[] getAnomalies() {
        return anomalies.clone();
    }
}
