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

package com.amazon.insights.testutils;

import java.util.Random;

/**
 * Four-feature engagement rows in [0,1] labelled 1 when the weighted sum
 * {@code 0.4, 0.3, 0.2, 0.1} exceeds one half. The classes are separable by a
 * hyperplane, which keeps the classifier tests stable.
 */
public class EngagementData {

    private final double[][] features;
    private final double[] labels;

    public EngagementData(int count, long seed) {
        Random random = new Random(seed);
        features = new double[count][4];
        labels = new double[count];
        for (int i = 0; i < count; i++) {
            double score = 0;
            double[] weights = { 0.4, 0.3, 0.2, 0.1 };
            for (int j = 0; j < 4; j++) {
                features[i][j] = random.nextDouble();
                score += weights[j] * features[i][j];
            }
            labels[i] = (score > 0.5) ? 1 : 0;
        }
    }

    public double[][] getFeatures() {
        return features;
    }

    public double[] getLabels() {
        return labels;
    }
}
