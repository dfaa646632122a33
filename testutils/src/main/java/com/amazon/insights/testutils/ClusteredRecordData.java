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
 * Multivariate records in [0,1] concentrated around a center, with optional
 * outliers appended at the end.
 */
public class ClusteredRecordData {

    private ClusteredRecordData() {
    }

    /**
     * Two-dimensional points evenly spaced on an ellipse around the center, the
     * major axis along the diagonal {@code (1, 1)} and the minor axis along
     * {@code (1, -1)}. Reconstruction errors over such a ring are a smooth
     * periodic function of the angle, so they pile up near their extremes and the
     * outlier fence above them is stable.
     *
     * @param count    number of ring points
     * @param centerX  first coordinate of the center
     * @param centerY  second coordinate of the center
     * @param major    offset per coordinate at the ends of the major axis
     * @param minor    offset per coordinate at the ends of the minor axis
     * @param outliers records appended after the ring
     * @return the ring followed by the outliers
     */
    public static double[][] ellipse(int count, double centerX, double centerY, double major, double minor,
            double[]... outliers) {
        double[][] answer = new double[count + outliers.length][];
        for (int i = 0; i < count; i++) {
            double angle = 2 * Math.PI * i / count;
            double along = major * Math.cos(angle);
            double across = minor * Math.sin(angle);
            answer[i] = new double[] { centerX + along + across, centerY + along - across };
        }
        for (int k = 0; k < outliers.length; k++) {
            answer[count + k] = outliers[k].clone();
        }
        return answer;
    }

    /**
     * Gaussian points around the center, clipped into [0,1].
     */
    public static double[][] gaussianCluster(int count, double[] center, double sigma, long seed) {
        NormalDistribution dist = new NormalDistribution(new Random(seed));
        double[][] answer = new double[count][center.length];
        for (int i = 0; i < count; i++) {
            for (int j = 0; j < center.length; j++) {
                answer[i][j] = Math.max(0, Math.min(1, dist.nextDouble(center[j], sigma)));
            }
        }
        return answer;
    }
}
