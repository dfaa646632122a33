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
 * Monthly-style series built from a linear trend, a sinusoidal season and
 * optional Gaussian noise. All generators are deterministic for a given seed.
 */
public class SeasonalSeriesData {

    private final double base;
    private final double slope;
    private final double amplitude;
    private final int period;
    private final double noiseSigma;

    public SeasonalSeriesData(double base, double slope, double amplitude, int period, double noiseSigma) {
        this.base = base;
        this.slope = slope;
        this.amplitude = amplitude;
        this.period = period;
        this.noiseSigma = noiseSigma;
    }

    /**
     * a straight line without season or noise
     */
    public static double[] linear(int length, double base, double slope) {
        return new SeasonalSeriesData(base, slope, 0, 12, 0).generate(length, 0);
    }

    public double[] generate(int length, long seed) {
        NormalDistribution dist = new NormalDistribution(new Random(seed));
        double[] answer = new double[length];
        for (int i = 0; i < length; i++) {
            answer[i] = base + slope * i + amplitude * Math.sin(2 * Math.PI * i / period);
            if (noiseSigma > 0) {
                answer[i] += dist.nextDouble(0, noiseSigma);
            }
        }
        return answer;
    }

    /**
     * the same series with isolated spikes of the given size at the given
     * positions
     */
    public double[] generateWithSpikes(int length, long seed, int[] positions, double spike) {
        double[] answer = generate(length, seed);
        for (int position : positions) {
            answer[position] += spike;
        }
        return answer;
    }
}
