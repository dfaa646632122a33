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

package com.amazon.insights.statistics;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.insights.errors.InsufficientDataException;

public class OutlierFenceTest {

    @Test
    public void testQuartiles() {
        double[] values = { 8, 3, 5, 1, 7, 2, 6, 4 };
        assertArrayEquals(new double[] { 3, 7 }, OutlierFence.quartiles(values), 0.0);
        assertArrayEquals(new double[] { 8, 3, 5, 1, 7, 2, 6, 4 }, values, 0.0);
        assertArrayEquals(new double[] { 5, 5 }, OutlierFence.quartiles(new double[] { 5 }), 0.0);
    }

    @Test
    public void testThreshold() {
        double[] values = { 1, 2, 3, 4, 5, 6, 7, 8 };
        assertEquals(13, OutlierFence.threshold(values), 1e-12);
        assertEquals(7, OutlierFence.threshold(values, 0), 1e-12);
        assertEquals(19, OutlierFence.threshold(values, 3), 1e-12);
    }

    @ParameterizedTest
    @ValueSource(longs = { 0, 1, 17, 123 })
    public void testMonotoneInMultiplier(long seed) {
        Random random = new Random(seed);
        double[] values = new double[37];
        for (int i = 0; i < values.length; i++) {
            values[i] = random.nextDouble() * random.nextDouble();
        }
        double previous = OutlierFence.threshold(values, 0);
        for (double multiplier = 0.25; multiplier <= 5; multiplier += 0.25) {
            double next = OutlierFence.threshold(values, multiplier);
            assertTrue(next >= previous);
            previous = next;
        }
    }

    @Test
    public void testExceeds() {
        boolean[] flags = OutlierFence.exceeds(new double[] { 1, 13, 13.5, -20 }, 13);
        assertFalse(flags[0]);
        assertFalse(flags[1]);
        assertTrue(flags[2]);
        assertFalse(flags[3]);
    }

    @Test
    public void testIncorrectArguments() {
        assertThrows(InsufficientDataException.class, () -> OutlierFence.quartiles(new double[0]));
        assertThrows(NullPointerException.class, () -> OutlierFence.quartiles(null));
        assertThrows(IllegalArgumentException.class, () -> OutlierFence.threshold(new double[] { 1 }, -1));
        assertThrows(IllegalArgumentException.class,
                () -> OutlierFence.threshold(new double[] { 1 }, Double.POSITIVE_INFINITY));
    }
}
