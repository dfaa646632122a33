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

package com.amazon.insights.returntypes;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.amazon.insights.errors.DimensionMismatchException;

public class FeatureMatrixTest {

    @Test
    public void testCopies() {
        double[][] rows = { { 1, 2 }, { 3, 4 }, { 5, 6 } };
        FeatureMatrix matrix = FeatureMatrix.of(rows);
        rows[0][0] = 100;
        assertEquals(1, matrix.get(0, 0));
        matrix.row(1)[0] = 100;
        assertEquals(3, matrix.get(1, 0));
        matrix.toArray()[2][1] = 100;
        assertEquals(6, matrix.get(2, 1));
        assertEquals(3, matrix.rows());
        assertEquals(2, matrix.width());
    }

    @Test
    public void testSlice() {
        FeatureMatrix matrix = FeatureMatrix.of(new double[][] { { 1 }, { 2 }, { 3 }, { 4 } });
        FeatureMatrix tail = matrix.slice(3, 4);
        assertEquals(1, tail.rows());
        assertArrayEquals(new double[] { 4 }, tail.row(0), 0.0);
        assertEquals(2, matrix.slice(0, 2).rows());
        assertThrows(IllegalArgumentException.class, () -> matrix.slice(2, 2));
        assertThrows(IllegalArgumentException.class, () -> matrix.slice(0, 5));
    }

    @Test
    public void testCheckAligned() {
        FeatureMatrix matrix = FeatureMatrix.ofRow(new double[] { 1, 2, 3 });
        matrix.checkAligned(new double[] { 1 });
        DimensionMismatchException exception = assertThrows(DimensionMismatchException.class,
                () -> matrix.checkAligned(new double[] { 1, 0 }));
        assertEquals(1, exception.getExpected());
        assertEquals(2, exception.getActual());
        assertThrows(IllegalArgumentException.class, () -> matrix.checkAligned(new double[] { Double.NaN }));
    }

    @Test
    public void testIncorrectRows() {
        assertThrows(IllegalArgumentException.class, () -> FeatureMatrix.of(new double[0][]));
        assertThrows(IllegalArgumentException.class, () -> FeatureMatrix.of(new double[][] { {} }));
        assertThrows(IllegalArgumentException.class, () -> FeatureMatrix.of(new double[][] { { 1, 2 }, { 3 } }));
        assertThrows(IllegalArgumentException.class,
                () -> FeatureMatrix.of(new double[][] { { 1, Double.POSITIVE_INFINITY } }));
        assertThrows(NullPointerException.class, () -> FeatureMatrix.of(null));
    }
}
