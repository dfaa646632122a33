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

import static com.amazon.insights.CommonUtils.checkArgument;
import static com.amazon.insights.CommonUtils.checkFinite;
import static com.amazon.insights.CommonUtils.checkNotNull;
import static com.amazon.insights.CommonUtils.deepCopy;

import java.util.Arrays;

import com.amazon.insights.errors.DimensionMismatchException;

/**
 * An immutable, rectangular, non-empty matrix of finite values; one row per
 * record or per lag window. The width is fixed at construction and is what
 * models compare against their initialized input width.
 */
public class FeatureMatrix {

    private final double[][] rows;

    private final int width;

    private FeatureMatrix(double[][] rows, int width) {
        this.rows = rows;
        this.width = width;
    }

    /**
     * validates and copies the rows
     *
     * @param rows the data, one array per row
     * @return a matrix over a private copy of the rows
     * @throws IllegalArgumentException if the rows are empty, ragged or hold NaN
     *                                  or infinite values
     */
    public static FeatureMatrix of(double[][] rows) {
        checkNotNull(rows, "rows must not be null");
        checkArgument(rows.length > 0, "at least one row is required");
        checkNotNull(rows[0], "rows must not be null");
        int width = rows[0].length;
        checkArgument(width > 0, "rows must have at least one column");
        for (double[] row : rows) {
            checkNotNull(row, "rows must not be null");
            checkArgument(row.length == width, "ragged rows: expected width " + width + " found " + row.length);
            checkFinite(row, "values must be finite");
        }
        return new FeatureMatrix(deepCopy(rows), width);
    }

    /**
     * a matrix holding a single row
     *
     * @param row the feature vector
     * @return the matrix
     */
    public static FeatureMatrix ofRow(double[] row) {
        checkNotNull(row, "row must not be null");
        return of(new double[][] { row });
    }

    public int rows() {
        return rows.length;
    }

    public int width() {
        return width;
    }

    public double[] row(int index) {
        checkArgument(index >= 0 && index < rows.length, "incorrect index");
        return Arrays.copyOf(rows[index], width);
    }

    public double get(int row, int column) {
        return rows[row][column];
    }

    /**
     * @param labels values aligned with the rows
     * @throws DimensionMismatchException if the label count differs from the row
     *                                    count
     */
    public void checkAligned(double[] labels) {
        checkNotNull(labels, "labels must not be null");
        if (labels.length != rows.length) {
            throw new DimensionMismatchException("label vector", rows.length, labels.length);
        }
        checkFinite(labels, "labels must be finite");
    }

    /**
     * @param from first row, inclusive
     * @param to   last row, exclusive
     * @return the sub-matrix of the given rows
     */
    public FeatureMatrix slice(int from, int to) {
        checkArgument(0 <= from && from < to && to <= rows.length, "incorrect range");
        return new FeatureMatrix(Arrays.copyOfRange(rows, from, to), width);
    }

    public double[][] toArray() {
        return deepCopy(rows);
    }
}
