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

package com.amazon.insights.errors;

/**
 * A width disagrees with the width fixed earlier, typically the feature width
 * of an already initialized model.
 */
public class DimensionMismatchException extends InsightsException {

    private static final long serialVersionUID = 1L;

    private final int expected;

    private final int actual;

    public DimensionMismatchException(String what, int expected, int actual) {
        super(what + " expected width " + expected + " but was " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
