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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class PaymentRiskAnalyzerTest {

    private final PaymentRiskAnalyzer analyzer = new PaymentRiskAnalyzer();

    @Test
    public void testReliablePayer() {
        PaymentBehavior behavior = analyzer.analyze(12, new double[] { 0, 5, 10, 3, 2, 10, 0, 0, 0, -4 });
        assertEquals(0.83, behavior.getReliability(), 1e-12);
        assertEquals(3, behavior.getAveragePaymentDelay(), 1e-12);
        assertEquals(10, behavior.getPaymentFrequency(), 1e-12);
        assertEquals(0.15, behavior.getRiskScore(), 1e-12);
        assertFalse(analyzer.isAtRisk(behavior));
    }

    @Test
    public void testLatePayer() {
        PaymentBehavior behavior = analyzer.analyze(24, new double[] { 40, 45, 60, 35, 50, 30, 31, 33 });
        assertEquals(0.33, behavior.getReliability(), 1e-12);
        assertEquals(4, behavior.getPaymentFrequency(), 1e-12);
        // delays past the horizon count fully
        assertEquals(0.77, behavior.getRiskScore(), 1e-12);
        assertTrue(analyzer.isAtRisk(behavior));
    }

    @Test
    public void testNoBills() {
        PaymentBehavior behavior = analyzer.analyze(0, new double[0]);
        assertEquals(0, behavior.getReliability());
        assertEquals(1, behavior.getRiskScore());
        assertTrue(analyzer.isAtRisk(behavior));
    }

    @Test
    public void testIncorrectArguments() {
        assertThrows(IllegalArgumentException.class, () -> analyzer.analyze(1, new double[] { 0, 0 }));
        assertThrows(IllegalArgumentException.class, () -> analyzer.analyze(-1, new double[0]));
        assertThrows(NullPointerException.class, () -> analyzer.analyze(1, null));
    }
}
