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

package com.amazon.insights.planning;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.LocalDate;
import java.time.Month;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.amazon.insights.errors.InsufficientDataException;
import com.amazon.insights.returntypes.TrendDirection;

public class MaintenancePredictorTest {

    private static MaintenancePredictor predictor(double first, double second, double third) {
        MaintenancePredictor predictor = new MaintenancePredictor();
        // out of order on purpose
        predictor.addRecord(LocalDate.of(2024, 5, 9), third, "roof");
        predictor.addRecord(LocalDate.of(2024, 1, 10), first, "plumbing");
        predictor.addRecord(LocalDate.of(2024, 3, 10), second, "heating");
        return predictor;
    }

    @Test
    public void testPredictNext() {
        MaintenanceForecast forecast = predictor(500, 700, 600).predictNext();
        assertEquals(LocalDate.of(2024, 7, 8), forecast.getNextMaintenanceDate());
        assertEquals(600, forecast.getPredictedAmount());
        assertEquals(720, forecast.getRecommendedBudget());
        assertEquals(MaintenancePredictor.MAX_CONFIDENCE, forecast.getConfidence(), 1e-12);
    }

    @ParameterizedTest
    @CsvSource({ "500,700,600,0.9", "200,600,700,0.53", "100,1000,100,0.1" })
    public void testConfidence(double first, double second, double third, double expected) {
        assertEquals(expected, predictor(first, second, third).predictNext().getConfidence(), 1e-12);
    }

    @Test
    public void testOnlyRecentRecordsPriceTheNextJob() {
        MaintenancePredictor predictor = new MaintenancePredictor();
        LocalDate date = LocalDate.of(2023, 1, 1);
        for (int i = 0; i < 8; i++) {
            predictor.addRecord(date.plusMonths(i), (i < 2) ? 1000 : 100, "cleaning");
        }
        assertEquals(100, predictor.predictNext().getPredictedAmount());
    }

    @Test
    public void testHistoryLimit() {
        MaintenancePredictor predictor = new MaintenancePredictor(3);
        for (int day = 1; day <= 5; day++) {
            predictor.addRecord(LocalDate.of(2024, 6, day), day, "garden");
        }
        assertEquals(3, predictor.getRecords().size());
        assertEquals(LocalDate.of(2024, 6, 3), predictor.getRecords().get(0).getDate());
        assertEquals(MaintenancePredictor.DEFAULT_HISTORY_LIMIT, new MaintenancePredictor().getHistoryLimit());
        assertThrows(IllegalArgumentException.class, () -> new MaintenancePredictor(2));
        assertThrows(UnsupportedOperationException.class, () -> predictor.getRecords().clear());
    }

    @Test
    public void testPatterns() {
        MaintenancePredictor predictor = new MaintenancePredictor();
        for (int month = 1; month <= 6; month++) {
            predictor.addRecord(LocalDate.of(2024, month, 15), (month <= 3) ? 100 : 200, "repairs");
        }
        MaintenancePatterns patterns = predictor.analyzePatterns();
        assertEquals(150, patterns.getAverageCost());
        // 6 jobs over 152 days
        assertEquals(14.21, patterns.getFrequency(), 1e-12);
        assertEquals(6, patterns.getMonthlyTotals().size());
        assertEquals(200L, patterns.getMonthlyTotals().get(Month.JUNE));
        assertEquals(TrendDirection.INCREASING, patterns.getCostTrend());
    }

    @Test
    public void testMonthlyTotalsSpanYears() {
        MaintenancePredictor predictor = new MaintenancePredictor();
        predictor.addRecord(LocalDate.of(2024, 1, 5), 100, "boiler");
        predictor.addRecord(LocalDate.of(2024, 7, 5), 75.4, "painting");
        predictor.addRecord(LocalDate.of(2025, 1, 5), 50, "boiler");
        MaintenancePatterns patterns = predictor.analyzePatterns();
        assertEquals(150L, patterns.getMonthlyTotals().get(Month.JANUARY));
        assertEquals(75L, patterns.getMonthlyTotals().get(Month.JULY));
        // no older window to compare with
        assertEquals(TrendDirection.STABLE, patterns.getCostTrend());
    }

    @Test
    public void testDecreasingCosts() {
        MaintenancePredictor predictor = new MaintenancePredictor();
        double[] amounts = { 300, 100, 100, 100 };
        for (int i = 0; i < amounts.length; i++) {
            predictor.addRecord(LocalDate.of(2024, 2, 1).plusWeeks(i), amounts[i], "pest control");
        }
        assertEquals(TrendDirection.DECREASING, predictor.analyzePatterns().getCostTrend());
    }

    @Test
    public void testSameDayRecords() {
        MaintenancePredictor predictor = new MaintenancePredictor();
        predictor.addRecord(LocalDate.of(2024, 9, 1), 80, "locks");
        predictor.addRecord(LocalDate.of(2024, 9, 1), 120, "windows");
        MaintenancePatterns patterns = predictor.analyzePatterns();
        assertEquals(0, patterns.getFrequency());
        assertEquals(100, patterns.getAverageCost());
    }

    @Test
    public void testTooFewRecords() {
        MaintenancePredictor predictor = new MaintenancePredictor();
        InsufficientDataException patternsError = assertThrows(InsufficientDataException.class,
                predictor::analyzePatterns);
        assertEquals(2, patternsError.getRequired());
        assertEquals(0, patternsError.getActual());

        predictor.addRecord(LocalDate.of(2024, 1, 1), 10, "filters");
        predictor.addRecord(LocalDate.of(2024, 2, 1), 10, "filters");
        InsufficientDataException forecastError = assertThrows(InsufficientDataException.class,
                predictor::predictNext);
        assertEquals(3, forecastError.getRequired());
        assertEquals(2, forecastError.getActual());
        assertThrows(NullPointerException.class, () -> predictor.addRecord(null));
        assertThrows(IllegalArgumentException.class,
                () -> predictor.addRecord(LocalDate.of(2024, 3, 1), -1, "filters"));
    }
}
