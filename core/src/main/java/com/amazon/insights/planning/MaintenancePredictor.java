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

import static com.amazon.insights.CommonUtils.checkArgument;
import static com.amazon.insights.CommonUtils.checkNotNull;
import static com.amazon.insights.CommonUtils.clamp;
import static com.amazon.insights.CommonUtils.mean;
import static com.amazon.insights.CommonUtils.variance;

import java.time.LocalDate;
import java.time.Month;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.amazon.insights.errors.InsufficientDataException;
import com.amazon.insights.returntypes.TrendDirection;

/**
 * Keeps the most recent maintenance jobs of a property and predicts the next
 * one from them. The next date is the last date plus the mean interval between
 * jobs; the amount is the mean of the last few jobs. Instances are not thread
 * safe.
 */
public class MaintenancePredictor {

    public static final int DEFAULT_HISTORY_LIMIT = 24;

    public static final int MIN_RECORDS_FOR_FORECAST = 3;

    public static final int MIN_RECORDS_FOR_PATTERNS = 2;

    // jobs averaged for the predicted amount
    public static final int RECENT_RECORDS = 6;

    // jobs in each of the two windows compared for the cost trend
    public static final int TREND_WINDOW = 3;

    public static final double TREND_TOLERANCE = 0.15;

    /**
     * Variance of the recent amounts at which confidence reaches 0 before
     * clamping.
     */
    public static final double CONFIDENCE_SCALE = 100000;

    public static final double MIN_CONFIDENCE = 0.1;

    public static final double MAX_CONFIDENCE = 0.9;

    public static final double BUDGET_MARGIN = 1.2;

    public static final double DAYS_PER_MONTH = 30;

    private final int historyLimit;

    // sorted by date, oldest first
    private final List<MaintenanceRecord> records = new ArrayList<>();

    public MaintenancePredictor() {
        this(DEFAULT_HISTORY_LIMIT);
    }

    public MaintenancePredictor(int historyLimit) {
        checkArgument(historyLimit >= MIN_RECORDS_FOR_FORECAST, "history limit must be at least 3");
        this.historyLimit = historyLimit;
    }

    /**
     * Adds a job; once more than the history limit are kept the oldest ones are
     * dropped.
     */
    public void addRecord(MaintenanceRecord record) {
        checkNotNull(record, "record must not be null");
        records.add(record);
        records.sort(Comparator.comparing(MaintenanceRecord::getDate));
        while (records.size() > historyLimit) {
            records.remove(0);
        }
    }

    public void addRecord(LocalDate date, double amount, String type) {
        addRecord(new MaintenanceRecord(date, amount, type));
    }

    public List<MaintenanceRecord> getRecords() {
        return Collections.unmodifiableList(new ArrayList<>(records));
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    /**
     * @return the expected next job
     * @throws InsufficientDataException with fewer than
     *                                   {@link #MIN_RECORDS_FOR_FORECAST} records
     */
    public MaintenanceForecast predictNext() {
        checkRecords(MIN_RECORDS_FOR_FORECAST);
        int count = records.size();
        MaintenanceRecord first = records.get(0);
        MaintenanceRecord last = records.get(count - 1);
        double averageInterval = ChronoUnit.DAYS.between(first.getDate(), last.getDate()) / (double) (count - 1);
        LocalDate next = last.getDate().plusDays(Math.round(averageInterval));

        double[] recent = amounts(Math.max(0, count - RECENT_RECORDS), count);
        double predicted = mean(recent);
        double confidence = clamp(1 - variance(recent) / CONFIDENCE_SCALE, MIN_CONFIDENCE, MAX_CONFIDENCE);
        return new MaintenanceForecast(Math.round(predicted), BudgetRecommender.round(confidence), next,
                Math.round(predicted * BUDGET_MARGIN));
    }

    /**
     * @return cost level, frequency, monthly totals and the direction of recent
     *         costs
     * @throws InsufficientDataException with fewer than
     *                                   {@link #MIN_RECORDS_FOR_PATTERNS} records
     */
    public MaintenancePatterns analyzePatterns() {
        checkRecords(MIN_RECORDS_FOR_PATTERNS);
        int count = records.size();
        double[] all = amounts(0, count);

        double months = ChronoUnit.DAYS.between(records.get(0).getDate(), records.get(count - 1).getDate())
                / DAYS_PER_MONTH;
        double frequency = (months > 0) ? BudgetRecommender.round(count / months * 12) : 0;

        Map<Month, Double> totals = new EnumMap<>(Month.class);
        for (MaintenanceRecord record : records) {
            totals.merge(record.getDate().getMonth(), record.getAmount(), Double::sum);
        }
        Map<Month, Long> monthlyTotals = new EnumMap<>(Month.class);
        totals.forEach((month, total) -> monthlyTotals.put(month, Math.round(total)));

        double recent = mean(amounts(Math.max(0, count - TREND_WINDOW), count));
        int olderEnd = Math.max(0, count - TREND_WINDOW);
        int olderStart = Math.max(0, count - 2 * TREND_WINDOW);
        double older = (olderEnd > olderStart) ? mean(amounts(olderStart, olderEnd)) : recent;

        return new MaintenancePatterns(Math.round(mean(all)), frequency, Collections.unmodifiableMap(monthlyTotals),
                TrendDirection.compare(recent, older, TREND_TOLERANCE));
    }

    private double[] amounts(int from, int to) {
        double[] answer = new double[to - from];
        for (int i = from; i < to; i++) {
            answer[i - from] = records.get(i).getAmount();
        }
        return answer;
    }

    private void checkRecords(int required) {
        if (records.size() < required) {
            throw new InsufficientDataException("not enough maintenance records", required, records.size());
        }
    }
}
