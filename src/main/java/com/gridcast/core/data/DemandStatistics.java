package com.gridcast.core.data;

import com.gridcast.core.model.SeriesPoint;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Pure statistics over demand windows.
 */
public final class DemandStatistics {

    private static final Duration EXPECTED_STEP = Duration.ofHours(1);

    private DemandStatistics() {}

    public static double[] values(List<SeriesPoint> points) {
        return points.stream().mapToDouble(SeriesPoint::value).toArray();
    }

    public static double mean(double[] values) {
        return Arrays.stream(values).average().orElse(Double.NaN);
    }

    /**
     * Sample standard deviation (n - 1 denominator); 0 for fewer than two values.
     */
    public static double sampleStdDev(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double sumSq = 0;
        for (double v : values) {
            sumSq += (v - mean) * (v - mean);
        }
        return Math.sqrt(sumSq / (values.length - 1));
    }

    /**
     * Quantile with linear interpolation between closest ranks.
     *
     * @param q quantile in [0, 1]
     */
    public static double quantile(double[] values, double q) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double rank = q * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
    }

    public static DemandStatisticsReport describe(List<SeriesPoint> points, ZoneOffset offset) {
        if (points.isEmpty()) {
            throw new IllegalArgumentException("No demand points to describe");
        }
        double[] values = values(points);

        double[] hourSums = new double[25];
        int[] hourCounts = new int[25];
        for (var point : points) {
            int hourEnding = point.timestamp().atOffset(offset).getHour() + 1;
            hourSums[hourEnding] += point.value();
            hourCounts[hourEnding]++;
        }
        int peakHour = -1;
        int minHour = -1;
        for (int h = 1; h <= 24; h++) {
            if (hourCounts[h] == 0) {
                continue;
            }
            double avg = hourSums[h] / hourCounts[h];
            if (peakHour < 0 || avg > hourSums[peakHour] / hourCounts[peakHour]) {
                peakHour = h;
            }
            if (minHour < 0 || avg < hourSums[minHour] / hourCounts[minHour]) {
                minHour = h;
            }
        }

        var percentiles = new LinkedHashMap<String, Double>();
        percentiles.put("p25", round2(quantile(values, 0.25)));
        percentiles.put("p50", round2(quantile(values, 0.50)));
        percentiles.put("p75", round2(quantile(values, 0.75)));
        percentiles.put("p95", round2(quantile(values, 0.95)));

        return new DemandStatisticsReport(
                values.length,
                round2(mean(values)),
                round2(quantile(values, 0.5)),
                round2(sampleStdDev(values)),
                Arrays.stream(values).min().orElseThrow(),
                Arrays.stream(values).max().orElseThrow(),
                percentiles,
                peakHour,
                round2(hourSums[peakHour] / hourCounts[peakHour]),
                minHour,
                round2(hourSums[minHour] / hourCounts[minHour]));
    }

    /**
     * Checks an hourly window covering the calendar days {@code startDate..endDate} inclusive.
     */
    public static DataQualityReport assessQuality(List<SeriesPoint> points, LocalDate startDate, LocalDate endDate) {
        long expected = Duration.between(startDate.atStartOfDay(), endDate.plusDays(1).atStartOfDay()).toHours();
        int actual = points.size();
        long missing = Math.max(0, expected - actual);
        double completeness = expected == 0 ? 0.0 : Math.min(100.0, actual * 100.0 / expected);

        double[] values = values(points);
        double mean = mean(values);
        double std = sampleStdDev(values);
        int outliers = 0;
        if (std > 0) {
            for (double v : values) {
                if (Math.abs(v - mean) > 3 * std) {
                    outliers++;
                }
            }
        }

        Duration gapThreshold = Duration.ofMillis((long) (EXPECTED_STEP.toMillis() * 1.5));
        int gaps = 0;
        for (int i = 1; i < points.size(); i++) {
            if (Duration.between(points.get(i - 1).timestamp(), points.get(i).timestamp()).compareTo(gapThreshold) > 0) {
                gaps++;
            }
        }

        var issues = new ArrayList<String>();
        if (missing > 0) {
            issues.add(missing + " missing hours out of " + expected + " expected");
        }
        if (outliers > 0) {
            issues.add(outliers + " outlier values detected");
        }
        if (gaps > 0) {
            issues.add(gaps + " time gaps detected");
        }
        if (issues.isEmpty()) {
            issues.add("No quality issues detected");
        }

        boolean valid = completeness >= 95.0 && outliers < actual * 0.01;
        return new DataQualityReport(valid, expected, actual, missing, round2(completeness), outliers, gaps, issues);
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
