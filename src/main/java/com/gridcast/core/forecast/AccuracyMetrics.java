package com.gridcast.core.forecast;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Holdout accuracy metrics. All values are "lower is better".
 */
public final class AccuracyMetrics {

    public static final String MAPE = "MAPE";
    public static final String RMSE = "RMSE";
    public static final String MAE = "MAE";
    public static final String INTERVAL_WIDTH_VARIANCE = "INTERVAL_WIDTH_VARIANCE";
    public static final String MEAN_INTERVAL_WIDTH = "MEAN_INTERVAL_WIDTH";

    public static final List<String> SUPPORTED = List.of(MAPE, RMSE, MAE, INTERVAL_WIDTH_VARIANCE);

    private AccuracyMetrics() {
    }

    /**
     * Scores {@code predictions} against {@code actual}. MAPE skips zero actuals and is
     * {@code NaN} when every actual is zero.
     */
    public static Map<String, Double> compute(List<Prediction> predictions, double[] actual) {
        if (predictions.size() != actual.length) {
            throw new IllegalArgumentException(
                    "Expected " + actual.length + " predictions, got " + predictions.size());
        }
        if (actual.length == 0) {
            throw new IllegalArgumentException("Cannot score an empty holdout");
        }
        int n = actual.length;
        double absSum = 0;
        double sqSum = 0;
        double pctSum = 0;
        int pctCount = 0;
        double widthSum = 0;
        double[] widths = new double[n];
        for (int i = 0; i < n; i++) {
            Prediction p = predictions.get(i);
            double error = actual[i] - p.estimate();
            absSum += Math.abs(error);
            sqSum += error * error;
            if (actual[i] != 0) {
                pctSum += Math.abs(error / actual[i]);
                pctCount++;
            }
            widths[i] = p.upper() - p.lower();
            widthSum += widths[i];
        }
        double meanWidth = widthSum / n;
        double widthVar = 0;
        for (double w : widths) {
            widthVar += (w - meanWidth) * (w - meanWidth);
        }
        widthVar /= n;

        var metrics = new LinkedHashMap<String, Double>();
        metrics.put(MAPE, pctCount > 0 ? 100.0 * pctSum / pctCount : Double.NaN);
        metrics.put(RMSE, Math.sqrt(sqSum / n));
        metrics.put(MAE, absSum / n);
        metrics.put(INTERVAL_WIDTH_VARIANCE, widthVar);
        metrics.put(MEAN_INTERVAL_WIDTH, meanWidth);
        return metrics;
    }
}
