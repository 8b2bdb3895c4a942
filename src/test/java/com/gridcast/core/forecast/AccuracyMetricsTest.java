package com.gridcast.core.forecast;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AccuracyMetricsTest {

    @Test
    @DisplayName("computes MAPE, RMSE, MAE and interval statistics")
    void computes() {
        var metrics = AccuracyMetrics.compute(
                List.of(new Prediction(110, 100, 120), new Prediction(90, 85, 95)),
                new double[]{100, 100});

        assertEquals(10.0, metrics.get(AccuracyMetrics.MAPE), 1e-9);
        assertEquals(10.0, metrics.get(AccuracyMetrics.RMSE), 1e-9);
        assertEquals(10.0, metrics.get(AccuracyMetrics.MAE), 1e-9);
        assertEquals(15.0, metrics.get(AccuracyMetrics.MEAN_INTERVAL_WIDTH), 1e-9);
        assertEquals(25.0, metrics.get(AccuracyMetrics.INTERVAL_WIDTH_VARIANCE), 1e-9);
    }

    @Test
    @DisplayName("MAPE skips zero actuals and is NaN when all are zero")
    void zeroActuals() {
        var mixed = AccuracyMetrics.compute(
                List.of(new Prediction(10, 10, 10), new Prediction(110, 110, 110)),
                new double[]{0, 100});
        assertEquals(10.0, mixed.get(AccuracyMetrics.MAPE), 1e-9);

        var zeros = AccuracyMetrics.compute(List.of(new Prediction(1, 1, 1)), new double[]{0});
        assertTrue(zeros.get(AccuracyMetrics.MAPE).isNaN());
        assertEquals(1.0, zeros.get(AccuracyMetrics.MAE), 1e-9);
    }

    @Test
    @DisplayName("rejects mismatched or empty inputs")
    void invalidInputs() {
        assertThrows(IllegalArgumentException.class,
                () -> AccuracyMetrics.compute(List.of(new Prediction(1, 1, 1)), new double[]{1, 2}));
        assertThrows(IllegalArgumentException.class, () -> AccuracyMetrics.compute(List.of(), new double[0]));
    }
}
