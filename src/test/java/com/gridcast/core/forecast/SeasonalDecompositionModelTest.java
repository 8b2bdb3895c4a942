package com.gridcast.core.forecast;

import com.gridcast.core.data.DemandFixtures;
import com.gridcast.core.model.ModelKind;
import com.gridcast.core.model.SeriesPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SeasonalDecompositionModelTest {

    private final SeasonalDecompositionModel model = new SeasonalDecompositionModel(24, 1.96);

    private static double[] values(List<SeriesPoint> points) {
        return points.stream().mapToDouble(SeriesPoint::value).toArray();
    }

    @Test
    @DisplayName("requires at least two seasonal periods")
    void minimumWindow() {
        assertEquals(48, model.minimumWindow());
        var ex = assertThrows(InsufficientDataException.class, () -> model.fit(new double[47]));
        assertEquals(ModelKind.SEASONAL_DECOMPOSITION, ex.kind());
        assertEquals(48, ex.required());
        assertEquals(47, ex.actual());
    }

    @Test
    @DisplayName("tracks the daily cycle on the next day")
    void forecastsDailyCycle() {
        double[] all = values(DemandFixtures.hourly(24 * 9));
        double[] training = Arrays.copyOfRange(all, 0, 24 * 8);
        double[] nextDay = Arrays.copyOfRange(all, 24 * 8, 24 * 9);

        var predictions = model.fit(training).predict(24);

        var metrics = AccuracyMetrics.compute(predictions, nextDay);
        assertTrue(metrics.get(AccuracyMetrics.MAPE) < 5.0, "MAPE was " + metrics.get(AccuracyMetrics.MAPE));
    }

    @Test
    @DisplayName("intervals are ordered and widen with the horizon")
    void intervalsWiden() {
        var predictions = model.fit(values(DemandFixtures.hourly(24 * 7))).predict(48);

        for (Prediction p : predictions) {
            assertTrue(p.lower() <= p.estimate() && p.estimate() <= p.upper());
        }
        double first = predictions.get(0).upper() - predictions.get(0).lower();
        double last = predictions.get(47).upper() - predictions.get(47).lower();
        assertTrue(last > first);
    }

    @Test
    @DisplayName("reports a zero-centred seasonal profile")
    @SuppressWarnings("unchecked")
    void parameters() {
        var params = model.fit(values(DemandFixtures.hourly(24 * 7))).parameters();
        assertEquals(24, params.get("period"));
        var profile = (List<Double>) params.get("seasonal_profile");
        assertEquals(24, profile.size());
        assertEquals(0.0, profile.stream().mapToDouble(Double::doubleValue).sum(), 1e-6);
        assertTrue((Double) params.get("residual_std") > 0);
    }
}
