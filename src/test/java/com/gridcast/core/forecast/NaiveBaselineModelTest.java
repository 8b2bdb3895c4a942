package com.gridcast.core.forecast;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class NaiveBaselineModelTest {

    private final NaiveBaselineModel model = new NaiveBaselineModel(24, 168, 1.96);

    private static double[] ramp(int n) {
        return IntStream.range(0, n).mapToDouble(t -> 1000 + t).toArray();
    }

    @Test
    @DisplayName("needs two days of history")
    void minimumWindow() {
        assertEquals(48, model.minimumWindow());
        assertThrows(InsufficientDataException.class, () -> model.fit(new double[47]));
    }

    @Test
    @DisplayName("repeats yesterday when less than a week and a day is available")
    void repeatsYesterday() {
        double[] values = ramp(48);
        var fitted = model.fit(values);

        assertEquals("last_day", fitted.parameters().get("pattern"));
        var predictions = fitted.predict(24);
        for (int h = 0; h < 24; h++) {
            assertEquals(values[24 + h], predictions.get(h).estimate());
        }
    }

    @Test
    @DisplayName("repeats last week once enough history exists")
    void repeatsLastWeek() {
        double[] values = ramp(192);
        var fitted = model.fit(values);

        assertEquals("last_week", fitted.parameters().get("pattern"));
        assertEquals(values[192 - 168], fitted.predict(1).get(0).estimate());
    }

    @Test
    @DisplayName("bounds come from seasonal differences and widen per repeated season")
    void bounds() {
        // ramp: every daily difference is 24, so the spread is exactly 24
        var predictions = model.fit(ramp(48)).predict(25);

        double first = predictions.get(0).upper() - predictions.get(0).lower();
        double afterOneSeason = predictions.get(24).upper() - predictions.get(24).lower();
        assertEquals(2 * 1.96 * 24, first, 1e-9);
        assertEquals(first * Math.sqrt(2), afterOneSeason, 1e-9);
    }

    @Test
    @DisplayName("a perfectly periodic series gets zero-width bounds")
    void periodicSeries() {
        double[] values = IntStream.range(0, 72).mapToDouble(t -> t % 24).toArray();
        var p = model.fit(values).predict(1).get(0);
        assertEquals(p.lower(), p.upper());
    }
}
