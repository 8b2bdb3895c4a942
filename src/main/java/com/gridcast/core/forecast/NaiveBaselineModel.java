package com.gridcast.core.forecast;

import com.gridcast.core.model.ModelKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Seasonal naive baseline: repeats last week's values, or yesterday's when less than
 * a week (plus a day of residuals) is available.
 * <p>
 * The baseline has no native uncertainty model, so bounds come from the spread of its own
 * historical errors, {@code x[t] - x[t - season]}, widened once per repeated season.
 */
public class NaiveBaselineModel implements ForecastModel {

    private final int dailyPeriod;
    private final int weeklyPeriod;
    private final double z;

    public NaiveBaselineModel(int dailyPeriod, int weeklyPeriod, double z) {
        this.dailyPeriod = dailyPeriod;
        this.weeklyPeriod = weeklyPeriod;
        this.z = z;
    }

    @Override
    public ModelKind kind() {
        return ModelKind.NAIVE_BASELINE;
    }

    @Override
    public int minimumWindow() {
        return 2 * dailyPeriod;
    }

    @Override
    public FittedModel fit(double[] values) {
        int n = values.length;
        if (n < minimumWindow()) {
            throw new InsufficientDataException(kind(), minimumWindow(), n);
        }
        int season = n >= weeklyPeriod + dailyPeriod ? weeklyPeriod : dailyPeriod;

        double sumSq = 0;
        for (int t = season; t < n; t++) {
            double error = values[t] - values[t - season];
            sumSq += error * error;
        }
        double spread = Math.sqrt(sumSq / (n - season));
        double[] lastSeason = Arrays.copyOfRange(values, n - season, n);
        return new Fitted(season, lastSeason, spread);
    }

    private final class Fitted implements FittedModel {

        private final int season;
        private final double[] lastSeason;
        private final double spread;

        private Fitted(int season, double[] lastSeason, double spread) {
            this.season = season;
            this.lastSeason = lastSeason;
            this.spread = spread;
        }

        @Override
        public Map<String, Object> parameters() {
            var params = new LinkedHashMap<String, Object>();
            params.put("season", season);
            params.put("pattern", season == weeklyPeriod ? "last_week" : "last_day");
            params.put("residual_spread", spread);
            return params;
        }

        @Override
        public List<Prediction> predict(int horizon) {
            var predictions = new ArrayList<Prediction>(horizon);
            for (int h = 1; h <= horizon; h++) {
                double estimate = lastSeason[(h - 1) % season];
                int repeats = (h - 1) / season;
                double halfWidth = z * spread * Math.sqrt(repeats + 1.0);
                predictions.add(new Prediction(estimate, estimate - halfWidth, estimate + halfWidth));
            }
            return predictions;
        }
    }
}
