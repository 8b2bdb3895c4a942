package com.gridcast.core.forecast;

import com.gridcast.core.model.ModelKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Additive decomposition into a linear trend, a fixed-period seasonal profile and noise.
 * <p>
 * The trend is an ordinary least-squares line over the whole series; the seasonal profile is
 * the mean detrended value per phase, centred on zero. Intervals use the residual standard
 * deviation and widen with the number of elapsed periods.
 */
public class SeasonalDecompositionModel implements ForecastModel {

    private final int period;
    private final double z;

    public SeasonalDecompositionModel(int period, double z) {
        if (period < 2) {
            throw new IllegalArgumentException("period must be at least 2");
        }
        this.period = period;
        this.z = z;
    }

    @Override
    public ModelKind kind() {
        return ModelKind.SEASONAL_DECOMPOSITION;
    }

    @Override
    public int minimumWindow() {
        return 2 * period;
    }

    @Override
    public FittedModel fit(double[] values) {
        int n = values.length;
        if (n < minimumWindow()) {
            throw new InsufficientDataException(kind(), minimumWindow(), n);
        }

        double tMean = (n - 1) / 2.0;
        double yMean = Arrays.stream(values).average().orElseThrow();
        double sxy = 0;
        double sxx = 0;
        for (int t = 0; t < n; t++) {
            sxy += (t - tMean) * (values[t] - yMean);
            sxx += (t - tMean) * (t - tMean);
        }
        double slope = sxy / sxx;
        double level = yMean - slope * tMean;

        double[] seasonal = new double[period];
        int[] counts = new int[period];
        for (int t = 0; t < n; t++) {
            seasonal[t % period] += values[t] - (level + slope * t);
            counts[t % period]++;
        }
        double seasonalMean = 0;
        for (int k = 0; k < period; k++) {
            seasonal[k] /= counts[k];
            seasonalMean += seasonal[k] / period;
        }
        for (int k = 0; k < period; k++) {
            seasonal[k] -= seasonalMean;
        }

        double ssr = 0;
        for (int t = 0; t < n; t++) {
            double residual = values[t] - (level + slope * t + seasonal[t % period]);
            ssr += residual * residual;
        }
        int dof = n - 2 - (period - 1);
        double sigma = Math.sqrt(ssr / Math.max(1, dof));
        if (!Double.isFinite(sigma) || !Double.isFinite(slope)) {
            throw new ForecastingException("Seasonal decomposition produced non-finite parameters");
        }
        return new Fitted(n, level, slope, seasonal, sigma);
    }

    private final class Fitted implements FittedModel {

        private final int n;
        private final double level;
        private final double slope;
        private final double[] seasonal;
        private final double sigma;

        private Fitted(int n, double level, double slope, double[] seasonal, double sigma) {
            this.n = n;
            this.level = level;
            this.slope = slope;
            this.seasonal = seasonal;
            this.sigma = sigma;
        }

        @Override
        public Map<String, Object> parameters() {
            var params = new LinkedHashMap<String, Object>();
            params.put("period", period);
            params.put("level", level);
            params.put("slope", slope);
            params.put("residual_std", sigma);
            params.put("seasonal_profile", Arrays.stream(seasonal).boxed().toList());
            return params;
        }

        @Override
        public List<Prediction> predict(int horizon) {
            var predictions = new ArrayList<Prediction>(horizon);
            for (int h = 1; h <= horizon; h++) {
                int t = n - 1 + h;
                double estimate = level + slope * t + seasonal[t % period];
                double halfWidth = z * sigma * Math.sqrt(1.0 + (double) h / period);
                predictions.add(new Prediction(estimate, estimate - halfWidth, estimate + halfWidth));
            }
            return predictions;
        }
    }
}
