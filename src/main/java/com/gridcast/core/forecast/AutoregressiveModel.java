package com.gridcast.core.forecast;

import com.gridcast.core.model.ModelKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AR(p) model fitted by least squares on the mean-centred series.
 * <p>
 * Multi-step forecasts are produced recursively. Interval widths follow the
 * moving-average (psi) weights of the fitted process.
 */
public class AutoregressiveModel implements ForecastModel {

    private static final double PIVOT_EPSILON = 1e-12;
    private static final double RIDGE = 1e-8;

    private final int order;
    private final double z;

    public AutoregressiveModel(int order, double z) {
        if (order < 1) {
            throw new IllegalArgumentException("order must be at least 1");
        }
        this.order = order;
        this.z = z;
    }

    @Override
    public ModelKind kind() {
        return ModelKind.AUTOREGRESSIVE;
    }

    @Override
    public int minimumWindow() {
        return Math.max(4 * order, order + 10);
    }

    @Override
    public FittedModel fit(double[] values) {
        int n = values.length;
        if (n < minimumWindow()) {
            throw new InsufficientDataException(kind(), minimumWindow(), n);
        }
        double mean = Arrays.stream(values).average().orElseThrow();
        double[] y = Arrays.stream(values).map(v -> v - mean).toArray();

        int k = order + 1;
        double[][] xtx = new double[k][k];
        double[] xty = new double[k];
        double[] row = new double[k];
        for (int t = order; t < n; t++) {
            row[0] = 1.0;
            for (int i = 1; i <= order; i++) {
                row[i] = y[t - i];
            }
            for (int a = 0; a < k; a++) {
                xty[a] += row[a] * y[t];
                for (int b = 0; b < k; b++) {
                    xtx[a][b] += row[a] * row[b];
                }
            }
        }
        double trace = 0;
        for (int a = 0; a < k; a++) {
            trace += xtx[a][a];
        }
        double ridge = RIDGE * Math.max(1.0, trace / k);
        for (int a = 0; a < k; a++) {
            xtx[a][a] += ridge;
        }

        double[] beta = solve(xtx, xty);
        double intercept = beta[0];
        double[] phi = Arrays.copyOfRange(beta, 1, k);

        double ssr = 0;
        for (int t = order; t < n; t++) {
            double fitted = intercept;
            for (int i = 1; i <= order; i++) {
                fitted += phi[i - 1] * y[t - i];
            }
            ssr += (y[t] - fitted) * (y[t] - fitted);
        }
        double sigma = Math.sqrt(ssr / Math.max(1, (n - order) - k));
        if (!Double.isFinite(sigma)) {
            throw new ForecastingException("Autoregressive fit produced a non-finite residual spread");
        }
        double[] tail = Arrays.copyOfRange(y, n - order, n);
        return new Fitted(mean, intercept, phi, sigma, tail);
    }

    /**
     * Solves {@code a x = b} by Gaussian elimination with partial pivoting. Inputs are overwritten.
     */
    static double[] solve(double[][] a, double[] b) {
        int k = b.length;
        for (int col = 0; col < k; col++) {
            int pivot = col;
            for (int r = col + 1; r < k; r++) {
                if (Math.abs(a[r][col]) > Math.abs(a[pivot][col])) {
                    pivot = r;
                }
            }
            if (Math.abs(a[pivot][col]) < PIVOT_EPSILON) {
                throw new ForecastingException("Autoregressive design matrix is singular");
            }
            double[] tmpRow = a[col];
            a[col] = a[pivot];
            a[pivot] = tmpRow;
            double tmp = b[col];
            b[col] = b[pivot];
            b[pivot] = tmp;

            for (int r = col + 1; r < k; r++) {
                double factor = a[r][col] / a[col][col];
                b[r] -= factor * b[col];
                for (int c = col; c < k; c++) {
                    a[r][c] -= factor * a[col][c];
                }
            }
        }
        double[] x = new double[k];
        for (int r = k - 1; r >= 0; r--) {
            double sum = b[r];
            for (int c = r + 1; c < k; c++) {
                sum -= a[r][c] * x[c];
            }
            x[r] = sum / a[r][r];
        }
        return x;
    }

    private final class Fitted implements FittedModel {

        private final double mean;
        private final double intercept;
        private final double[] phi;
        private final double sigma;
        private final double[] tail;

        private Fitted(double mean, double intercept, double[] phi, double sigma, double[] tail) {
            this.mean = mean;
            this.intercept = intercept;
            this.phi = phi;
            this.sigma = sigma;
            this.tail = tail;
        }

        @Override
        public Map<String, Object> parameters() {
            var params = new LinkedHashMap<String, Object>();
            params.put("order", order);
            params.put("mean", mean);
            params.put("intercept", intercept);
            params.put("coefficients", Arrays.stream(phi).boxed().toList());
            params.put("residual_std", sigma);
            return params;
        }

        @Override
        public List<Prediction> predict(int horizon) {
            // history[0..order) holds the last observed values, oldest first
            double[] history = new double[order + horizon];
            System.arraycopy(tail, 0, history, 0, order);

            double[] psi = new double[horizon];
            psi[0] = 1.0;
            for (int j = 1; j < horizon; j++) {
                double sum = 0;
                for (int i = 1; i <= Math.min(j, order); i++) {
                    sum += phi[i - 1] * psi[j - i];
                }
                psi[j] = sum;
            }

            var predictions = new ArrayList<Prediction>(horizon);
            double cumulativePsiSq = 0;
            for (int h = 0; h < horizon; h++) {
                int t = order + h;
                double next = intercept;
                for (int i = 1; i <= order; i++) {
                    next += phi[i - 1] * history[t - i];
                }
                history[t] = next;
                cumulativePsiSq += psi[h] * psi[h];
                double estimate = next + mean;
                double halfWidth = z * sigma * Math.sqrt(cumulativePsiSq);
                predictions.add(new Prediction(estimate, estimate - halfWidth, estimate + halfWidth));
            }
            return predictions;
        }
    }
}
