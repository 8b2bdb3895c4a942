package com.gridcast.core.forecast;

import com.gridcast.core.model.ModelKind;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Model manager settings bound from {@code gridcast.forecast.*}.
 */
@Component
@ConfigurationProperties(prefix = "gridcast.forecast")
public class ForecastProperties {

    /** Model kinds tried in order when producing a forecast. */
    private List<ModelKind> chain = new ArrayList<>(List.of(
            ModelKind.SEASONAL_DECOMPOSITION, ModelKind.AUTOREGRESSIVE, ModelKind.NAIVE_BASELINE));

    private int seasonalPeriod = 24;
    private int weeklyPeriod = 168;
    private int autoregressiveOrder = 24;

    /** Number of seasonal periods held out for backtesting before the final refit. */
    private int holdoutPeriods = 1;

    private String primaryMetric = AccuracyMetrics.MAPE;
    private int retentionPerKind = 3;
    private double confidenceZ = 1.96;
    private double tieTolerance = 1e-9;
    private int maxHorizon = 336;

    public List<ModelKind> getChain() {
        return chain;
    }

    public void setChain(List<ModelKind> chain) {
        this.chain = chain;
    }

    public int getSeasonalPeriod() {
        return seasonalPeriod;
    }

    public void setSeasonalPeriod(int seasonalPeriod) {
        this.seasonalPeriod = seasonalPeriod;
    }

    public int getWeeklyPeriod() {
        return weeklyPeriod;
    }

    public void setWeeklyPeriod(int weeklyPeriod) {
        this.weeklyPeriod = weeklyPeriod;
    }

    public int getAutoregressiveOrder() {
        return autoregressiveOrder;
    }

    public void setAutoregressiveOrder(int autoregressiveOrder) {
        this.autoregressiveOrder = autoregressiveOrder;
    }

    public int getHoldoutPeriods() {
        return holdoutPeriods;
    }

    public void setHoldoutPeriods(int holdoutPeriods) {
        this.holdoutPeriods = holdoutPeriods;
    }

    public String getPrimaryMetric() {
        return primaryMetric;
    }

    public void setPrimaryMetric(String primaryMetric) {
        this.primaryMetric = primaryMetric;
    }

    public int getRetentionPerKind() {
        return retentionPerKind;
    }

    public void setRetentionPerKind(int retentionPerKind) {
        this.retentionPerKind = retentionPerKind;
    }

    public double getConfidenceZ() {
        return confidenceZ;
    }

    public void setConfidenceZ(double confidenceZ) {
        this.confidenceZ = confidenceZ;
    }

    public double getTieTolerance() {
        return tieTolerance;
    }

    public void setTieTolerance(double tieTolerance) {
        this.tieTolerance = tieTolerance;
    }

    public int getMaxHorizon() {
        return maxHorizon;
    }

    public void setMaxHorizon(int maxHorizon) {
        this.maxHorizon = maxHorizon;
    }

    public int holdoutPoints() {
        return holdoutPeriods * seasonalPeriod;
    }

    /**
     * Instantiates the configured chain.
     */
    public List<ForecastModel> buildChain() {
        return chain.stream().map(this::create).toList();
    }

    public ForecastModel create(ModelKind kind) {
        return switch (kind) {
            case SEASONAL_DECOMPOSITION -> new SeasonalDecompositionModel(seasonalPeriod, confidenceZ);
            case AUTOREGRESSIVE -> new AutoregressiveModel(autoregressiveOrder, confidenceZ);
            case NAIVE_BASELINE -> new NaiveBaselineModel(seasonalPeriod, weeklyPeriod, confidenceZ);
        };
    }
}
