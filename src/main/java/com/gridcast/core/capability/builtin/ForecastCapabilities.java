package com.gridcast.core.capability.builtin;

import com.gridcast.core.capability.CapabilityArguments;
import com.gridcast.core.capability.CapabilityDescriptor;
import com.gridcast.core.capability.CapabilityProvider;
import com.gridcast.core.capability.InvocationContext;
import com.gridcast.core.capability.ParameterSpec;
import com.gridcast.core.capability.ParameterType;
import com.gridcast.core.data.DemandDataProperties;
import com.gridcast.core.data.DemandDataSource;
import com.gridcast.core.data.DemandQuery;
import com.gridcast.core.data.DemandSeries;
import com.gridcast.core.forecast.ForecastAttempt;
import com.gridcast.core.forecast.ForecastModelManager;
import com.gridcast.core.forecast.ForecastProperties;
import com.gridcast.core.forecast.ForecastRun;
import com.gridcast.core.forecast.ForecastStrategy;
import com.gridcast.core.forecast.ForecastingException;
import com.gridcast.core.forecast.InsufficientDataException;
import com.gridcast.core.forecast.ModelCandidate;
import com.gridcast.core.forecast.ModelComparison;
import com.gridcast.core.forecast.NoModelAvailableException;
import com.gridcast.core.forecast.TrainingAbandonedException;
import com.gridcast.core.freshness.DataFreshnessGate;
import com.gridcast.core.freshness.FreshnessProperties;
import com.gridcast.core.model.ErrorKind;
import com.gridcast.core.model.FreshnessVerdict;
import com.gridcast.core.model.ModelKind;
import com.gridcast.core.model.ResultEnvelope;
import com.gridcast.core.model.SeriesPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Model training, evaluation, comparison and forecast production.
 * <p>
 * Training windows end at the newest stored data point rather than at the current time, so a
 * lagging data feed still yields a full window. Every capability here stores candidates only
 * through {@link InvocationContext#tryCommit()}.
 */
@Component
public class ForecastCapabilities implements CapabilityProvider {

    private static final Logger log = LoggerFactory.getLogger(ForecastCapabilities.class);

    public static final String TRAIN_MODEL = "train_model";
    public static final String EVALUATE_MODEL = "evaluate_model";
    public static final String COMPARE_MODELS = "compare_models";
    public static final String PRODUCE_FORECAST = "produce_forecast";

    private static final Duration TRAINING_TIMEOUT = Duration.ofSeconds(120);
    private static final Duration STEP = Duration.ofHours(1);

    private final ForecastModelManager modelManager;
    private final DemandDataSource dataSource;
    private final DemandDataProperties dataProperties;
    private final ForecastProperties forecastProperties;
    private final DataFreshnessGate freshnessGate;
    private final FreshnessProperties freshnessProperties;
    private final Clock clock;

    public ForecastCapabilities(ForecastModelManager modelManager, DemandDataSource dataSource,
                                DemandDataProperties dataProperties, ForecastProperties forecastProperties,
                                DataFreshnessGate freshnessGate, FreshnessProperties freshnessProperties,
                                Clock clock) {
        this.modelManager = modelManager;
        this.dataSource = dataSource;
        this.dataProperties = dataProperties;
        this.forecastProperties = forecastProperties;
        this.freshnessGate = freshnessGate;
        this.freshnessProperties = freshnessProperties;
        this.clock = clock;
    }

    @Override
    public List<CapabilityDescriptor> capabilities() {
        ParameterSpec daysBack = ParameterSpec.optional("days_back", ParameterType.INTEGER,
                "Days of history ending at the newest data point (default "
                        + dataProperties.getTrainingDaysBack() + ")").range(2, 3650);
        ParameterSpec series = ParameterSpec.optional("series", ParameterType.ENUM, "Demand measure")
                .allowed(ParameterSpec.namesOf(DemandSeries.class));
        ParameterSpec zone = ParameterSpec.optional("zone", ParameterType.STRING, "Zone name for zonal demand");
        ParameterSpec kind = ParameterSpec.required("kind", ParameterType.ENUM, "Model kind")
                .allowed(ParameterSpec.namesOf(ModelKind.class));

        return List.of(
                new CapabilityDescriptor(TRAIN_MODEL,
                        "Train one model kind on recent history and register the candidate.",
                        List.of(kind, daysBack, series, zone),
                        "candidate_id, kind, training window, holdout metrics",
                        TRAINING_TIMEOUT, this::train),
                new CapabilityDescriptor(EVALUATE_MODEL,
                        "Backtest one model kind on the most recent holdout segment without registering it.",
                        List.of(kind, daysBack, series, zone),
                        "kind, target, holdout_points, metrics (MAPE, RMSE, MAE, interval width variance)",
                        TRAINING_TIMEOUT, this::evaluate),
                new CapabilityDescriptor(COMPARE_MODELS,
                        "Train every model kind and rank them by " + forecastProperties.getPrimaryMetric() + ".",
                        List.of(daysBack, series, zone),
                        "primary_metric, ranking (best first), per-kind attempts",
                        TRAINING_TIMEOUT, this::compare),
                new CapabilityDescriptor(PRODUCE_FORECAST,
                        "Produce a demand forecast with confidence bounds, falling back through the model chain "
                                + modelManager.chainKinds() + " until one trains.",
                        List.of(
                                ParameterSpec.required("horizon", ParameterType.INTEGER, "Hours to forecast")
                                        .range(1, forecastProperties.getMaxHorizon()),
                                daysBack, series, zone,
                                ParameterSpec.optional("strategy", ParameterType.ENUM,
                                        "FALLBACK: first kind that trains; BEST: train all and pick the best")
                                        .allowed(ParameterSpec.namesOf(ForecastStrategy.class)),
                                ParameterSpec.optional("require_fresh", ParameterType.BOOLEAN,
                                        "Fail with STALE_DATA instead of forecasting from stale data")),
                        "ForecastResult: candidate_id, kind, horizon, points (timestamp, estimate, lower, upper)",
                        TRAINING_TIMEOUT, this::produceForecast));
    }

    ResultEnvelope train(CapabilityArguments args, InvocationContext ctx) {
        ModelKind kind = args.enumValue("kind", ModelKind.class, ModelKind.SEASONAL_DECOMPOSITION);
        return withHistory(args, (target, points) -> {
            ModelCandidate candidate = modelManager.train(target, points, kind, ctx::tryCommit);
            return ResultEnvelope.ok(candidate.describe(),
                    "Trained " + candidate.id() + " on " + points.size() + " points");
        });
    }

    ResultEnvelope evaluate(CapabilityArguments args, InvocationContext ctx) {
        ModelKind kind = args.enumValue("kind", ModelKind.class, ModelKind.SEASONAL_DECOMPOSITION);
        return withHistory(args, (target, points) -> {
            Map<String, Double> metrics = modelManager.backtest(target, points, kind);
            var data = new LinkedHashMap<String, Object>();
            data.put("kind", kind.name());
            data.put("target", target);
            data.put("holdout_points", forecastProperties.holdoutPoints());
            data.put("metrics", metrics);
            return ResultEnvelope.ok(data, kind + " backtest " + forecastProperties.getPrimaryMetric() + " = "
                    + metrics.get(forecastProperties.getPrimaryMetric()));
        });
    }

    ResultEnvelope compare(CapabilityArguments args, InvocationContext ctx) {
        return withHistory(args, (target, points) -> {
            ModelComparison comparison = modelManager.compare(target, points, ctx::tryCommit);
            var data = new LinkedHashMap<String, Object>();
            data.put("target", target);
            data.put("primary_metric", comparison.primaryMetric());
            data.put("best", comparison.best().describe());
            data.put("ranking", comparison.ranked().stream().map(ModelCandidate::describe).toList());
            return ResultEnvelope.ok(data, "Best model for " + target + " is " + comparison.best().id(),
                    Map.of("attempts", attemptMaps(comparison.attempts())));
        });
    }

    ResultEnvelope produceForecast(CapabilityArguments args, InvocationContext ctx) {
        int horizon = args.integer("horizon", 24);
        ForecastStrategy strategy = args.enumValue("strategy", ForecastStrategy.class, ForecastStrategy.FALLBACK);
        boolean requireFresh = args.bool("require_fresh", false);

        return withHistory(args, (target, points) -> {
            Instant latest = points.get(points.size() - 1).timestamp();
            FreshnessVerdict verdict = freshnessGate.checkFreshness(latest, clock.instant(),
                    freshnessProperties.toPolicy());
            ForecastRun run;
            try {
                run = modelManager.produceForecast(target, points, horizon, strategy, ctx::tryCommit);
            } catch (NoModelAvailableException e) {
                return ResultEnvelope.failure(ErrorKind.NO_MODEL_AVAILABLE, e.getMessage(),
                        Map.of("attempts", attemptMaps(e.attempts()), "strategy", strategy.name()));
            }

            var meta = new LinkedHashMap<String, Object>();
            meta.put("strategy", strategy.name());
            meta.put("attempts", attemptMaps(run.attempts()));
            meta.put("candidate", run.candidate().describe());
            meta.put("training_points", points.size());
            meta.put("freshness", verdict.verdict().name());
            meta.put("hours_old", verdict.hoursOld());
            meta.put("stale", verdict.isStale());

            if (verdict.isStale() && requireFresh) {
                return ResultEnvelope.failure(ErrorKind.STALE_DATA,
                        "StaleData: newest data point is " + verdict.hoursOld() + " hours old; the attached forecast "
                                + "was produced from it", run.result(), meta);
            }
            String note = verdict.isStale() ? " (data is " + verdict.hoursOld() + " hours old)" : "";
            return ResultEnvelope.ok(run.result(), horizon + "-hour forecast for " + target + " from "
                    + run.candidate().id() + note, meta);
        });
    }

    @FunctionalInterface
    private interface HistoryAction {
        ResultEnvelope apply(String target, List<SeriesPoint> points);
    }

    /**
     * Resolves the training window and maps forecasting failures onto envelopes.
     */
    private ResultEnvelope withHistory(CapabilityArguments args, HistoryAction action) {
        DemandQuery query;
        try {
            query = DemandQuery.of(
                    args.enumValue("series", DemandSeries.class, DemandSeries.ONTARIO_DEMAND),
                    args.string("zone").orElse(null));
        } catch (IllegalArgumentException e) {
            return ResultEnvelope.failure(ErrorKind.VALIDATION_FAILED, "ValidationFailed: " + e.getMessage());
        }
        var latest = dataSource.latestTimestamp();
        if (latest.isEmpty()) {
            return ResultEnvelope.failure(ErrorKind.NO_DATA, "NoData: the demand store contains no data");
        }
        int days = args.integer("days_back", dataProperties.getTrainingDaysBack());
        Instant end = latest.get().plus(STEP);
        Instant start = end.minus(Duration.ofDays(days));
        List<SeriesPoint> points = dataSource.query(start, end, query);
        if (points.isEmpty()) {
            return ResultEnvelope.failure(ErrorKind.INSUFFICIENT_DATA,
                    "InsufficientData: no " + query.targetKey() + " data in the " + days + " days before " + end);
        }

        String target = query.targetKey();
        try {
            return action.apply(target, points);
        } catch (InsufficientDataException e) {
            return ResultEnvelope.failure(ErrorKind.INSUFFICIENT_DATA, e.getMessage(),
                    Map.of("required_points", e.required(), "available_points", e.actual()));
        } catch (NoModelAvailableException e) {
            return ResultEnvelope.failure(ErrorKind.NO_MODEL_AVAILABLE, e.getMessage(),
                    Map.of("attempts", attemptMaps(e.attempts())));
        } catch (TrainingAbandonedException e) {
            log.warn("{}", e.getMessage());
            return ResultEnvelope.failure(ErrorKind.TIMEOUT, "TimeoutError: " + e.getMessage());
        } catch (ForecastingException e) {
            return ResultEnvelope.failure(ErrorKind.TRAINING_FAILED, "TrainingFailed: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            return ResultEnvelope.failure(ErrorKind.VALIDATION_FAILED, "ValidationFailed: " + e.getMessage());
        }
    }

    private static List<Map<String, Object>> attemptMaps(List<ForecastAttempt> attempts) {
        return attempts.stream().map(ForecastAttempt::toMap).toList();
    }
}
