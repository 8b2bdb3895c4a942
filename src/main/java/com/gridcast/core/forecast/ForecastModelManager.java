package com.gridcast.core.forecast;

import com.gridcast.core.metrics.AgentMetrics;
import com.gridcast.core.model.ForecastPoint;
import com.gridcast.core.model.ForecastResult;
import com.gridcast.core.model.ModelKind;
import com.gridcast.core.model.SeriesPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BooleanSupplier;

/**
 * Trains, evaluates, ranks and runs forecasting models for a target.
 * <p>
 * Kinds are tried in the configured chain order. Each target has its own read/write lock:
 * training, selection and the combined produce-a-forecast operation take the write lock;
 * forecasting from an already stored candidate takes the read lock. Evaluation is a pure
 * function of its inputs and takes no lock.
 */
@Service
public class ForecastModelManager {

    private static final Logger log = LoggerFactory.getLogger(ForecastModelManager.class);
    private static final Duration DEFAULT_STEP = Duration.ofHours(1);

    private final ForecastProperties properties;
    private final List<ForecastModel> chain;
    private final ModelCandidateStore store;
    private final AgentMetrics metrics;
    private final Clock clock;
    private final AtomicInteger candidateCounter = new AtomicInteger();
    private final Map<String, ReadWriteLock> targetLocks = new ConcurrentHashMap<>();

    @Autowired
    public ForecastModelManager(ForecastProperties properties, ModelCandidateStore store,
                                AgentMetrics metrics, Clock clock) {
        this(properties, properties.buildChain(), store, metrics, clock);
    }

    public ForecastModelManager(ForecastProperties properties, List<ForecastModel> chain,
                                ModelCandidateStore store, AgentMetrics metrics, Clock clock) {
        if (chain.isEmpty()) {
            throw new IllegalArgumentException("Fallback chain must contain at least one model kind");
        }
        this.properties = properties;
        this.chain = List.copyOf(chain);
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
    }

    public List<ModelKind> chainKinds() {
        return chain.stream().map(ForecastModel::kind).toList();
    }

    public ModelCandidateStore store() {
        return store;
    }

    /**
     * Fits a candidate of {@code kind} on the whole series (after holding out the tail to
     * compute metrics) and stores it.
     *
     * @param commit consulted right before the candidate is stored; {@code false} discards it
     * @throws InsufficientDataException   if the series is shorter than the kind's minimum window
     * @throws TrainingAbandonedException  if {@code commit} refused the store
     * @throws ForecastingException        if the model could not be fitted
     */
    public ModelCandidate train(String target, List<SeriesPoint> series, ModelKind kind, BooleanSupplier commit) {
        ReadWriteLock lock = lockFor(target);
        lock.writeLock().lock();
        try {
            return trainLocked(target, sorted(series), modelFor(kind), commit);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Same as {@link #train(String, List, ModelKind, BooleanSupplier)} restricted to points in
     * {@code [windowStart, windowEnd)}.
     */
    public ModelCandidate train(String target, List<SeriesPoint> series, Instant windowStart, Instant windowEnd,
                                ModelKind kind, BooleanSupplier commit) {
        var window = series.stream()
                .filter(p -> windowStart == null || !p.timestamp().isBefore(windowStart))
                .filter(p -> windowEnd == null || p.timestamp().isBefore(windowEnd))
                .toList();
        return train(target, window, kind, commit);
    }

    /**
     * Fits {@code kind} on all but the last holdout segment of the series and scores it on that
     * segment. Nothing is stored.
     */
    public Map<String, Double> backtest(String target, List<SeriesPoint> series, ModelKind kind) {
        List<SeriesPoint> points = sorted(series);
        ForecastModel model = modelFor(kind);
        int holdout = properties.holdoutPoints();
        if (holdout < 1) {
            throw new ForecastingException("Backtesting " + kind + " needs holdout-periods of at least 1");
        }
        int required = model.minimumWindow() + holdout;
        if (points.size() < required) {
            throw new InsufficientDataException(kind, required, points.size());
        }
        List<SeriesPoint> training = points.subList(0, points.size() - holdout);
        double[] actual = values(points.subList(points.size() - holdout, points.size()));
        ModelCandidate transientCandidate = fitCandidate(target, training, model, Map.of());
        return evaluate(transientCandidate, actual);
    }

    /**
     * Scores the candidate's next {@code holdout.length} predictions against {@code holdout}.
     * Pure: the same candidate and holdout always give the same metrics.
     */
    public Map<String, Double> evaluate(ModelCandidate candidate, double[] holdout) {
        List<Prediction> predictions = candidate.model().predict(holdout.length);
        for (Prediction p : predictions) {
            if (!p.isFinite()) {
                throw new ForecastingException(candidate.kind() + " produced a non-finite prediction during evaluation");
            }
        }
        return AccuracyMetrics.compute(predictions, holdout);
    }

    /**
     * Ranks candidates and records the winner as the target's selected model.
     *
     * @throws NoModelAvailableException if there is nothing to choose from
     */
    public ModelCandidate selectBest(String target, List<ModelCandidate> candidates) {
        ReadWriteLock lock = lockFor(target);
        lock.writeLock().lock();
        try {
            if (candidates.isEmpty()) {
                throw new NoModelAvailableException(target, List.of());
            }
            ModelCandidate best = rank(candidates).get(0);
            store.select(best);
            log.info("Selected {} ({}) for {}", best.id(), best.kind(), target);
            return best;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Orders candidates by the primary metric (lower first; missing values last), then by
     * interval-width variance, then by position in the fallback chain.
     */
    public List<ModelCandidate> rank(List<ModelCandidate> candidates) {
        String primary = properties.getPrimaryMetric();
        double tolerance = properties.getTieTolerance();
        Comparator<ModelCandidate> byRank = (a, b) -> {
            int cmp = compareMetric(a.metric(primary), b.metric(primary), tolerance);
            if (cmp != 0) {
                return cmp;
            }
            cmp = compareMetric(a.metric(AccuracyMetrics.INTERVAL_WIDTH_VARIANCE),
                    b.metric(AccuracyMetrics.INTERVAL_WIDTH_VARIANCE), tolerance);
            if (cmp != 0) {
                return cmp;
            }
            return Integer.compare(chainIndex(a.kind()), chainIndex(b.kind()));
        };
        var ranked = new ArrayList<>(candidates);
        ranked.sort(byRank);
        return ranked;
    }

    /**
     * Produces a forecast from a stored candidate.
     *
     * @throws ForecastingException if the candidate is no longer stored or predicts non-finite values
     */
    public ForecastResult forecast(ModelCandidate candidate, int horizon) {
        requireHorizon(horizon);
        ReadWriteLock lock = lockFor(candidate.target());
        lock.readLock().lock();
        try {
            if (!store.contains(candidate)) {
                throw new ForecastingException("Candidate " + candidate.id() + " is not registered for "
                        + candidate.target());
            }
            return project(candidate, horizon);
        } finally {
            lock.readLock().unlock();
        }
    }

    private ForecastResult project(ModelCandidate candidate, int horizon) {
        List<Prediction> predictions = candidate.model().predict(horizon);
        var points = new ArrayList<ForecastPoint>(horizon);
        for (int i = 0; i < predictions.size(); i++) {
            Prediction p = predictions.get(i);
            if (!p.isFinite()) {
                throw new ForecastingException(candidate.kind() + " produced a non-finite prediction at step " + (i + 1));
            }
            Instant ts = candidate.windowEnd().plus(candidate.step().multipliedBy(i + 1L));
            points.add(new ForecastPoint(ts, p.estimate(), p.lower(), p.upper()));
        }
        return new ForecastResult(candidate.id(), candidate.kind(), candidate.target(), horizon,
                points, clock.instant());
    }

    /**
     * Produces a forecast as one consolidated operation.
     * <p>
     * {@link ForecastStrategy#FALLBACK} trains kinds in chain order and forecasts from the first
     * that succeeds; {@link ForecastStrategy#BEST} trains every kind and forecasts from the
     * top-ranked one. Every attempt is returned in the run.
     *
     * @throws NoModelAvailableException  if no kind in the chain could be trained
     * @throws TrainingAbandonedException if the invocation was abandoned mid-run
     */
    public ForecastRun produceForecast(String target, List<SeriesPoint> series, int horizon,
                                       ForecastStrategy strategy, BooleanSupplier commit) {
        List<SeriesPoint> points = sorted(series);
        ReadWriteLock lock = lockFor(target);
        lock.writeLock().lock();
        try {
            var attempts = new ArrayList<ForecastAttempt>();
            if (strategy == ForecastStrategy.BEST) {
                List<ModelCandidate> trained = trainAll(target, points, commit, attempts);
                metrics.recordFallbackDepth(attempts.size());
                if (trained.isEmpty()) {
                    throw new NoModelAvailableException(target, attempts);
                }
                ModelCandidate best = rank(trained).get(0);
                store.select(best);
                return new ForecastRun(forecast(best, horizon), best, attempts);
            }

            requireHorizon(horizon);
            for (ForecastModel model : chain) {
                try {
                    ModelCandidate candidate = fitScored(target, points, model);
                    ForecastResult result;
                    try {
                        result = project(candidate, horizon);
                    } catch (ForecastingException e) {
                        metrics.recordModelTraining(model.kind().name(), false);
                        throw e;
                    }
                    register(candidate, commit, points.size());
                    attempts.add(ForecastAttempt.succeeded(candidate));
                    store.select(candidate);
                    metrics.recordFallbackDepth(attempts.size());
                    log.info("Forecast for {} produced by {} after {} attempt(s)", target, candidate.id(), attempts.size());
                    return new ForecastRun(result, candidate, attempts);
                } catch (TrainingAbandonedException e) {
                    throw e;
                } catch (ForecastingException e) {
                    log.warn("{} failed for {}: {}; trying next kind", model.kind(), target, e.getMessage());
                    attempts.add(ForecastAttempt.failed(model.kind(), e.getMessage()));
                }
            }
            metrics.recordFallbackDepth(attempts.size());
            throw new NoModelAvailableException(target, attempts);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Trains every kind in the chain and ranks the ones that succeeded. Does not change the
     * target's selected model.
     */
    public ModelComparison compare(String target, List<SeriesPoint> series, BooleanSupplier commit) {
        List<SeriesPoint> points = sorted(series);
        ReadWriteLock lock = lockFor(target);
        lock.writeLock().lock();
        try {
            var attempts = new ArrayList<ForecastAttempt>();
            List<ModelCandidate> trained = trainAll(target, points, commit, attempts);
            if (trained.isEmpty()) {
                throw new NoModelAvailableException(target, attempts);
            }
            return new ModelComparison(target, properties.getPrimaryMetric(), rank(trained), attempts);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Metrics of the latest candidate per kind for a target, keyed by kind name.
     */
    public Map<String, Map<String, Double>> latestMetrics(String target) {
        var result = new LinkedHashMap<String, Map<String, Double>>();
        for (ModelCandidate candidate : store.latestPerKind(target)) {
            result.put(candidate.kind().name(), candidate.metrics());
        }
        return result;
    }

    private List<ModelCandidate> trainAll(String target, List<SeriesPoint> points, BooleanSupplier commit,
                                          List<ForecastAttempt> attempts) {
        var trained = new ArrayList<ModelCandidate>();
        for (ForecastModel model : chain) {
            try {
                ModelCandidate candidate = trainLocked(target, points, model, commit);
                trained.add(candidate);
                attempts.add(ForecastAttempt.succeeded(candidate));
            } catch (TrainingAbandonedException e) {
                throw e;
            } catch (ForecastingException e) {
                attempts.add(ForecastAttempt.failed(model.kind(), e.getMessage()));
            }
        }
        return trained;
    }

    private ModelCandidate trainLocked(String target, List<SeriesPoint> points, ForecastModel model,
                                       BooleanSupplier commit) {
        return register(fitScored(target, points, model), commit, points.size());
    }

    /**
     * Fits a candidate on all points, scored on the holdout tail when the series is long enough.
     * Nothing is stored; a failure is counted against the kind.
     */
    private ModelCandidate fitScored(String target, List<SeriesPoint> points, ForecastModel model) {
        ModelKind kind = model.kind();
        try {
            if (points.size() < model.minimumWindow()) {
                throw new InsufficientDataException(kind, model.minimumWindow(), points.size());
            }
            Map<String, Double> holdoutMetrics = Map.of();
            int holdout = properties.holdoutPoints();
            if (holdout > 0 && points.size() >= model.minimumWindow() + holdout) {
                List<SeriesPoint> training = points.subList(0, points.size() - holdout);
                double[] actual = values(points.subList(points.size() - holdout, points.size()));
                holdoutMetrics = evaluate(fitCandidate(target, training, model, Map.of()), actual);
            }
            return fitCandidate(target, points, model, holdoutMetrics);
        } catch (ForecastingException e) {
            metrics.recordModelTraining(kind.name(), false);
            throw e;
        }
    }

    private ModelCandidate register(ModelCandidate candidate, BooleanSupplier commit, int pointCount) {
        if (!commit.getAsBoolean()) {
            throw new TrainingAbandonedException(candidate.target(), candidate.kind());
        }
        List<ModelCandidate> evicted = store.add(candidate);
        if (!evicted.isEmpty()) {
            log.debug("Evicted {} candidate(s) of {} for {}", evicted.size(), candidate.kind(), candidate.target());
        }
        metrics.recordModelTraining(candidate.kind().name(), true);
        log.info("Trained {} for {} on {} points, metrics {}", candidate.id(), candidate.target(), pointCount,
                candidate.metrics());
        return candidate;
    }

    private void requireHorizon(int horizon) {
        if (horizon < 1 || horizon > properties.getMaxHorizon()) {
            throw new IllegalArgumentException(
                    "Horizon must be between 1 and " + properties.getMaxHorizon() + ", got " + horizon);
        }
    }

    private ModelCandidate fitCandidate(String target, List<SeriesPoint> points, ForecastModel model,
                                        Map<String, Double> candidateMetrics) {
        FittedModel fitted;
        try {
            fitted = model.fit(values(points));
        } catch (ForecastingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ForecastingException(model.kind() + " fit failed: " + e.getMessage(), e);
        }
        String id = "%s-%04d".formatted(model.kind().code(), candidateCounter.incrementAndGet());
        return new ModelCandidate(id, target, model.kind(),
                points.get(0).timestamp(), points.get(points.size() - 1).timestamp(),
                inferStep(points), clock.instant(), fitted.parameters(), candidateMetrics, fitted);
    }

    private ForecastModel modelFor(ModelKind kind) {
        return chain.stream()
                .filter(m -> m.kind() == kind)
                .findFirst()
                .orElseGet(() -> properties.create(kind));
    }

    private int chainIndex(ModelKind kind) {
        for (int i = 0; i < chain.size(); i++) {
            if (chain.get(i).kind() == kind) {
                return i;
            }
        }
        return chain.size();
    }

    private ReadWriteLock lockFor(String target) {
        return targetLocks.computeIfAbsent(target, t -> new ReentrantReadWriteLock());
    }

    private static int compareMetric(double a, double b, double tolerance) {
        double x = Double.isNaN(a) ? Double.POSITIVE_INFINITY : a;
        double y = Double.isNaN(b) ? Double.POSITIVE_INFINITY : b;
        if (x == y || Math.abs(x - y) <= tolerance) {
            return 0;
        }
        return x < y ? -1 : 1;
    }

    private static List<SeriesPoint> sorted(List<SeriesPoint> series) {
        return series.stream().sorted(Comparator.comparing(SeriesPoint::timestamp)).toList();
    }

    private static double[] values(List<SeriesPoint> points) {
        return points.stream().mapToDouble(SeriesPoint::value).toArray();
    }

    /**
     * Median spacing between consecutive points; hourly when there are fewer than two.
     */
    static Duration inferStep(List<SeriesPoint> points) {
        if (points.size() < 2) {
            return DEFAULT_STEP;
        }
        long[] diffs = new long[points.size() - 1];
        for (int i = 1; i < points.size(); i++) {
            diffs[i - 1] = Duration.between(points.get(i - 1).timestamp(), points.get(i).timestamp()).toMillis();
        }
        Arrays.sort(diffs);
        long median = diffs[diffs.length / 2];
        return median > 0 ? Duration.ofMillis(median) : DEFAULT_STEP;
    }
}
