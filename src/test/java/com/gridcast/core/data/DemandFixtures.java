package com.gridcast.core.data;

import com.gridcast.core.model.SeriesPoint;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Synthetic hourly demand and an in-memory {@link DemandDataSource} for tests.
 */
public final class DemandFixtures {

    public static final Instant START = Instant.parse("2025-01-06T05:00:00Z");

    private DemandFixtures() {
    }

    /**
     * Daily-cycle demand around 15 GW with gaussian noise, one point per hour from {@code start}.
     */
    public static List<SeriesPoint> hourly(int count, Instant start, long seed) {
        var random = new Random(seed);
        var points = new ArrayList<SeriesPoint>(count);
        for (int t = 0; t < count; t++) {
            double daily = 2000 * Math.sin(2 * Math.PI * t / 24.0);
            double value = 15000 + daily + random.nextGaussian() * 150;
            points.add(new SeriesPoint(start.plus(Duration.ofHours(t)), value));
        }
        return points;
    }

    public static List<SeriesPoint> hourly(int count) {
        return hourly(count, START, 42L);
    }

    public static InMemoryDemandDataSource source(List<SeriesPoint> points) {
        return new InMemoryDemandDataSource(points);
    }

    /**
     * Serves the same points for every series and zone.
     */
    public static class InMemoryDemandDataSource implements DemandDataSource {

        private final List<SeriesPoint> points;
        private int queries;

        public InMemoryDemandDataSource(List<SeriesPoint> points) {
            this.points = List.copyOf(points);
        }

        @Override
        public List<SeriesPoint> query(Instant start, Instant end, DemandQuery filters) {
            queries++;
            return points.stream()
                    .filter(p -> !p.timestamp().isBefore(start) && p.timestamp().isBefore(end))
                    .toList();
        }

        @Override
        public Optional<Instant> latestTimestamp() {
            return points.isEmpty() ? Optional.empty() : Optional.of(points.get(points.size() - 1).timestamp());
        }

        @Override
        public DataSummary summary() {
            if (points.isEmpty()) {
                return new DataSummary(0, null, null, 0, 0, 0);
            }
            var stats = points.stream().mapToDouble(SeriesPoint::value).summaryStatistics();
            return new DataSummary(points.size(), points.get(0).timestamp(),
                    points.get(points.size() - 1).timestamp(), stats.getMin(), stats.getMax(), stats.getAverage());
        }

        public int queries() {
            return queries;
        }
    }
}
