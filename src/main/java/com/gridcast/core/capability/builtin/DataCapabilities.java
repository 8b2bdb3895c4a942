package com.gridcast.core.capability.builtin;

import com.gridcast.core.capability.CapabilityArguments;
import com.gridcast.core.capability.CapabilityDescriptor;
import com.gridcast.core.capability.CapabilityProvider;
import com.gridcast.core.capability.InvocationContext;
import com.gridcast.core.capability.ParameterSpec;
import com.gridcast.core.capability.ParameterType;
import com.gridcast.core.data.DataQualityReport;
import com.gridcast.core.data.DataSummary;
import com.gridcast.core.data.DemandDataProperties;
import com.gridcast.core.data.DemandDataSource;
import com.gridcast.core.data.DemandQuery;
import com.gridcast.core.data.DemandSeries;
import com.gridcast.core.data.DemandStatistics;
import com.gridcast.core.data.DemandStatisticsReport;
import com.gridcast.core.freshness.DataFreshnessGate;
import com.gridcast.core.freshness.FreshnessProperties;
import com.gridcast.core.model.ErrorKind;
import com.gridcast.core.model.FreshnessVerdict;
import com.gridcast.core.model.ResultEnvelope;
import com.gridcast.core.model.SeriesPoint;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only capabilities over the demand store.
 */
@Component
public class DataCapabilities implements CapabilityProvider {

    public static final String CHECK_DATA_FRESHNESS = "check_data_freshness";
    public static final String GET_DATA_SUMMARY = "get_data_summary";
    public static final String QUERY_DEMAND_DATA = "query_demand_data";
    public static final String VALIDATE_DATA_QUALITY = "validate_data_quality";
    public static final String CALCULATE_DEMAND_STATISTICS = "calculate_demand_statistics";
    public static final String GET_CURRENT_TIME = "get_current_time";

    /** Metadata key carrying the newest data timestamp as ISO-8601 text. */
    public static final String LATEST_TIMESTAMP_KEY = "latest_timestamp";

    private final DemandDataSource dataSource;
    private final DemandDataProperties dataProperties;
    private final DataFreshnessGate freshnessGate;
    private final FreshnessProperties freshnessProperties;
    private final Clock clock;

    public DataCapabilities(DemandDataSource dataSource, DemandDataProperties dataProperties,
                            DataFreshnessGate freshnessGate, FreshnessProperties freshnessProperties, Clock clock) {
        this.dataSource = dataSource;
        this.dataProperties = dataProperties;
        this.freshnessGate = freshnessGate;
        this.freshnessProperties = freshnessProperties;
        this.clock = clock;
    }

    @Override
    public List<CapabilityDescriptor> capabilities() {
        List<ParameterSpec> windowParams = List.of(
                ParameterSpec.optional("start_date", ParameterType.DATE, "First market day (YYYY-MM-DD)"),
                ParameterSpec.optional("end_date", ParameterType.DATE, "Last market day, inclusive (YYYY-MM-DD)"),
                ParameterSpec.optional("days_back", ParameterType.INTEGER,
                        "Days to look back from now when no dates are given").range(1, 3650),
                ParameterSpec.optional("series", ParameterType.ENUM, "Demand measure")
                        .allowed(ParameterSpec.namesOf(DemandSeries.class)),
                ParameterSpec.optional("zone", ParameterType.STRING, "Zone name for zonal demand"));
        List<ParameterSpec> dateRange = List.of(
                ParameterSpec.required("start_date", ParameterType.DATE, "First market day (YYYY-MM-DD)"),
                ParameterSpec.required("end_date", ParameterType.DATE, "Last market day, inclusive (YYYY-MM-DD)"));

        return List.of(
                new CapabilityDescriptor(CHECK_DATA_FRESHNESS,
                        "Check when demand data was last updated and whether it is stale. Call before forecasting.",
                        List.of(),
                        "latest/earliest timestamp, total_rows, hours_old, verdict (FRESH|STALE)",
                        null, (args, ctx) -> checkFreshness()),
                new CapabilityDescriptor(GET_DATA_SUMMARY,
                        "Summary of stored Ontario demand: row count, date range, min/max/average MW.",
                        List.of(),
                        "total_rows, earliest, latest, min_demand_mw, max_demand_mw, avg_demand_mw",
                        null, (args, ctx) -> summary()),
                new CapabilityDescriptor(QUERY_DEMAND_DATA,
                        "Fetch hourly demand for a date range (default: the last 7 days).",
                        windowParams,
                        "record_count, date_range, avg/peak/min MW and the most recent records",
                        null, this::queryDemand),
                new CapabilityDescriptor(VALIDATE_DATA_QUALITY,
                        "Check completeness, outliers (beyond 3 standard deviations) and time gaps for a date range.",
                        dateRange,
                        "is_valid, expected/actual/missing hours, completeness_pct, outlier_count, gap_count, issues",
                        null, this::validateQuality),
                new CapabilityDescriptor(CALCULATE_DEMAND_STATISTICS,
                        "Mean, median, spread, percentiles and peak/minimum hour of demand for a date range.",
                        dateRange,
                        "mean/median/std/min/max MW, percentiles p25..p95, peak_hour, min_hour",
                        null, this::statistics),
                new CapabilityDescriptor(GET_CURRENT_TIME,
                        "Current date and time.",
                        List.of(),
                        "ISO-8601 timestamp",
                        null, (args, ctx) -> ResultEnvelope.ok(clock.instant().toString(), "Current time")));
    }

    ResultEnvelope checkFreshness() {
        var latest = dataSource.latestTimestamp();
        if (latest.isEmpty()) {
            return ResultEnvelope.failure(ErrorKind.NO_DATA, "NoData: the demand store contains no data");
        }
        DataSummary summary = dataSource.summary();
        FreshnessVerdict verdict = freshnessGate.checkFreshness(latest.get(), clock.instant(),
                freshnessProperties.toPolicy());
        var data = new LinkedHashMap<String, Object>();
        data.put("latest_timestamp", latest.get().toString());
        data.put("earliest_timestamp", summary.earliest() != null ? summary.earliest().toString() : null);
        data.put("total_rows", summary.totalRows());
        data.put("hours_old", verdict.hoursOld());
        data.put("threshold_hours", verdict.threshold().toMinutes() / 60.0);
        data.put("verdict", verdict.verdict().name());
        String message = verdict.isStale()
                ? "Data is stale: newest point is " + verdict.hoursOld() + " hours old"
                : "Data is fresh: newest point is " + verdict.hoursOld() + " hours old";
        return ResultEnvelope.ok(data, message, Map.of(LATEST_TIMESTAMP_KEY, latest.get().toString()));
    }

    ResultEnvelope summary() {
        DataSummary summary = dataSource.summary();
        if (summary.isEmpty()) {
            return ResultEnvelope.failure(ErrorKind.NO_DATA, "NoData: the demand store contains no data");
        }
        return ResultEnvelope.ok(summary, "Summary of " + summary.totalRows() + " demand records");
    }

    ResultEnvelope queryDemand(CapabilityArguments args, InvocationContext ctx) {
        DemandWindow window;
        try {
            window = DemandWindow.resolve(args, dataProperties, clock, dataProperties.getDefaultDaysBack());
        } catch (IllegalArgumentException e) {
            return ResultEnvelope.failure(ErrorKind.VALIDATION_FAILED, "ValidationFailed: " + e.getMessage());
        }
        List<SeriesPoint> points = dataSource.query(window.start(), window.end(), window.query());
        if (points.isEmpty()) {
            return ResultEnvelope.failure(ErrorKind.INSUFFICIENT_DATA,
                    "InsufficientData: no " + window.query().targetKey() + " data between "
                            + window.start() + " and " + window.end());
        }
        double[] values = DemandStatistics.values(points);
        int limit = Math.max(1, dataProperties.getMaxRecords());
        List<SeriesPoint> records = points.subList(Math.max(0, points.size() - limit), points.size());

        var data = new LinkedHashMap<String, Object>();
        data.put("target", window.query().targetKey());
        data.put("record_count", points.size());
        data.put("date_range", List.of(points.get(0).timestamp().toString(),
                points.get(points.size() - 1).timestamp().toString()));
        data.put("avg_demand_mw", Math.round(DemandStatistics.mean(values) * 100.0) / 100.0);
        data.put("peak_demand_mw", Arrays.stream(values).max().orElseThrow());
        data.put("min_demand_mw", Arrays.stream(values).min().orElseThrow());
        data.put("records", records);
        return ResultEnvelope.ok(data, "Retrieved " + points.size() + " hourly records for "
                + window.query().targetKey(), Map.of("truncated", records.size() < points.size()));
    }

    ResultEnvelope validateQuality(CapabilityArguments args, InvocationContext ctx) {
        LocalDate start = args.date("start_date").orElseThrow();
        LocalDate end = args.date("end_date").orElseThrow();
        if (start.isAfter(end)) {
            return ResultEnvelope.failure(ErrorKind.VALIDATION_FAILED,
                    "ValidationFailed: start_date " + start + " is after end_date " + end);
        }
        List<SeriesPoint> points = fetchDays(start, end);
        if (points.isEmpty()) {
            return ResultEnvelope.failure(ErrorKind.INSUFFICIENT_DATA,
                    "InsufficientData: no data found between " + start + " and " + end);
        }
        DataQualityReport report = DemandStatistics.assessQuality(points, start, end);
        return ResultEnvelope.ok(report, report.valid()
                ? "Data quality is acceptable"
                : "Data quality issues: " + String.join("; ", report.issues()));
    }

    ResultEnvelope statistics(CapabilityArguments args, InvocationContext ctx) {
        LocalDate start = args.date("start_date").orElseThrow();
        LocalDate end = args.date("end_date").orElseThrow();
        if (start.isAfter(end)) {
            return ResultEnvelope.failure(ErrorKind.VALIDATION_FAILED,
                    "ValidationFailed: start_date " + start + " is after end_date " + end);
        }
        List<SeriesPoint> points = fetchDays(start, end);
        if (points.isEmpty()) {
            return ResultEnvelope.failure(ErrorKind.INSUFFICIENT_DATA,
                    "InsufficientData: no data available for statistics between " + start + " and " + end);
        }
        DemandStatisticsReport report = DemandStatistics.describe(points, dataProperties.marketOffset());
        return ResultEnvelope.ok(report, "Statistics calculated for " + report.count() + " hours of data");
    }

    private List<SeriesPoint> fetchDays(LocalDate start, LocalDate end) {
        var offset = dataProperties.marketOffset();
        Instant from = start.atStartOfDay().toInstant(offset);
        Instant to = end.plusDays(1).atStartOfDay().toInstant(offset);
        return dataSource.query(from, to, DemandQuery.ontario());
    }
}
