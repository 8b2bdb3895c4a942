package com.gridcast.core.data;

import com.gridcast.core.model.SeriesPoint;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to historical hourly demand.
 */
public interface DemandDataSource {

    /**
     * Points with {@code start <= timestamp < end}, ordered by timestamp.
     *
     * @throws DataSourceException if the store cannot be read
     */
    List<SeriesPoint> query(Instant start, Instant end, DemandQuery filters);

    /**
     * Timestamp of the newest province-wide data point, empty when there is no data.
     */
    Optional<Instant> latestTimestamp();

    /**
     * Aggregates over the province-wide series.
     */
    DataSummary summary();
}
