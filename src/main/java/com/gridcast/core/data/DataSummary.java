package com.gridcast.core.data;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Aggregate view of the whole demand table.
 */
public record DataSummary(
    @JsonProperty("total_rows") long totalRows,
    Instant earliest,
    Instant latest,
    @JsonProperty("min_demand_mw") double minDemand,
    @JsonProperty("max_demand_mw") double maxDemand,
    @JsonProperty("avg_demand_mw") double avgDemand
) {

    public boolean isEmpty() {
        return totalRows == 0;
    }
}
