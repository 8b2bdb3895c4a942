package com.gridcast.core.data;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Completeness and plausibility assessment of a demand window.
 *
 * @param valid true when completeness is at least 95% and fewer than 1% of values are outliers
 */
public record DataQualityReport(
    @JsonProperty("is_valid") boolean valid,
    @JsonProperty("expected_hours") long expectedHours,
    @JsonProperty("actual_hours") int actualHours,
    @JsonProperty("missing_hours") long missingHours,
    @JsonProperty("completeness_pct") double completenessPct,
    @JsonProperty("outlier_count") int outlierCount,
    @JsonProperty("gap_count") int gapCount,
    List<String> issues
) {

    @JsonProperty("has_gaps")
    public boolean hasGaps() {
        return gapCount > 0;
    }
}
