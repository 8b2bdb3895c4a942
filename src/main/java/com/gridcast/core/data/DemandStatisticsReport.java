package com.gridcast.core.data;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Descriptive statistics of a demand window. Hours are hour-ending values 1..24 in market time.
 */
public record DemandStatisticsReport(
    int count,
    @JsonProperty("mean_demand_mw") double mean,
    @JsonProperty("median_demand_mw") double median,
    @JsonProperty("std_dev_mw") double stdDev,
    @JsonProperty("min_demand_mw") double min,
    @JsonProperty("max_demand_mw") double max,
    Map<String, Double> percentiles,
    @JsonProperty("peak_hour") int peakHour,
    @JsonProperty("peak_hour_avg_mw") double peakHourAverage,
    @JsonProperty("min_hour") int minHour,
    @JsonProperty("min_hour_avg_mw") double minHourAverage
) {}
