package com.gridcast.core.data;

/**
 * Demand measures published by the market operator.
 */
public enum DemandSeries {
    /** Province-wide demand. */
    ONTARIO_DEMAND,
    /** Total market demand, including exports. */
    MARKET_DEMAND,
    /** Demand of a single transmission zone; requires a zone filter. */
    ZONAL_DEMAND
}
