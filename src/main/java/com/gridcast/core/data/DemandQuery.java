package com.gridcast.core.data;

import java.util.Locale;

/**
 * Filters applied to a demand query.
 *
 * @param series which demand measure to read
 * @param zone   zone name for {@link DemandSeries#ZONAL_DEMAND}, otherwise {@code null}
 */
public record DemandQuery(DemandSeries series, String zone) {

    public DemandQuery {
        series = series == null ? DemandSeries.ONTARIO_DEMAND : series;
        zone = zone == null || zone.isBlank() ? null : zone.trim();
        if (series == DemandSeries.ZONAL_DEMAND && zone == null) {
            throw new IllegalArgumentException("A zone is required for zonal demand");
        }
    }

    public static DemandQuery ontario() {
        return new DemandQuery(DemandSeries.ONTARIO_DEMAND, null);
    }

    public static DemandQuery of(DemandSeries series, String zone) {
        if (zone != null && !zone.isBlank() && series != DemandSeries.ZONAL_DEMAND) {
            return new DemandQuery(DemandSeries.ZONAL_DEMAND, zone);
        }
        return new DemandQuery(series, zone);
    }

    /**
     * Key identifying the forecasting target this query describes.
     */
    public String targetKey() {
        String base = series.name().toLowerCase(Locale.ROOT);
        return zone == null ? base : base + ":" + zone.toLowerCase(Locale.ROOT);
    }
}
