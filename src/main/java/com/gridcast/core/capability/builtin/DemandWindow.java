package com.gridcast.core.capability.builtin;

import com.gridcast.core.capability.CapabilityArguments;
import com.gridcast.core.data.DemandDataProperties;
import com.gridcast.core.data.DemandQuery;
import com.gridcast.core.data.DemandSeries;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Query window resolved from the common {@code start_date}/{@code end_date}/{@code days_back}/
 * {@code series}/{@code zone} arguments. Explicit dates are whole market days, end inclusive.
 */
record DemandWindow(Instant start, Instant end, DemandQuery query) {

    static DemandWindow resolve(CapabilityArguments args, DemandDataProperties properties, Clock clock,
                                int defaultDaysBack) {
        DemandQuery query = DemandQuery.of(
                args.enumValue("series", DemandSeries.class, DemandSeries.ONTARIO_DEMAND),
                args.string("zone").orElse(null));
        ZoneOffset offset = properties.marketOffset();
        var startDate = args.date("start_date");
        var endDate = args.date("end_date");
        if (startDate.isPresent() || endDate.isPresent()) {
            LocalDate last = endDate.orElseGet(() -> LocalDate.now(clock.withZone(offset)));
            LocalDate first = startDate.orElseGet(() -> last.minusDays(defaultDaysBack));
            if (first.isAfter(last)) {
                throw new IllegalArgumentException("start_date " + first + " is after end_date " + last);
            }
            return new DemandWindow(first.atStartOfDay().toInstant(offset),
                    last.plusDays(1).atStartOfDay().toInstant(offset), query);
        }
        Instant end = clock.instant();
        int days = args.integer("days_back", defaultDaysBack);
        return new DemandWindow(end.minus(Duration.ofDays(days)), end, query);
    }

    static LocalDate marketDate(Instant instant, DemandDataProperties properties) {
        return instant.atOffset(properties.marketOffset()).toLocalDate();
    }
}
