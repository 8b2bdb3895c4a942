package com.gridcast.core.data;

import com.gridcast.core.model.SeriesPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads hourly demand from the market operator tables over plain JDBC.
 * <p>
 * Rows carry a calendar date and an hour-ending value 1..24 in market time;
 * each row becomes a {@link SeriesPoint} stamped with the start of its hour.
 */
@Repository
public class JdbcDemandDataSource implements DemandDataSource {

    private static final Logger log = LoggerFactory.getLogger(JdbcDemandDataSource.class);

    private final DataSource dataSource;
    private final DemandDataProperties properties;

    public JdbcDemandDataSource(DataSource dataSource, DemandDataProperties properties) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.properties = properties;
    }

    @Override
    public List<SeriesPoint> query(Instant start, Instant end, DemandQuery filters) {
        ZoneOffset offset = properties.marketOffset();
        LocalDate firstDate = start.atOffset(offset).toLocalDate();
        LocalDate lastDate = end.atOffset(offset).toLocalDate();

        String sql;
        if (filters.series() == DemandSeries.ZONAL_DEMAND) {
            sql = """
                    SELECT "%s", "%s", "%s" FROM %s
                    WHERE "%s" >= ? AND "%s" <= ? AND "%s" = ?
                    ORDER BY "%s", "%s"
                    """.formatted(properties.getDateColumn(), properties.getHourColumn(),
                    properties.getZonalValueColumn(), properties.getZonalTable(),
                    properties.getDateColumn(), properties.getDateColumn(), properties.getZoneColumn(),
                    properties.getDateColumn(), properties.getHourColumn());
        } else {
            String valueColumn = filters.series() == DemandSeries.MARKET_DEMAND
                    ? properties.getMarketColumn()
                    : properties.getOntarioColumn();
            sql = """
                    SELECT "%s", "%s", "%s" FROM %s
                    WHERE "%s" >= ? AND "%s" <= ?
                    ORDER BY "%s", "%s"
                    """.formatted(properties.getDateColumn(), properties.getHourColumn(), valueColumn,
                    properties.getDemandTable(), properties.getDateColumn(), properties.getDateColumn(),
                    properties.getDateColumn(), properties.getHourColumn());
        }

        var points = new ArrayList<SeriesPoint>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setDate(1, Date.valueOf(firstDate));
            stmt.setDate(2, Date.valueOf(lastDate));
            if (filters.series() == DemandSeries.ZONAL_DEMAND) {
                stmt.setString(3, filters.zone());
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    Instant timestamp = toInstant(rs.getDate(1).toLocalDate(), rs.getInt(2), offset);
                    double value = rs.getDouble(3);
                    if (rs.wasNull()) {
                        continue;
                    }
                    if (!timestamp.isBefore(start) && timestamp.isBefore(end)) {
                        points.add(new SeriesPoint(timestamp, value));
                    }
                }
            }
        } catch (SQLException e) {
            throw new DataSourceException("Failed to fetch " + filters.targetKey() + " demand data: " + e.getMessage(), e);
        }
        log.debug("Fetched {} {} points between {} and {}", points.size(), filters.targetKey(), start, end);
        return points;
    }

    @Override
    public Optional<Instant> latestTimestamp() {
        return edgeTimestamp("DESC");
    }

    @Override
    public DataSummary summary() {
        String sql = """
                SELECT COUNT(*), MIN("%s"), MAX("%s"), AVG("%s") FROM %s
                """.formatted(properties.getOntarioColumn(), properties.getOntarioColumn(),
                properties.getOntarioColumn(), properties.getDemandTable());
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            if (!rs.next() || rs.getLong(1) == 0) {
                return new DataSummary(0, null, null, 0, 0, 0);
            }
            long rows = rs.getLong(1);
            double min = rs.getDouble(2);
            double max = rs.getDouble(3);
            double avg = rs.getDouble(4);
            return new DataSummary(rows, edgeTimestamp("ASC").orElse(null), edgeTimestamp("DESC").orElse(null),
                    min, max, avg);
        } catch (SQLException e) {
            throw new DataSourceException("Failed to summarize demand data: " + e.getMessage(), e);
        }
    }

    private Optional<Instant> edgeTimestamp(String direction) {
        String sql = """
                SELECT "%s", "%s" FROM %s
                ORDER BY "%s" %s, "%s" %s
                LIMIT 1
                """.formatted(properties.getDateColumn(), properties.getHourColumn(), properties.getDemandTable(),
                properties.getDateColumn(), direction, properties.getHourColumn(), direction);
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            if (!rs.next()) {
                return Optional.empty();
            }
            return Optional.of(toInstant(rs.getDate(1).toLocalDate(), rs.getInt(2), properties.marketOffset()));
        } catch (SQLException e) {
            throw new DataSourceException("Failed to read demand data bounds: " + e.getMessage(), e);
        }
    }

    static Instant toInstant(LocalDate date, int hourEnding, ZoneOffset offset) {
        return date.atStartOfDay().plusHours(hourEnding - 1L).toInstant(offset);
    }
}
