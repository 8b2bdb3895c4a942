package com.gridcast.core.decisionlog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gridcast.core.model.AgentPhase;
import com.gridcast.core.model.ErrorKind;
import com.gridcast.core.model.ForecastResult;
import com.gridcast.core.model.PhaseRecord;
import com.gridcast.core.model.SessionStatus;
import com.gridcast.core.model.SessionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * PostgreSQL-backed {@link DecisionLedger}.
 * <p>
 * Phase records go to {@code gridcast_decision_log} as
 * {@code (session_id, recorded_at, phase, rationale, invocations)} rows with the
 * invocation digests serialized as JSON. Terminal summaries go to
 * {@code gridcast_session_outcomes}. Both tables are insert-only; the database
 * sequence provides atomic ordering across concurrent sessions.
 */
public class JdbcDecisionLedger implements DecisionLedger {

    private static final Logger log = LoggerFactory.getLogger(JdbcDecisionLedger.class);

    private static final String LOG_TABLE = "gridcast_decision_log";
    private static final String OUTCOME_TABLE = "gridcast_session_outcomes";

    private static final String CREATE_LOG_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                sequence          BIGSERIAL PRIMARY KEY,
                session_id        VARCHAR(64) NOT NULL,
                recorded_at       TIMESTAMP WITH TIME ZONE NOT NULL,
                phase             VARCHAR(32) NOT NULL,
                rationale         TEXT,
                invocations       TEXT NOT NULL,
                corrects_sequence BIGINT REFERENCES %s (sequence)
            )
            """.formatted(LOG_TABLE, LOG_TABLE);

    private static final String CREATE_OUTCOME_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                sequence     BIGSERIAL PRIMARY KEY,
                session_id   VARCHAR(64) NOT NULL,
                goal         TEXT,
                status       VARCHAR(16) NOT NULL,
                final_phase  VARCHAR(16) NOT NULL,
                reason       TEXT,
                error_kind   VARCHAR(48),
                iterations   INTEGER NOT NULL,
                forecast     TEXT,
                started_at   TIMESTAMP WITH TIME ZONE,
                finished_at  TIMESTAMP WITH TIME ZONE
            )
            """.formatted(OUTCOME_TABLE);

    private static final String INSERT_ENTRY_SQL = """
            INSERT INTO %s (session_id, recorded_at, phase, rationale, invocations, corrects_sequence)
            VALUES (?, ?, ?, ?, ?, ?)
            RETURNING sequence
            """.formatted(LOG_TABLE);

    private static final String SELECT_ENTRIES_SQL = """
            SELECT sequence, session_id, recorded_at, phase, rationale, invocations, corrects_sequence
            FROM %s
            WHERE session_id = ?
            ORDER BY sequence ASC
            """.formatted(LOG_TABLE);

    private static final String INSERT_OUTCOME_SQL = """
            INSERT INTO %s (session_id, goal, status, final_phase, reason, error_kind, iterations,
                            forecast, started_at, finished_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(OUTCOME_TABLE);

    private static final String SELECT_OUTCOMES_SQL = """
            SELECT session_id, goal, status, final_phase, reason, error_kind, iterations,
                   forecast, started_at, finished_at
            FROM %s
            ORDER BY sequence DESC
            LIMIT ?
            """.formatted(OUTCOME_TABLE);

    private static final TypeReference<List<Map<String, Object>>> DIGEST_LIST = new TypeReference<>() {};

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcDecisionLedger(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper must not be null");
    }

    /**
     * Creates the ledger tables if they do not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement logStmt = conn.prepareStatement(CREATE_LOG_TABLE_SQL);
             PreparedStatement outcomeStmt = conn.prepareStatement(CREATE_OUTCOME_TABLE_SQL)) {
            logStmt.execute();
            outcomeStmt.execute();
            log.info("Ledger tables '{}' and '{}' ensured", LOG_TABLE, OUTCOME_TABLE);
        }
    }

    @Override
    public LedgerEntry appendPhase(String sessionId, PhaseRecord record) {
        var digests = record.invocations().stream().map(DecisionLedger::digest).toList();
        return insertEntry(sessionId, record.timestamp(), record.phase().name(), record.rationale(), digests, null);
    }

    @Override
    public LedgerEntry appendCorrection(String sessionId, long correctedSequence, String rationale, Instant timestamp) {
        return insertEntry(sessionId, timestamp, LedgerEntry.CORRECTION_PHASE, rationale, List.of(), correctedSequence);
    }

    @Override
    public void appendOutcome(SessionSummary summary) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_OUTCOME_SQL)) {
            stmt.setString(1, summary.sessionId());
            stmt.setString(2, summary.goal());
            stmt.setString(3, summary.status().name());
            stmt.setString(4, summary.finalPhase().name());
            stmt.setString(5, summary.reason());
            stmt.setString(6, summary.errorKind() != null ? summary.errorKind().name() : null);
            stmt.setInt(7, summary.iterations());
            stmt.setString(8, summary.forecast() != null ? objectMapper.writeValueAsString(summary.forecast()) : null);
            stmt.setTimestamp(9, toTimestamp(summary.startedAt()));
            stmt.setTimestamp(10, toTimestamp(summary.finishedAt()));
            stmt.executeUpdate();
            log.debug("Recorded outcome {} for session {}", summary.status(), summary.sessionId());
        } catch (SQLException | JsonProcessingException e) {
            throw new DecisionLedgerException("Failed to record outcome for session " + summary.sessionId(), e);
        }
    }

    @Override
    public List<LedgerEntry> entries(String sessionId) {
        var entries = new ArrayList<LedgerEntry>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ENTRIES_SQL)) {
            stmt.setString(1, sessionId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    long correctsValue = rs.getLong("corrects_sequence");
                    Long corrects = rs.wasNull() ? null : correctsValue;
                    entries.add(new LedgerEntry(
                            rs.getLong("sequence"),
                            rs.getString("session_id"),
                            rs.getTimestamp("recorded_at").toInstant(),
                            rs.getString("phase"),
                            rs.getString("rationale"),
                            objectMapper.readValue(rs.getString("invocations"), DIGEST_LIST),
                            corrects));
                }
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new DecisionLedgerException("Failed to read ledger entries for session " + sessionId, e);
        }
        return entries;
    }

    @Override
    public List<SessionSummary> recentOutcomes(int limit) {
        var outcomes = new ArrayList<SessionSummary>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_OUTCOMES_SQL)) {
            stmt.setInt(1, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String forecastJson = rs.getString("forecast");
                    String errorKind = rs.getString("error_kind");
                    outcomes.add(new SessionSummary(
                            rs.getString("session_id"),
                            rs.getString("goal"),
                            SessionStatus.valueOf(rs.getString("status")),
                            AgentPhase.valueOf(rs.getString("final_phase")),
                            rs.getString("reason"),
                            errorKind != null ? ErrorKind.valueOf(errorKind) : null,
                            rs.getInt("iterations"),
                            forecastJson != null ? objectMapper.readValue(forecastJson, ForecastResult.class) : null,
                            toInstant(rs.getTimestamp("started_at")),
                            toInstant(rs.getTimestamp("finished_at")),
                            List.of()));
                }
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new DecisionLedgerException("Failed to read recent session outcomes", e);
        }
        return outcomes;
    }

    private LedgerEntry insertEntry(String sessionId, Instant timestamp, String phase, String rationale,
                                    List<Map<String, Object>> digests, Long corrects) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_ENTRY_SQL)) {
            stmt.setString(1, sessionId);
            stmt.setTimestamp(2, toTimestamp(timestamp));
            stmt.setString(3, phase);
            stmt.setString(4, rationale);
            stmt.setString(5, objectMapper.writeValueAsString(digests));
            if (corrects != null) {
                stmt.setLong(6, corrects);
            } else {
                stmt.setNull(6, Types.BIGINT);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("Insert into " + LOG_TABLE + " returned no sequence");
                }
                return new LedgerEntry(rs.getLong(1), sessionId, timestamp, phase, rationale, digests, corrects);
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new DecisionLedgerException("Failed to append " + phase + " entry for session " + sessionId, e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
