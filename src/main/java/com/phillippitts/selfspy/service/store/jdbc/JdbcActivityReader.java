package com.phillippitts.selfspy.service.store.jdbc;

import com.phillippitts.selfspy.exception.StoreUnavailableException;
import com.phillippitts.selfspy.service.store.ActivityCounts;
import com.phillippitts.selfspy.service.store.ActivityReader;
import com.phillippitts.selfspy.service.store.AppDurationRow;
import com.phillippitts.selfspy.service.store.ExportData;
import com.phillippitts.selfspy.service.store.KeystrokeRow;
import com.phillippitts.selfspy.service.store.PointerRow;
import com.phillippitts.selfspy.service.store.ProcessRow;
import com.phillippitts.selfspy.service.store.SessionRow;
import com.phillippitts.selfspy.service.store.WindowRow;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * JDBC implementation of {@link ActivityReader}. Connection-level failures surface as
 * {@link StoreUnavailableException}; other data access errors propagate unchanged.
 */
@Component
public class JdbcActivityReader implements ActivityReader {

    private static final Logger LOG = LogManager.getLogger(JdbcActivityReader.class);

    private static final String COUNTS = """
            SELECT
              (SELECT COALESCE(SUM(count), 0) FROM keystroke_batches WHERE recorded_at BETWEEN ?1 AND ?2),
              (SELECT COUNT(*) FROM pointer_events WHERE recorded_at BETWEEN ?1 AND ?2),
              (SELECT COUNT(*) FROM pointer_events WHERE recorded_at BETWEEN ?1 AND ?2 AND event_type = 'click'),
              (SELECT COUNT(*) FROM windows WHERE first_seen BETWEEN ?1 AND ?2 AND continued = 0)
            """;

    private static final String SESSIONS = """
            SELECT id, start_time, end_time FROM sessions
            WHERE start_time <= ?2 AND (end_time IS NULL OR end_time >= ?1)
            ORDER BY start_time
            """;

    private static final String APP_DURATIONS = """
            SELECT p.name AS name,
                   SUM(w.active_ms) AS duration_ms,
                   COUNT(CASE WHEN w.continued = 0 THEN 1 END) AS window_count,
                   COALESCE(SUM(k.cnt), 0) + COALESCE(SUM(m.cnt), 0) AS event_count
            FROM windows w
            JOIN processes p ON p.id = w.process_id
            LEFT JOIN (SELECT window_id, SUM(count) AS cnt FROM keystroke_batches
                       WHERE recorded_at BETWEEN ?1 AND ?2 GROUP BY window_id) k ON k.window_id = w.id
            LEFT JOIN (SELECT window_id, COUNT(*) AS cnt FROM pointer_events
                       WHERE recorded_at BETWEEN ?1 AND ?2 GROUP BY window_id) m ON m.window_id = w.id
            WHERE w.first_seen BETWEEN ?1 AND ?2
            GROUP BY p.name
            """;

    private static final String EXPORT_PROCESSES = """
            SELECT id, name, bundle_id, first_seen, last_seen FROM processes
            WHERE id IN (SELECT process_id FROM windows WHERE first_seen BETWEEN ?1 AND ?2)
            ORDER BY id
            """;

    private static final String EXPORT_WINDOWS = """
            SELECT id, title, process_id, pid, x, y, width, height, first_seen, last_seen, active_ms, continued
            FROM windows WHERE first_seen BETWEEN ?1 AND ?2 ORDER BY id
            """;

    private static final String EXPORT_KEYSTROKES = """
            SELECT id, window_id, payload, encrypted, modifiers, count, recorded_at
            FROM keystroke_batches WHERE recorded_at BETWEEN ?1 AND ?2 ORDER BY id
            """;

    private static final String EXPORT_POINTER = """
            SELECT id, window_id, x, y, button, event_type, recorded_at
            FROM pointer_events WHERE recorded_at BETWEEN ?1 AND ?2 ORDER BY id
            """;

    private static final RowMapper<SessionRow> SESSION_MAPPER = (rs, n) ->
            new SessionRow(rs.getLong("id"), instant(rs, "start_time"), nullableInstant(rs, "end_time"));

    private final JdbcTemplate jdbc;

    public JdbcActivityReader(JdbcTemplate jdbc) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    }

    @Override
    public ActivityCounts counts(Instant from, Instant to) {
        return guarded("counts", () -> jdbc.queryForObject(COUNTS,
                (rs, n) -> new ActivityCounts(rs.getLong(1), rs.getLong(2), rs.getLong(3), rs.getLong(4)),
                from.toEpochMilli(), to.toEpochMilli()));
    }

    @Override
    public List<SessionRow> sessionsOverlapping(Instant from, Instant to) {
        return guarded("sessions", () -> jdbc.query(SESSIONS, SESSION_MAPPER, from.toEpochMilli(), to.toEpochMilli()));
    }

    @Override
    public List<AppDurationRow> appDurations(Instant from, Instant to) {
        return guarded("app durations", () -> jdbc.query(APP_DURATIONS,
                (rs, n) -> new AppDurationRow(rs.getString("name"), rs.getLong("duration_ms"),
                        rs.getLong("window_count"), rs.getLong("event_count")),
                from.toEpochMilli(), to.toEpochMilli()));
    }

    @Override
    public ExportData export(Instant from, Instant to) {
        long a = from.toEpochMilli();
        long b = to.toEpochMilli();
        return guarded("export", () -> new ExportData(
                jdbc.query(EXPORT_PROCESSES, (rs, n) -> new ProcessRow(rs.getLong("id"), rs.getString("name"),
                        rs.getString("bundle_id"), instant(rs, "first_seen"), instant(rs, "last_seen")), a, b),
                jdbc.query(EXPORT_WINDOWS, (rs, n) -> new WindowRow(rs.getLong("id"), rs.getString("title"),
                        rs.getLong("process_id"), rs.getInt("pid"), rs.getInt("x"), rs.getInt("y"),
                        rs.getInt("width"), rs.getInt("height"), instant(rs, "first_seen"),
                        instant(rs, "last_seen"), rs.getLong("active_ms"), rs.getInt("continued") != 0), a, b),
                jdbc.query(EXPORT_KEYSTROKES, (rs, n) -> new KeystrokeRow(rs.getLong("id"),
                        nullableLong(rs, "window_id"), rs.getString("payload"), rs.getInt("encrypted") != 0,
                        rs.getString("modifiers"), rs.getInt("count"), instant(rs, "recorded_at")), a, b),
                jdbc.query(EXPORT_POINTER, (rs, n) -> new PointerRow(rs.getLong("id"),
                        nullableLong(rs, "window_id"), rs.getInt("x"), rs.getInt("y"), rs.getString("button"),
                        rs.getString("event_type"), instant(rs, "recorded_at")), a, b),
                jdbc.query(SESSIONS, SESSION_MAPPER, a, b)));
    }

    @Override
    public boolean isAvailable() {
        try {
            jdbc.queryForObject("SELECT 1", Integer.class);
            return true;
        } catch (DataAccessException e) {
            LOG.debug("Store probe failed: {}", e.getMessage());
            return false;
        }
    }

    private static <T> T guarded(String what, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessResourceException e) {
            throw new StoreUnavailableException("Activity store unavailable while reading " + what, e);
        }
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        return Instant.ofEpochMilli(rs.getLong(column));
    }

    private static Instant nullableInstant(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(value);
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
