package com.phillippitts.selfspy.service.store.jdbc;

import com.phillippitts.selfspy.domain.PointerEvent;
import com.phillippitts.selfspy.domain.WindowKey;
import com.phillippitts.selfspy.domain.WindowRecord;
import com.phillippitts.selfspy.service.store.ActivityWriter;
import com.phillippitts.selfspy.service.store.PreparedKeystroke;
import com.phillippitts.selfspy.service.store.PreparedSnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * JDBC implementation of {@link ActivityWriter} for SQLite.
 *
 * <p>Each {@link #persist} runs in its own transaction bounded by the given timeout. The
 * insert steps are separate methods so each one runs against the same transactional
 * connection and a failure in any of them rolls back the whole snapshot.
 */
@Component
public class JdbcActivityWriter implements ActivityWriter {

    private static final Logger LOG = LogManager.getLogger(JdbcActivityWriter.class);

    static final String UPSERT_PROCESS = """
            INSERT INTO processes (name, bundle_id, first_seen, last_seen) VALUES (?, ?, ?, ?)
            ON CONFLICT (name, bundle_id) DO UPDATE SET
                first_seen = MIN(first_seen, excluded.first_seen),
                last_seen = MAX(last_seen, excluded.last_seen)
            """;

    static final String FIND_PROCESS = "SELECT id FROM processes WHERE name = ? AND bundle_id = ?";

    static final String INSERT_WINDOW = """
            INSERT INTO windows (title, process_id, pid, x, y, width, height, first_seen, last_seen, active_ms,
                                 continued)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    static final String LATEST_WINDOW = """
            SELECT w.id FROM windows w JOIN processes p ON p.id = w.process_id
            WHERE w.title = ? AND p.name = ? AND w.pid = ?
            ORDER BY w.last_seen DESC, w.id DESC LIMIT 1
            """;

    static final String INSERT_KEYSTROKE = """
            INSERT INTO keystroke_batches (window_id, payload, encrypted, modifiers, count, recorded_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    static final String INSERT_POINTER = """
            INSERT INTO pointer_events (window_id, x, y, button, event_type, recorded_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    private final JdbcTemplate jdbc;
    private final PlatformTransactionManager transactionManager;

    public JdbcActivityWriter(JdbcTemplate jdbc, PlatformTransactionManager transactionManager) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
        this.transactionManager = Objects.requireNonNull(transactionManager, "transactionManager");
    }

    @Override
    public int persist(PreparedSnapshot snapshot, Duration timeout) {
        TransactionTemplate tx = new TransactionTemplate(transactionManager);
        tx.setTimeout((int) Math.max(1, (timeout.toMillis() + 999) / 1000));
        Integer rows = tx.execute(status -> {
            Map<ProcessKey, Long> processIds = upsertProcesses(snapshot.windows());
            Map<WindowKey, Long> windowIds = insertWindows(snapshot.windows(), processIds);
            int inserted = snapshot.windows().size();
            inserted += insertKeystrokes(snapshot.keystrokes(), windowIds);
            inserted += insertPointerEvents(snapshot.pointerEvents(), windowIds);
            return inserted;
        });
        return rows == null ? 0 : rows;
    }

    /**
     * Creates or refreshes one process row per distinct (name, bundle id).
     */
    protected Map<ProcessKey, Long> upsertProcesses(List<WindowRecord> windows) {
        Map<ProcessKey, Instant[]> spans = new LinkedHashMap<>();
        for (WindowRecord w : windows) {
            ProcessKey key = new ProcessKey(w.key().processName(), w.bundleId());
            spans.merge(key, new Instant[]{w.firstSeen(), w.lastSeen()}, (a, b) -> new Instant[]{
                    a[0].isBefore(b[0]) ? a[0] : b[0],
                    a[1].isAfter(b[1]) ? a[1] : b[1]});
        }
        Map<ProcessKey, Long> ids = new HashMap<>();
        for (Map.Entry<ProcessKey, Instant[]> e : spans.entrySet()) {
            ProcessKey key = e.getKey();
            jdbc.update(UPSERT_PROCESS, key.name(), key.bundleId(),
                    e.getValue()[0].toEpochMilli(), e.getValue()[1].toEpochMilli());
            Long id = jdbc.queryForObject(FIND_PROCESS, Long.class, key.name(), key.bundleId());
            ids.put(key, id);
        }
        return ids;
    }

    protected Map<WindowKey, Long> insertWindows(List<WindowRecord> windows, Map<ProcessKey, Long> processIds) {
        Map<WindowKey, Long> ids = new HashMap<>();
        for (WindowRecord w : windows) {
            Long processId = processIds.get(new ProcessKey(w.key().processName(), w.bundleId()));
            jdbc.update(INSERT_WINDOW, w.key().title(), processId, w.key().processId(),
                    w.x(), w.y(), w.width(), w.height(),
                    w.firstSeen().toEpochMilli(), w.lastSeen().toEpochMilli(), w.activeMillis(),
                    w.continued() ? 1 : 0);
            ids.put(w.key(), lastInsertId());
        }
        return ids;
    }

    protected int insertKeystrokes(List<PreparedKeystroke> keystrokes, Map<WindowKey, Long> windowIds) {
        if (keystrokes.isEmpty()) {
            return 0;
        }
        Map<WindowKey, Long> resolved = new HashMap<>(windowIds);
        List<Object[]> args = new ArrayList<>(keystrokes.size());
        for (PreparedKeystroke k : keystrokes) {
            args.add(new Object[]{
                    resolve(k.windowKey(), resolved),
                    k.payload().payload(),
                    k.payload().encrypted() ? 1 : 0,
                    String.join(",", new TreeSet<>(k.modifiers())),
                    k.count(),
                    k.recordedAt().toEpochMilli()});
        }
        jdbc.batchUpdate(INSERT_KEYSTROKE, args);
        return args.size();
    }

    protected int insertPointerEvents(List<PointerEvent> events, Map<WindowKey, Long> windowIds) {
        if (events.isEmpty()) {
            return 0;
        }
        Map<WindowKey, Long> resolved = new HashMap<>(windowIds);
        List<Object[]> args = new ArrayList<>(events.size());
        for (PointerEvent e : events) {
            args.add(new Object[]{
                    resolve(e.windowKey(), resolved),
                    e.x(),
                    e.y(),
                    e.button(),
                    e.type().dbValue(),
                    e.timestamp().toEpochMilli()});
        }
        jdbc.batchUpdate(INSERT_POINTER, args);
        return args.size();
    }

    /**
     * Window id for a reference: this snapshot's record, else the latest stored window with
     * the same key, else null.
     */
    private Long resolve(WindowKey key, Map<WindowKey, Long> cache) {
        if (key == null) {
            return null;
        }
        if (cache.containsKey(key)) {
            return cache.get(key);
        }
        List<Long> found = jdbc.queryForList(LATEST_WINDOW, Long.class, key.title(), key.processName(), key.processId());
        Long id = found.isEmpty() ? null : found.get(0);
        if (id == null) {
            LOG.debug("No stored window for reference; storing NULL window_id (process={})", key.processName());
        }
        cache.put(key, id);
        return id;
    }

    private long lastInsertId() {
        Long id = jdbc.queryForObject("SELECT last_insert_rowid()", Long.class);
        if (id == null) {
            throw new IllegalStateException("last_insert_rowid() returned null");
        }
        return id;
    }

    @Override
    public long openSession(Instant start) {
        // same connection for the insert and last_insert_rowid()
        Long id = new TransactionTemplate(transactionManager).execute(status -> {
            jdbc.update("INSERT INTO sessions (start_time, end_time) VALUES (?, NULL)", start.toEpochMilli());
            return lastInsertId();
        });
        return Objects.requireNonNull(id, "session id");
    }

    @Override
    public void touchSession(long sessionId, Instant end) {
        jdbc.update("UPDATE sessions SET end_time = ? WHERE id = ?", end.toEpochMilli(), sessionId);
    }

    @Override
    public void closeSession(long sessionId, Instant end) {
        int updated = jdbc.update("UPDATE sessions SET end_time = ? WHERE id = ?", end.toEpochMilli(), sessionId);
        if (updated == 0) {
            LOG.warn("Session {} not found when closing", sessionId);
        }
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

    /**
     * Identity of a process row.
     */
    protected record ProcessKey(String name, String bundleId) {
    }
}
