package com.phillippitts.selfspy.service.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.opencsv.CSVWriter;
import com.phillippitts.selfspy.config.properties.ReportingProperties;
import com.phillippitts.selfspy.domain.ExportFormat;
import com.phillippitts.selfspy.exception.EncryptionException;
import com.phillippitts.selfspy.exception.SelfspyException;
import com.phillippitts.selfspy.service.crypto.KeystrokeProtector;
import com.phillippitts.selfspy.service.store.ActivityReader;
import com.phillippitts.selfspy.service.store.ExportData;
import com.phillippitts.selfspy.service.store.KeystrokeRow;
import com.phillippitts.selfspy.service.store.PointerRow;
import com.phillippitts.selfspy.service.store.ProcessRow;
import com.phillippitts.selfspy.service.store.SessionRow;
import com.phillippitts.selfspy.service.store.WindowRow;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Serializes stored activity for a day range as JSON, CSV or SQL text.
 *
 * <p>Pure read-then-serialize: nothing is written to the store. Keystroke payloads are
 * exported as stored unless {@code selfspy.reporting.decrypt-exports} is on and a key is
 * configured; a payload that fails to decrypt is exported empty.
 */
@Service
public class ActivityExporter {

    private static final Logger LOG = LogManager.getLogger(ActivityExporter.class);

    static final String[] CSV_HEADER = {
            "record_type", "id", "parent_id", "name", "title", "bundle_id", "pid",
            "x", "y", "width", "height", "button", "event_type",
            "payload", "encrypted", "modifiers", "count", "active_ms", "start", "end"
    };

    private final ActivityReader reader;
    private final KeystrokeProtector protector;
    private final ReportingProperties props;
    private final ObjectMapper mapper;
    private final Clock clock;

    public ActivityExporter(ActivityReader reader,
                            KeystrokeProtector protector,
                            ReportingProperties props,
                            ObjectMapper mapper,
                            Clock clock) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.protector = Objects.requireNonNull(protector, "protector");
        this.props = Objects.requireNonNull(props, "props");
        this.mapper = mapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @param days window ending now; 0 exports an empty range
     * @throws IllegalArgumentException if days is negative
     * @throws com.phillippitts.selfspy.exception.StoreUnavailableException if the store cannot be read
     */
    public String exportRange(int days, ExportFormat format) {
        if (days < 0) {
            throw new IllegalArgumentException("days must be >= 0, was " + days);
        }
        Objects.requireNonNull(format, "format");
        Instant to = clock.instant();
        Instant from = to.minus(Duration.ofDays(days));
        ExportData data = days == 0
                ? new ExportData(List.of(), List.of(), List.of(), List.of(), List.of())
                : reader.export(from, to);
        if (props.isDecryptExports()) {
            data = decryptPayloads(data);
        }
        LOG.info("Exporting {} day(s) as {}: windows={}, keystrokes={}, pointerEvents={}",
                days, format, data.windows().size(), data.keystrokes().size(), data.pointerEvents().size());
        return switch (format) {
            case JSON -> toJson(data, from, to, days);
            case CSV -> toCsv(data);
            case SQL -> toSql(data);
        };
    }

    private ExportData decryptPayloads(ExportData data) {
        if (!protector.isEncrypting()) {
            LOG.warn("Export decryption requested but no key is configured; exporting payloads as stored");
            return data;
        }
        int failed = 0;
        List<KeystrokeRow> rows = new ArrayList<>(data.keystrokes().size());
        for (KeystrokeRow row : data.keystrokes()) {
            if (!row.encrypted()) {
                rows.add(row);
                continue;
            }
            try {
                rows.add(row.decrypted(protector.reveal(row.payload(), true)));
            } catch (EncryptionException e) {
                failed++;
                rows.add(row.withoutPayload());
            }
        }
        if (failed > 0) {
            LOG.warn("{} keystroke payload(s) could not be decrypted and were exported empty", failed);
        }
        return new ExportData(data.processes(), data.windows(), rows, data.pointerEvents(), data.sessions());
    }

    String toJson(ExportData data, Instant from, Instant to, int days) {
        Map<String, Object> range = new LinkedHashMap<>();
        range.put("from", from);
        range.put("to", to);
        range.put("days", days);

        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("range", range);
        doc.put("processes", data.processes());
        doc.put("windows", data.windows());
        doc.put("keystrokes", data.keystrokes());
        doc.put("pointerEvents", data.pointerEvents());
        doc.put("sessions", data.sessions());
        try {
            return mapper.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new SelfspyException("Failed to serialize export as JSON", e);
        }
    }

    String toCsv(ExportData data) {
        StringWriter out = new StringWriter();
        try (CSVWriter csv = new CSVWriter(out)) {
            csv.writeNext(CSV_HEADER, false);
            for (ProcessRow p : data.processes()) {
                csv.writeNext(row("process", p.id(), null, p.name(), null, p.bundleId(), null,
                        null, null, null, null, null, null, null, null, null, null, null,
                        p.firstSeen(), p.lastSeen()), false);
            }
            for (WindowRow w : data.windows()) {
                csv.writeNext(row("window", w.id(), w.processId(), null, w.title(), null, w.pid(),
                        w.x(), w.y(), w.width(), w.height(), null, null, null, null, null, null, w.activeMillis(),
                        w.firstSeen(), w.lastSeen()), false);
            }
            for (KeystrokeRow k : data.keystrokes()) {
                csv.writeNext(row("keystroke", k.id(), k.windowId(), null, null, null, null,
                        null, null, null, null, null, null, k.payload(), k.encrypted(), k.modifiers(), k.count(), null,
                        k.recordedAt(), null), false);
            }
            for (PointerRow m : data.pointerEvents()) {
                csv.writeNext(row("pointer", m.id(), m.windowId(), null, null, null, null,
                        m.x(), m.y(), null, null, m.button(), m.eventType(), null, null, null, null, null,
                        m.recordedAt(), null), false);
            }
            for (SessionRow s : data.sessions()) {
                csv.writeNext(row("session", s.id(), null, null, null, null, null,
                        null, null, null, null, null, null, null, null, null, null, null,
                        s.startTime(), s.endTime()), false);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV export", e);
        }
        return out.toString();
    }

    private static String[] row(Object... values) {
        String[] cells = new String[values.length];
        for (int i = 0; i < values.length; i++) {
            cells[i] = values[i] == null ? "" : String.valueOf(values[i]);
        }
        return cells;
    }

    String toSql(ExportData data) {
        StringBuilder sql = new StringBuilder("BEGIN TRANSACTION;\n");
        for (ProcessRow p : data.processes()) {
            insert(sql, "processes", "id, name, bundle_id, first_seen, last_seen",
                    p.id(), p.name(), p.bundleId(), p.firstSeen(), p.lastSeen());
        }
        for (WindowRow w : data.windows()) {
            insert(sql, "windows",
                    "id, title, process_id, pid, x, y, width, height, first_seen, last_seen, active_ms, continued",
                    w.id(), w.title(), w.processId(), w.pid(), w.x(), w.y(), w.width(), w.height(),
                    w.firstSeen(), w.lastSeen(), w.activeMillis(), w.continued() ? 1 : 0);
        }
        for (KeystrokeRow k : data.keystrokes()) {
            insert(sql, "keystroke_batches", "id, window_id, payload, encrypted, modifiers, count, recorded_at",
                    k.id(), k.windowId(), k.payload(), k.encrypted() ? 1 : 0, k.modifiers(), k.count(), k.recordedAt());
        }
        for (PointerRow m : data.pointerEvents()) {
            insert(sql, "pointer_events", "id, window_id, x, y, button, event_type, recorded_at",
                    m.id(), m.windowId(), m.x(), m.y(), m.button(), m.eventType(), m.recordedAt());
        }
        for (SessionRow s : data.sessions()) {
            insert(sql, "sessions", "id, start_time, end_time", s.id(), s.startTime(), s.endTime());
        }
        return sql.append("COMMIT;\n").toString();
    }

    private static void insert(StringBuilder sql, String table, String columns, Object... values) {
        sql.append("INSERT INTO ").append(table).append(" (").append(columns).append(") VALUES (");
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append(literal(values[i]));
        }
        sql.append(");\n");
    }

    static String literal(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Number n) {
            return n.toString();
        }
        if (value instanceof Instant t) {
            return Long.toString(t.toEpochMilli());
        }
        return "'" + value.toString().replace("'", "''") + "'";
    }
}
