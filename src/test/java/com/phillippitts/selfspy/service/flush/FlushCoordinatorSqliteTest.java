package com.phillippitts.selfspy.service.flush;

import com.phillippitts.selfspy.config.properties.BufferProperties;
import com.phillippitts.selfspy.config.properties.FlushProperties;
import com.phillippitts.selfspy.domain.PointerEvent;
import com.phillippitts.selfspy.domain.WindowKey;
import com.phillippitts.selfspy.service.buffer.EventBuffer;
import com.phillippitts.selfspy.service.crypto.KeystrokeProtector;
import com.phillippitts.selfspy.service.metrics.ActivityMetrics;
import com.phillippitts.selfspy.service.store.jdbc.JdbcActivityWriter;
import com.phillippitts.selfspy.testutil.CapturingPublisher;
import com.phillippitts.selfspy.testutil.MutableClock;
import com.phillippitts.selfspy.testutil.SqliteTestDatabase;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static com.phillippitts.selfspy.testutil.TestEvents.click;
import static com.phillippitts.selfspy.testutil.TestEvents.key;
import static com.phillippitts.selfspy.testutil.TestEvents.window;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Retry against a real SQLite store: a failed attempt leaves no partial rows behind.
 */
class FlushCoordinatorSqliteTest {

    private static final Instant T0 = Instant.parse("2026-01-05T10:00:00Z");
    private static final WindowKey W1 = new WindowKey("Doc", "editor", 10);
    private static final List<String> TABLES =
            List.of("processes", "windows", "keystroke_batches", "pointer_events", "sessions");

    @TempDir
    Path tempDir;

    private final CapturingPublisher publisher = new CapturingPublisher();
    private final ActivityMetrics metrics = new ActivityMetrics(new SimpleMeterRegistry());
    private final MutableClock clock = new MutableClock(T0);
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    private ThreadPoolTaskScheduler scheduler;
    private SqliteTestDatabase retried;
    private SqliteTestDatabase clean;

    @BeforeEach
    void setUp() throws IOException {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.initialize();
        retried = new SqliteTestDatabase(Files.createDirectories(tempDir.resolve("retried")));
        clean = new SqliteTestDatabase(Files.createDirectories(tempDir.resolve("clean")));
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
        retried.close();
        clean.close();
    }

    private FlushResult flushSampleActivity(JdbcActivityWriter writer) {
        EventBuffer buffer = new EventBuffer(BufferProperties.defaults(), publisher, metrics);
        buffer.addWindow(window("Doc", "editor", 10, T0));
        buffer.addKeystroke(key("a", W1, T0.plusSeconds(1)));
        buffer.addKeystroke(key("b", W1, T0.plusSeconds(2)));
        buffer.addPointerEvent(click(W1, T0.plusSeconds(3)));
        FlushProperties props = new FlushProperties();
        props.setMaxAttempts(3);
        FlushCoordinator coordinator = new FlushCoordinator(buffer, writer, KeystrokeProtector.plaintext(), props,
                scheduler, publisher, metrics, clock, sleeps::add);
        return coordinator.flushNow();
    }

    @Test
    void failedAttemptThenSuccessStoresSameRowsAsOneCleanFlush() {
        FailingFirstAttemptWriter failing = new FailingFirstAttemptWriter(retried);

        FlushResult retriedResult = flushSampleActivity(failing);
        FlushResult cleanResult = flushSampleActivity(new JdbcActivityWriter(clean.jdbc(), clean.transactionManager()));

        assertThat(failing.attempts.get()).isEqualTo(2);
        assertThat(sleeps).containsExactly(Duration.ofMillis(200));
        assertThat(retriedResult).isEqualTo(cleanResult);
        assertThat(retriedResult.outcome()).isEqualTo(FlushResult.Outcome.PERSISTED);
        for (String table : TABLES) {
            assertThat(retried.count(table)).as(table).isEqualTo(clean.count(table));
        }
        assertThat(retried.count("windows")).isEqualTo(1);
        assertThat(retried.jdbc().queryForList("SELECT window_id FROM keystroke_batches", Long.class))
                .containsOnly(retried.jdbc().queryForObject("SELECT id FROM windows", Long.class));
    }

    /**
     * Writes every row of the first attempt, then fails before commit.
     */
    private static final class FailingFirstAttemptWriter extends JdbcActivityWriter {
        private final AtomicInteger attempts = new AtomicInteger();

        FailingFirstAttemptWriter(SqliteTestDatabase db) {
            super(db.jdbc(), db.transactionManager());
        }

        @Override
        protected int insertPointerEvents(List<PointerEvent> events, Map<WindowKey, Long> windowIds) {
            int n = super.insertPointerEvents(events, windowIds);
            if (attempts.incrementAndGet() == 1) {
                throw new DataAccessResourceFailureException("database is locked");
            }
            return n;
        }
    }
}
