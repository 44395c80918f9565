package com.phillippitts.selfspy.service.flush;

import com.phillippitts.selfspy.config.logging.MdcTaskDecorator;
import com.phillippitts.selfspy.config.properties.FlushProperties;
import com.phillippitts.selfspy.domain.KeystrokeBatch;
import com.phillippitts.selfspy.domain.Snapshot;
import com.phillippitts.selfspy.exception.EncryptionException;
import com.phillippitts.selfspy.exception.FlushException;
import com.phillippitts.selfspy.service.buffer.EventBuffer;
import com.phillippitts.selfspy.service.buffer.FlushTrigger;
import com.phillippitts.selfspy.service.crypto.KeystrokeProtector;
import com.phillippitts.selfspy.service.flush.event.FlushFailedEvent;
import com.phillippitts.selfspy.service.flush.event.StoreUnavailableEvent;
import com.phillippitts.selfspy.service.metrics.ActivityMetrics;
import com.phillippitts.selfspy.service.store.ActivityWriter;
import com.phillippitts.selfspy.service.store.PreparedKeystroke;
import com.phillippitts.selfspy.service.store.PreparedSnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.TaskDecorator;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionTimedOutException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Decides when to flush the {@link EventBuffer} and writes drained snapshots to the store.
 *
 * <p>Triggers: buffered size reaching the flush threshold (via {@link FlushTrigger}), elapsed
 * time reaching {@code selfspy.flush.interval} (checked by a periodic tick), and the final
 * flush on {@link #stop()}. All of them run on the single-threaded {@code flushScheduler},
 * so store writes are serialized.
 *
 * <p>Algorithm per flush:
 * <ol>
 *   <li>Probe the store; if unreachable, publish {@link StoreUnavailableEvent} and leave the buffer alone</li>
 *   <li>Drain; an empty snapshot is a no-op</li>
 *   <li>Encrypt keystroke payloads once; a payload that fails to encrypt drops only its record</li>
 *   <li>Persist in one transaction, retrying the same prepared snapshot with exponential backoff</li>
 *   <li>After the last failed attempt, discard the snapshot, publish {@link FlushFailedEvent}
 *       and throw {@link FlushException}</li>
 * </ol>
 *
 * <p>The coordinator also owns the session row: opened on start (or on the first flush that
 * finds the store reachable), its end refreshed after each successful flush, closed after the
 * final flush.
 */
@Component
public class FlushCoordinator {

    private static final Logger LOG = LogManager.getLogger(FlushCoordinator.class);
    private static final TaskDecorator MDC = new MdcTaskDecorator();

    static final Duration MIN_TICK = Duration.ofMillis(100);
    private static final Duration UNAVAILABLE_LOG_THROTTLE = Duration.ofMinutes(1);

    private final EventBuffer buffer;
    private final ActivityWriter writer;
    private final KeystrokeProtector protector;
    private final FlushProperties props;
    private final TaskScheduler scheduler;
    private final ApplicationEventPublisher publisher;
    private final ActivityMetrics metrics;
    private final Clock clock;
    private final Sleeper sleeper;

    private final ReentrantLock flushLock = new ReentrantLock();
    private final AtomicBoolean flushQueued = new AtomicBoolean(false);
    private final AtomicLong flushSeq = new AtomicLong();

    private volatile boolean running;
    private volatile ScheduledFuture<?> tick;
    private volatile Instant lastFlushAt;
    private volatile Instant sessionStart;
    private volatile Long sessionId;
    private volatile Instant lastUnavailableNotice;

    @Autowired
    public FlushCoordinator(EventBuffer buffer,
                            ActivityWriter writer,
                            KeystrokeProtector protector,
                            FlushProperties props,
                            @Qualifier("flushScheduler") TaskScheduler scheduler,
                            ApplicationEventPublisher publisher,
                            ActivityMetrics metrics,
                            Clock clock) {
        this(buffer, writer, protector, props, scheduler, publisher, metrics, clock, Sleeper.THREAD);
    }

    FlushCoordinator(EventBuffer buffer,
                     ActivityWriter writer,
                     KeystrokeProtector protector,
                     FlushProperties props,
                     TaskScheduler scheduler,
                     ApplicationEventPublisher publisher,
                     ActivityMetrics metrics,
                     Clock clock,
                     Sleeper sleeper) {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.protector = Objects.requireNonNull(protector, "protector");
        this.props = Objects.requireNonNull(props, "props");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Opens the session, starts the periodic tick and subscribes to size triggers.
     */
    public void start() {
        if (running) {
            return;
        }
        Instant now = clock.instant();
        sessionStart = now;
        lastFlushAt = now;
        openSessionQuietly();
        buffer.onFlushNeeded(this::requestFlush);
        Duration period = props.getInterval().dividedBy(4);
        if (period.compareTo(MIN_TICK) < 0) {
            period = MIN_TICK;
        }
        tick = scheduler.scheduleWithFixedDelay(MDC.decorate(this::onTick), period);
        running = true;
        LOG.info("FlushCoordinator started: interval={}, tick={}, sessionId={}", props.getInterval(), period, sessionId);
    }

    /**
     * Stops triggers, runs the final flush on the flush scheduler and waits for it up to
     * {@code selfspy.flush.stop-timeout}, then closes the session.
     */
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        buffer.onFlushNeeded(null);
        ScheduledFuture<?> t = tick;
        if (t != null) {
            t.cancel(false);
        }
        CompletableFuture<Void> done = new CompletableFuture<>();
        try {
            scheduler.schedule(MDC.decorate(() -> {
                try {
                    finalFlush();
                    done.complete(null);
                } catch (RuntimeException e) {
                    done.completeExceptionally(e);
                }
            }), clock.instant());
            done.get(props.getStopTimeout().toMillis(), TimeUnit.MILLISECONDS);
            LOG.info("FlushCoordinator stopped");
        } catch (TimeoutException e) {
            LOG.error("Final flush did not finish within {}; buffered events may be lost", props.getStopTimeout());
        } catch (ExecutionException e) {
            LOG.error("Final flush failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for the final flush");
        } catch (RuntimeException e) {
            // scheduler already shut down: flush on the caller thread
            LOG.warn("Flush scheduler unavailable ({}); running final flush inline", e.toString());
            finalFlush();
        }
    }

    public boolean isRunning() {
        return running;
    }

    public Long currentSessionId() {
        return sessionId;
    }

    /**
     * Queues a flush on the flush scheduler. Repeated requests before it runs coalesce.
     */
    public void requestFlush(FlushTrigger.Reason reason) {
        if (!running) {
            return;
        }
        if (flushQueued.compareAndSet(false, true)) {
            LOG.debug("Flush requested: reason={}", reason);
            scheduler.schedule(MDC.decorate(() -> {
                flushQueued.set(false);
                flushQuietly();
            }), clock.instant());
        }
    }

    void onTick() {
        Instant last = lastFlushAt;
        if (last == null || !clock.instant().isBefore(last.plus(props.getInterval()))) {
            flushQuietly();
        }
    }

    private void flushQuietly() {
        try {
            flushNow();
        } catch (FlushException e) {
            // already logged and published
            LOG.debug("Scheduled flush discarded a snapshot: {}", e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Unexpected error during scheduled flush", e);
        }
    }

    private void finalFlush() {
        try {
            flushNow();
        } catch (FlushException e) {
            LOG.error("Final flush discarded a snapshot: {}", e.getMessage());
        } finally {
            closeSessionQuietly();
        }
    }

    /**
     * Runs one flush cycle on the calling thread.
     *
     * @throws FlushException if the snapshot was discarded after all attempts
     */
    public FlushResult flushNow() {
        flushLock.lock();
        long seq = flushSeq.incrementAndGet();
        ThreadContext.put("flushId", String.valueOf(seq));
        try {
            if (!writer.isAvailable()) {
                onStoreUnavailable();
                return FlushResult.STORE_UNAVAILABLE;
            }
            if (sessionId == null) {
                openSessionQuietly();
            }
            if (sessionId != null) {
                ThreadContext.put("sessionId", String.valueOf(sessionId));
            }
            Snapshot snapshot = buffer.drain();
            lastFlushAt = clock.instant();
            if (snapshot.isEmpty()) {
                return FlushResult.EMPTY;
            }
            PreparedSnapshot prepared = prepare(snapshot);
            int rows = persistWithRetry(snapshot, prepared);
            touchSessionQuietly();
            return FlushResult.persisted(rows);
        } finally {
            ThreadContext.remove("flushId");
            ThreadContext.remove("sessionId");
            flushLock.unlock();
        }
    }

    private PreparedSnapshot prepare(Snapshot snapshot) {
        List<PreparedKeystroke> keystrokes = new ArrayList<>(snapshot.keystrokes().size());
        int failed = 0;
        for (KeystrokeBatch batch : snapshot.keystrokes()) {
            try {
                keystrokes.add(new PreparedKeystroke(protector.protect(batch.text()), batch.modifiers(),
                        batch.count(), batch.windowKey(), batch.recordedAt()));
            } catch (EncryptionException e) {
                failed++;
                LOG.warn("Dropping keystroke batch that failed to encrypt: count={}, recordedAt={}, error={}",
                        batch.count(), batch.recordedAt(), e.getMessage());
            }
        }
        if (failed > 0) {
            metrics.incrementDiscarded(failed);
        }
        return new PreparedSnapshot(snapshot.windows(), keystrokes, snapshot.pointerEvents());
    }

    private int persistWithRetry(Snapshot snapshot, PreparedSnapshot prepared) {
        long start = System.nanoTime();
        int maxAttempts = props.getMaxAttempts();
        RuntimeException last = null;
        int attempt = 0;
        while (attempt < maxAttempts) {
            attempt++;
            try {
                int rows = writer.persist(prepared, props.getTransactionTimeout());
                metrics.recordFlushLatency(System.nanoTime() - start, "success");
                metrics.incrementPersisted(rows);
                LOG.debug("Flushed {} records in {} attempt(s)", rows, attempt);
                return rows;
            } catch (RuntimeException e) {
                last = e;
                metrics.incrementFlushFailure(failureReason(e));
                if (attempt >= maxAttempts) {
                    break;
                }
                Duration backoff = props.backoffAfter(attempt);
                LOG.warn("Flush attempt {}/{} failed ({}); retrying in {} ms",
                        attempt, maxAttempts, e.toString(), backoff.toMillis());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    LOG.warn("Interrupted during flush backoff; giving up after {} attempt(s)", attempt);
                    break;
                }
            }
        }
        metrics.recordFlushLatency(System.nanoTime() - start, "discarded");
        metrics.incrementDiscarded(prepared.recordCount());
        Instant earliest = snapshot.earliest().orElse(null);
        Instant latest = snapshot.latest().orElse(null);
        LOG.error("Discarding snapshot after {} failed attempt(s): records={}, range={} .. {}",
                attempt, prepared.recordCount(), earliest, latest, last);
        String reason = last == null ? "unknown" : last.getClass().getSimpleName();
        publisher.publishEvent(new FlushFailedEvent(prepared.recordCount(), attempt, earliest, latest, reason,
                clock.instant()));
        throw new FlushException("Snapshot discarded after retries", prepared.recordCount(), attempt,
                earliest, latest, last);
    }

    private static String failureReason(RuntimeException e) {
        if (e instanceof TransactionTimedOutException || e instanceof QueryTimeoutException) {
            return "timeout";
        }
        if (e instanceof DataAccessResourceFailureException) {
            return "unavailable";
        }
        return "error";
    }

    private void onStoreUnavailable() {
        int buffered = buffer.size();
        Instant now = clock.instant();
        Instant prev = lastUnavailableNotice;
        if (prev == null || !now.isBefore(prev.plus(UNAVAILABLE_LOG_THROTTLE))) {
            lastUnavailableNotice = now;
            LOG.warn("Activity store unreachable; keeping {} buffered items", buffered);
            publisher.publishEvent(new StoreUnavailableEvent(buffered, now));
        }
    }

    private void openSessionQuietly() {
        try {
            sessionId = writer.openSession(sessionStart == null ? clock.instant() : sessionStart);
            LOG.info("Opened session {}", sessionId);
        } catch (RuntimeException e) {
            LOG.warn("Could not open session yet: {}", e.toString());
        }
    }

    private void touchSessionQuietly() {
        Long id = sessionId;
        if (id == null) {
            return;
        }
        try {
            writer.touchSession(id, clock.instant());
        } catch (RuntimeException e) {
            LOG.warn("Could not refresh end of session {}: {}", id, e.toString());
        }
    }

    private void closeSessionQuietly() {
        Long id = sessionId;
        if (id == null) {
            return;
        }
        try {
            writer.closeSession(id, clock.instant());
            LOG.info("Closed session {}", id);
        } catch (RuntimeException e) {
            LOG.warn("Could not close session {}: {}", id, e.toString());
        } finally {
            sessionId = null;
        }
    }
}
