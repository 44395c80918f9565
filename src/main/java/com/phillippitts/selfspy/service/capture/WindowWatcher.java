package com.phillippitts.selfspy.service.capture;

import com.phillippitts.selfspy.config.logging.MdcTaskDecorator;
import com.phillippitts.selfspy.config.properties.MonitorProperties;
import com.phillippitts.selfspy.service.engine.ActivityEventSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * Polls {@link ActiveWindowProvider} on the watcher scheduler and reports every observation
 * to the sink. Repeated observations of the same window are collapsed downstream.
 */
@Component
public class WindowWatcher {

    private static final Logger LOG = LogManager.getLogger(WindowWatcher.class);
    private static final TaskDecorator MDC = new MdcTaskDecorator();

    private final ActiveWindowProvider provider;
    private final ActivityEventSink sink;
    private final MonitorProperties props;
    private final TaskScheduler scheduler;
    private final Clock clock;

    private volatile ScheduledFuture<?> poll;

    public WindowWatcher(ActiveWindowProvider provider,
                         ActivityEventSink sink,
                         MonitorProperties props,
                         @Qualifier("watcherScheduler") TaskScheduler scheduler,
                         Clock clock) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.props = Objects.requireNonNull(props, "props");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public synchronized void start() {
        if (poll != null) {
            return;
        }
        if (!props.isCaptureWindows()) {
            LOG.info("Window capture disabled by configuration");
            return;
        }
        if (!provider.isSupported()) {
            LOG.warn("Active window detection is not supported on this platform; windows will not be recorded");
            return;
        }
        poll = scheduler.scheduleWithFixedDelay(MDC.decorate(this::pollOnce), props.getWindowPollInterval());
        LOG.info("Window watcher started: interval={}", props.getWindowPollInterval());
    }

    public synchronized void stop() {
        ScheduledFuture<?> p = poll;
        if (p != null) {
            p.cancel(false);
            poll = null;
            LOG.info("Window watcher stopped");
        }
    }

    public boolean isRunning() {
        return poll != null;
    }

    void pollOnce() {
        try {
            provider.activeWindow().ifPresent(w -> sink.onWindowChange(w.title(), w.processName(), w.processId(),
                    w.bundleId(), w.x(), w.y(), w.width(), w.height(), clock.instant()));
        } catch (RuntimeException e) {
            LOG.warn("Window poll failed: {}", e.toString());
        }
    }
}
