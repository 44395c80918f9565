package com.phillippitts.selfspy.service.capture;

import com.phillippitts.selfspy.config.properties.MonitorProperties;
import com.phillippitts.selfspy.exception.CaptureException;
import com.phillippitts.selfspy.service.capture.event.CapturePermissionDeniedEvent;
import com.phillippitts.selfspy.service.engine.ActivityEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Instant;

/**
 * Wires capture sources to the {@link ActivityEngine} and ties them to the application lifecycle.
 *
 * Start order: input hook, engine (session and flush scheduling), window watcher. The hook is
 * registered first so a permission failure surfaces as {@link CaptureException} before any
 * buffering begins. Stop runs in reverse and ends with the engine's final flush.
 *
 * Tests should inject a fake InputHook and emit normalized events directly to the registered
 * listeners.
 */
@Service
public class ActivityMonitor implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(ActivityMonitor.class);

    static final String INPUT_SOURCE = "input-hook";

    private final InputHook hook;
    private final ActivityEngine engine;
    private final WindowWatcher watcher;
    private final MonitorProperties props;
    private final ApplicationEventPublisher publisher;

    private volatile boolean running;

    public ActivityMonitor(InputHook hook,
                           ActivityEngine engine,
                           WindowWatcher watcher,
                           MonitorProperties props,
                           ApplicationEventPublisher publisher) {
        this.hook = hook;
        this.engine = engine;
        this.watcher = watcher;
        this.props = props;
        this.publisher = publisher;
    }

    /**
     * @throws CaptureException if the input hook cannot be registered
     */
    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        hook.setKeyListener(e -> engine.onKeystroke(e.text(), e.modifiers(), null,
                Instant.ofEpochMilli(e.whenMillis())));
        hook.setPointerListener(e -> engine.onPointerEvent(e.x(), e.y(), e.button(), e.type(), null,
                Instant.ofEpochMilli(e.whenMillis())));
        try {
            hook.register();
        } catch (SecurityException se) {
            LOG.warn("Global input hook permission denied: {}", se.toString());
            publisher.publishEvent(new CapturePermissionDeniedEvent(INPUT_SOURCE, Instant.now()));
            throw new CaptureException(INPUT_SOURCE, "Input capture could not start: " + se.getMessage(), se);
        }
        engine.start();
        watcher.start();
        running = true;
        LOG.info("Activity monitor started");
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        watcher.stop();
        try {
            hook.unregister();
        } catch (RuntimeException e) {
            LOG.debug("Error unregistering input hook: {}", e.toString());
        }
        engine.stop();
        LOG.info("Activity monitor stopped");
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return props.isAutostart();
    }
}
