package com.phillippitts.selfspy.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration properties for the capture sources and monitor lifecycle.
 *
 * <p>Example application.properties:
 * <pre>
 * selfspy.monitor.data-dir=${user.home}/.selfspy
 * selfspy.monitor.window-poll-interval=1s
 * selfspy.monitor.capture-text=true
 * </pre>
 */
@ConfigurationProperties(prefix = "selfspy.monitor")
@Validated
public class MonitorProperties {

    /** Start monitoring together with the application context. */
    private boolean autostart = true;

    /** Directory holding the database and the password digest. */
    @NotBlank(message = "Data directory must not be blank")
    private String dataDir = Path.of(System.getProperty("user.home"), ".selfspy").toString();

    /** How often the window watcher asks the platform for the foreground window. */
    @NotNull
    private Duration windowPollInterval = Duration.ofSeconds(1);

    /** Record typed text; when false keystrokes are only counted. */
    private boolean captureText = true;

    /** Record pointer clicks and scrolls. */
    private boolean capturePointer = true;

    /** Poll and record the foreground window. */
    private boolean captureWindows = true;

    /** Also record pointer moves (high volume). */
    private boolean recordPointerMoves = false;

    public boolean isAutostart() {
        return autostart;
    }

    public void setAutostart(boolean autostart) {
        this.autostart = autostart;
    }

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public Duration getWindowPollInterval() {
        return windowPollInterval;
    }

    public void setWindowPollInterval(Duration windowPollInterval) {
        this.windowPollInterval = windowPollInterval;
    }

    public boolean isCaptureText() {
        return captureText;
    }

    public void setCaptureText(boolean captureText) {
        this.captureText = captureText;
    }

    public boolean isCapturePointer() {
        return capturePointer;
    }

    public void setCapturePointer(boolean capturePointer) {
        this.capturePointer = capturePointer;
    }

    public boolean isCaptureWindows() {
        return captureWindows;
    }

    public void setCaptureWindows(boolean captureWindows) {
        this.captureWindows = captureWindows;
    }

    public boolean isRecordPointerMoves() {
        return recordPointerMoves;
    }

    public void setRecordPointerMoves(boolean recordPointerMoves) {
        this.recordPointerMoves = recordPointerMoves;
    }
}
