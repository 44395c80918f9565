package com.phillippitts.selfspy.service.capture.impl;

import com.phillippitts.selfspy.service.capture.ActiveWindow;
import com.phillippitts.selfspy.service.capture.ActiveWindowProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Foreground window lookup through platform command-line tools.
 *
 * <ul>
 *   <li>Linux (X11): {@code xdotool} for window id, title, geometry and pid; process name
 *       from {@code /proc/<pid>/comm}</li>
 *   <li>macOS: {@code osascript} querying System Events for the frontmost process</li>
 * </ul>
 * Other platforms are unsupported and always report no window.
 */
public class CommandActiveWindowProvider implements ActiveWindowProvider {

    private static final Logger LOG = LogManager.getLogger(CommandActiveWindowProvider.class);

    static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(2);

    static final String APPLE_SCRIPT = """
            tell application "System Events"
                set frontApp to first process whose frontmost is true
                set appName to name of frontApp
                set appPid to unix id of frontApp
                set appBundle to ""
                try
                    set appBundle to bundle identifier of frontApp
                end try
                try
                    set frontWindow to first window of frontApp
                    set {wx, wy} to position of frontWindow
                    set {ww, wh} to size of frontWindow
                    return appName & "|" & appPid & "|" & appBundle & "|" & wx & "|" & wy & "|" & ww & "|" & wh & "|" & (name of frontWindow)
                on error
                    return appName & "|" & appPid & "|" & appBundle & "|0|0|0|0|" & appName
                end try
            end tell
            """;

    enum Platform { LINUX, MAC, UNSUPPORTED }

    private final Platform platform;
    private final CommandRunner runner;
    private final Path procRoot;
    private volatile boolean failureLogged;

    public CommandActiveWindowProvider() {
        this(detect(System.getProperty("os.name", "")), new DefaultCommandRunner(), Path.of("/proc"));
    }

    CommandActiveWindowProvider(Platform platform, CommandRunner runner, Path procRoot) {
        this.platform = platform;
        this.runner = runner;
        this.procRoot = procRoot;
    }

    static Platform detect(String osName) {
        String os = osName.toLowerCase(Locale.ROOT);
        if (os.contains("mac") || os.contains("darwin")) {
            return Platform.MAC;
        }
        if (os.contains("linux")) {
            return Platform.LINUX;
        }
        return Platform.UNSUPPORTED;
    }

    @Override
    public boolean isSupported() {
        return platform != Platform.UNSUPPORTED;
    }

    @Override
    public Optional<ActiveWindow> activeWindow() {
        try {
            Optional<ActiveWindow> window = switch (platform) {
                case LINUX -> queryXdotool();
                case MAC -> queryAppleScript();
                case UNSUPPORTED -> Optional.empty();
            };
            failureLogged = false;
            return window;
        } catch (IOException | RuntimeException e) {
            if (!failureLogged) {
                failureLogged = true;
                LOG.warn("Active window query failed on {}: {}", platform, e.getMessage());
            }
            return Optional.empty();
        }
    }

    private Optional<ActiveWindow> queryXdotool() throws IOException {
        String id = runner.run(List.of("xdotool", "getactivewindow"), COMMAND_TIMEOUT).trim();
        if (id.isEmpty()) {
            return Optional.empty();
        }
        String title = runner.run(List.of("xdotool", "getwindowname", id), COMMAND_TIMEOUT).strip();
        int[] geometry = parseXdotoolGeometry(
                runner.run(List.of("xdotool", "getwindowgeometry", "--shell", id), COMMAND_TIMEOUT));
        int pid = parseInt(runner.run(List.of("xdotool", "getwindowpid", id), COMMAND_TIMEOUT).trim());
        String process = processName(pid);
        return Optional.of(new ActiveWindow(title, process, pid, "",
                geometry[0], geometry[1], geometry[2], geometry[3]));
    }

    /**
     * Parses {@code --shell} output ({@code X=..}, {@code Y=..}, {@code WIDTH=..}, {@code HEIGHT=..}).
     */
    static int[] parseXdotoolGeometry(String output) {
        int[] g = new int[4];
        for (String line : output.split("\\R")) {
            int eq = line.indexOf('=');
            if (eq < 0) {
                continue;
            }
            String key = line.substring(0, eq).trim();
            int value = parseInt(line.substring(eq + 1).trim());
            switch (key) {
                case "X" -> g[0] = value;
                case "Y" -> g[1] = value;
                case "WIDTH" -> g[2] = value;
                case "HEIGHT" -> g[3] = value;
                default -> { }
            }
        }
        return g;
    }

    private String processName(int pid) {
        if (pid > 0) {
            Path comm = procRoot.resolve(Integer.toString(pid)).resolve("comm");
            try {
                String name = Files.readString(comm, StandardCharsets.UTF_8).trim();
                if (!name.isEmpty()) {
                    return name;
                }
            } catch (IOException e) {
                LOG.debug("Cannot read {}: {}", comm, e.getMessage());
            }
        }
        return "unknown";
    }

    private Optional<ActiveWindow> queryAppleScript() throws IOException {
        return parseAppleScript(runner.run(List.of("osascript", "-e", APPLE_SCRIPT), COMMAND_TIMEOUT));
    }

    /**
     * Parses {@code app|pid|bundle|x|y|w|h|title}; the title is last because it may contain '|'.
     */
    static Optional<ActiveWindow> parseAppleScript(String output) {
        String[] parts = output.strip().split("\\|", 8);
        if (parts.length < 8 || parts[0].isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new ActiveWindow(parts[7], parts[0], parseInt(parts[1]), parts[2],
                parseInt(parts[3]), parseInt(parts[4]), parseInt(parts[5]), parseInt(parts[6])));
    }

    private static int parseInt(String s) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
