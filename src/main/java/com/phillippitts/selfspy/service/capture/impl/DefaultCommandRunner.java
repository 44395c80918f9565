package com.phillippitts.selfspy.service.capture.impl;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Default production implementation of {@link CommandRunner} using {@link ProcessBuilder}.
 * Output is small (one line per query), so stdout is read after the process exits.
 */
final class DefaultCommandRunner implements CommandRunner {

    private static final int MAX_OUTPUT_BYTES = 64 * 1024;

    @Override
    public String run(List<String> command, Duration timeout) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        Process process = pb.start();
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IOException("Command timed out after " + timeout.toMillis() + " ms: " + command.get(0));
            }
            if (process.exitValue() != 0) {
                throw new IOException("Command exited with " + process.exitValue() + ": " + command.get(0));
            }
            try (InputStream in = process.getInputStream()) {
                return new String(in.readNBytes(MAX_OUTPUT_BYTES), StandardCharsets.UTF_8);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IOException("Interrupted while running " + command.get(0), e);
        }
    }
}
