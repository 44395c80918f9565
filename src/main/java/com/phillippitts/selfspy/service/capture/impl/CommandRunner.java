package com.phillippitts.selfspy.service.capture.impl;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so window queries can be tested without
 * spawning real processes.
 */
interface CommandRunner {

    /**
     * Runs a command to completion and returns its standard output.
     *
     * @throws IOException if the command cannot be started, exits non-zero, or exceeds the timeout
     */
    String run(List<String> command, Duration timeout) throws IOException;
}
