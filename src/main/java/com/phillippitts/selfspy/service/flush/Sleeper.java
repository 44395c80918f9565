package com.phillippitts.selfspy.service.flush;

import java.time.Duration;

/**
 * Backoff delay between flush attempts. Replaced in tests to avoid real waits.
 */
@FunctionalInterface
interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());
}
