/**
 * Capture sources: the global input hook, foreground window polling and the monitor
 * lifecycle that connects them to the activity engine.
 */
package com.phillippitts.selfspy.service.capture;
