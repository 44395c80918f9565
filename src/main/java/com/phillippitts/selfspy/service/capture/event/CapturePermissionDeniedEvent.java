package com.phillippitts.selfspy.service.capture.event;

import java.time.Instant;

/**
 * Published when registering the global input hook fails due to OS permissions
 * (e.g., macOS Accessibility permission not granted).
 */
public record CapturePermissionDeniedEvent(String source, Instant at) { }
