/**
 * Immutable domain values shared by capture, buffering, persistence and reporting.
 *
 * <p>Exactly three event kinds enter the system: {@link com.phillippitts.selfspy.domain.KeystrokeEvent},
 * {@link com.phillippitts.selfspy.domain.PointerEvent} and {@link com.phillippitts.selfspy.domain.WindowEvent}.
 * Adding a kind is a schema change.
 *
 * @since 1.0
 */
package com.phillippitts.selfspy.domain;
