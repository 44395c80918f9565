/**
 * Service layer: capture, buffering, persistence and reporting.
 *
 * <p>Data flows from {@code capture} through {@code engine} into {@code buffer}, is written
 * by {@code flush} into {@code store}, and is read back by {@code stats} and {@code export}.
 */
package com.phillippitts.selfspy.service;
