/**
 * In-memory accumulation of captured events between flushes, including window
 * deduplication and foreground-time accounting.
 */
package com.phillippitts.selfspy.service.buffer;
