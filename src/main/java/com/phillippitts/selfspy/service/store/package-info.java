/**
 * Durable activity store over Spring JDBC and SQLite.
 *
 * <p>{@link com.phillippitts.selfspy.service.store.ActivityWriter} is used only by the flush
 * coordinator; {@link com.phillippitts.selfspy.service.store.ActivityReader} serves stats and
 * export. Timestamps are stored as epoch milliseconds.
 */
package com.phillippitts.selfspy.service.store;
