/**
 * Flush scheduling, retry with backoff and session bookkeeping.
 */
package com.phillippitts.selfspy.service.flush;
