/**
 * Read-side statistics over the activity store.
 */
package com.phillippitts.selfspy.service.stats;
