/**
 * Text export of stored activity (JSON, CSV, SQL).
 */
package com.phillippitts.selfspy.service.export;
