/**
 * The activity engine: single owner of monitor state and inbound event port.
 */
package com.phillippitts.selfspy.service.engine;
