/**
 * Spring configuration: schedulers, typed properties and logging infrastructure.
 */
package com.phillippitts.selfspy.config;
