/**
 * Typed {@code @ConfigurationProperties} for the {@code selfspy.*} and {@code threadpool.*} namespaces.
 * Invalid values fail application startup.
 */
package com.phillippitts.selfspy.config.properties;
