/**
 * Privacy rules applied before events reach the buffer.
 */
package com.phillippitts.selfspy.service.privacy;
