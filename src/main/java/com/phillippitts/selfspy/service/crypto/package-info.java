/**
 * Keystroke payload encryption: AES-256-GCM codec, PBKDF2 key derivation and the
 * password digest check.
 */
package com.phillippitts.selfspy.service.crypto;
