package com.phillippitts.selfspy.service.store;

import java.time.Instant;

public record ProcessRow(long id, String name, String bundleId, Instant firstSeen, Instant lastSeen) { }
