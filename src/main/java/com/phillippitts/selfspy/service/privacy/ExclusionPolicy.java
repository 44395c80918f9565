package com.phillippitts.selfspy.service.privacy;

import com.phillippitts.selfspy.config.properties.PrivacyProperties;
import com.phillippitts.selfspy.domain.WindowKey;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether activity attributed to a process must be ignored.
 * Matching is case-insensitive on the exact process name.
 */
@Component
public class ExclusionPolicy {

    private final Set<String> excluded;

    public ExclusionPolicy(PrivacyProperties props) {
        this.excluded = props.excludeApplications().stream()
                .filter(s -> s != null && !s.isBlank())
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean isExcluded(String processName) {
        return processName != null && excluded.contains(processName.trim().toLowerCase(Locale.ROOT));
    }

    /** Unknown windows are never excluded. */
    public boolean isExcluded(WindowKey key) {
        return key != null && isExcluded(key.processName());
    }
}
