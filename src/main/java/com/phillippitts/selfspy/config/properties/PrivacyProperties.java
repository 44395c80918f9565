package com.phillippitts.selfspy.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Exclusion rules for sensitive applications.
 *
 * @param excludeApplications process names whose windows, keystrokes and clicks are never recorded
 */
@ConfigurationProperties(prefix = "selfspy.privacy")
public record PrivacyProperties(List<String> excludeApplications) {

    public PrivacyProperties {
        excludeApplications = excludeApplications == null
                ? List.of("1Password", "Bitwarden", "KeePass", "KeePassXC")
                : List.copyOf(excludeApplications);
    }
}
