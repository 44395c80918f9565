package com.phillippitts.selfspy.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for stats and export.
 */
@ConfigurationProperties(prefix = "selfspy.reporting")
@Validated
public class ReportingProperties {

    /** Number of applications listed in stats. */
    @Positive
    private int topApps = 10;

    /** Decrypt keystroke payloads in exports when a key is configured. */
    private boolean decryptExports = false;

    public int getTopApps() {
        return topApps;
    }

    public void setTopApps(int topApps) {
        this.topApps = topApps;
    }

    public boolean isDecryptExports() {
        return decryptExports;
    }

    public void setDecryptExports(boolean decryptExports) {
        this.decryptExports = decryptExports;
    }
}
