package com.phillippitts.callcopilot.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Per-session and fan-out behavior.
 */
@ConfigurationProperties(prefix = "copilot.session")
@Validated
public class SessionProperties {

    /** Tenant used when the carrier sends no account id. */
    @NotBlank
    private String defaultTenant = "default";

    /** Final segments shorter than this (after trim) skip intent classification. */
    @Positive
    private int intentMinLength = 10;

    /** Number of most recent final segments passed to intent classification. */
    @Positive
    private int intentContextWindow = 5;

    @Positive
    private int kbMaxResults = 10;

    public String getDefaultTenant() {
        return defaultTenant;
    }

    public void setDefaultTenant(String defaultTenant) {
        this.defaultTenant = defaultTenant;
    }

    public int getIntentMinLength() {
        return intentMinLength;
    }

    public void setIntentMinLength(int intentMinLength) {
        this.intentMinLength = intentMinLength;
    }

    public int getIntentContextWindow() {
        return intentContextWindow;
    }

    public void setIntentContextWindow(int intentContextWindow) {
        this.intentContextWindow = intentContextWindow;
    }

    public int getKbMaxResults() {
        return kbMaxResults;
    }

    public void setKbMaxResults(int kbMaxResults) {
        this.kbMaxResults = kbMaxResults;
    }
}
