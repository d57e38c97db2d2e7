package com.phillippitts.windowanalysis.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Retention of completed analyses.
 */
@Validated
@ConfigurationProperties(prefix = "analysis.store")
public class StoreProperties {

    /** Completed analyses older than this are purged. Default: one day. */
    @Positive
    private long auditTtlMinutes = 1440;

    public long getAuditTtlMinutes() {
        return auditTtlMinutes;
    }

    public void setAuditTtlMinutes(long auditTtlMinutes) {
        this.auditTtlMinutes = auditTtlMinutes;
    }
}
