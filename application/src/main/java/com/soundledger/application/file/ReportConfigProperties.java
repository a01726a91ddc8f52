package com.soundledger.application.file;

import jakarta.validation.constraints.AssertTrue;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Where payout statements go. With {@code enabled} false no S3 client is built and exports
 * are rejected as not configured.
 */
@Validated
@ConfigurationProperties(prefix = "reports")
public record ReportConfigProperties(
        boolean enabled,
        String bucket,
        String keyPrefix
) {
    public ReportConfigProperties {
        bucket = bucket == null ? "" : bucket.trim();
        keyPrefix = keyPrefix == null ? "" : keyPrefix.trim();
    }

    @AssertTrue(message = "reports.bucket is required when reports are enabled")
    public boolean isBucketSetWhenEnabled() {
        return !enabled || !bucket.isEmpty();
    }

    @AssertTrue(message = "reports.key-prefix must not start with '/'")
    public boolean isKeyPrefixRelative() {
        return !keyPrefix.startsWith("/");
    }
}
