package com.example.careaccess.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Audit trail configuration.
 *
 * @param recentWindow     how far back the recent-access cache remembers emergency requests
 * @param recentMaxEntries upper bound on cached recent-access records
 * @param maxPageSize      largest page an audit query may return
 * @param defaultPageSize  page size used when a query does not name one
 */
@ConfigurationProperties(prefix = "app.audit")
public record AuditProperties(
        Duration recentWindow,
        Integer recentMaxEntries,
        Integer maxPageSize,
        Integer defaultPageSize
) {
    public AuditProperties {
        if (recentWindow == null) {
            recentWindow = Duration.ofHours(1);
        }
        if (recentMaxEntries == null || recentMaxEntries < 1) {
            recentMaxEntries = 10_000;
        }
        if (maxPageSize == null || maxPageSize < 1) {
            maxPageSize = 500;
        }
        if (defaultPageSize == null || defaultPageSize < 1) {
            defaultPageSize = 100;
        }
    }

    public static AuditProperties defaults() {
        return new AuditProperties(null, null, null, null);
    }
}
