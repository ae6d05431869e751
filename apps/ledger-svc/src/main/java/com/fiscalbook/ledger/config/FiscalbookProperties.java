package com.fiscalbook.ledger.config;

import java.time.DateTimeException;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "fiscalbook")
public record FiscalbookProperties(Snapshots snapshots) {

    @ConstructorBinding
    public FiscalbookProperties {
        // snapshots may be omitted entirely; accessor falls back to defaults
    }

    public Snapshots snapshots() {
        return snapshots != null ? snapshots : new Snapshots(null, null, null, null, null);
    }

    public record Snapshots(
            Integer defaultRetentionCount,
            Integer maxRetentionCount,
            Integer defaultPageSize,
            Integer maxPageSize,
            String zone
    ) {
        public static final int DEFAULT_RETENTION_COUNT = 12;
        public static final int MAX_RETENTION_COUNT = 100;
        public static final int DEFAULT_PAGE_SIZE = 50;
        public static final int MAX_PAGE_SIZE = 500;

        public Snapshots {
            if (defaultRetentionCount == null) defaultRetentionCount = DEFAULT_RETENTION_COUNT;
            if (maxRetentionCount == null) maxRetentionCount = MAX_RETENTION_COUNT;
            if (defaultPageSize == null) defaultPageSize = DEFAULT_PAGE_SIZE;
            if (maxPageSize == null) maxPageSize = MAX_PAGE_SIZE;
            if (zone == null || zone.isBlank()) zone = "UTC";

            if (maxRetentionCount <= 0) {
                throw new IllegalArgumentException("maxRetentionCount must be positive");
            }
            if (defaultRetentionCount <= 0 || defaultRetentionCount > maxRetentionCount) {
                throw new IllegalArgumentException("defaultRetentionCount must be between 1 and maxRetentionCount");
            }
            if (maxPageSize <= 0) {
                throw new IllegalArgumentException("maxPageSize must be positive");
            }
            if (defaultPageSize <= 0 || defaultPageSize > maxPageSize) {
                throw new IllegalArgumentException("defaultPageSize must be between 1 and maxPageSize");
            }
            try {
                ZoneId.of(zone);
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("zone must be a valid time zone id: " + zone, e);
            }
        }

        public ZoneId zoneId() {
            return ZoneId.of(zone);
        }
    }
}
