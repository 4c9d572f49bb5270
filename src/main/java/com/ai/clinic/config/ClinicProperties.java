package com.ai.clinic.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneOffset;

@ConfigurationProperties(prefix = "clinic")
public record ClinicProperties(
        String zoneId,
        String zoneOffset,
        Integer maxAlternatives
) {
    public static final String DEFAULT_ZONE_ID = "Asia/Kolkata";
    public static final ZoneOffset DEFAULT_OFFSET = ZoneOffset.ofHoursMinutes(5, 30);
    public static final int DEFAULT_MAX_ALTERNATIVES = 3;

    public static ClinicProperties defaults() {
        return new ClinicProperties(DEFAULT_ZONE_ID, DEFAULT_OFFSET.getId(), DEFAULT_MAX_ALTERNATIVES);
    }

    /** Calendar-facing time zone name. Slot arithmetic always uses {@link #offset()}. */
    public String safeZoneId() {
        return notBlank(zoneId) ? zoneId : DEFAULT_ZONE_ID;
    }

    public ZoneOffset offset() {
        return notBlank(zoneOffset) ? ZoneOffset.of(zoneOffset.trim()) : DEFAULT_OFFSET;
    }

    public int safeMaxAlternatives() {
        return maxAlternatives != null && maxAlternatives > 0 ? maxAlternatives : DEFAULT_MAX_ALTERNATIVES;
    }

    private boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
