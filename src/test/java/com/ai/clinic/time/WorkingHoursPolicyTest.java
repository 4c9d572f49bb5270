package com.ai.clinic.time;

import com.ai.clinic.config.ClinicProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class WorkingHoursPolicyTest {

    private static final ZoneOffset IST = ZoneOffset.ofHoursMinutes(5, 30);

    private final WorkingHoursPolicy policy = new WorkingHoursPolicy(ClinicProperties.defaults());

    @Test
    void boundariesAreHalfOpen() {
        assertThat(policy.withinHours(at(8, 59))).isFalse();
        assertThat(policy.withinHours(at(9, 0))).isTrue();
        assertThat(policy.withinHours(at(12, 59))).isTrue();
        assertThat(policy.withinHours(at(13, 0))).isFalse();
        assertThat(policy.withinHours(at(13, 30))).isFalse();
        assertThat(policy.withinHours(at(13, 59))).isFalse();
        assertThat(policy.withinHours(at(14, 0))).isTrue();
        assertThat(policy.withinHours(at(17, 59))).isTrue();
        assertThat(policy.withinHours(at(18, 0))).isFalse();
    }

    @Test
    void instantsInOtherOffsetsAreConvertedFirst() {
        // 03:30Z is 09:00 and 12:30Z is 18:00 in the clinic
        assertThat(policy.withinHours(OffsetDateTime.of(2025, 8, 21, 3, 30, 0, 0, ZoneOffset.UTC))).isTrue();
        assertThat(policy.withinHours(OffsetDateTime.of(2025, 8, 21, 12, 30, 0, 0, ZoneOffset.UTC))).isFalse();
    }

    @Test
    void slotMustEndInsideTheSameSession() {
        assertThat(policy.allows(slot(9, 0))).isTrue();
        assertThat(policy.allows(slot(12, 0))).isTrue();
        assertThat(policy.allows(slot(14, 0))).isTrue();
        assertThat(policy.allows(slot(17, 0))).isTrue();

        assertThat(policy.allows(slot(12, 30))).isFalse();
        assertThat(policy.allows(slot(13, 30))).isFalse();
        assertThat(policy.allows(slot(17, 30))).isFalse();
        assertThat(policy.allows(slot(8, 30))).isFalse();
    }

    private static OffsetDateTime at(int hour, int minute) {
        return OffsetDateTime.of(2025, 8, 21, hour, minute, 0, 0, IST);
    }

    private static SlotInterval slot(int hour, int minute) {
        return SlotInterval.of(at(hour, minute), Duration.ofMinutes(30));
    }
}
