package com.ai.clinic.service;

import com.ai.clinic.exception.ErrorKind;
import com.ai.clinic.exception.SchedulingException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContactValidatorTest {

    private final ContactValidator validator = new ContactValidator();

    @Test
    void emailIsTrimmedAndLowerCased() {
        assertThat(validator.normalizeEmail("  Asha.Rao@Example.COM ")).isEqualTo("asha.rao@example.com");
    }

    @Test
    void malformedEmailIsRejected() {
        assertThatThrownBy(() -> validator.normalizeEmail("asha@example"))
                .isInstanceOfSatisfying(SchedulingException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_EMAIL));
        assertThatThrownBy(() -> validator.normalizeEmail(null)).isInstanceOf(SchedulingException.class);
    }

    @Test
    void phoneAcceptsCountryCodeAndSpaces() {
        assertThat(validator.normalizePhone("+91 98765 43210")).isEqualTo("9876543210");
        assertThat(validator.normalizePhone("6000000000")).isEqualTo("6000000000");
    }

    @Test
    void phoneMustBeTenDigitMobile() {
        for (String bad : new String[]{"5876543210", "98765", "98765432101", "98765-43210", ""}) {
            assertThatThrownBy(() -> validator.normalizePhone(bad))
                    .isInstanceOfSatisfying(SchedulingException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_PHONE));
        }
    }

    @Test
    void nameIsRequired() {
        assertThat(validator.requireName("  Asha Rao ")).isEqualTo("Asha Rao");
        assertThatThrownBy(() -> validator.requireName(" ")).isInstanceOf(SchedulingException.class);
    }
}
