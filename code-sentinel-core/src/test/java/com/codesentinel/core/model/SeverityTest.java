package com.codesentinel.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeverityTest {

    @ParameterizedTest
    @CsvSource({
        "CRITICAL, ERROR, true",
        "ERROR, ERROR, true",
        "WARNING, ERROR, false",
        "INFO, CRITICAL, false",
        "CRITICAL, INFO, true"
    })
    void isAtLeast_followsSeverityOrder(Severity severity, Severity threshold, boolean expected) {
        assertThat(severity.isAtLeast(threshold)).isEqualTo(expected);
    }

    @Test
    void fromString_ignoresCase() {
        assertThat(Severity.fromString("Warning")).isEqualTo(Severity.WARNING);
        assertThatThrownBy(() -> Severity.fromString("fatal"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("fatal");
    }
}
