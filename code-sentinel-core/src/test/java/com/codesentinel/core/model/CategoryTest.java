package com.codesentinel.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Category} name parsing.
 */
class CategoryTest {

    @ParameterizedTest
    @CsvSource({
        "security, SECURITY",
        "SECURITY, SECURITY",
        "dead_code, DEAD_CODE",
        "dead-code, DEAD_CODE",
        "code_smells, QUALITY",
        "quality, QUALITY",
        "type_hint, TYPE_HINTS",
        "' syntax ', SYNTAX"
    })
    void fromString_acceptsWireNamesAndAliases(String input, Category expected) {
        assertThat(Category.fromString(input)).isEqualTo(expected);
    }

    @Test
    void fromString_unknownName_throws() {
        assertThatThrownBy(() -> Category.fromString("astrology"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown category: astrology");
    }

    @Test
    void wireName_isSnakeCase() {
        assertThat(Category.DEAD_CODE.wireName()).isEqualTo("dead_code");
        assertThat(Category.TYPE_HINTS.displayName()).isEqualTo("Type Hints");
    }
}
