package com.codesentinel.core.model;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ScoreRatingTest {

    @ParameterizedTest
    @CsvSource({
        "100, Excellent",
        "80, Excellent",
        "79, Good",
        "60, Good",
        "59, Needs Improvement",
        "40, Needs Improvement",
        "39, Critical",
        "0, Critical"
    })
    void of_usesInclusiveLowerBounds(int score, String expectedLabel) {
        assertThat(ScoreRating.of(score).label()).isEqualTo(expectedLabel);
    }
}
