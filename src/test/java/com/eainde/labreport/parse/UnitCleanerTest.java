package com.eainde.labreport.parse;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class UnitCleanerTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "ммольл, ммоль/л",
            "ммолыл, ммоль/л",
            "мкмольл, мкмоль/л",
            "мкмолыл, мкмоль/л",
            "гл, г/л",
            "мгл, мг/л",
            "мкгл, мкг/л",
            "едл, Ед/л",
            "г/л, г/л",
            "10^9/л, 10^9/л"
    })
    @DisplayName("should repair units that lost their slash or a letter")
    void repairsOcrUnits(String raw, String expected) {
        assertThat(UnitCleaner.clean(raw)).isEqualTo(expected);
    }
}
