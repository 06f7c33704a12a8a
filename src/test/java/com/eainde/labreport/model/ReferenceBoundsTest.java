package com.eainde.labreport.model;

import com.eainde.labreport.model.ReferenceBounds.Kind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class ReferenceBoundsTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = '|', value = {
            "130,00 - 160,00 | RANGE       | 130.0 | 160.0",
            "3.05 - 6.4      | RANGE       | 3.05  | 6.4",
            "S/CO < 1,0      | UPPER       | NaN   | 1.0",
            "менее 5         | UPPER       | NaN   | 5.0",
            "до 22,0         | UPPER       | NaN   | 22.0",
            "≤ 0,5           | UPPER       | NaN   | 0.5",
            "более 60        | LOWER       | 60.0  | NaN",
            "> 1.5           | LOWER       | 1.5   | NaN",
            "5,0             | APPROXIMATE | 5.0   | 5.0",
    })
    @DisplayName("should read the side and numbers of a range")
    void parses(String text, Kind kind, double lower, double upper) {
        assertThat(ReferenceBounds.parse(text)).contains(new ReferenceBounds(kind, lower, upper));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"Not specified", "отрицательно"})
    @DisplayName("should give nothing when the text carries no number")
    void noNumbers(String text) {
        assertThat(ReferenceBounds.parse(text)).isEmpty();
    }

    @Test
    @DisplayName("should not treat a word ending in 'до' as an upper bound")
    void embeddedPreposition() {
        assertThat(ReferenceBounds.parse("Следовые количества, медо 4"))
                .hasValueSatisfying(bounds -> assertThat(bounds.kind()).isEqualTo(Kind.APPROXIMATE));
    }

    @Test
    @DisplayName("should drop a trailing separator from a number")
    void trailingSeparator() {
        assertThat(ReferenceBounds.numbersIn("от 4. до 9,")).containsExactly(4.0, 9.0);
    }
}
