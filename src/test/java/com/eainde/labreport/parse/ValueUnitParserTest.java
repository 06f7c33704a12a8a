package com.eainde.labreport.parse;

import com.eainde.labreport.model.MetricRecord;
import com.eainde.labreport.model.ParsedValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueUnitParserTest {

    private final ValueUnitParser parser = new ValueUnitParser();

    private ParsedValue parse(String text) {
        Optional<ParsedValue> parsed = parser.parse(text);
        assertThat(parsed).as("parse of '%s'", text).isPresent();
        return parsed.get();
    }

    // =========================================================================
    //  Qualitative answers
    // =========================================================================

    @Nested
    @DisplayName("Qualitative keywords")
    class Qualitative {

        @Test
        @DisplayName("should map 'Не обнаружено' to 0.0 at 0.95")
        void notDetected() {
            ParsedValue parsed = parse("Не обнаружено");

            assertThat(parsed.value()).isEqualTo(0.0);
            assertThat(parsed.unit()).isEqualTo(MetricRecord.QUALITATIVE_UNIT);
            assertThat(parsed.confidence()).isEqualTo(0.95);
            assertThat(parsed.strategy()).isEqualTo("qualitative");
        }

        @Test
        @DisplayName("should ignore a trailing parenthetical when reading the answer")
        void trailingParenthetical() {
            ParsedValue parsed = parse("Положительно (реф: отрицательно)");

            assertThat(parsed.value()).isEqualTo(1.0);
            assertThat(parsed.confidence()).isEqualTo(0.90);
        }

        @Test
        @DisplayName("should map 'Норма.' to the 0.5 sentinel")
        void normalWithPunctuation() {
            ParsedValue parsed = parse("Норма.");

            assertThat(parsed.value()).isEqualTo(0.5);
            assertThat(parsed.confidence()).isEqualTo(0.85);
        }

        @Test
        @DisplayName("should read English answers")
        void english() {
            assertThat(parse("negative").value()).isEqualTo(0.0);
            assertThat(parse("Detected").value()).isEqualTo(1.0);
        }
    }

    // =========================================================================
    //  Exponent notations
    // =========================================================================

    @Nested
    @DisplayName("Scientific and multiplier notation")
    class Exponents {

        @Test
        @DisplayName("should keep the mantissa and move the exponent into the unit")
        void scientific() {
            ParsedValue parsed = parse("5.66 10^12/л (норма: 4,50 - 5,90)");

            assertThat(parsed.value()).isEqualTo(5.66);
            assertThat(parsed.unit()).isEqualTo("10^12/л");
            assertThat(parsed.confidence()).isEqualTo(0.95);
            assertThat(parsed.strategy()).isEqualTo("scientific");
        }

        @Test
        @DisplayName("should read a glued 109/л as 10^9/л")
        void scientificWithoutCaret() {
            ParsedValue parsed = parse("7,2 109/л");

            assertThat(parsed.value()).isEqualTo(7.2);
            assertThat(parsed.unit()).isEqualTo("10^9/л");
        }

        @Test
        @DisplayName("should rebuild a lost 10 base when a caret survives")
        void multiplierWithCaret() {
            ParsedValue parsed = parse("319 9^9/л");

            assertThat(parsed.value()).isEqualTo(319.0);
            assertThat(parsed.unit()).isEqualTo("10^9/л");
            assertThat(parsed.confidence()).isEqualTo(0.90);
            assertThat(parsed.strategy()).isEqualTo("multiplier");
        }

        @Test
        @DisplayName("should keep a bare multiplier with a × prefix")
        void bareMultiplier() {
            ParsedValue parsed = parse("4,5 12/л");

            assertThat(parsed.value()).isEqualTo(4.5);
            assertThat(parsed.unit()).isEqualTo("×12/л");
            assertThat(parsed.confidence()).isEqualTo(0.85);
        }
    }

    // =========================================================================
    //  Decimals and units
    // =========================================================================

    @Nested
    @DisplayName("Decimals and plain units")
    class Decimals {

        @Test
        @DisplayName("should read a dotted decimal with unit at 0.80")
        void dottedDecimal() {
            ParsedValue parsed = parse("163.00 г/л (норма: 130,00 - 160,00)");

            assertThat(parsed.value()).isEqualTo(163.0);
            assertThat(parsed.unit()).isEqualTo("г/л");
            assertThat(parsed.confidence()).isEqualTo(0.80);
            assertThat(parsed.strategy()).isEqualTo("spaced-decimal");
        }

        @Test
        @DisplayName("should rejoin a decimal split by a space")
        void spaceSplitDecimal() {
            ParsedValue parsed = parse("5 66 г/л");

            assertThat(parsed.value()).isEqualTo(5.66);
            assertThat(parsed.unit()).isEqualTo("г/л");
        }

        @Test
        @DisplayName("should clean a unit that lost its slash")
        void cleansUnit() {
            assertThat(parse("5,1 ммолыл").unit()).isEqualTo("ммоль/л");
        }

        @Test
        @DisplayName("should read an integer with a known unit at 0.75")
        void standardUnit() {
            ParsedValue parsed = parse("45 Ед/л");

            assertThat(parsed.value()).isEqualTo(45.0);
            assertThat(parsed.unit()).isEqualTo("Ед/л");
            assertThat(parsed.confidence()).isEqualTo(0.75);
            assertThat(parsed.strategy()).isEqualTo("standard");
        }

        @Test
        @DisplayName("should accept a compound unit outside the known list")
        void genericUnit() {
            assertThat(parse("12 мм/час").unit()).isEqualTo("мм/час");
        }

        @Test
        @DisplayName("should fall back to a bare number with unit 'units'")
        void bareNumber() {
            ParsedValue parsed = parse("4.2");

            assertThat(parsed.value()).isEqualTo(4.2);
            assertThat(parsed.unit()).isEqualTo(BareNumberStrategy.DEFAULT_UNIT);
            assertThat(parsed.confidence()).isEqualTo(0.50);
        }
    }

    // =========================================================================
    //  Signal-to-cutoff
    // =========================================================================

    @Nested
    @DisplayName("S/CO readings")
    class SignalCutoff {

        @Test
        @DisplayName("should score a verdict plus S/CO at 0.95")
        void combined() {
            ParsedValue parsed = parse("Не обнаружено, S/CO = 0,13");

            assertThat(parsed.value()).isEqualTo(0.13);
            assertThat(parsed.unit()).isEqualTo(SignalCutoffStrategy.UNIT);
            assertThat(parsed.confidence()).isEqualTo(0.95);
        }

        @Test
        @DisplayName("should score a bare S/CO at 0.90")
        void bare() {
            ParsedValue parsed = parse("S/CO = 0,21");

            assertThat(parsed.value()).isEqualTo(0.21);
            assertThat(parsed.confidence()).isEqualTo(0.90);
        }
    }

    // =========================================================================
    //  Rejections and configuration
    // =========================================================================

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @Test
        @DisplayName("should refuse fragments carrying a date")
        void contaminated() {
            assertThat(parser.parse("5,1 ммоль/л 26.04.2025")).isEmpty();
            assertThat(ValueUnitParser.isContaminated("Алу орны: Астана")).isTrue();
        }

        @Test
        @DisplayName("should return empty for blank or numberless text")
        void nothingToParse() {
            assertThat(parser.parse(null)).isEmpty();
            assertThat(parser.parse("   ")).isEmpty();
            assertThat(parser.parse("Текст")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Strategy list")
    class StrategyList {

        @Test
        @DisplayName("should run the default cascade in documented order")
        void defaultOrder() {
            assertThat(parser.strategies())
                    .extracting(ValueParseStrategy::name)
                    .containsExactly("qualitative", "scientific", "multiplier", "spaced-decimal",
                            "signal-cutoff", "standard", "bare-number");
        }

        @Test
        @DisplayName("should honour a custom strategy list")
        void customList() {
            ValueUnitParser bareOnly = new ValueUnitParser(List.of(new BareNumberStrategy()));

            ParsedValue parsed = bareOnly.parse("163.00 г/л").orElseThrow();

            assertThat(parsed.value()).isEqualTo(163.0);
            assertThat(parsed.unit()).isEqualTo("г/л");
            assertThat(parsed.confidence()).isEqualTo(0.50);
        }

        @Test
        @DisplayName("should reject an empty strategy list")
        void emptyList() {
            assertThatThrownBy(() -> new ValueUnitParser(List.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    // =========================================================================
    //  Garbled numbers
    // =========================================================================

    @Nested
    @DisplayName("Garbled numbers")
    class GarbledNumbers {

        @Test
        @DisplayName("should not parse a run-together exponent")
        void overlongExponent() {
            assertThat(parser.parse("250 10^99999999999/л (норма: 150 - 400)")).isEmpty();
            assertThat(new ScientificNotationStrategy().parse("250 10^99999999999/л")).isEmpty();
            assertThat(new MultiplierNotationStrategy().parse("250 9^99999999/л")).isEmpty();
        }

        @Test
        @DisplayName("should still read three-digit exponents")
        void threeDigitExponent() {
            assertThat(parse("1,5 10^100/л").unit()).isEqualTo("10^100/л");
        }

        @Test
        @DisplayName("should leave an overflowing mantissa to the value guard")
        void overlongMantissa() {
            ParsedValue parsed = parse("9".repeat(400) + " 10^9/л");

            assertThat(parsed.value()).isInfinite();
            assertThat(parsed.unit()).isEqualTo("10^9/л");
        }

        @Test
        @DisplayName("should move on to the next strategy when one cannot read its number")
        void failingStrategy() {
            ValueParseStrategy broken = new ValueParseStrategy() {
                @Override
                public String name() {
                    return "broken";
                }

                @Override
                public Optional<ParsedValue> parse(String valueText) {
                    throw new NumberFormatException("For input string: \"" + valueText + "\"");
                }
            };
            ValueUnitParser withBroken = new ValueUnitParser(List.of(broken, new BareNumberStrategy()));

            assertThat(withBroken.parse("42 г/л")).hasValueSatisfying(parsed ->
                    assertThat(parsed.strategy()).isEqualTo("bare-number"));
        }
    }
}
