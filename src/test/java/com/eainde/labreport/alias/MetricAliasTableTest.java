package com.eainde.labreport.alias;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class MetricAliasTableTest {

    private final MetricAliasTable table = new MetricAliasTable();

    // =========================================================================
    //  Direct lookup
    // =========================================================================

    @Nested
    @DisplayName("Direct lookup")
    class DirectLookup {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "HGB, hemoglobin",
                "Гемоглобин, hemoglobin",
                "rbc, red_blood_cells",
                "NEU#, neutrophils_absolute",
                "LYM%, lymphocytes_percentage",
                "P-LCR, platelet_large_cell_ratio",
                "Глюкоза, glucose",
                "АЛТ, alt_alanine_aminotransferase",
                "Аланинаминотрансфераза, alt_alanine_aminotransferase"
        })
        @DisplayName("should resolve surface forms case-insensitively")
        void resolvesKnownForms(String raw, String canonical) {
            assertThat(table.resolve(raw)).isEqualTo(canonical);
        }

        @Test
        @DisplayName("should collapse inner whitespace before lookup")
        void collapsesWhitespace() {
            assertThat(table.resolve("  Мочевая   кислота ")).isEqualTo("uric_acid");
        }
    }

    // =========================================================================
    //  Prefixes, suffixes and compound names
    // =========================================================================

    @Nested
    @DisplayName("Prefixes, suffixes and compound names")
    class Affixes {

        @Test
        @DisplayName("should drop a leading 'общий'")
        void dropsGeneralPrefix() {
            assertThat(table.resolve("Общий белок")).isEqualTo("total_protein");
        }

        @Test
        @DisplayName("should keep 'свободный' for free thyroid hormones")
        void keepsFreeHormonePrefix() {
            assertThat(table.resolve("Свободный Т4")).isEqualTo("free_t4");
            assertThat(table.resolve("Свободный Т3")).isEqualTo("free_t3");
        }

        @Test
        @DisplayName("should map bilirubin qualifiers through compound names")
        void bilirubinCompounds() {
            assertThat(table.resolve("Билирубин общий")).isEqualTo("total_bilirubin");
            assertThat(table.resolve("Билирубин прямой")).isEqualTo("direct_bilirubin");
            assertThat(table.resolve("Билирубин конъюгированный")).isEqualTo("direct_bilirubin");
            assertThat(table.resolve("Билирубин неконъюгированный")).isEqualTo("indirect_bilirubin");
        }

        @Test
        @DisplayName("should strip a trailing _ABS / _PCT marker")
        void stripsTrailingMarkers() {
            assertThat(table.resolve("HGB_ABS")).isEqualTo("hemoglobin");
            assertThat(table.resolve("PLT%")).isEqualTo("platelets");
        }
    }

    // =========================================================================
    //  Tabular OCR artefacts and abbreviation variants
    // =========================================================================

    @Nested
    @DisplayName("Tabular names and abbreviation variants")
    class Variants {

        @Test
        @DisplayName("should drop digits glued to a tabular test name")
        void tabularDigits() {
            assertThat(table.resolve("ТТГ1")).isEqualTo("thyroid_stimulating_hormone");
            assertThat(table.resolve("Свободный ТЗ 2")).isEqualTo("free_t3");
        }

        @Test
        @DisplayName("should read 25-OH vitamin D written with Latin letters")
        void vitaminD() {
            assertThat(table.resolve("25-OH витамин D")).isEqualTo("vitamin_d_25_oh");
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "АЛАТ, alt_alanine_aminotransferase",
                "АСАТ, ast_aspartate_aminotransferase",
                "TSH, thyroid_stimulating_hormone",
                "ГГТП, gamma_glutamyl_transferase",
                "CRP, c_reactive_protein",
                "INR, international_normalized_ratio",
                "Anti-HCV, hepatitis_c_antibodies"
        })
        @DisplayName("should fall through to known abbreviation variants")
        void abbreviationVariants(String raw, String canonical) {
            assertThat(table.resolve(raw)).isEqualTo(canonical);
        }

        @Test
        @DisplayName("should accept Latin and Cyrillic C in hepatitis names")
        void hepatitisLetterVariants() {
            assertThat(table.resolve("Антитела к гепатиту C")).isEqualTo("hepatitis_c_antibodies");
            assertThat(table.resolve("Антитела к гепатиту С")).isEqualTo("hepatitis_c_antibodies");
        }
    }

    // =========================================================================
    //  Fallback
    // =========================================================================

    @Nested
    @DisplayName("Fallback")
    class Fallback {

        @Test
        @DisplayName("should lowercase and underscore unknown names")
        void normalizesUnknown() {
            assertThat(table.resolve("Лактат дегидрогеназа-5")).isEqualTo("лактат_дегидрогеназа_5");
        }

        @Test
        @DisplayName("should map canonical names onto themselves")
        void canonicalIsFixedPoint() {
            assertThat(table.resolve("hemoglobin")).isEqualTo("hemoglobin");
            assertThat(table.resolve("alt_alanine_aminotransferase")).isEqualTo("alt_alanine_aminotransferase");
            assertThat(table.isCanonical("hemoglobin")).isTrue();
            assertThat(table.isCanonical("HGB")).isFalse();
        }
    }
}
