package com.eainde.labreport.extract;

import com.eainde.labreport.model.MetricRecord;
import com.eainde.labreport.model.MetricStatus;
import com.eainde.labreport.model.PassResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StructuralExtractorTest {

    // =========================================================================
    //  With the real line parser
    // =========================================================================

    @Nested
    @DisplayName("Full pipeline")
    class FullPipeline {

        private final StructuralExtractor extractor = new StructuralExtractor(LineParserFixtures.defaultParser());

        @Test
        @DisplayName("should keep only lines that parse as metrics")
        void mixedPage() {
            String page = String.join("\n",
                    "Общий анализ крови",
                    "HGB: 163.00 г/л (норма: 130,00 - 160,00)",
                    "RBC: 5.66 10^12/л (норма: 4,50 - 5,90)",
                    "Дата: 26.04.2025",
                    "Антитела к гепатиту C: Не обнаружено");

            PassResult result = extractor.extract(page);

            assertThat(result.metrics())
                    .extracting(MetricRecord::name)
                    .containsExactly("hemoglobin", "red_blood_cells", "hepatitis_c_antibodies");
            assertThat(result.metrics()).extracting(MetricRecord::status)
                    .containsExactly(MetricStatus.HIGH, MetricStatus.NORMAL, MetricStatus.NOT_DETECTED);
            assertThat(result.lines()).containsExactly(
                    "HGB: 163.00 г/л (норма: 130,00 - 160,00)",
                    "RBC: 5.66 10^12/л (норма: 4,50 - 5,90)",
                    "Антитела к гепатиту C: Не обнаружено");
        }

        @Test
        @DisplayName("should drop a line with a run-together exponent and keep the rest of the page")
        void overlongExponent() {
            PassResult result = extractor.extract(String.join("\n",
                    "HGB: 163.00 г/л (норма: 130,00 - 160,00)",
                    "PLT: 250 10^99999999999/л (норма: 150 - 400)"));

            assertThat(result.metrics()).extracting(MetricRecord::name).containsExactly("hemoglobin");
        }

        @Test
        @DisplayName("should drop a line whose number overflows and keep the rest of the page")
        void overlongMantissa() {
            PassResult result = extractor.extract(String.join("\n",
                    "PLT: " + "9".repeat(400) + " 10^9/л (норма: 150 - 400)",
                    "HGB: 163.00 г/л (норма: 130,00 - 160,00)"));

            assertThat(result.metrics()).extracting(MetricRecord::name).containsExactly("hemoglobin");
        }

        @Test
        @DisplayName("should return an empty pass for blank text")
        void blank() {
            assertThat(extractor.extract("  ")).isEqualTo(PassResult.EMPTY);
            assertThat(extractor.extract(null)).isEqualTo(PassResult.EMPTY);
        }
    }

    // =========================================================================
    //  With a mocked line parser
    // =========================================================================

    @Nested
    @DisplayName("Line selection")
    class LineSelection {

        @Mock
        private MetricLineParser lineParser;

        @Test
        @DisplayName("should only hand lines with a separator to the parser")
        void separatorLinesOnly() {
            when(lineParser.parseLine("HGB: 150 г/л")).thenReturn(Optional.empty());

            PassResult result = new StructuralExtractor(lineParser).extract("Гемоглобин\r\nHGB: 150 г/л");

            assertThat(result.metrics()).isEmpty();
            verify(lineParser).parseLine("HGB: 150 г/л");
            verify(lineParser, never()).parseLine("Гемоглобин");
        }

        @Test
        @DisplayName("should not call the parser for text without separators")
        void noSeparators() {
            new StructuralExtractor(lineParser).extract("Гемоглобин\n150 г/л");

            verify(lineParser, never()).parseLine(anyString());
        }
    }
}
