package com.eainde.labreport.alias;

import com.eainde.labreport.extract.LineParserFixtures;
import com.eainde.labreport.extract.StructuralExtractor;
import com.eainde.labreport.model.MetricRecord;
import com.eainde.labreport.model.MetricStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Every name the alias table produces must survive being rendered with
 * {@link MetricRecord#toCanonicalLine()} and read back by the structural pass.
 */
class CanonicalLineRoundTripTest {

    private final StructuralExtractor extractor = new StructuralExtractor(LineParserFixtures.defaultParser());

    static Stream<String> canonicalNames() {
        return MetricAliasTable.canonicalNames().stream().sorted();
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("canonicalNames")
    @DisplayName("should read a canonical line back into the same record")
    void roundTrip(String name) {
        MetricRecord record = new MetricRecord(name, null, 12.5, "ммоль/л", "10 - 15",
                MetricStatus.NORMAL, 0.75, null);

        assertThat(extractor.extract(record.toCanonicalLine()).metrics())
                .as(record.toCanonicalLine())
                .singleElement()
                .satisfies(again -> {
                    assertThat(again.name()).isEqualTo(name);
                    assertThat(again.value()).isEqualTo(12.5);
                    assertThat(again.status()).isEqualTo(MetricStatus.NORMAL);
                });
    }

    @Test
    @DisplayName("should read a coagulation time in seconds back after rendering")
    void coagulationTime() {
        MetricRecord first = extractor.extract("АЧТВ: 35 сек (норма: 25 - 37)").metrics().get(0);

        assertThat(first.name()).isEqualTo("activated_partial_thromboplastin_time");
        assertThat(first.toCanonicalLine()).isEqualTo("activated_partial_thromboplastin_time: 35.0 сек (25 - 37)");
        assertThat(extractor.extract(first.toCanonicalLine()).metrics())
                .singleElement()
                .satisfies(again -> {
                    assertThat(again.name()).isEqualTo(first.name());
                    assertThat(again.value()).isEqualTo(35.0);
                    assertThat(again.unit()).isEqualTo("сек");
                    assertThat(again.status()).isEqualTo(MetricStatus.NORMAL);
                });
    }
}
