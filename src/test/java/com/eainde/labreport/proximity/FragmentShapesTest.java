package com.eainde.labreport.proximity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FragmentShapesTest {

    @Test
    @DisplayName("should recognise value-shaped fragments")
    void values() {
        assertThat(FragmentShapes.isValue("163 г/л")).isTrue();
        assertThat(FragmentShapes.isValue("5.66 10^12/л")).isTrue();
        assertThat(FragmentShapes.isValue("S/CO = 0,13")).isTrue();
        assertThat(FragmentShapes.isValue("163")).isFalse();
    }

    @Test
    @DisplayName("should normalise dash ranges and keep 'от ... до' ranges verbatim")
    void ranges() {
        assertThat(FragmentShapes.rangeText("4,50–5,90")).isEqualTo("4,50 - 5,90");
        assertThat(FragmentShapes.rangeText("от 3 до 5")).isEqualTo("от 3 до 5");
        assertThat(FragmentShapes.rangeText("Гемоглобин")).isNull();
    }

    @Test
    @DisplayName("should tell test names from other fragments")
    void testNames() {
        assertThat(FragmentShapes.isTestName("NEU#")).isTrue();
        assertThat(FragmentShapes.isTestName("Свободный Т4")).isTrue();
        assertThat(FragmentShapes.isTestName("г/л")).isFalse();
        assertThat(FragmentShapes.isLabCode("Hgb")).isFalse();
    }

    @Test
    @DisplayName("should flag dated and labelled fragments")
    void contamination() {
        assertThat(FragmentShapes.isDateContaminated("Дата: 26.04.2025")).isTrue();
        assertThat(FragmentShapes.isLabelledLine("HGB: 150 г/л")).isTrue();
        assertThat(FragmentShapes.isLabelledLine("HGB:")).isFalse();
    }
}
