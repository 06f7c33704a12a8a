package com.eainde.labreport;

import com.eainde.labreport.config.ExtractionSettings;
import com.eainde.labreport.model.LabReportAnalysis;
import com.eainde.labreport.model.MetricRecord;
import com.eainde.labreport.model.OcrPage;
import com.eainde.labreport.workflow.LabReportEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "lab.extraction.validation.min-metrics=3")
class LabReportApplicationTest {

    @Autowired
    private LabReportEngine engine;

    @Autowired
    private ExtractionSettings settings;

    @Test
    @DisplayName("should bind extraction settings from properties")
    void bindsSettings() {
        assertThat(settings.getMinMetrics()).isEqualTo(3);
        assertThat(settings.getLabelWindow()).isEqualTo(8);
        assertThat(settings.isRequireKnownName()).isFalse();
    }

    @Test
    @DisplayName("should analyze a page with the wired engine")
    void analyzesPage() {
        LabReportAnalysis analysis = engine.analyzePage(OcrPage.of(List.of(
                "Общий анализ крови",
                "HGB: 163.00 г/л (норма: 130,00 - 160,00)",
                "RBC: 5.66 10^12/л (норма: 4,50 - 5,90)")));

        assertThat(analysis.metrics()).extracting(MetricRecord::name)
                .containsExactly("hemoglobin", "red_blood_cells");
        // two metrics and two keywords, both under threshold
        assertThat(analysis.valid()).isFalse();
    }
}
