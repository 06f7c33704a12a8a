package com.eainde.labreport.validation;

import com.eainde.labreport.config.ExtractionSettings;
import com.eainde.labreport.config.MedicalVocabulary;
import com.eainde.labreport.model.DocumentVerdict;
import com.eainde.labreport.model.MetricRecord;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Judges whether a processed page or document looks like a lab report, from the
 * number of extracted metrics and the medical vocabulary in the raw text.
 */
@Log4j2
@Component
public class DocumentValidator {

    public static final String VALID_MESSAGE = "Valid medical document detected with multiple health metrics.";
    public static final String KEYWORDS_ONLY_MESSAGE = "Document contains medical terminology but few structured metrics.";
    public static final String SINGLE_METRIC_MESSAGE =
            "Document contains only one health metric. Please upload a complete medical report.";
    public static final String NOT_MEDICAL_MESSAGE =
            "This doesn't appear to be a medical document. Please upload a lab report or medical test result.";

    /** Names of placeholder rows some upstream fixtures emit. */
    private static final Set<String> PLACEHOLDER_NAMES = Set.of("Sample Metric", "sample_metric");

    private final int minMetrics;
    private final int minKeywords;

    public DocumentValidator(ExtractionSettings settings) {
        this.minMetrics = settings.getMinMetrics();
        this.minKeywords = settings.getMinKeywords();
    }

    public DocumentVerdict validate(List<MetricRecord> metrics, String fullText) {
        int realMetrics = (int) metrics.stream()
                .filter(m -> !PLACEHOLDER_NAMES.contains(m.name()))
                .count();
        if (realMetrics >= minMetrics) {
            return new DocumentVerdict(true, VALID_MESSAGE, realMetrics);
        }

        int keywords = countKeywords(fullText);
        if (keywords >= minKeywords) {
            log.info("Only {} metrics but {} medical keywords, accepting with caveat", realMetrics, keywords);
            return new DocumentVerdict(true, KEYWORDS_ONLY_MESSAGE, realMetrics);
        }
        if (realMetrics == 1) {
            return new DocumentVerdict(false, SINGLE_METRIC_MESSAGE, realMetrics);
        }
        return new DocumentVerdict(false, NOT_MEDICAL_MESSAGE, realMetrics);
    }

    static int countKeywords(String fullText) {
        if (fullText == null || fullText.isBlank()) {
            return 0;
        }
        String lower = fullText.toLowerCase(Locale.ROOT);
        int count = 0;
        for (String keyword : MedicalVocabulary.DOCUMENT_KEYWORDS) {
            if (lower.contains(keyword)) {
                count++;
            }
        }
        return count;
    }
}
