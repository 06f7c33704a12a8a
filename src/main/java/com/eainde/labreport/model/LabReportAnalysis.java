package com.eainde.labreport.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Final output handed to downstream consumers.
 *
 * @param metrics           recognized metrics, concatenated across pages
 * @param summary           description of page/image quality
 * @param valid             document plausibility verdict
 * @param validationMessage justification for {@code valid}
 * @param extractedText     cleaned text of all pages, blank-line separated
 * @param pageCount         number of pages processed
 */
public record LabReportAnalysis(
        @JsonProperty("metrics")            List<MetricRecord> metrics,
        @JsonProperty("summary")            String summary,
        @JsonProperty("valid")              boolean valid,
        @JsonProperty("validation_message") String validationMessage,
        @JsonProperty("extracted_text")     String extractedText,
        @JsonProperty("page_count")         int pageCount
) {

    public static LabReportAnalysis of(List<MetricRecord> metrics, String summary,
                                       DocumentVerdict verdict, String extractedText, int pageCount) {
        return new LabReportAnalysis(List.copyOf(metrics), summary,
                verdict.valid(), verdict.message(), extractedText, pageCount);
    }

    public DocumentVerdict verdict() {
        return new DocumentVerdict(valid, validationMessage, metrics.size());
    }
}
