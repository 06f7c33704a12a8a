package com.eainde.labreport.model;

import java.util.List;

/**
 * Result of running the extraction workflow over one page.
 *
 * @param metrics       merged records, one per canonical name
 * @param verdict       page-level plausibility verdict
 * @param extractedText cleaned text: reconstructed or profile-filtered lines, then structural lines
 * @param route         secondary path that ran next to the structural pass
 * @param profileId     id of the matched document profile, empty for the proximity route
 * @param mergeStats    de-duplication statistics
 */
public record PageExtraction(
        List<MetricRecord> metrics,
        DocumentVerdict verdict,
        String extractedText,
        ExtractionRoute route,
        String profileId,
        MergeStats mergeStats
) {}
