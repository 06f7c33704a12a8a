package com.eainde.labreport.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Tunable knobs of the extraction engine, bound from {@code lab.extraction.*}.
 *
 * <p>Pure value holder: the engine components take it by constructor, so unit
 * tests build one through {@link #defaults()} without a Spring context.</p>
 */
@Getter
@Component
public class ExtractionSettings {

    private final int labelWindow;
    private final int labCodeWindow;
    private final int hepatitisWindow;
    private final int panelWindow;
    private final int templateWindow;
    private final double templateConfidence;
    private final int minMetrics;
    private final int minKeywords;
    private final double maxPlainValue;
    private final boolean requireKnownName;

    public ExtractionSettings(
            @Value("${lab.extraction.proximity.label-window:8}") int labelWindow,
            @Value("${lab.extraction.proximity.lab-code-window:5}") int labCodeWindow,
            @Value("${lab.extraction.proximity.hepatitis-window:6}") int hepatitisWindow,
            @Value("${lab.extraction.proximity.panel-window:10}") int panelWindow,
            @Value("${lab.extraction.template.window:5}") int templateWindow,
            @Value("${lab.extraction.template.confidence:0.80}") double templateConfidence,
            @Value("${lab.extraction.validation.min-metrics:2}") int minMetrics,
            @Value("${lab.extraction.validation.min-keywords:3}") int minKeywords,
            @Value("${lab.extraction.suspicious.max-plain-value:10000}") double maxPlainValue,
            @Value("${lab.extraction.filter.require-known-name:false}") boolean requireKnownName) {

        if (labelWindow < 1 || labCodeWindow < 1 || hepatitisWindow < 1
                || panelWindow < 1 || templateWindow < 1) {
            throw new IllegalArgumentException("Look-ahead windows must be >= 1");
        }
        if (templateConfidence < 0.0 || templateConfidence > 1.0) {
            throw new IllegalArgumentException("template confidence must be in [0,1]: " + templateConfidence);
        }
        this.labelWindow = labelWindow;
        this.labCodeWindow = labCodeWindow;
        this.hepatitisWindow = hepatitisWindow;
        this.panelWindow = panelWindow;
        this.templateWindow = templateWindow;
        this.templateConfidence = templateConfidence;
        this.minMetrics = minMetrics;
        this.minKeywords = minKeywords;
        this.maxPlainValue = maxPlainValue;
        this.requireKnownName = requireKnownName;
    }

    public static ExtractionSettings defaults() {
        return new ExtractionSettings(8, 5, 6, 10, 5, 0.80, 2, 3, 10_000, false);
    }
}
