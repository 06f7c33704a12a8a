package com.eainde.labreport.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Plausibility verdict for one processed page or document.
 *
 * @param valid       whether the input looks like a lab report
 * @param message     human-readable justification
 * @param metricCount number of metrics that contributed to the verdict
 */
public record DocumentVerdict(
        @JsonProperty("valid")              boolean valid,
        @JsonProperty("validation_message") String message,
        @JsonProperty("metric_count")       int metricCount
) implements Serializable {}
