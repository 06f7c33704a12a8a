package com.eainde.labreport.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of labels a {@link MetricRecord} can carry.
 */
public enum MetricStatus {
    NORMAL("normal"),
    LOW("low"),
    HIGH("high"),
    ELEVATED("elevated"),
    DETECTED("detected"),
    NOT_DETECTED("not_detected"),
    UNKNOWN("unknown");

    private final String label;

    MetricStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
