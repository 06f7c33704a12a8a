package com.eainde.labreport.filter;

import java.util.Locale;

/**
 * A {@code label: value} split of one text line, before it is accepted as a metric.
 *
 * @param label     text left of the first separator
 * @param valueText text right of the first separator
 * @param fullLine  the whole line
 */
public record CandidateLine(String label, String valueText, String fullLine) {

    public CandidateLine {
        label = label == null ? "" : label.strip();
        valueText = valueText == null ? "" : valueText.strip();
        fullLine = fullLine == null ? label + ": " + valueText : fullLine;
    }

    public String labelLower() {
        return label.toLowerCase(Locale.ROOT);
    }

    public String valueLower() {
        return valueText.toLowerCase(Locale.ROOT);
    }
}
