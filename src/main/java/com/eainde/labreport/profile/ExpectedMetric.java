package com.eainde.labreport.profile;

import java.util.List;

/**
 * One metric a document profile looks for.
 *
 * @param canonicalName name written on the extracted record
 * @param nameVariants  spellings that identify the metric's label fragment
 * @param fallbackRange range used when the page shows none
 */
public record ExpectedMetric(String canonicalName, List<String> nameVariants, String fallbackRange) {

    public ExpectedMetric {
        if (canonicalName == null || canonicalName.isBlank()) {
            throw new IllegalArgumentException("canonicalName must not be blank");
        }
        if (nameVariants == null || nameVariants.isEmpty()) {
            throw new IllegalArgumentException("At least one name variant is required for " + canonicalName);
        }
        nameVariants = List.copyOf(nameVariants);
    }
}
