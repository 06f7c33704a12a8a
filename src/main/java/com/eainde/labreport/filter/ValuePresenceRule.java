package com.eainde.labreport.filter;

import com.eainde.labreport.config.MedicalVocabulary;

import java.util.regex.Pattern;

/**
 * Rejects values that carry neither a number nor a qualitative answer.
 */
public class ValuePresenceRule implements LineRejectRule {

    private static final Pattern DIGIT = Pattern.compile("\\d");

    @Override
    public String name() {
        return "value-presence";
    }

    @Override
    public boolean rejects(CandidateLine line) {
        if (MedicalVocabulary.containsQualitativeKeyword(line.valueText()) || line.valueLower().contains("норма")) {
            return false;
        }
        return !DIGIT.matcher(line.valueText()).find();
    }
}
