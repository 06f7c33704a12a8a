package com.eainde.labreport.filter;

import com.eainde.labreport.config.MedicalVocabulary;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Rejects values with no unit indicator: no known unit token, no number followed
 * by unit-like text or a parenthesised range, and no qualitative answer.
 */
public class UnitIndicatorRule implements LineRejectRule {

    private static final List<Pattern> UNIT_SHAPES = List.of(
            Pattern.compile("\\d+[.,]?\\d*\\s*[а-яА-ЯёЁa-zA-Z/%×·*^°]+"),
            Pattern.compile("\\d+[.,]?\\d*\\s+10\\^?\\d+"),
            Pattern.compile("\\d+[.,]?\\d*\\s*\\([^)]*\\)"));

    @Override
    public String name() {
        return "unit-indicator";
    }

    @Override
    public boolean rejects(CandidateLine line) {
        if (MedicalVocabulary.anyFind(MedicalVocabulary.UNIT_INDICATORS, line.valueLower())) {
            return false;
        }
        if (MedicalVocabulary.anyFind(UNIT_SHAPES, line.valueText())) {
            return false;
        }
        return !MedicalVocabulary.containsQualitativeKeyword(line.valueText());
    }
}
