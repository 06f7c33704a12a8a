package com.eainde.labreport.filter;

import com.eainde.labreport.config.MedicalVocabulary;

import java.util.regex.Pattern;

/**
 * Rejects section headers ("Общий анализ крови: ...") and demographic fields
 * ("Возраст: 45"). A qualitative medical answer in the value overrides both.
 */
public class SectionHeaderRule implements LineRejectRule {

    private static final Pattern NUMBER_WITH_UNIT = Pattern.compile("\\d+[.,]?\\d*\\s*[а-яА-ЯёЁa-zA-Z/%×·*^°]+");
    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern PARENTHETICAL_LABEL = Pattern.compile("^[^(]*\\([^)]*\\)$");
    private static final Pattern NUMBER_THEN_LETTER = Pattern.compile("\\d+[.,]?\\d*\\s*[а-яА-ЯёЁa-zA-Z]");
    private static final int LONG_LABEL = 20;

    @Override
    public String name() {
        return "section-header";
    }

    @Override
    public boolean rejects(CandidateLine line) {
        String label = line.labelLower();
        if (MedicalVocabulary.containsQualitativeKeyword(line.valueText())) {
            return false;
        }
        if (MedicalVocabulary.anyFind(MedicalVocabulary.SECTION_HEADER_PATTERNS, label)
                || MedicalVocabulary.anyFind(MedicalVocabulary.SECTION_HEADER_PATTERNS, line.valueLower())) {
            return true;
        }
        if (MedicalVocabulary.anyFind(MedicalVocabulary.DEMOGRAPHIC_PATTERNS, label)) {
            return true;
        }
        if (!NUMBER_WITH_UNIT.matcher(line.valueText()).find()
                && (line.label().length() > LONG_LABEL || !DIGIT.matcher(line.valueText()).find())) {
            return !MedicalVocabulary.anyFind(MedicalVocabulary.QUALITATIVE_TEST_PATTERNS, label);
        }
        return PARENTHETICAL_LABEL.matcher(line.label()).matches()
                && !NUMBER_THEN_LETTER.matcher(line.valueText()).find();
    }
}
