package com.eainde.labreport.filter;

import com.eainde.labreport.config.MedicalVocabulary;

import java.util.regex.Pattern;

/**
 * Rejects dates, clock times and {@code Дата:}/{@code Время:} fields, unless the
 * label is a test name that happens to contain a time word (prothrombin time,
 * 25-OH vitamin D).
 */
public class TimestampRule implements LineRejectRule {

    private static final Pattern STANDALONE_TIME = Pattern.compile("^\\d{1,2}[:.]\\d{2}$");
    private static final Pattern MEASUREMENT_CONTEXT =
            Pattern.compile("норма|range|г/л|мг/дл|ммоль/л|мкмоль/л|%|пг|фл|/л|мм/час");
    private static final Pattern TIMESTAMP = Pattern.compile("\\d{1,2}[./]\\d{1,2}[./]\\d{4}\\s+\\d{1,2}:\\d{2}");
    private static final Pattern LAB_CODE_IN_LABEL = Pattern.compile("[A-Z]{2,5}");
    private static final Pattern CONCENTRATION_UNIT = Pattern.compile("г/л|мг/дл|ммоль/л");

    @Override
    public String name() {
        return "timestamp";
    }

    @Override
    public boolean rejects(CandidateLine line) {
        String label = line.labelLower();
        if (MedicalVocabulary.anyFind(MedicalVocabulary.TIME_CONTEXT_PATTERNS, label)) {
            return false;
        }
        if (MedicalVocabulary.DATE.matcher(line.label()).find()) {
            return true;
        }
        if (STANDALONE_TIME.matcher(line.valueText()).find()
                && !MEASUREMENT_CONTEXT.matcher(line.valueLower()).find()) {
            return true;
        }
        if (TIMESTAMP.matcher(line.fullLine()).find()) {
            return true;
        }
        return MedicalVocabulary.DATETIME_KEYWORD.matcher(label).find()
                && !LAB_CODE_IN_LABEL.matcher(line.label()).find()
                && !CONCENTRATION_UNIT.matcher(line.valueLower()).find();
    }
}
