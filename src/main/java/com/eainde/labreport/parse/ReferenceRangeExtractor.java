package com.eainde.labreport.parse;

import com.eainde.labreport.model.MetricRecord;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the displayed reference range out of a value fragment. Purely textual;
 * numbers are read later by {@link StatusClassifier}.
 */
@Component
public class ReferenceRangeExtractor {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    private static final String LABEL = "(?:норма|референс|reference\\s+range|norm)";

    private static final Pattern LABELLED_IN_PARENTHESES = Pattern.compile("\\(" + LABEL + "\\s*:\\s*([^)]+)\\)", FLAGS);
    private static final Pattern LABELLED = Pattern.compile(LABEL + "\\s*:\\s*(.+)$", FLAGS);
    private static final Pattern PARENTHESES = Pattern.compile("\\(([^)]*\\d+[^)]*)\\)");
    private static final Pattern SINGLE_BOUND =
            Pattern.compile("(?:[<>≤≥]|менее|более|не\\s+более|до|от)\\s*\\d", FLAGS);
    private static final Pattern NUMERIC_RANGE =
            Pattern.compile("(" + Numbers.DECIMAL + "\\s*[-–]\\s*" + Numbers.DECIMAL + ")");

    /**
     * @return the range text, or {@value MetricRecord#RANGE_NOT_SPECIFIED}
     */
    public String extractRange(String valueText) {
        Matcher labelledParen = LABELLED_IN_PARENTHESES.matcher(valueText);
        if (labelledParen.find()) {
            return labelledParen.group(1).strip();
        }
        Matcher labelled = LABELLED.matcher(valueText);
        if (labelled.find()) {
            String range = labelled.group(1).strip();
            if (!range.isEmpty()) {
                return range;
            }
        }
        Matcher paren = PARENTHESES.matcher(valueText);
        while (paren.find()) {
            String content = paren.group(1).strip();
            if (NUMERIC_RANGE.matcher(content).find() || SINGLE_BOUND.matcher(content).find()) {
                return content;
            }
        }
        Matcher bare = NUMERIC_RANGE.matcher(valueText);
        if (bare.find()) {
            return bare.group(1).strip();
        }
        return MetricRecord.RANGE_NOT_SPECIFIED;
    }
}
