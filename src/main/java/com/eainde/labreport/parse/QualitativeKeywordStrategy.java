package com.eainde.labreport.parse;

import com.eainde.labreport.model.MetricRecord;
import com.eainde.labreport.model.ParsedValue;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Whole-fragment qualitative answers such as {@code Не обнаружено} or {@code positive},
 * mapped to the sentinel values 0.0, 1.0 and 0.5.
 */
public class QualitativeKeywordStrategy implements ValueParseStrategy {

    public static final double DETECTED = 1.0;
    public static final double NOT_DETECTED = 0.0;
    public static final double NORMAL = 0.5;

    private static final Pattern TRAILING_PARENTHESES = Pattern.compile("\\s*\\([^)]*\\)\\s*$");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.,;]+$");

    private static final Map<Pattern, double[]> ANSWERS = new LinkedHashMap<>();

    static {
        answer("^не\\s+обнаружено$", NOT_DETECTED, 0.95);
        answer("^обнаружено$", DETECTED, 0.95);
        answer("^not\\s+detected$", NOT_DETECTED, 0.95);
        answer("^detected$", DETECTED, 0.95);
        answer("^отрицательно$", NOT_DETECTED, 0.90);
        answer("^положительно$", DETECTED, 0.90);
        answer("^позитивно$", DETECTED, 0.90);
        answer("^негативно$", NOT_DETECTED, 0.90);
        answer("^negative$", NOT_DETECTED, 0.90);
        answer("^positive$", DETECTED, 0.90);
        answer("^норма$", NORMAL, 0.85);
        answer("^в\\s+пределах\\s+нормы$", NORMAL, 0.85);
        answer("^normal$", NORMAL, 0.85);
    }

    private static void answer(String regex, double sentinel, double confidence) {
        ANSWERS.put(Pattern.compile(regex), new double[]{sentinel, confidence});
    }

    @Override
    public String name() {
        return "qualitative";
    }

    @Override
    public Optional<ParsedValue> parse(String valueText) {
        String answer = TRAILING_PARENTHESES.matcher(valueText.toLowerCase(Locale.ROOT).strip()).replaceFirst("");
        answer = TRAILING_PUNCTUATION.matcher(answer.strip()).replaceFirst("");
        for (Map.Entry<Pattern, double[]> entry : ANSWERS.entrySet()) {
            if (entry.getKey().matcher(answer).find()) {
                double[] v = entry.getValue();
                return Optional.of(new ParsedValue(v[0], MetricRecord.QUALITATIVE_UNIT, v[1], name()));
            }
        }
        return Optional.empty();
    }
}
