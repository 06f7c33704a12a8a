package com.eainde.labreport.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Numeric reading of a displayed reference range.
 *
 * <pre>
 *   "130,00 - 160,00"  RANGE        lower=130.0 upper=160.0
 *   "S/CO &lt; 1,0"       UPPER        upper=1.0
 *   "более 60"         LOWER        lower=60.0
 *   "5,0"              APPROXIMATE  lower=upper=5.0
 * </pre>
 *
 * @param kind  how the numbers bound the value
 * @param lower lower bound, NaN when absent
 * @param upper upper bound, NaN when absent
 */
public record ReferenceBounds(Kind kind, double lower, double upper) implements Serializable {

    public enum Kind { RANGE, UPPER, LOWER, APPROXIMATE }

    private static final Pattern NUMBER = Pattern.compile("\\d+[.,]?\\d*");
    private static final Pattern UPPER_BOUND = Pattern.compile("менее|меньше|<|≤|(?<![а-яё])до\\s|less|below");
    private static final Pattern LOWER_BOUND = Pattern.compile("более|больше|>|≥|выше|more|above|greater");

    /**
     * Reads the bounds out of range text. Two or more numbers form {@code [first, second]};
     * a single number becomes a bound whose side is chosen by comparator words.
     */
    public static Optional<ReferenceBounds> parse(String rangeText) {
        if (rangeText == null || rangeText.isBlank()) {
            return Optional.empty();
        }
        List<Double> numbers = numbersIn(rangeText);
        if (numbers.size() >= 2) {
            return Optional.of(new ReferenceBounds(Kind.RANGE, numbers.get(0), numbers.get(1)));
        }
        if (numbers.size() == 1) {
            double bound = numbers.get(0);
            String lower = rangeText.toLowerCase(Locale.ROOT);
            if (UPPER_BOUND.matcher(lower).find()) {
                return Optional.of(new ReferenceBounds(Kind.UPPER, Double.NaN, bound));
            }
            if (LOWER_BOUND.matcher(lower).find()) {
                return Optional.of(new ReferenceBounds(Kind.LOWER, bound, Double.NaN));
            }
            return Optional.of(new ReferenceBounds(Kind.APPROXIMATE, bound, bound));
        }
        return Optional.empty();
    }

    /**
     * All decimal numbers in the text, accepting either {@code ,} or {@code .} as separator.
     */
    public static List<Double> numbersIn(String text) {
        List<Double> numbers = new ArrayList<>();
        Matcher m = NUMBER.matcher(text);
        while (m.find()) {
            String token = m.group().replace(',', '.');
            if (token.endsWith(".")) {
                token = token.substring(0, token.length() - 1);
            }
            numbers.add(Double.parseDouble(token));
        }
        return numbers;
    }
}
