package com.eainde.labreport.parse;

import com.eainde.labreport.model.ParsedValue;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code 5.66 10^12/л}: the mantissa stays the value and the exponent moves into
 * the unit, so {@code 10^12/л} is reported verbatim. Exponents longer than three
 * digits are run-together OCR noise and do not match.
 */
public class ScientificNotationStrategy implements ValueParseStrategy {

    private static final Pattern PATTERN =
            Pattern.compile("(" + Numbers.DECIMAL + ")\\s+10\\^?(\\d{1,3})\\s*([а-яА-ЯёЁa-zA-Z/×·*^]+)");

    @Override
    public String name() {
        return "scientific";
    }

    @Override
    public Optional<ParsedValue> parse(String valueText) {
        Matcher m = PATTERN.matcher(valueText);
        if (!m.find()) {
            return Optional.empty();
        }
        String unit = "10^" + Integer.parseInt(m.group(2)) + UnitCleaner.clean(m.group(3));
        return Optional.of(new ParsedValue(Numbers.parse(m.group(1)), unit, 0.95, name()));
    }
}
