package com.eainde.labreport.parse;

import com.eainde.labreport.model.ParsedValue;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decimals whose separator came through as a comma or a gap: {@code 5,66 г/л},
 * {@code 5 66 г/л} and {@code 163.00 г/л} all reassemble to {@code int.frac}.
 */
public class SpacedDecimalStrategy implements ValueParseStrategy {

    private static final Pattern PATTERN =
            Pattern.compile("(\\d+)[.,\\s]+(\\d+)\\s*([а-яА-ЯёЁa-zA-Z/%×·*^]+)");

    @Override
    public String name() {
        return "spaced-decimal";
    }

    @Override
    public Optional<ParsedValue> parse(String valueText) {
        Matcher m = PATTERN.matcher(valueText);
        if (!m.find()) {
            return Optional.empty();
        }
        double value = Double.parseDouble(m.group(1) + "." + m.group(2));
        return Optional.of(new ParsedValue(value, UnitCleaner.clean(m.group(3)), 0.80, name()));
    }
}
