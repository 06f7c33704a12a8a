package com.eainde.labreport.parse;

import com.eainde.labreport.model.ParsedValue;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scientific notation that lost its {@code 10}: {@code 319 9^9/л} still carries an
 * exponent and scores 0.90, a bare multiplier such as {@code 4,5 12/л} is kept
 * as {@code ×12/л} at 0.85.
 */
public class MultiplierNotationStrategy implements ValueParseStrategy {

    private static final Pattern PATTERN =
            Pattern.compile("(" + Numbers.DECIMAL + ")\\s+(\\d{1,3}\\^?\\d{0,3})([а-яА-ЯёЁa-zA-Z/×·*][а-яА-ЯёЁa-zA-Z/×·*^]*)");

    @Override
    public String name() {
        return "multiplier";
    }

    @Override
    public Optional<ParsedValue> parse(String valueText) {
        Matcher m = PATTERN.matcher(valueText);
        if (!m.find()) {
            return Optional.empty();
        }
        double value = Numbers.parse(m.group(1));
        String multiplier = m.group(2);
        String unit = UnitCleaner.clean(m.group(3));
        int caret = multiplier.indexOf('^');
        if (caret >= 0) {
            String exponent = multiplier.substring(caret + 1);
            if (exponent.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new ParsedValue(value, "10^" + Integer.parseInt(exponent) + unit, 0.90, name()));
        }
        return Optional.of(new ParsedValue(value, "×" + multiplier + unit, 0.85, name()));
    }
}
