package com.eainde.labreport.parse;

import com.eainde.labreport.model.ParsedValue;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last resort: the first number in the fragment, with unit {@value #DEFAULT_UNIT}
 * unless a unit token follows it directly.
 */
public class BareNumberStrategy implements ValueParseStrategy {

    public static final String DEFAULT_UNIT = "units";

    private static final Pattern NUMBER = Pattern.compile(Numbers.DECIMAL);
    private static final Pattern LEADING_UNIT = Pattern.compile("^\\s*([а-яА-ЯёЁa-zA-Z/%×·*^]+|U/L|МЕ/л|сек)");

    @Override
    public String name() {
        return "bare-number";
    }

    @Override
    public Optional<ParsedValue> parse(String valueText) {
        Matcher m = NUMBER.matcher(valueText);
        if (!m.find()) {
            return Optional.empty();
        }
        Matcher unit = LEADING_UNIT.matcher(valueText.substring(m.end()));
        String unitText = unit.find() ? UnitCleaner.clean(unit.group(1)) : DEFAULT_UNIT;
        return Optional.of(new ParsedValue(Numbers.parse(m.group()), unitText, 0.50, name()));
    }
}
