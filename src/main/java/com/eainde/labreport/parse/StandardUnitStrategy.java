package com.eainde.labreport.parse;

import com.eainde.labreport.model.ParsedValue;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Plain {@code <number> <unit>}. Known medical unit tokens are tried before the
 * generic letters-and-slashes unit.
 */
public class StandardUnitStrategy implements ValueParseStrategy {

    private static final Pattern PATTERN = Pattern.compile("(" + Numbers.DECIMAL + ")\\s*("
            + "U/L|МЕ/л|Ед/л|мкМЕ/мл|нг/мл|пг/мл|нг/дл|мг/л|мкг/л|ммоль/л|мкмоль/л|сек"
            + "|[а-яА-ЯёЁa-zA-Z/%×·*^°]+(?:/[а-яА-ЯёЁa-zA-Z]+)?)");

    @Override
    public String name() {
        return "standard";
    }

    @Override
    public Optional<ParsedValue> parse(String valueText) {
        Matcher m = PATTERN.matcher(valueText);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(new ParsedValue(Numbers.parse(m.group(1)), UnitCleaner.clean(m.group(2)), 0.75, name()));
    }
}
