package com.eainde.labreport.parse;

import com.eainde.labreport.model.ParsedValue;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Signal-to-cutoff readings of infectious-disease markers. With a qualitative
 * verdict in front ({@code Не обнаружено, S/CO = 0,13}) the match scores 0.95;
 * a bare {@code S/CO = 0,13} scores 0.90.
 */
public class SignalCutoffStrategy implements ValueParseStrategy {

    public static final String UNIT = "S/CO";

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    private static final Pattern COMBINED = Pattern.compile(
            "(не\\s+обнаружено|обнаружено|not\\s+detected|detected|negative|positive).*?s/co\\s*=\\s*("
                    + Numbers.DECIMAL + ")", FLAGS);
    private static final Pattern BARE = Pattern.compile("s/co\\s*=\\s*(" + Numbers.DECIMAL + ")", FLAGS);

    @Override
    public String name() {
        return "signal-cutoff";
    }

    @Override
    public Optional<ParsedValue> parse(String valueText) {
        Matcher combined = COMBINED.matcher(valueText);
        if (combined.find()) {
            return Optional.of(new ParsedValue(Numbers.parse(combined.group(2)), UNIT, 0.95, name()));
        }
        Matcher bare = BARE.matcher(valueText);
        if (bare.find()) {
            return Optional.of(new ParsedValue(Numbers.parse(bare.group(1)), UNIT, 0.90, name()));
        }
        return Optional.empty();
    }
}
