package com.eainde.labreport.parse;

import com.eainde.labreport.model.ParsedValue;

import java.util.Optional;

/**
 * One step of the value/unit cascade. Strategies are tried in a fixed order and
 * the first one that yields a value wins.
 */
public interface ValueParseStrategy {

    /** Short identifier used in logs and on {@link ParsedValue#strategy()}. */
    String name();

    /**
     * @param valueText text to the right of the label, already stripped
     * @return the parsed value, or empty when this strategy does not apply
     */
    Optional<ParsedValue> parse(String valueText);
}
