package com.eainde.labreport.parse;

import com.eainde.labreport.config.MedicalVocabulary;
import com.eainde.labreport.model.ParsedValue;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns the value side of a metric line into {@code (value, unit, confidence)}.
 *
 * <p>Fragments carrying administrative contamination (embedded dates, report
 * boilerplate) or a run-together exponent are refused outright. Otherwise the strategies run in order and the
 * first match wins:</p>
 * <ol>
 *   <li>qualitative keyword (0.85-0.95)</li>
 *   <li>scientific notation (0.95)</li>
 *   <li>multiplier notation (0.85-0.90)</li>
 *   <li>comma/space-broken decimal (0.80)</li>
 *   <li>qualitative + S/CO, then bare S/CO (0.95 / 0.90)</li>
 *   <li>number with unit (0.75)</li>
 *   <li>bare number (0.50)</li>
 * </ol>
 */
@Log4j2
@Component
public class ValueUnitParser {

    /** An exponent of four or more digits is OCR run-together noise, not a power of ten. */
    private static final Pattern RUN_TOGETHER_EXPONENT = Pattern.compile("\\^\\s*\\d{4,}");

    private final List<ValueParseStrategy> strategies;

    public ValueUnitParser() {
        this(List.of(
                new QualitativeKeywordStrategy(),
                new ScientificNotationStrategy(),
                new MultiplierNotationStrategy(),
                new SpacedDecimalStrategy(),
                new SignalCutoffStrategy(),
                new StandardUnitStrategy(),
                new BareNumberStrategy()));
    }

    public ValueUnitParser(List<ValueParseStrategy> strategies) {
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one value strategy is required");
        }
        this.strategies = List.copyOf(strategies);
    }

    public Optional<ParsedValue> parse(String valueText) {
        if (valueText == null || valueText.isBlank()) {
            return Optional.empty();
        }
        String text = valueText.strip();
        if (isContaminated(text)) {
            log.debug("Value fragment contaminated, not parsing: '{}'", text);
            return Optional.empty();
        }
        if (RUN_TOGETHER_EXPONENT.matcher(text).find()) {
            log.debug("Value fragment has an unreadable exponent, not parsing: '{}'", text);
            return Optional.empty();
        }
        for (ValueParseStrategy strategy : strategies) {
            Optional<ParsedValue> parsed;
            try {
                parsed = strategy.parse(text);
            } catch (NumberFormatException e) {
                log.warn("Strategy '{}' could not read a number in '{}': {}", strategy.name(), text, e.getMessage());
                continue;
            }
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    public static boolean isContaminated(String text) {
        return MedicalVocabulary.anyFind(MedicalVocabulary.CONTAMINATION_PATTERNS, text);
    }

    public List<ValueParseStrategy> strategies() {
        return strategies;
    }
}
