package com.eainde.labreport.extract;

import com.eainde.labreport.alias.MetricAliasTable;
import com.eainde.labreport.filter.CandidateLine;
import com.eainde.labreport.filter.LineValidityFilter;
import com.eainde.labreport.model.MetricRecord;
import com.eainde.labreport.model.MetricStatus;
import com.eainde.labreport.model.ParsedValue;
import com.eainde.labreport.parse.ReferenceRangeExtractor;
import com.eainde.labreport.parse.StatusClassifier;
import com.eainde.labreport.parse.SuspiciousValueGuard;
import com.eainde.labreport.parse.ValueUnitParser;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns one {@code label: value} line into a {@link MetricRecord}:
 * filter, value/unit parse, plausibility guard, range, status, alias.
 *
 * <p>Every failure is local: the line is logged and skipped, nothing is thrown.</p>
 */
@Log4j2
@Component
public class MetricLineParser {

    public static final char SEPARATOR = ':';

    private final LineValidityFilter filter;
    private final ValueUnitParser valueParser;
    private final SuspiciousValueGuard suspiciousValueGuard;
    private final ReferenceRangeExtractor rangeExtractor;
    private final StatusClassifier statusClassifier;
    private final MetricAliasTable aliasTable;

    public MetricLineParser(LineValidityFilter filter,
                            ValueUnitParser valueParser,
                            SuspiciousValueGuard suspiciousValueGuard,
                            ReferenceRangeExtractor rangeExtractor,
                            StatusClassifier statusClassifier,
                            MetricAliasTable aliasTable) {
        this.filter = filter;
        this.valueParser = valueParser;
        this.suspiciousValueGuard = suspiciousValueGuard;
        this.rangeExtractor = rangeExtractor;
        this.statusClassifier = statusClassifier;
        this.aliasTable = aliasTable;
    }

    /**
     * Parses a line, splitting label and value at the first separator.
     *
     * @return the record, or empty when the line is not a recognizable metric
     */
    public Optional<MetricRecord> parseLine(String line) {
        if (line == null) {
            return Optional.empty();
        }
        int separator = line.indexOf(SEPARATOR);
        if (separator < 0) {
            return Optional.empty();
        }
        String label = line.substring(0, separator).strip();
        String valueText = line.substring(separator + 1).strip();
        if (valueText.isEmpty()) {
            return Optional.empty();
        }
        return parse(new CandidateLine(label, valueText, line.strip()));
    }

    public Optional<MetricRecord> parse(CandidateLine candidate) {
        Optional<String> rejection = filter.firstRejection(candidate);
        if (rejection.isPresent()) {
            log.debug("Skipping non-metric line [{}]: {}", rejection.get(), candidate.fullLine());
            return Optional.empty();
        }

        Optional<ParsedValue> parsed = valueParser.parse(candidate.valueText());
        if (parsed.isEmpty()) {
            log.warn("Failed to parse value of line: {}", candidate.fullLine());
            return Optional.empty();
        }
        ParsedValue value = parsed.get();

        Optional<String> suspicious = suspiciousValueGuard.check(value);
        if (suspicious.isPresent()) {
            log.warn("Suspicious value ({}) on line: {} = {} {}",
                    suspicious.get(), candidate.label(), value.value(), value.unit());
            return Optional.empty();
        }

        String range = rangeExtractor.extractRange(candidate.valueText());
        MetricStatus status = statusClassifier.classify(value.value(), value.unit(), range);
        String name = aliasTable.resolve(candidate.label());

        MetricRecord metric = new MetricRecord(name, candidate.label(), value.value(), value.unit(),
                range, status, value.confidence(), candidate.fullLine());
        log.debug("Parsed {} = {} {} [{}] via {} (confidence {})",
                name, value.value(), value.unit(), status, value.strategy(), value.confidence());
        return Optional.of(metric);
    }
}
