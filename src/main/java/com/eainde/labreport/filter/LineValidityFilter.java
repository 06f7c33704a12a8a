package com.eainde.labreport.filter;

import com.eainde.labreport.alias.MetricAliasTable;
import com.eainde.labreport.config.ExtractionSettings;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Decides whether a {@code label: value} line is a lab result. Runs an ordered
 * table of {@link LineRejectRule}s; the first rule that fires rejects the line.
 *
 * <p>Strict on dates and headers, lenient on names.</p>
 */
@Component
public class LineValidityFilter {

    private final List<LineRejectRule> rules;

    @Autowired
    public LineValidityFilter(ExtractionSettings settings, MetricAliasTable aliasTable) {
        this(List.of(
                new TimestampRule(),
                new SectionHeaderRule(),
                new MetricNameRule(settings.isRequireKnownName(), aliasTable),
                new ValuePresenceRule(),
                new UnitIndicatorRule()));
    }

    public LineValidityFilter(List<LineRejectRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public boolean isValidMetricLine(String label, String valueText, String fullLine) {
        return firstRejection(new CandidateLine(label, valueText, fullLine)).isEmpty();
    }

    /**
     * @return name of the first rule rejecting the line, empty when the line is accepted
     */
    public Optional<String> firstRejection(CandidateLine line) {
        for (LineRejectRule rule : rules) {
            if (rule.rejects(line)) {
                return Optional.of(rule.name());
            }
        }
        return Optional.empty();
    }

    public List<LineRejectRule> rules() {
        return rules;
    }
}
