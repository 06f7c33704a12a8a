package com.eainde.labreport.filter;

import com.eainde.labreport.alias.MetricAliasTable;
import com.eainde.labreport.config.MedicalVocabulary;

import java.util.Locale;

/**
 * Rejects labels outside the plausible length band. Unknown names are accepted
 * unless {@code requireKnownName} is set; a name is known when the medical
 * vocabulary recognizes it or it resolves to a canonical alias.
 */
public class MetricNameRule implements LineRejectRule {

    static final int MAX_LENGTH = 50;

    private final boolean requireKnownName;
    private final MetricAliasTable aliasTable;

    public MetricNameRule(boolean requireKnownName, MetricAliasTable aliasTable) {
        this.requireKnownName = requireKnownName;
        this.aliasTable = aliasTable;
    }

    @Override
    public String name() {
        return "metric-name";
    }

    @Override
    public boolean rejects(CandidateLine line) {
        String label = line.label();
        if (label.length() > MAX_LENGTH || label.isEmpty()) {
            return true;
        }
        if (label.length() == 1) {
            return !MedicalVocabulary.SINGLE_LETTER_CODES.contains(label.toUpperCase(Locale.ROOT));
        }
        return requireKnownName && !isKnown(label);
    }

    private boolean isKnown(String label) {
        return MedicalVocabulary.isRecognizedMedicalName(label)
                || aliasTable.isCanonical(aliasTable.resolve(label));
    }
}
