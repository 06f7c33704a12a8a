package com.eainde.labreport.parse;

import com.eainde.labreport.config.ExtractionSettings;
import com.eainde.labreport.model.ParsedValue;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Rejects parses that are known OCR artefacts rather than measurements.
 */
@Component
public class SuspiciousValueGuard {

    private final double maxPlainValue;

    public SuspiciousValueGuard(ExtractionSettings settings) {
        this.maxPlainValue = settings.getMaxPlainValue();
    }

    /**
     * @return the reason the value is implausible, or empty when it may be kept
     */
    public Optional<String> check(ParsedValue parsed) {
        if (parsed.isQualitative()) {
            return Optional.empty();
        }
        String unit = parsed.unit();
        double value = parsed.value();
        if (!Double.isFinite(value)) {
            return Optional.of("non-finite value");
        }
        // A mangled "10^9/л" collapses to "9 /л" on some scans.
        if (value == 9.0 && ("/л".equals(unit) || "/L".equalsIgnoreCase(unit))) {
            return Optional.of("degenerate 9 /л reading");
        }
        if (value <= 0.0) {
            return Optional.of("non-positive quantitative value");
        }
        if (!unit.contains("10^") && value > maxPlainValue) {
            return Optional.of("value above " + maxPlainValue + " without exponent");
        }
        return Optional.empty();
    }
}
