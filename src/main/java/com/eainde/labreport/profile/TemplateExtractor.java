package com.eainde.labreport.profile;

import com.eainde.labreport.config.ExtractionSettings;
import com.eainde.labreport.model.MetricRecord;
import com.eainde.labreport.model.MetricStatus;
import com.eainde.labreport.model.ParsedValue;
import com.eainde.labreport.model.PassResult;
import com.eainde.labreport.parse.StatusClassifier;
import com.eainde.labreport.parse.SuspiciousValueGuard;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a page through a {@link DocumentProfile}: for each expected metric it finds
 * the first label fragment, then looks ahead a few fragments for the value, the
 * unit and the range, stopping at the label of another expected metric. Values go
 * through the same {@link SuspiciousValueGuard} as parsed lines.
 */
@Log4j2
@Component
public class TemplateExtractor {

    private static final Pattern DECIMAL = Pattern.compile("(\\d+[.,]\\d+)");
    private static final Pattern INTEGER_ONLY = Pattern.compile("^(\\d+)$");
    private static final Pattern DASH_RANGE = Pattern.compile("(\\d+(?:[.,]\\d+)?\\s*[-–]\\s*\\d+(?:[.,]\\d+)?)");
    private static final Pattern UPPER_BOUND = Pattern.compile("<\\s*\\d+");
    private static final int SHORT_VARIANT = 4;

    private final int window;
    private final double confidence;
    private final StatusClassifier statusClassifier;
    private final SuspiciousValueGuard suspiciousValueGuard;

    public TemplateExtractor(ExtractionSettings settings, StatusClassifier statusClassifier,
                             SuspiciousValueGuard suspiciousValueGuard) {
        this.window = settings.getTemplateWindow();
        this.confidence = settings.getTemplateConfidence();
        this.statusClassifier = statusClassifier;
        this.suspiciousValueGuard = suspiciousValueGuard;
    }

    public PassResult extract(DocumentProfile profile, List<String> fragments) {
        List<String> pieces = fragments.stream()
                .map(f -> f == null ? "" : f.strip())
                .toList();
        List<MetricRecord> metrics = new ArrayList<>();
        for (ExpectedMetric expected : profile.expectedMetrics()) {
            extractOne(profile, expected, pieces).ifPresent(metrics::add);
        }
        log.info("Template '{}': {} of {} expected metrics found",
                profile.id(), metrics.size(), profile.expectedMetrics().size());
        return new PassResult(profile.cleanLines(pieces), metrics);
    }

    private Optional<MetricRecord> extractOne(DocumentProfile profile, ExpectedMetric expected, List<String> pieces) {
        int labelIndex = -1;
        for (int i = 0; i < pieces.size() && labelIndex < 0; i++) {
            if (namesMetric(pieces.get(i), expected)) {
                labelIndex = i;
            }
        }
        if (labelIndex < 0) {
            return Optional.empty();
        }

        Double value = null;
        String unit = null;
        String range = null;
        int end = Math.min(pieces.size(), labelIndex + 1 + window);
        for (int i = labelIndex + 1; i < end; i++) {
            String piece = pieces.get(i);
            if (namesOtherMetric(piece, profile, expected)) {
                break;
            }
            Matcher dashRange = DASH_RANGE.matcher(piece);
            boolean rangeShaped = dashRange.find();
            if (range == null && rangeShaped) {
                range = dashRange.group(1);
            }
            if (piece.contains("<") && UPPER_BOUND.matcher(piece).find()) {
                range = piece;
                rangeShaped = true;
            }
            if (value == null && !rangeShaped) {
                value = readValue(piece);
            }
            if (unit == null) {
                unit = profile.correctUnit(piece).orElse(null);
            }
        }
        if (value == null) {
            log.debug("Template '{}': no value near '{}'", profile.id(), pieces.get(labelIndex));
            return Optional.empty();
        }

        String label = pieces.get(labelIndex);
        String shownRange = range == null ? expected.fallbackRange() : range;
        String shownUnit = unit == null ? profile.defaultUnit() : unit;
        Optional<String> suspicious = suspiciousValueGuard.check(new ParsedValue(value, shownUnit, confidence, "template"));
        if (suspicious.isPresent()) {
            log.warn("Template '{}': suspicious value ({}) for {} = {} {}",
                    profile.id(), suspicious.get(), expected.canonicalName(), value, shownUnit);
            return Optional.empty();
        }
        MetricStatus status = statusClassifier.classify(value, shownUnit, shownRange);
        String line = label + ": " + value + " " + shownUnit + " (норма: " + shownRange + ")";
        return Optional.of(new MetricRecord(expected.canonicalName(), label, value, shownUnit,
                shownRange, status, confidence, line));
    }

    /**
     * @return the number in the piece, or null when there is none or it overflows
     */
    private static Double readValue(String piece) {
        double value;
        Matcher decimal = DECIMAL.matcher(piece);
        Matcher integer = INTEGER_ONLY.matcher(piece);
        if (decimal.find()) {
            value = Double.parseDouble(decimal.group(1).replace(',', '.'));
        } else if (integer.find()) {
            value = Double.parseDouble(integer.group(1));
        } else {
            return null;
        }
        return Double.isFinite(value) ? value : null;
    }

    private static boolean namesOtherMetric(String piece, DocumentProfile profile, ExpectedMetric current) {
        for (ExpectedMetric other : profile.expectedMetrics()) {
            if (other != current && namesMetric(piece, other)) {
                return true;
            }
        }
        return false;
    }

    static boolean namesMetric(String piece, ExpectedMetric expected) {
        String lower = piece.toLowerCase(Locale.ROOT);
        for (String variant : expected.nameVariants()) {
            String v = variant.toLowerCase(Locale.ROOT);
            if (v.length() <= SHORT_VARIANT) {
                if (Pattern.compile("(?<![а-яёa-z])" + Pattern.quote(v) + "(?![а-яёa-z])").matcher(lower).find()) {
                    return true;
                }
            } else if (lower.contains(v)) {
                return true;
            }
        }
        return false;
    }
}
