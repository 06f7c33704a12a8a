package com.eainde.labreport.parse;

import com.eainde.labreport.model.MetricRecord;
import com.eainde.labreport.model.MetricStatus;
import com.eainde.labreport.model.ReferenceBounds;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Assigns a {@link MetricStatus} by comparing a value with its reference range.
 *
 * <p>Resolution order: qualitative sentinel, numeric bounds, status keywords in the
 * range text, and finally {@link MetricStatus#NORMAL} when nothing gives a signal.</p>
 */
@Component
public class StatusClassifier {

    private static final double APPROXIMATE_TOLERANCE = 0.10;

    // Longer phrases first: "не обнаружено" must win over "обнаружено".
    private static final Map<String, MetricStatus> KEYWORDS = new LinkedHashMap<>();

    static {
        KEYWORDS.put("не обнаружено", MetricStatus.NOT_DETECTED);
        KEYWORDS.put("not detected", MetricStatus.NOT_DETECTED);
        KEYWORDS.put("отрицательно", MetricStatus.NOT_DETECTED);
        KEYWORDS.put("negative", MetricStatus.NOT_DETECTED);
        KEYWORDS.put("обнаружено", MetricStatus.DETECTED);
        KEYWORDS.put("положительно", MetricStatus.DETECTED);
        KEYWORDS.put("positive", MetricStatus.DETECTED);
        KEYWORDS.put("detected", MetricStatus.DETECTED);
        KEYWORDS.put("выше нормы", MetricStatus.ELEVATED);
        KEYWORDS.put("повышено", MetricStatus.ELEVATED);
        KEYWORDS.put("elevated", MetricStatus.ELEVATED);
        KEYWORDS.put("увеличено", MetricStatus.HIGH);
        KEYWORDS.put("понижено", MetricStatus.LOW);
        KEYWORDS.put("снижено", MetricStatus.LOW);
        KEYWORDS.put("в пределах нормы", MetricStatus.NORMAL);
        KEYWORDS.put("within normal limits", MetricStatus.NORMAL);
        KEYWORDS.put("нормально", MetricStatus.NORMAL);
        KEYWORDS.put("норма", MetricStatus.NORMAL);
        KEYWORDS.put("normal", MetricStatus.NORMAL);
        KEYWORDS.put("high", MetricStatus.HIGH);
        KEYWORDS.put("low", MetricStatus.LOW);
    }

    /**
     * Classifies a value whose unit is unknown. A sentinel value (1.0, 0.0, 0.5)
     * without a displayed range is read as a qualitative answer.
     */
    public MetricStatus classify(double value, String rangeText) {
        String range = rangeText == null ? MetricRecord.RANGE_NOT_SPECIFIED : rangeText;
        if (MetricRecord.RANGE_NOT_SPECIFIED.equals(range)) {
            Optional<MetricStatus> sentinel = sentinelStatus(value);
            if (sentinel.isPresent()) {
                return sentinel.get();
            }
        }
        return classifyAgainstRange(value, range);
    }

    /**
     * Classifies a parsed value. Sentinels are only interpreted when the unit is
     * {@value MetricRecord#QUALITATIVE_UNIT}, so a measured 1.0 stays a number.
     */
    public MetricStatus classify(double value, String unit, String rangeText) {
        String range = rangeText == null ? MetricRecord.RANGE_NOT_SPECIFIED : rangeText;
        if (MetricRecord.QUALITATIVE_UNIT.equals(unit)) {
            return sentinelStatus(value).orElse(MetricStatus.NORMAL);
        }
        return classifyAgainstRange(value, range);
    }

    private MetricStatus classifyAgainstRange(double value, String range) {
        Optional<ReferenceBounds> bounds = ReferenceBounds.parse(range);
        if (bounds.isPresent()) {
            return compare(value, bounds.get());
        }
        return keywordStatus(range).orElse(MetricStatus.NORMAL);
    }

    private static MetricStatus compare(double value, ReferenceBounds bounds) {
        switch (bounds.kind()) {
            case RANGE:
                double min = Math.min(bounds.lower(), bounds.upper());
                double max = Math.max(bounds.lower(), bounds.upper());
                if (value < min) {
                    return MetricStatus.LOW;
                }
                return value > max ? MetricStatus.HIGH : MetricStatus.NORMAL;
            case UPPER:
                return value <= bounds.upper() ? MetricStatus.NORMAL : MetricStatus.HIGH;
            case LOWER:
                return value >= bounds.lower() ? MetricStatus.NORMAL : MetricStatus.LOW;
            default:
                double reference = bounds.lower();
                if (reference == 0.0) {
                    if (value == 0.0) {
                        return MetricStatus.NORMAL;
                    }
                    return value > 0.0 ? MetricStatus.HIGH : MetricStatus.LOW;
                }
                if (Math.abs(value - reference) / Math.abs(reference) < APPROXIMATE_TOLERANCE) {
                    return MetricStatus.NORMAL;
                }
                return value > reference ? MetricStatus.HIGH : MetricStatus.LOW;
        }
    }

    private static Optional<MetricStatus> sentinelStatus(double value) {
        if (value == QualitativeKeywordStrategy.DETECTED) {
            return Optional.of(MetricStatus.DETECTED);
        }
        if (value == QualitativeKeywordStrategy.NOT_DETECTED) {
            return Optional.of(MetricStatus.NOT_DETECTED);
        }
        if (value == QualitativeKeywordStrategy.NORMAL) {
            return Optional.of(MetricStatus.NORMAL);
        }
        return Optional.empty();
    }

    private static Optional<MetricStatus> keywordStatus(String range) {
        String lower = range.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, MetricStatus> keyword : KEYWORDS.entrySet()) {
            if (lower.contains(keyword.getKey())) {
                return Optional.of(keyword.getValue());
            }
        }
        return Optional.empty();
    }
}
