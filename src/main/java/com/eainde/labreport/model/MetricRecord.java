package com.eainde.labreport.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * One recognized lab value.
 *
 * <p>Qualitative results use a sentinel in {@code value}: {@code 1.0} detected/positive,
 * {@code 0.0} not detected/negative, {@code 0.5} normal; their unit is
 * {@value #QUALITATIVE_UNIT}.</p>
 *
 * @param name           canonical lowercase, underscore-joined identifier, never blank
 * @param rawLabel       label text as detected, kept for audit
 * @param value          finite measured value or qualitative sentinel
 * @param unit           free-form unit, may carry a {@code 10^n} exponent
 * @param referenceRange displayed range text or {@value #RANGE_NOT_SPECIFIED}
 * @param status         classification against the reference range
 * @param confidence     strategy-dependent score in [0, 1]
 * @param originalLine   line the record was parsed from (debug only)
 */
public record MetricRecord(
        @JsonProperty("name")            String name,
        @JsonIgnore                      String rawLabel,
        @JsonProperty("value")           double value,
        @JsonProperty("unit")            String unit,
        @JsonProperty("reference_range") String referenceRange,
        @JsonProperty("status")          MetricStatus status,
        @JsonProperty("confidence")      double confidence,
        @JsonProperty("original_line")   String originalLine
) implements Serializable {

    public static final String RANGE_NOT_SPECIFIED = "Not specified";
    public static final String QUALITATIVE_UNIT = "qualitative";

    public MetricRecord {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Metric name must not be blank");
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Metric value must be finite: " + value);
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence out of [0,1]: " + confidence);
        }
        Objects.requireNonNull(status, "status");
        unit = unit == null ? "" : unit;
        referenceRange = referenceRange == null || referenceRange.isBlank()
                ? RANGE_NOT_SPECIFIED : referenceRange;
        rawLabel = rawLabel == null ? name : rawLabel;
        originalLine = originalLine == null ? "" : originalLine;
    }

    @JsonIgnore
    public boolean isQualitative() {
        return QUALITATIVE_UNIT.equals(unit);
    }

    @JsonIgnore
    public boolean hasReferenceRange() {
        return !RANGE_NOT_SPECIFIED.equals(referenceRange);
    }

    /**
     * Numeric bounds of {@link #referenceRange()}, when it carries any.
     */
    public Optional<ReferenceBounds> bounds() {
        return ReferenceBounds.parse(referenceRange);
    }

    /**
     * Renders the record as {@code "name: value unit (range)"}, the shape the
     * line extractor accepts, so a record can be fed back through it.
     */
    public String toCanonicalLine() {
        StringBuilder line = new StringBuilder(name).append(": ")
                .append(BigDecimal.valueOf(value).toPlainString());
        if (!unit.isEmpty()) {
            line.append(' ').append(unit);
        }
        if (hasReferenceRange()) {
            line.append(" (").append(referenceRange).append(')');
        }
        return line.toString();
    }
}
