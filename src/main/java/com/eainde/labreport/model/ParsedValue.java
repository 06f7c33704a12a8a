package com.eainde.labreport.model;

/**
 * Output of the value/unit parser for one value fragment.
 *
 * @param value      parsed number or qualitative sentinel
 * @param unit       cleaned unit text
 * @param confidence score of the strategy that matched
 * @param strategy   name of the strategy that matched
 */
public record ParsedValue(double value, String unit, double confidence, String strategy) {

    public boolean isQualitative() {
        return MetricRecord.QUALITATIVE_UNIT.equals(unit);
    }
}
