package com.eainde.labreport.parse;

/**
 * Decimal parsing for OCR tokens that use either {@code ,} or {@code .} as separator.
 */
final class Numbers {

    static final String DECIMAL = "\\d+[.,]?\\d*";

    private Numbers() {
    }

    static double parse(String token) {
        return Double.parseDouble(token.replace(',', '.'));
    }
}
