package com.eainde.labreport.model;

import java.util.List;
import java.util.Objects;

/**
 * One page of OCR output: the fragments in emission order plus the concatenated raw text.
 *
 * @param fragments    recognized text fragments, in the order the OCR engine emitted them
 * @param rawText      concatenated fragments; defaults to the fragments joined by newlines
 * @param imageQuality measurements of the source image, or null when not supplied
 */
public record OcrPage(List<String> fragments, String rawText, ImageQuality imageQuality) {

    public OcrPage {
        Objects.requireNonNull(fragments, "fragments");
        fragments = fragments.stream().map(f -> f == null ? "" : f).toList();
        rawText = rawText == null ? String.join("\n", fragments) : rawText;
    }

    public static OcrPage of(List<String> fragments) {
        return new OcrPage(fragments, null, null);
    }

    public static OcrPage of(List<String> fragments, ImageQuality imageQuality) {
        return new OcrPage(fragments, null, imageQuality);
    }
}
