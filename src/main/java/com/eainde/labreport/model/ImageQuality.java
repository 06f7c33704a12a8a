package com.eainde.labreport.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Image measurements supplied by the image-quality analyzer ahead of OCR.
 */
public record ImageQuality(
        @JsonProperty("resolution") String resolution,
        @JsonProperty("sharpness")  double sharpness,
        @JsonProperty("contrast")   double contrast
) {}
