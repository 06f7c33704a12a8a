package com.eainde.labreport.model;

/**
 * Secondary reconstruction path chosen for a page, next to the structural pass.
 */
public enum ExtractionRoute {
    /** Row structure lost; labels are paired with nearby value and range fragments. */
    PROXIMITY,
    /** Page matches a registered document profile. */
    TEMPLATE
}
