package com.eainde.labreport.model;

import java.io.Serializable;
import java.util.List;

/**
 * Output of one extraction pass over a page.
 *
 * @param lines   text lines the pass produced or consumed (cleaned text)
 * @param metrics candidate records, in discovery order
 */
public record PassResult(List<String> lines, List<MetricRecord> metrics) implements Serializable {

    public static final PassResult EMPTY = new PassResult(List.of(), List.of());

    public PassResult {
        lines = List.copyOf(lines);
        metrics = List.copyOf(metrics);
    }
}
