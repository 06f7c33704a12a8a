package com.eainde.labreport.merge;

import com.eainde.labreport.model.MergeStats;
import com.eainde.labreport.model.MetricRecord;

import java.util.List;

/**
 * Merged metrics, one per canonical name, plus statistics.
 */
public record MergeResult(List<MetricRecord> metrics, MergeStats stats) {

    public MergeResult {
        metrics = List.copyOf(metrics);
    }
}
