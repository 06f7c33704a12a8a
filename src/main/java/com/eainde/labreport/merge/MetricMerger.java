package com.eainde.labreport.merge;

import com.eainde.labreport.model.MergeStats;
import com.eainde.labreport.model.MetricRecord;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces the candidates of all extraction passes to one record per canonical
 * name, keeping the highest confidence. On a tie the earlier candidate stays, so
 * pass order decides (structural first).
 *
 * <p>Output keeps the position at which each name was first seen.</p>
 */
@Log4j2
@Component
public class MetricMerger {

    @SafeVarargs
    public final MergeResult merge(List<MetricRecord>... passes) {
        List<MetricRecord> all = new ArrayList<>();
        for (List<MetricRecord> pass : passes) {
            if (pass != null) {
                all.addAll(pass);
            }
        }
        return merge(all);
    }

    public MergeResult merge(List<MetricRecord> candidates) {
        Map<String, MetricRecord> byName = new LinkedHashMap<>();
        int duplicates = 0;
        int replaced = 0;
        for (MetricRecord candidate : candidates) {
            MetricRecord existing = byName.get(candidate.name());
            if (existing == null) {
                byName.put(candidate.name(), candidate);
                continue;
            }
            duplicates++;
            if (candidate.confidence() > existing.confidence()) {
                byName.put(candidate.name(), candidate);
                replaced++;
                log.debug("'{}': {} (confidence {}) replaces {} (confidence {})", candidate.name(),
                        candidate.value(), candidate.confidence(), existing.value(), existing.confidence());
            }
        }
        MergeStats stats = new MergeStats(candidates.size(), byName.size(), duplicates, replaced);
        if (duplicates > 0) {
            log.info("Merged {} candidates into {} metrics ({} duplicates, {} replaced by higher confidence)",
                    stats.totalCandidatesBeforeMerge(), stats.totalCandidatesAfterMerge(), duplicates, replaced);
        }
        return new MergeResult(new ArrayList<>(byName.values()), stats);
    }
}
