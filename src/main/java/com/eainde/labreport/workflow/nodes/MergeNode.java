package com.eainde.labreport.workflow.nodes;

import com.eainde.labreport.merge.MergeResult;
import com.eainde.labreport.merge.MetricMerger;
import com.eainde.labreport.workflow.ExtractionState;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Structural candidates first, then whichever secondary pass ran.
 */
@Component
public class MergeNode implements AsyncNodeAction<ExtractionState> {

    private final MetricMerger merger;

    public MergeNode(MetricMerger merger) {
        this.merger = merger;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(ExtractionState state) {
        MergeResult result = merger.merge(
                state.getStructural().metrics(),
                state.getProximity().metrics(),
                state.getTemplate().metrics());
        return CompletableFuture.completedFuture(Map.of(
                ExtractionState.METRICS, new ArrayList<>(result.metrics()),
                ExtractionState.MERGE_STATS, result.stats()));
    }
}
