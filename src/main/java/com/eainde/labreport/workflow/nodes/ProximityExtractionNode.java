package com.eainde.labreport.workflow.nodes;

import com.eainde.labreport.proximity.ProximityExtractor;
import com.eainde.labreport.workflow.ExtractionState;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
public class ProximityExtractionNode implements AsyncNodeAction<ExtractionState> {

    private final ProximityExtractor extractor;

    public ProximityExtractionNode(ProximityExtractor extractor) {
        this.extractor = extractor;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(ExtractionState state) {
        return CompletableFuture.completedFuture(
                Map.of(ExtractionState.PROXIMITY, extractor.extract(state.getFragments())));
    }
}
