package com.eainde.labreport.workflow.nodes;

import com.eainde.labreport.extract.StructuralExtractor;
import com.eainde.labreport.workflow.ExtractionState;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
public class StructuralExtractionNode implements AsyncNodeAction<ExtractionState> {

    private final StructuralExtractor extractor;

    public StructuralExtractionNode(StructuralExtractor extractor) {
        this.extractor = extractor;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(ExtractionState state) {
        return CompletableFuture.completedFuture(
                Map.of(ExtractionState.STRUCTURAL, extractor.extract(state.getRawText())));
    }
}
