package com.eainde.labreport.workflow;

import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Chooses the secondary pass: the template pass when a document profile matched,
 * proximity reconstruction otherwise.
 */
@Component
public class ReconstructionRoutingEdge implements AsyncEdgeAction<ExtractionState> {

    public static final String TEMPLATE = "template";
    public static final String PROXIMITY = "proximity";

    @Override
    public CompletableFuture<String> apply(ExtractionState state) {
        return CompletableFuture.completedFuture(state.hasProfile() ? TEMPLATE : PROXIMITY);
    }
}
