package com.eainde.labreport.workflow.nodes;

import com.eainde.labreport.validation.DocumentValidator;
import com.eainde.labreport.workflow.ExtractionState;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
public class ValidateNode implements AsyncNodeAction<ExtractionState> {

    private final DocumentValidator validator;

    public ValidateNode(DocumentValidator validator) {
        this.validator = validator;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(ExtractionState state) {
        return CompletableFuture.completedFuture(
                Map.of(ExtractionState.VERDICT, validator.validate(state.getMetrics(), state.getRawText())));
    }
}
