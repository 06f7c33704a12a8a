package com.eainde.labreport.workflow.nodes;

import com.eainde.labreport.model.PassResult;
import com.eainde.labreport.profile.DocumentProfile;
import com.eainde.labreport.profile.DocumentProfiles;
import com.eainde.labreport.profile.TemplateExtractor;
import com.eainde.labreport.workflow.ExtractionState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

@Log4j2
@Component
public class TemplateExtractionNode implements AsyncNodeAction<ExtractionState> {

    private final DocumentProfiles profiles;
    private final TemplateExtractor extractor;

    public TemplateExtractionNode(DocumentProfiles profiles, TemplateExtractor extractor) {
        this.profiles = profiles;
        this.extractor = extractor;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(ExtractionState state) {
        Optional<DocumentProfile> profile = profiles.byId(state.getProfileId());
        if (profile.isEmpty()) {
            log.warn("Routed to template pass but profile '{}' is not registered", state.getProfileId());
            return CompletableFuture.completedFuture(Map.of(ExtractionState.TEMPLATE, PassResult.EMPTY));
        }
        return CompletableFuture.completedFuture(
                Map.of(ExtractionState.TEMPLATE, extractor.extract(profile.get(), state.getFragments())));
    }
}
