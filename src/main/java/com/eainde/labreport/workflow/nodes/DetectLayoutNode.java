package com.eainde.labreport.workflow.nodes;

import com.eainde.labreport.profile.DocumentProfile;
import com.eainde.labreport.profile.DocumentProfiles;
import com.eainde.labreport.workflow.ExtractionState;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
public class DetectLayoutNode implements AsyncNodeAction<ExtractionState> {

    private final DocumentProfiles profiles;

    public DetectLayoutNode(DocumentProfiles profiles) {
        this.profiles = profiles;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(ExtractionState state) {
        String profileId = profiles.detect(state.getFragments())
                .map(DocumentProfile::id)
                .orElse("");
        return CompletableFuture.completedFuture(Map.of(ExtractionState.PROFILE_ID, profileId));
    }
}
