package com.eainde.labreport.workflow.nodes;

import com.eainde.labreport.model.MetricRecord;
import com.eainde.labreport.model.MetricStatus;
import com.eainde.labreport.model.PassResult;
import com.eainde.labreport.profile.DocumentProfiles;
import com.eainde.labreport.profile.TemplateExtractor;
import com.eainde.labreport.workflow.ExtractionState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TemplateExtractionNodeTest {

    @Mock
    private DocumentProfiles profiles;

    @Mock
    private TemplateExtractor extractor;

    private static ExtractionState stateWithProfile(String profileId) {
        return new ExtractionState(Map.of(
                ExtractionState.FRAGMENTS, List.of("Глюкоза", "5,1"),
                ExtractionState.PROFILE_ID, profileId));
    }

    @Test
    @DisplayName("should run the matched profile over the page fragments")
    void runsProfile() {
        PassResult pass = new PassResult(List.of("Глюкоза", "5,1"), List.of(new MetricRecord("glucose", "Глюкоза",
                5.1, "ммоль/л", "3.05 - 6.4", MetricStatus.NORMAL, 0.80, "Глюкоза: 5.1 ммоль/л")));
        when(profiles.byId("kazakh-biochemistry")).thenReturn(Optional.of(DocumentProfiles.KAZAKH_BIOCHEMISTRY));
        when(extractor.extract(DocumentProfiles.KAZAKH_BIOCHEMISTRY, List.of("Глюкоза", "5,1"))).thenReturn(pass);

        Map<String, Object> update = new TemplateExtractionNode(profiles, extractor)
                .apply(stateWithProfile("kazakh-biochemistry")).join();

        assertThat(update).containsEntry(ExtractionState.TEMPLATE, pass);
    }

    @Test
    @DisplayName("should yield an empty pass for an unregistered profile")
    void unknownProfile() {
        when(profiles.byId("ghost")).thenReturn(Optional.empty());

        Map<String, Object> update = new TemplateExtractionNode(profiles, extractor)
                .apply(stateWithProfile("ghost")).join();

        assertThat(update).containsEntry(ExtractionState.TEMPLATE, PassResult.EMPTY);
        verifyNoInteractions(extractor);
    }
}
