package com.eainde.labreport.workflow;

import com.eainde.labreport.model.DocumentVerdict;
import com.eainde.labreport.model.MergeStats;
import com.eainde.labreport.model.MetricRecord;
import com.eainde.labreport.model.PassResult;
import org.bsc.langgraph4j.state.AgentState;

import java.util.List;
import java.util.Map;

/**
 * Graph state for one page. Every value is {@link java.io.Serializable} because the
 * graph clones state between nodes.
 */
public class ExtractionState extends AgentState {

    public static final String FRAGMENTS = "fragments";
    public static final String RAW_TEXT = "rawText";
    public static final String PROFILE_ID = "profileId";
    public static final String STRUCTURAL = "structural";
    public static final String PROXIMITY = "proximity";
    public static final String TEMPLATE = "template";
    public static final String METRICS = "metrics";
    public static final String MERGE_STATS = "mergeStats";
    public static final String VERDICT = "verdict";

    public ExtractionState(Map<String, Object> initData) {
        super(initData);
    }

    @SuppressWarnings("unchecked")
    public List<String> getFragments() {
        return (List<String>) this.data().getOrDefault(FRAGMENTS, List.of());
    }

    public String getRawText() {
        return (String) this.data().getOrDefault(RAW_TEXT, "");
    }

    /** Matched document profile id, empty when no profile matched. */
    public String getProfileId() {
        return (String) this.data().getOrDefault(PROFILE_ID, "");
    }

    public boolean hasProfile() {
        return !getProfileId().isEmpty();
    }

    public PassResult getStructural() {
        return pass(STRUCTURAL);
    }

    public PassResult getProximity() {
        return pass(PROXIMITY);
    }

    public PassResult getTemplate() {
        return pass(TEMPLATE);
    }

    @SuppressWarnings("unchecked")
    public List<MetricRecord> getMetrics() {
        return (List<MetricRecord>) this.data().getOrDefault(METRICS, List.of());
    }

    public MergeStats getMergeStats() {
        return (MergeStats) this.data().getOrDefault(MERGE_STATS, new MergeStats(0, 0, 0, 0));
    }

    public DocumentVerdict getVerdict() {
        return (DocumentVerdict) this.data().get(VERDICT);
    }

    private PassResult pass(String key) {
        return (PassResult) this.data().getOrDefault(key, PassResult.EMPTY);
    }

    public static Map<String, Object> initial(List<String> fragments, String rawText) {
        return Map.of(FRAGMENTS, List.copyOf(fragments), RAW_TEXT, rawText);
    }
}
