package com.eainde.labreport.workflow;

import com.eainde.labreport.workflow.nodes.DetectLayoutNode;
import com.eainde.labreport.workflow.nodes.MergeNode;
import com.eainde.labreport.workflow.nodes.ProximityExtractionNode;
import com.eainde.labreport.workflow.nodes.StructuralExtractionNode;
import com.eainde.labreport.workflow.nodes.TemplateExtractionNode;
import com.eainde.labreport.workflow.nodes.ValidateNode;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Page extraction as a graph:
 *
 * <pre>
 *   START → detect_layout → structural ─┬─ proximity ─┬→ merge → validate → END
 *                                       └─ template  ─┘
 * </pre>
 */
@Configuration
public class LabExtractionWorkflowGraph {

    public static final String WORKFLOW_NAME = "labExtractionWorkflow";

    static final String DETECT_LAYOUT = "detect_layout";
    static final String STRUCTURAL = "structural";
    static final String PROXIMITY = "proximity";
    static final String TEMPLATE = "template";
    static final String MERGE = "merge";
    static final String VALIDATE = "validate";

    private final DetectLayoutNode detectLayoutNode;
    private final StructuralExtractionNode structuralNode;
    private final ProximityExtractionNode proximityNode;
    private final TemplateExtractionNode templateNode;
    private final MergeNode mergeNode;
    private final ValidateNode validateNode;
    private final ReconstructionRoutingEdge routingEdge;

    public LabExtractionWorkflowGraph(
            DetectLayoutNode detectLayoutNode,
            StructuralExtractionNode structuralNode,
            ProximityExtractionNode proximityNode,
            TemplateExtractionNode templateNode,
            MergeNode mergeNode,
            ValidateNode validateNode,
            ReconstructionRoutingEdge routingEdge) {
        this.detectLayoutNode = detectLayoutNode;
        this.structuralNode = structuralNode;
        this.proximityNode = proximityNode;
        this.templateNode = templateNode;
        this.mergeNode = mergeNode;
        this.validateNode = validateNode;
        this.routingEdge = routingEdge;
    }

    @Bean(WORKFLOW_NAME)
    public CompiledGraph<ExtractionState> build() throws GraphStateException {

        StateGraph<ExtractionState> workflow = new StateGraph<>(ExtractionState::new);

        workflow.addNode(DETECT_LAYOUT, detectLayoutNode);
        workflow.addNode(STRUCTURAL, structuralNode);
        workflow.addNode(PROXIMITY, proximityNode);
        workflow.addNode(TEMPLATE, templateNode);
        workflow.addNode(MERGE, mergeNode);
        workflow.addNode(VALIDATE, validateNode);

        workflow.addEdge(START, DETECT_LAYOUT);
        workflow.addEdge(DETECT_LAYOUT, STRUCTURAL);

        workflow.addConditionalEdges(
                STRUCTURAL,
                routingEdge,
                Map.of(
                        ReconstructionRoutingEdge.PROXIMITY, PROXIMITY,
                        ReconstructionRoutingEdge.TEMPLATE, TEMPLATE
                )
        );

        workflow.addEdge(PROXIMITY, MERGE);
        workflow.addEdge(TEMPLATE, MERGE);
        workflow.addEdge(MERGE, VALIDATE);
        workflow.addEdge(VALIDATE, END);

        return workflow.compile();
    }
}
