package com.eainde.labreport.workflow;

import com.eainde.labreport.alias.MetricAliasTable;
import com.eainde.labreport.config.ExtractionSettings;
import com.eainde.labreport.extract.MetricLineParser;
import com.eainde.labreport.extract.StructuralExtractor;
import com.eainde.labreport.filter.LineValidityFilter;
import com.eainde.labreport.merge.MetricMerger;
import com.eainde.labreport.model.DocumentVerdict;
import com.eainde.labreport.model.ExtractionRoute;
import com.eainde.labreport.model.ImageQuality;
import com.eainde.labreport.model.LabReportAnalysis;
import com.eainde.labreport.model.MetricRecord;
import com.eainde.labreport.model.OcrPage;
import com.eainde.labreport.model.PageExtraction;
import com.eainde.labreport.model.PassResult;
import com.eainde.labreport.parse.ReferenceRangeExtractor;
import com.eainde.labreport.parse.StatusClassifier;
import com.eainde.labreport.parse.SuspiciousValueGuard;
import com.eainde.labreport.parse.ValueUnitParser;
import com.eainde.labreport.profile.DocumentProfiles;
import com.eainde.labreport.profile.TemplateExtractor;
import com.eainde.labreport.proximity.ProximityExtractor;
import com.eainde.labreport.validation.DocumentValidator;
import com.eainde.labreport.workflow.nodes.DetectLayoutNode;
import com.eainde.labreport.workflow.nodes.MergeNode;
import com.eainde.labreport.workflow.nodes.ProximityExtractionNode;
import com.eainde.labreport.workflow.nodes.StructuralExtractionNode;
import com.eainde.labreport.workflow.nodes.TemplateExtractionNode;
import com.eainde.labreport.workflow.nodes.ValidateNode;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the extraction engine.
 *
 * <p>Each page runs through the {@link LabExtractionWorkflowGraph}: structural pass,
 * then proximity reconstruction or a document-profile template, then a merge that
 * keeps the most confident record per canonical name, then validation. Pages are
 * independent; a multi-page document concatenates page metrics and is validated
 * once over all pages.</p>
 *
 * <p>Stateless apart from the compiled graph, so one instance serves concurrent
 * callers.</p>
 */
@Log4j2
@Service
public class LabReportEngine {

    private final CompiledGraph<ExtractionState> workflow;
    private final DocumentValidator validator;

    public LabReportEngine(@Qualifier(LabExtractionWorkflowGraph.WORKFLOW_NAME) CompiledGraph<ExtractionState> workflow,
                           DocumentValidator validator) {
        this.workflow = workflow;
        this.validator = validator;
    }

    /**
     * Wires an engine without a Spring context.
     */
    public static LabReportEngine create(ExtractionSettings settings) {
        StatusClassifier statusClassifier = new StatusClassifier();
        SuspiciousValueGuard suspiciousValueGuard = new SuspiciousValueGuard(settings);
        MetricAliasTable aliasTable = new MetricAliasTable();
        MetricLineParser lineParser = new MetricLineParser(
                new LineValidityFilter(settings, aliasTable),
                new ValueUnitParser(),
                suspiciousValueGuard,
                new ReferenceRangeExtractor(),
                statusClassifier,
                aliasTable);
        DocumentProfiles profiles = new DocumentProfiles();
        DocumentValidator validator = new DocumentValidator(settings);
        LabExtractionWorkflowGraph graph = new LabExtractionWorkflowGraph(
                new DetectLayoutNode(profiles),
                new StructuralExtractionNode(new StructuralExtractor(lineParser)),
                new ProximityExtractionNode(new ProximityExtractor(lineParser, settings)),
                new TemplateExtractionNode(profiles, new TemplateExtractor(settings, statusClassifier, suspiciousValueGuard)),
                new MergeNode(new MetricMerger()),
                new ValidateNode(validator),
                new ReconstructionRoutingEdge());
        try {
            return new LabReportEngine(graph.build(), validator);
        } catch (GraphStateException e) {
            throw new LabReportExtractionException("Failed to compile extraction workflow", e);
        }
    }

    public static LabReportEngine withDefaults() {
        return create(ExtractionSettings.defaults());
    }

    /**
     * Runs the extraction workflow over one page.
     */
    public PageExtraction extractPage(OcrPage page) {
        Objects.requireNonNull(page, "page");
        ExtractionState state = run(page);

        PassResult secondary = state.hasProfile() ? state.getTemplate() : state.getProximity();
        List<String> cleaned = new ArrayList<>(secondary.lines());
        cleaned.addAll(state.getStructural().lines());

        PageExtraction extraction = new PageExtraction(
                List.copyOf(state.getMetrics()),
                state.getVerdict(),
                String.join("\n", cleaned),
                state.hasProfile() ? ExtractionRoute.TEMPLATE : ExtractionRoute.PROXIMITY,
                state.getProfileId(),
                state.getMergeStats());
        log.info("Page of {} fragments: {} metrics via {} route, valid={}",
                page.fragments().size(), extraction.metrics().size(), extraction.route(),
                extraction.verdict().valid());
        return extraction;
    }

    public LabReportAnalysis analyzePage(OcrPage page) {
        PageExtraction extraction = extractPage(page);
        return LabReportAnalysis.of(extraction.metrics(),
                pageSummary(page.imageQuality(), extraction.metrics().size()),
                extraction.verdict(), extraction.extractedText(), 1);
    }

    /**
     * Analyzes a document page by page. Metrics are concatenated in page order
     * without cross-page de-duplication; validation runs once over all pages.
     */
    public LabReportAnalysis analyzeDocument(List<OcrPage> pages) {
        Objects.requireNonNull(pages, "pages");
        if (pages.isEmpty()) {
            throw new IllegalArgumentException("A document needs at least one page");
        }
        if (pages.size() == 1) {
            return analyzePage(pages.get(0));
        }

        List<MetricRecord> metrics = new ArrayList<>();
        List<String> texts = new ArrayList<>();
        List<String> rawTexts = new ArrayList<>();
        for (OcrPage page : pages) {
            PageExtraction extraction = extractPage(page);
            metrics.addAll(extraction.metrics());
            texts.add(extraction.extractedText());
            rawTexts.add(page.rawText());
        }
        DocumentVerdict verdict = validator.validate(metrics, String.join("\n", rawTexts));
        String summary = String.format(Locale.ROOT,
                "Analysis of %d page document containing %d health metrics.", pages.size(), metrics.size());
        log.info("Document of {} pages: {} metrics, valid={}", pages.size(), metrics.size(), verdict.valid());
        return LabReportAnalysis.of(metrics, summary, verdict, String.join("\n\n", texts), pages.size());
    }

    private ExtractionState run(OcrPage page) {
        Optional<ExtractionState> result;
        try {
            result = workflow.invoke(ExtractionState.initial(page.fragments(), page.rawText()));
        } catch (Exception e) {
            throw new LabReportExtractionException("Extraction workflow failed", e);
        }
        return result.orElseThrow(() -> new LabReportExtractionException("Extraction workflow produced no final state"));
    }

    static String pageSummary(ImageQuality quality, int metricCount) {
        if (quality == null) {
            return String.format(Locale.ROOT, "Analysis of OCR page containing %d health metrics.", metricCount);
        }
        return String.format(Locale.ROOT, "Analysis of image with resolution %s, sharpness %.2f, and contrast %.2f.",
                quality.resolution(), quality.sharpness(), quality.contrast());
    }
}
