package com.eainde.labreport.proximity;

import com.eainde.labreport.config.ExtractionSettings;
import com.eainde.labreport.extract.MetricLineParser;
import com.eainde.labreport.model.MetricRecord;
import com.eainde.labreport.model.PassResult;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Secondary pass for pages whose rows fell apart into single fragments. Each
 * {@link FragmentReconstructor} proposes synthetic lines, which go through the
 * same {@link MetricLineParser} as the structural pass.
 */
@Log4j2
@Component
public class ProximityExtractor {

    private final MetricLineParser lineParser;
    private final List<FragmentReconstructor> reconstructors;

    @Autowired
    public ProximityExtractor(MetricLineParser lineParser, ExtractionSettings settings) {
        this(lineParser, List.of(
                new LabelWindowReconstructor(settings.getLabelWindow(), settings.getLabCodeWindow()),
                new HepatitisMarkerReconstructor(settings.getHepatitisWindow()),
                new BiochemicalPanelReconstructor(settings.getPanelWindow())));
    }

    public ProximityExtractor(MetricLineParser lineParser, List<FragmentReconstructor> reconstructors) {
        this.lineParser = lineParser;
        this.reconstructors = List.copyOf(reconstructors);
    }

    public PassResult extract(List<String> fragments) {
        List<String> cleaned = fragments.stream()
                .filter(f -> f != null && !f.isBlank())
                .map(String::strip)
                .toList();
        if (cleaned.isEmpty()) {
            return PassResult.EMPTY;
        }

        List<String> lines = new ArrayList<>();
        List<MetricRecord> metrics = new ArrayList<>();
        for (FragmentReconstructor reconstructor : reconstructors) {
            List<String> reconstructed = reconstructor.reconstruct(cleaned);
            int parsed = 0;
            for (String line : reconstructed) {
                Optional<MetricRecord> metric = lineParser.parseLine(line);
                if (metric.isPresent()) {
                    metrics.add(metric.get());
                    parsed++;
                }
            }
            lines.addAll(reconstructed);
            log.debug("{}: {} lines reconstructed, {} parsed", reconstructor.name(), reconstructed.size(), parsed);
        }
        log.info("Proximity pass: {} metrics from {} fragments", metrics.size(), cleaned.size());
        return new PassResult(lines, metrics);
    }
}
