package com.eainde.labreport.extract;

import com.eainde.labreport.model.MetricRecord;
import com.eainde.labreport.model.PassResult;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Primary pass: reads the page text line by line and keeps every line that parses
 * as a metric.
 */
@Log4j2
@Component
public class StructuralExtractor {

    private final MetricLineParser lineParser;

    public StructuralExtractor(MetricLineParser lineParser) {
        this.lineParser = lineParser;
    }

    public PassResult extract(String text) {
        if (text == null || text.isBlank()) {
            return PassResult.EMPTY;
        }
        String[] lines = text.split("\\R");
        List<String> accepted = new ArrayList<>();
        List<MetricRecord> metrics = new ArrayList<>();
        for (String line : lines) {
            if (line.indexOf(MetricLineParser.SEPARATOR) < 0) {
                continue;
            }
            Optional<MetricRecord> metric = lineParser.parseLine(line);
            if (metric.isPresent()) {
                metrics.add(metric.get());
                accepted.add(line.strip());
            }
        }
        log.info("Structural pass: {} of {} lines produced metrics", metrics.size(), lines.length);
        return new PassResult(accepted, metrics);
    }
}
