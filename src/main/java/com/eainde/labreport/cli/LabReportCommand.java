package com.eainde.labreport.cli;

import com.eainde.labreport.model.LabReportAnalysis;
import com.eainde.labreport.model.OcrPage;
import com.eainde.labreport.workflow.LabReportEngine;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line front end: each argument is a UTF-8 text file holding one page,
 * one OCR fragment per line. Prints the analysis as JSON.
 */
@Log4j2
@Component
public class LabReportCommand implements CommandLineRunner, ExitCodeGenerator {

    static final int OK = 0;
    static final int UNREADABLE_INPUT = 1;
    static final int USAGE = 2;

    private final LabReportEngine engine;
    private final ObjectMapper objectMapper;
    private final PrintStream out;
    private int exitCode = OK;

    @Autowired
    public LabReportCommand(LabReportEngine engine, ObjectMapper objectMapper) {
        this(engine, objectMapper, System.out);
    }

    LabReportCommand(LabReportEngine engine, ObjectMapper objectMapper, PrintStream out) {
        this.engine = engine;
        this.objectMapper = objectMapper;
        this.out = out;
    }

    @Override
    public void run(String... args) throws JsonProcessingException {
        List<String> files = new ArrayList<>();
        for (String arg : args) {
            // Spring's own --key=value options are not pages.
            if (!arg.startsWith("--")) {
                files.add(arg);
            }
        }
        if (files.isEmpty()) {
            log.warn("Usage: lab-report-ocr <page1.txt> [page2.txt ...]");
            exitCode = USAGE;
            return;
        }

        List<OcrPage> pages = new ArrayList<>();
        for (String file : files) {
            try {
                pages.add(OcrPage.of(Files.readAllLines(Path.of(file), StandardCharsets.UTF_8)));
            } catch (IOException e) {
                log.error("Cannot read page file {}: {}", file, e.getMessage());
                exitCode = UNREADABLE_INPUT;
                return;
            }
        }

        LabReportAnalysis analysis = engine.analyzeDocument(pages);
        out.println(objectMapper.writeValueAsString(analysis));
        exitCode = OK;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
