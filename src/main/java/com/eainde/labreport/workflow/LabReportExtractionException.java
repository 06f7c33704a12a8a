package com.eainde.labreport.workflow;

/**
 * Infrastructure fault of the extraction workflow: the graph failed to compile or a
 * run ended without a final state. Document content never raises this.
 */
public class LabReportExtractionException extends RuntimeException {

    public LabReportExtractionException(String message) {
        super(message);
    }

    public LabReportExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
