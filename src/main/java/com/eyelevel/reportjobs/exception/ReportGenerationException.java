package com.eyelevel.reportjobs.exception;

import java.io.Serial;

/**
 * Thrown when a single report could not be generated or stored. It fails that report only; the job carries on
 * with its other reports.
 */
public class ReportGenerationException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1843306621075907712L;

    public ReportGenerationException(String message) {
        super(message);
    }

    public ReportGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
