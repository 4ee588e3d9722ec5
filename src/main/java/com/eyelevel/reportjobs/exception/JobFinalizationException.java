package com.eyelevel.reportjobs.exception;

import java.io.Serial;

/**
 * Thrown when the terminal status of a job could not be written after all retry attempts. The job is left
 * PROCESSING for the stale job sweeper to fail.
 */
public class JobFinalizationException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 4127786093152641874L;

    public JobFinalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
