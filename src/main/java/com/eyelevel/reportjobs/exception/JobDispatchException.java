package com.eyelevel.reportjobs.exception;

import lombok.Getter;

import java.io.Serial;

/**
 * Thrown when a recorded job could not be handed off for processing. By the time it reaches a caller the job
 * has already been marked FAILED.
 */
@Getter
public class JobDispatchException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 8894102355640927731L;

    private final String jobId;

    public JobDispatchException(String jobId, String message, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
    }
}
