package com.eyelevel.reportjobs.exception;

import lombok.Getter;

import java.io.Serial;

/**
 * Thrown when the status of an existing job could not be assembled, for example because the store was
 * unreachable or a download link could not be signed.
 */
@Getter
public class JobStatusException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 2950716618842305127L;

    private final String jobId;

    public JobStatusException(String jobId, String message, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
    }
}
