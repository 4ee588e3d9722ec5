package com.eyelevel.reportjobs.exception;

import java.io.Serial;

/**
 * Thrown by the job store when a record with the same id already exists.
 */
public class JobAlreadyExistsException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 5032911784426615519L;

    public JobAlreadyExistsException(String jobId) {
        super("A job with id " + jobId + " already exists.");
    }
}
