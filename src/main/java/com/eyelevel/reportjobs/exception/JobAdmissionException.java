package com.eyelevel.reportjobs.exception;

import java.io.Serial;

/**
 * Thrown when a valid submission could not be recorded in the job store. No job exists afterwards.
 */
public class JobAdmissionException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -2204518871355729310L;

    public JobAdmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
