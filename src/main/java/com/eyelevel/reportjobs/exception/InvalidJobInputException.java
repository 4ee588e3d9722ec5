package com.eyelevel.reportjobs.exception;

import java.io.Serial;

/**
 * Thrown when a submitted payload cannot be admitted as a job, for example because it is not a JSON object.
 */
public class InvalidJobInputException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 7721495163402281953L;

    public InvalidJobInputException(String message) {
        super(message);
    }

    public InvalidJobInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
