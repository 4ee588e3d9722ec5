package com.eyelevel.reportjobs.exception;

import java.io.Serial;

public class MissingJobIdException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -6413925508231146203L;

    public MissingJobIdException() {
        super("Missing job_id parameter");
    }
}
