package com.eyelevel.reportjobs.exception;

import lombok.Getter;

import java.io.Serial;

@Getter
public class JobNotFoundException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -1502337467750123308L;

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job not found");
        this.jobId = jobId;
    }
}
