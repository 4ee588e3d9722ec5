package com.eyelevel.reportjobs.dto.common;

import com.eyelevel.reportjobs.model.JobStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * The body of every error response. Only {@code error} is always present.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error,
                            String jobId,
                            JobStatus status,
                            String usage,
                            String details,
                            List<String> allowedMethods) {

    public static ErrorResponse of(final String error) {
        return new ErrorResponse(error, null, null, null, null, null);
    }

    public static ErrorResponse of(final String error, final String details) {
        return new ErrorResponse(error, null, null, null, details, null);
    }

    public static ErrorResponse forJob(final String error, final String jobId) {
        return new ErrorResponse(error, jobId, null, null, null, null);
    }
}
