package com.eyelevel.reportjobs.dto.submit;

import com.eyelevel.reportjobs.model.JobStatus;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Acknowledgement of an accepted job.")
public record JobSubmissionResponse(
        @Schema(description = "Identifier to poll with.", example = "3f0e8a52-8d7c-4f39-9a5e-0c6a7f1b2d44")
        String jobId,
        @Schema(example = "PENDING")
        JobStatus status,
        @Schema(example = "~3 minutes")
        String estimatedCompletion,
        @Schema(description = "Relative URL that returns the job status.", example = "/?job_id=3f0e8a52-8d7c-4f39-9a5e-0c6a7f1b2d44")
        String checkStatusUrl,
        String message) {
}
