package com.eyelevel.reportjobs.controller;

import com.eyelevel.reportjobs.dto.common.ErrorResponse;
import com.eyelevel.reportjobs.dto.status.JobStatusResponse;
import com.eyelevel.reportjobs.dto.submit.JobSubmissionResponse;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

@Tag(name = "Report Jobs", description = "Submit assessments for report generation and poll for the results.")
public interface ReportJobApi {

    @Operation(summary = "Submit Report Job",
            description = "Records a new job for the assessment payload and starts generating its reports in the "
                    + "background. Returns immediately with the job id to poll.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Job accepted.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = JobSubmissionResponse.class),
                            examples = @ExampleObject(name = "Accepted", value = """
                                    {
                                        "job_id": "3f0e8a52-8d7c-4f39-9a5e-0c6a7f1b2d44",
                                        "status": "PENDING",
                                        "estimated_completion": "~3 minutes",
                                        "check_status_url": "/?job_id=3f0e8a52-8d7c-4f39-9a5e-0c6a7f1b2d44",
                                        "message": "Report generation started. Poll the status URL to follow progress."
                                    }
                                    """))),
            @ApiResponse(responseCode = "400", description = "The body is not a JSON object.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "500", description = "The job could not be recorded.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "503", description = "The job was recorded but could not be started; it is now FAILED.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    })
    ResponseEntity<JobSubmissionResponse> submitJob(@RequestBody JsonNode payload);

    @Operation(summary = "Get Job Status",
            description = "Returns the current status of a job. Once the job is COMPLETED or PARTIAL, each report "
                    + "carries a download link that is newly issued on every call.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Job found.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = JobStatusResponse.class))),
            @ApiResponse(responseCode = "400", description = "The job_id parameter is missing.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ErrorResponse.class),
                            examples = @ExampleObject(name = "Missing job_id", value = """
                                    {
                                        "error": "Missing job_id parameter",
                                        "usage": "GET /?job_id=<job_id>"
                                    }
                                    """))),
            @ApiResponse(responseCode = "404", description = "No job has this id.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ErrorResponse.class),
                            examples = @ExampleObject(name = "Not found", value = """
                                    {
                                        "error": "Job not found",
                                        "job_id": "3f0e8a52-8d7c-4f39-9a5e-0c6a7f1b2d44"
                                    }
                                    """))),
            @ApiResponse(responseCode = "500", description = "The status could not be assembled.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    })
    ResponseEntity<JobStatusResponse> getJobStatus(
            @Parameter(description = "The id returned on submission.", required = true,
                    example = "3f0e8a52-8d7c-4f39-9a5e-0c6a7f1b2d44")
            @RequestParam(value = "job_id", required = false) String jobId);
}
