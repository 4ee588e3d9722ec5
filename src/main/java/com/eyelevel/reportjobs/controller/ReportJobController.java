package com.eyelevel.reportjobs.controller;

import com.eyelevel.reportjobs.dto.status.JobStatusResponse;
import com.eyelevel.reportjobs.dto.submit.JobSubmissionResponse;
import com.eyelevel.reportjobs.exception.MissingJobIdException;
import com.eyelevel.reportjobs.service.job.ReportJobService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for submitting report jobs and polling their status. Both operations live on the root path.
 */
@Slf4j
@RestController
@RequestMapping(value = "/", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class ReportJobController implements ReportJobApi {

    private final ReportJobService reportJobService;

    @Override
    @PostMapping
    public ResponseEntity<JobSubmissionResponse> submitJob(@RequestBody final JsonNode payload) {
        log.info("Received report job submission.");
        final JobSubmissionResponse response = reportJobService.submit(payload);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @Override
    @GetMapping
    public ResponseEntity<JobStatusResponse> getJobStatus(
            @RequestParam(value = "job_id", required = false) final String jobId) {
        if (!StringUtils.hasText(jobId)) {
            throw new MissingJobIdException();
        }
        log.debug("Fetching status for job {}", jobId);
        return ResponseEntity.ok(reportJobService.status(jobId.trim()));
    }
}
