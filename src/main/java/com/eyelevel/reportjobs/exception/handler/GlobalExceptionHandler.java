package com.eyelevel.reportjobs.exception.handler;

import com.eyelevel.reportjobs.dto.common.ErrorResponse;
import com.eyelevel.reportjobs.exception.InvalidJobInputException;
import com.eyelevel.reportjobs.exception.JobAdmissionException;
import com.eyelevel.reportjobs.exception.JobDispatchException;
import com.eyelevel.reportjobs.exception.JobNotFoundException;
import com.eyelevel.reportjobs.exception.JobStatusException;
import com.eyelevel.reportjobs.exception.MissingJobIdException;
import com.eyelevel.reportjobs.exception.json.JsonParsingException;
import com.eyelevel.reportjobs.model.JobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;

/**
 * A centralized exception handler for the entire application.
 * It converts exceptions thrown from controllers into an {@link ErrorResponse} with the semantically correct
 * HTTP status code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String STATUS_USAGE = "GET /?job_id=<job_id>";

    // --- 4xx Client Error Handlers ---

    @ExceptionHandler({InvalidJobInputException.class, JsonParsingException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(final RuntimeException ex) {
        log.warn("Bad Request Exception: {}", ex.getMessage());
        return new ResponseEntity<>(ErrorResponse.of(ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles malformed JSON or unreadable request bodies. (400 Bad Request)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(final HttpMessageNotReadableException ex) {
        log.warn("Handling HttpMessageNotReadableException: {}", ex.getMessage());
        return new ResponseEntity<>(ErrorResponse.of("Malformed request body.",
                                                     "The request body is missing or is not valid JSON."),
                                    HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MissingJobIdException.class)
    public ResponseEntity<ErrorResponse> handleMissingJobId(final MissingJobIdException ex) {
        log.warn("Status requested without a job_id.");
        return new ResponseEntity<>(new ErrorResponse(ex.getMessage(), null, null, STATUS_USAGE, null, null),
                                    HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleJobNotFound(final JobNotFoundException ex) {
        log.warn("Job not found: {}", ex.getJobId());
        return new ResponseEntity<>(ErrorResponse.forJob(ex.getMessage(), ex.getJobId()), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResourceFound(final NoResourceFoundException ex) {
        log.warn("Handling NoResourceFoundException: {}", ex.getMessage());
        return new ResponseEntity<>(ErrorResponse.of("Resource not found.", "No endpoint /" + ex.getResourcePath()),
                                    HttpStatus.NOT_FOUND);
    }

    /**
     * Handles unsupported HTTP methods for an existing endpoint. (405 Method Not Allowed)
     */
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleHttpRequestMethodNotSupported(
            final HttpRequestMethodNotSupportedException ex) {
        final String[] supported = ex.getSupportedMethods();
        final List<String> allowed = supported == null ? List.of() : List.of(supported);
        log.warn("Handling HttpRequestMethodNotSupportedException: method '{}' not in {}", ex.getMethod(), allowed);
        final ErrorResponse body = new ErrorResponse("Method " + ex.getMethod() + " not allowed", null, null, null,
                                                     null, allowed);
        return new ResponseEntity<>(body, HttpStatus.METHOD_NOT_ALLOWED);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMediaTypeNotSupported(final HttpMediaTypeNotSupportedException ex) {
        log.warn("Handling HttpMediaTypeNotSupportedException: {}", ex.getMessage());
        return new ResponseEntity<>(ErrorResponse.of("Unsupported content type.", "Send the job as application/json."),
                                    HttpStatus.UNSUPPORTED_MEDIA_TYPE);
    }

    // --- 5xx Server Error Handlers ---

    @ExceptionHandler(JobAdmissionException.class)
    public ResponseEntity<ErrorResponse> handleAdmission(final JobAdmissionException ex) {
        log.error("Job admission failed: {}", ex.getMessage(), ex);
        return new ResponseEntity<>(ErrorResponse.of(ex.getMessage()), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    /**
     * The job exists but is FAILED; the body says so. (503 Service Unavailable)
     */
    @ExceptionHandler(JobDispatchException.class)
    public ResponseEntity<ErrorResponse> handleDispatch(final JobDispatchException ex) {
        log.error("Job dispatch failed for job {}: {}", ex.getJobId(), ex.getMessage());
        final ErrorResponse body = new ErrorResponse(ex.getMessage(), ex.getJobId(), JobStatus.FAILED, null, null,
                                                     null);
        return new ResponseEntity<>(body, HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(JobStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(final JobStatusException ex) {
        log.error("Status check failed for job {}: {}", ex.getJobId(), ex.getMessage(), ex);
        return new ResponseEntity<>(ErrorResponse.forJob(ex.getMessage(), ex.getJobId()),
                                    HttpStatus.INTERNAL_SERVER_ERROR);
    }

    /**
     * A catch-all handler for any other unhandled exceptions. (500 Internal Server Error)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllUncaughtException(final Exception ex) {
        log.error("An unexpected internal server error occurred: {}", ex.getMessage(), ex);
        return new ResponseEntity<>(ErrorResponse.of("An unexpected internal server error occurred."),
                                    HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
