package com.eyelevel.reportjobs.service.job;

import com.eyelevel.reportjobs.common.json.JsonSerializer;
import com.eyelevel.reportjobs.config.ReportJobsProperties;
import com.eyelevel.reportjobs.dto.status.ArtifactView;
import com.eyelevel.reportjobs.dto.status.FolderView;
import com.eyelevel.reportjobs.dto.status.JobStatusResponse;
import com.eyelevel.reportjobs.dto.submit.JobSubmissionResponse;
import com.eyelevel.reportjobs.exception.ArtifactAccessException;
import com.eyelevel.reportjobs.exception.InvalidJobInputException;
import com.eyelevel.reportjobs.exception.JobAdmissionException;
import com.eyelevel.reportjobs.exception.JobAlreadyExistsException;
import com.eyelevel.reportjobs.exception.JobDispatchException;
import com.eyelevel.reportjobs.exception.JobStatusException;
import com.eyelevel.reportjobs.model.ArtifactType;
import com.eyelevel.reportjobs.model.JobStatus;
import com.eyelevel.reportjobs.model.ReportArtifact;
import com.eyelevel.reportjobs.model.ReportJob;
import com.eyelevel.reportjobs.service.access.AccessHandle;
import com.eyelevel.reportjobs.service.access.ArtifactAccessService;
import com.eyelevel.reportjobs.service.dispatch.JobDispatcher;
import com.eyelevel.reportjobs.service.storage.StorageKeys;
import com.eyelevel.reportjobs.service.store.JobSnapshot;
import com.eyelevel.reportjobs.service.store.JobStore;
import com.eyelevel.reportjobs.service.store.JobTransition;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * The ingress side of the job lifecycle: admits new jobs and reports on existing ones. Neither operation
 * waits for report generation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportJobService {

    private final JobStore jobStore;
    private final JobDispatcher jobDispatcher;
    private final ArtifactAccessService artifactAccessService;
    private final JsonSerializer jsonSerializer;
    private final ReportJobsProperties properties;
    private final Clock clock;

    /**
     * Records a PENDING job for the payload and hands it off for processing.
     *
     * @throws InvalidJobInputException if the payload is not a JSON object.
     * @throws JobAdmissionException    if the job could not be recorded; nothing was dispatched.
     * @throws JobDispatchException     if the hand-off failed; the job has been marked FAILED.
     */
    public JobSubmissionResponse submit(final JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new InvalidJobInputException("Request body must be a JSON object.");
        }

        final String jobId = UUID.randomUUID().toString();
        final Instant now = clock.instant();
        final ReportJob job = new ReportJob();
        job.setId(jobId);
        job.setStatus(JobStatus.PENDING);
        job.setInput(jsonSerializer.serialize(payload));
        job.setExpectedArtifactTypes(properties.expectedTypes());
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        job.setExpiresAt(now.plus(properties.store().retention()));

        try {
            jobStore.create(job);
        } catch (DataAccessException | JobAlreadyExistsException e) {
            log.error("[Job {}] Could not record the new job.", jobId, e);
            throw new JobAdmissionException("Failed to create job: " + e.getMessage(), e);
        }
        log.info("[Job {}] Admitted; expecting {}.", jobId, properties.expectedTypes());

        try {
            jobDispatcher.dispatch(jobId);
        } catch (RuntimeException e) {
            final JobDispatchException dispatchException = e instanceof JobDispatchException jde
                    ? jde
                    : new JobDispatchException(jobId, "Failed to dispatch job: " + e.getMessage(), e);
            markDispatchFailed(jobId, dispatchException);
            throw dispatchException;
        }

        return new JobSubmissionResponse(jobId, JobStatus.PENDING, properties.estimatedCompletion(),
                                         "/?job_id=" + jobId,
                                         "Report generation started. Poll the status URL to follow progress.");
    }

    /**
     * Reads the job and, once it has artifacts, issues a new download link for each.
     *
     * @throws com.eyelevel.reportjobs.exception.JobNotFoundException if the job does not exist.
     * @throws JobStatusException                                    if the status could not be assembled.
     */
    public JobStatusResponse status(final String jobId) {
        final JobSnapshot snapshot;
        try {
            snapshot = jobStore.get(jobId);
        } catch (DataAccessException e) {
            throw new JobStatusException(jobId, "Failed to check job status: " + e.getMessage(), e);
        }

        return switch (snapshot.status()) {
            case PENDING, PROCESSING -> new JobStatusResponse(snapshot.id(), snapshot.status(), snapshot.createdAt(),
                                                              snapshot.updatedAt(), progressMessage(snapshot.status()),
                                                              null, null, null, null, null, null);
            case FAILED -> new JobStatusResponse(snapshot.id(), snapshot.status(), snapshot.createdAt(),
                                                 snapshot.updatedAt(), "Report generation failed.",
                                                 snapshot.errorMessage(), null, null, null, null, null);
            case COMPLETED, PARTIAL -> withArtifacts(snapshot);
        };
    }

    private JobStatusResponse withArtifacts(final JobSnapshot snapshot) {
        final List<ArtifactView> artifacts;
        try {
            artifacts = snapshot.artifacts().stream().map(this::toView).toList();
        } catch (ArtifactAccessException e) {
            log.error("[Job {}] Could not issue access handles.", snapshot.id(), e);
            throw new JobStatusException(snapshot.id(), "Failed to check job status: " + e.getMessage(), e);
        }

        final List<ArtifactType> missing = snapshot.missingTypes();
        final String message = snapshot.status() == JobStatus.COMPLETED
                ? "All " + artifacts.size() + " reports generated successfully."
                : artifacts.size() + " of " + snapshot.expectedTypes().size() + " reports generated; missing "
                        + missing.stream().map(ArtifactType::wireName).collect(Collectors.joining(", ")) + ".";

        final ArtifactType primaryType = properties.primaryArtifactType();
        final ArtifactView primary = primaryType == null ? null : artifacts.stream()
                                                                           .filter(view -> view.type() == primaryType)
                                                                           .findFirst()
                                                                           .orElse(null);

        return new JobStatusResponse(snapshot.id(), snapshot.status(), snapshot.createdAt(), snapshot.updatedAt(),
                                     message, null, artifacts, artifacts.size(),
                                     snapshot.status() == JobStatus.PARTIAL ? missing : null,
                                     folderOf(snapshot), primary);
    }

    private ArtifactView toView(final ReportArtifact artifact) {
        final AccessHandle handle = artifactAccessService.issue(artifact.getContainer(), artifact.getStorageKey(),
                                                                properties.access().handleTtl());
        return new ArtifactView(artifact.getArtifactType(), artifact.getStorageKey(), handle.url(),
                                handle.expiresIn(), handle.expiresAt(), artifact.getMetadata());
    }

    private static FolderView folderOf(final JobSnapshot snapshot) {
        final ReportArtifact first = snapshot.artifacts().get(0);
        final Object company = first.getMetadata().get("company_name");
        final String description = company == null
                ? "Reports for job " + snapshot.id()
                : "Reports for " + company + " (job " + snapshot.id() + ")";
        return new FolderView(first.getContainer(), StorageKeys.folderOf(first.getStorageKey()), description);
    }

    private static String progressMessage(final JobStatus status) {
        return status == JobStatus.PENDING
                ? "Job is queued and will start shortly."
                : "Reports are being generated. Check back shortly.";
    }

    private void markDispatchFailed(final String jobId, final JobDispatchException cause) {
        log.error("[Job {}] Dispatch failed; marking the job FAILED.", jobId, cause);
        try {
            jobStore.update(jobId, JobTransition.fail(JobStatus.PENDING, cause.getMessage()));
        } catch (RuntimeException e) {
            log.error("[Job {}] Could not mark the undispatched job FAILED; the stale job sweeper will.", jobId, e);
        }
    }
}
