package com.eyelevel.reportjobs.service.store;

import com.eyelevel.reportjobs.model.ArtifactType;
import com.eyelevel.reportjobs.model.JobStatus;
import com.eyelevel.reportjobs.model.ReportArtifact;
import org.springframework.util.StringUtils;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A conditional status change: the job moves to {@code to} only if its current status is one of {@code from}.
 * Terminal transitions also carry the artifacts to record, or the error message for a failure.
 * <p>
 * The constructor rejects transitions that could break the job invariants: leaving a terminal status,
 * a FAILED job with artifacts, a COMPLETED or PARTIAL job without any, or two artifacts of one type.
 */
public record JobTransition(Set<JobStatus> from, JobStatus to, List<ReportArtifact> artifacts, String errorMessage) {

    public JobTransition {
        if (from == null || from.isEmpty()) {
            throw new IllegalArgumentException("A transition needs at least one source status.");
        }
        if (from.stream().anyMatch(JobStatus::isTerminal)) {
            throw new IllegalArgumentException("Terminal jobs are read-only; cannot transition from " + from);
        }
        if (to == null || from.contains(to)) {
            throw new IllegalArgumentException("Invalid target status " + to + " for source " + from);
        }
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        final Set<ArtifactType> types = EnumSet.noneOf(ArtifactType.class);
        for (final ReportArtifact artifact : artifacts) {
            if (!types.add(artifact.getArtifactType())) {
                throw new IllegalArgumentException("Duplicate artifact type " + artifact.getArtifactType());
            }
        }
        switch (to) {
            case PROCESSING -> {
                if (!artifacts.isEmpty() || errorMessage != null) {
                    throw new IllegalArgumentException("A job cannot carry artifacts or an error while processing.");
                }
            }
            case COMPLETED, PARTIAL -> {
                if (artifacts.isEmpty()) {
                    throw new IllegalArgumentException(to + " requires at least one artifact.");
                }
                if (errorMessage != null) {
                    throw new IllegalArgumentException(to + " cannot carry an error message.");
                }
            }
            case FAILED -> {
                if (!artifacts.isEmpty()) {
                    throw new IllegalArgumentException("A failed job cannot carry artifacts.");
                }
                if (!StringUtils.hasText(errorMessage)) {
                    throw new IllegalArgumentException("A failed job requires an error message.");
                }
            }
            default -> throw new IllegalArgumentException("Cannot transition to " + to);
        }
        from = Set.copyOf(from);
    }

    /**
     * PENDING to PROCESSING; claimed by a worker before any generation starts.
     */
    public static JobTransition start() {
        return new JobTransition(EnumSet.of(JobStatus.PENDING), JobStatus.PROCESSING, List.of(), null);
    }

    /**
     * PROCESSING to COMPLETED or PARTIAL. The store decides which one is allowed by comparing the artifact
     * types with the job's expected types.
     */
    public static JobTransition finish(final JobStatus to, final List<ReportArtifact> artifacts) {
        return new JobTransition(EnumSet.of(JobStatus.PROCESSING), to, artifacts, null);
    }

    public static JobTransition fail(final JobStatus from, final String errorMessage) {
        return new JobTransition(EnumSet.of(from), JobStatus.FAILED, List.of(), errorMessage);
    }

    public boolean isTerminal() {
        return to.isTerminal();
    }
}
