package com.eyelevel.reportjobs.service.store;

import com.eyelevel.reportjobs.model.ArtifactType;
import com.eyelevel.reportjobs.model.JobStatus;
import com.eyelevel.reportjobs.model.ReportArtifact;
import com.eyelevel.reportjobs.model.ReportJob;

import java.time.Instant;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An immutable, point-in-time view of a job and its artifacts. Artifacts are only present once the job is
 * COMPLETED or PARTIAL, and are ordered by the job's expected type order.
 */
public record JobSnapshot(String id,
                          JobStatus status,
                          Instant createdAt,
                          Instant updatedAt,
                          String input,
                          List<ArtifactType> expectedTypes,
                          String errorMessage,
                          List<ReportArtifact> artifacts) {

    public JobSnapshot {
        expectedTypes = List.copyOf(expectedTypes);
        artifacts = List.copyOf(artifacts);
    }

    static JobSnapshot of(final ReportJob job, final List<ReportArtifact> artifacts) {
        final List<ArtifactType> expected = job.expectedArtifactTypes();
        final boolean hasArtifacts = job.getStatus() == JobStatus.COMPLETED || job.getStatus() == JobStatus.PARTIAL;
        final List<ReportArtifact> ordered = hasArtifacts
                ? artifacts.stream().sorted(Comparator.comparingInt(a -> orderOf(expected, a.getArtifactType()))).toList()
                : List.of();
        return new JobSnapshot(job.getId(), job.getStatus(), job.getCreatedAt(), job.getUpdatedAt(), job.getInput(),
                               expected, job.getErrorMessage(), ordered);
    }

    private static int orderOf(final List<ArtifactType> expected, final ArtifactType type) {
        final int index = expected.indexOf(type);
        return index < 0 ? Integer.MAX_VALUE : index;
    }

    /**
     * Expected types that have no artifact, in expected order. Empty unless the job is PARTIAL.
     */
    public List<ArtifactType> missingTypes() {
        if (status != JobStatus.PARTIAL) {
            return List.of();
        }
        final Set<ArtifactType> produced = artifacts.stream()
                                                    .map(ReportArtifact::getArtifactType)
                                                    .collect(Collectors.toCollection(() -> EnumSet.noneOf(ArtifactType.class)));
        return expectedTypes.stream().filter(type -> !produced.contains(type)).toList();
    }
}
