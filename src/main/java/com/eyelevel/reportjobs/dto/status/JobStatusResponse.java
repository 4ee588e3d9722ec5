package com.eyelevel.reportjobs.dto.status;

import com.eyelevel.reportjobs.model.ArtifactType;
import com.eyelevel.reportjobs.model.JobStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * The status of a job. Which fields are present depends on the status:
 * <ul>
 *     <li>PENDING, PROCESSING: timestamps and a progress message.</li>
 *     <li>COMPLETED, PARTIAL: additionally the artifacts, their count and folder, and for PARTIAL the
 *     missing types.</li>
 *     <li>FAILED: additionally the error message.</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(String jobId,
                                JobStatus status,
                                Instant createdAt,
                                Instant updatedAt,
                                String message,
                                String errorMessage,
                                List<ArtifactView> artifacts,
                                Integer artifactCount,
                                List<ArtifactType> missingTypes,
                                FolderView folder,
                                ArtifactView primaryArtifact) {
}
