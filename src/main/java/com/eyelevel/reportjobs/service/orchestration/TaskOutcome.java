package com.eyelevel.reportjobs.service.orchestration;

import com.eyelevel.reportjobs.model.ArtifactType;
import com.eyelevel.reportjobs.model.ReportArtifact;

/**
 * The result of one generation task: either the stored artifact or the reason it failed.
 */
public record TaskOutcome(ArtifactType type, ReportArtifact artifact, String failureReason) {

    public static TaskOutcome success(final ArtifactType type, final ReportArtifact artifact) {
        return new TaskOutcome(type, artifact, null);
    }

    public static TaskOutcome failure(final ArtifactType type, final String reason) {
        return new TaskOutcome(type, null, reason);
    }

    public boolean succeeded() {
        return artifact != null;
    }
}
