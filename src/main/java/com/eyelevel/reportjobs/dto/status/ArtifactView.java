package com.eyelevel.reportjobs.dto.status;

import com.eyelevel.reportjobs.model.ArtifactType;

import java.time.Instant;
import java.util.Map;

/**
 * One produced report with a freshly issued download link.
 */
public record ArtifactView(ArtifactType type,
                           String storageKey,
                           String accessHandle,
                           long expiresIn,
                           Instant expiresAt,
                           Map<String, Object> metadata) {
}
