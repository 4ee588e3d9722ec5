package com.eyelevel.reportjobs.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import jakarta.persistence.Version;
import lombok.Data;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The durable record of one report generation request. It is the only state shared between the ingress
 * handler that creates it and the worker that drives it to a terminal status.
 */
@Entity
@Table(name = "report_job", indexes = {
        @Index(name = "idx_report_job_status_updated", columnList = "status, updated_at"),
        @Index(name = "idx_report_job_expires", columnList = "expires_at")})
@Data
public class ReportJob {

    @Id
    @Column(length = 36, nullable = false, updatable = false)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private JobStatus status;

    /**
     * The submitted JSON object, verbatim.
     */
    @Column(columnDefinition = "TEXT", nullable = false, updatable = false)
    private String input;

    /**
     * Comma-separated wire names of the artifact types this job must produce, captured at admission.
     */
    @Column(nullable = false, updatable = false)
    private String expectedTypes;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Version
    private Long version;

    @Transient
    public List<ArtifactType> expectedArtifactTypes() {
        if (!StringUtils.hasText(expectedTypes)) {
            return List.of();
        }
        return Arrays.stream(expectedTypes.split(",")).map(String::trim).map(ArtifactType::fromWireName).toList();
    }

    public void setExpectedArtifactTypes(final List<ArtifactType> types) {
        this.expectedTypes = types.stream().map(ArtifactType::wireName).collect(Collectors.joining(","));
    }
}
