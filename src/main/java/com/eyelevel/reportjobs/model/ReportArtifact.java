package com.eyelevel.reportjobs.model;

import com.eyelevel.reportjobs.model.converter.MetadataConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One stored output of a job. Rows are inserted together with the job's terminal status and never
 * change afterwards.
 */
@Entity
@Table(name = "report_job_artifact", uniqueConstraints = {
        @UniqueConstraint(name = "uk_report_job_artifact_job_type", columnNames = {"job_id", "artifact_type"}),
        @UniqueConstraint(name = "uk_report_job_artifact_storage_key", columnNames = {"storage_key"})})
@Data
@NoArgsConstructor
public class ReportArtifact {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, length = 36)
    private String jobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "artifact_type", nullable = false, length = 16)
    private ArtifactType artifactType;

    @Column(nullable = false)
    private String container;

    @Column(name = "storage_key", nullable = false, length = 1024)
    private String storageKey;

    @Convert(converter = MetadataConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Column(nullable = false)
    private Instant createdAt;

    public ReportArtifact(final ArtifactType artifactType, final String container, final String storageKey,
                          final Map<String, Object> metadata) {
        this.artifactType = artifactType;
        this.container = container;
        this.storageKey = storageKey;
        this.metadata = new LinkedHashMap<>(metadata);
    }
}
