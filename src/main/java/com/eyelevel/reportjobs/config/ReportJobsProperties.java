package com.eyelevel.reportjobs.config;

import com.eyelevel.reportjobs.model.ArtifactType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;

/**
 * Binds application properties under the "app.reports" prefix to a single immutable configuration
 * object, validated once at start-up.
 *
 * @param expectedTypes       The artifact types every new job must produce, in presentation order.
 * @param primaryArtifactType Optional type echoed as a top-level {@code primary_artifact} for older clients.
 * @param estimatedCompletion Human-readable estimate returned on submission.
 */
@Validated
@ConfigurationProperties(prefix = "app.reports")
public record ReportJobsProperties(
        @DefaultValue({"executive", "technical", "compliance"}) List<ArtifactType> expectedTypes,
        ArtifactType primaryArtifactType,
        @DefaultValue("~3 minutes") String estimatedCompletion,
        @DefaultValue @Valid Store store,
        @DefaultValue @Valid Storage storage,
        @DefaultValue @Valid Access access,
        @DefaultValue @Valid Dispatch dispatch,
        @DefaultValue @Valid Generation generation,
        @DefaultValue @Valid Stale stale) {

    public ReportJobsProperties {
        if (expectedTypes == null || expectedTypes.isEmpty()) {
            throw new IllegalArgumentException("app.reports.expected-types must name at least one artifact type.");
        }
        if (EnumSet.copyOf(expectedTypes).size() != expectedTypes.size()) {
            throw new IllegalArgumentException("app.reports.expected-types must not repeat a type: " + expectedTypes);
        }
        expectedTypes = List.copyOf(expectedTypes);
    }

    /**
     * @param tableName Physical table holding job records; artifacts live in "{tableName}_artifact". At most
     *                  39 characters, so the index and constraint names built from it fit PostgreSQL's limit.
     * @param retention How long a record is kept after creation before the sweeper may purge it.
     */
    public record Store(@DefaultValue("report_job") @Pattern(regexp = "[a-z][a-z0-9_]{0,38}")
                        String tableName,
                        @DefaultValue("7d") Duration retention) {
    }

    /**
     * @param bucket    Blob container receiving generated artifacts.
     * @param keyPrefix Prefix prepended to every artifact key.
     * @param sseMode   Server-side encryption mode, {@code AES256} or {@code aws:kms}.
     * @param kmsKeyId  KMS key used when {@code sseMode} is {@code aws:kms}.
     */
    public record Storage(@DefaultValue("report-jobs-artifacts") @NotBlank String bucket,
                          @DefaultValue("reports/") String keyPrefix,
                          @DefaultValue("AES256") String sseMode,
                          String kmsKeyId) {

        public boolean usesKms() {
            return "aws:kms".equalsIgnoreCase(sseMode) && StringUtils.hasText(kmsKeyId);
        }
    }

    /**
     * @param handleTtl Validity window of every issued access handle.
     */
    public record Access(@DefaultValue("3600s") Duration handleTtl) {
    }

    public enum DispatchBackend {
        LOCAL, SQS
    }

    /**
     * @param backend       Where submitted jobs are handed off for orchestration.
     * @param queueName     SQS queue used when {@code backend} is {@code sqs}.
     * @param poolSize      Jobs orchestrated at once by the local backend.
     * @param queueCapacity Jobs waiting once every orchestrator thread is busy.
     */
    public record Dispatch(@DefaultValue("local") DispatchBackend backend,
                           @DefaultValue("report-jobs-queue") @NotBlank String queueName,
                           @DefaultValue("8") @Positive int poolSize,
                           @DefaultValue("100") @PositiveOrZero int queueCapacity) {
    }

    /**
     * @param timeout       Upper wall-clock bound on waiting for all generation tasks of one job.
     * @param poolSize      Generation tasks running at once across all jobs.
     * @param queueCapacity Tasks waiting once every generation thread is busy.
     */
    public record Generation(@DefaultValue("10m") Duration timeout,
                             @DefaultValue("24") @Positive int poolSize,
                             @DefaultValue("200") @PositiveOrZero int queueCapacity) {
    }

    /**
     * @param pendingTimeout    A job still PENDING after this long is declared lost and failed.
     * @param processingTimeout A job whose last write is older than this while PROCESSING is failed.
     */
    public record Stale(@DefaultValue("15m") Duration pendingTimeout,
                        @DefaultValue("30m") Duration processingTimeout) {
    }
}
