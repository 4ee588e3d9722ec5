package com.eyelevel.reportjobs.service.orchestration;

import com.eyelevel.reportjobs.common.json.JsonParser;
import com.eyelevel.reportjobs.config.ReportJobsProperties;
import com.eyelevel.reportjobs.exception.JobFinalizationException;
import com.eyelevel.reportjobs.exception.JobNotFoundException;
import com.eyelevel.reportjobs.exception.ReportGenerationException;
import com.eyelevel.reportjobs.model.ArtifactType;
import com.eyelevel.reportjobs.model.JobStatus;
import com.eyelevel.reportjobs.model.ReportArtifact;
import com.eyelevel.reportjobs.service.generation.AssessmentProfile;
import com.eyelevel.reportjobs.service.generation.GeneratedReport;
import com.eyelevel.reportjobs.service.generation.ReportGenerator;
import com.eyelevel.reportjobs.service.generation.ReportGeneratorRegistry;
import com.eyelevel.reportjobs.service.storage.S3StorageService;
import com.eyelevel.reportjobs.service.storage.StorageKeys;
import com.eyelevel.reportjobs.service.store.JobSnapshot;
import com.eyelevel.reportjobs.service.store.JobStore;
import com.eyelevel.reportjobs.service.store.JobTransition;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Drives one job from PENDING to a terminal status.
 * <p>
 * The job is first claimed with a conditional PENDING to PROCESSING write, so a redelivered trigger for a
 * job that has already started does nothing. One generation task per expected artifact type then runs on
 * the generation pool; the results are gathered under a single deadline and recorded with one terminal
 * write: COMPLETED if every task succeeded, PARTIAL if some did, FAILED if none did.
 */
@Slf4j
@Service
public class ReportOrchestrator {

    private final JobStore jobStore;
    private final JobFinalizer jobFinalizer;
    private final ReportGeneratorRegistry generatorRegistry;
    private final S3StorageService storageService;
    private final JsonParser jsonParser;
    private final AsyncTaskExecutor generationExecutor;
    private final ReportJobsProperties properties;
    private final Clock clock;

    public ReportOrchestrator(final JobStore jobStore,
                              final JobFinalizer jobFinalizer,
                              final ReportGeneratorRegistry generatorRegistry,
                              final S3StorageService storageService,
                              final JsonParser jsonParser,
                              @Qualifier("reportGenerationExecutor") final AsyncTaskExecutor generationExecutor,
                              final ReportJobsProperties properties,
                              final Clock clock) {
        this.jobStore = jobStore;
        this.jobFinalizer = jobFinalizer;
        this.generatorRegistry = generatorRegistry;
        this.storageService = storageService;
        this.jsonParser = jsonParser;
        this.generationExecutor = generationExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Runs the job to completion. Returns once the terminal status is recorded, or immediately if the job
     * was already claimed by another run.
     *
     * @param jobId The job to run.
     */
    public void run(final String jobId) {
        try {
            if (!jobStore.update(jobId, JobTransition.start())) {
                log.info("[Job {}] Already started or finished elsewhere; skipping this run.", jobId);
                return;
            }
        } catch (JobNotFoundException e) {
            log.warn("[Job {}] No such job; the trigger refers to a record that does not exist.", jobId);
            return;
        }
        log.info("[Job {}] Claimed for processing.", jobId);

        final JobTransition transition = execute(jobId);

        try {
            if (jobFinalizer.finalizeJob(jobId, transition)) {
                log.info("[Job {}] Finished with status {}.", jobId, transition.to());
            } else {
                log.warn("[Job {}] Left PROCESSING before the run finished; result {} discarded.", jobId,
                         transition.to());
            }
        } catch (JobFinalizationException e) {
            log.error("[Job {}] Run finished but its result could not be recorded. The job stays PROCESSING until "
                              + "the stale job sweeper fails it.", jobId, e);
        }
    }

    private JobTransition execute(final String jobId) {
        final JobSnapshot snapshot;
        final AssessmentProfile profile;
        try {
            snapshot = jobStore.get(jobId);
            final JsonNode input = jsonParser.parseTree(snapshot.input());
            profile = AssessmentProfile.from(input, clock);
        } catch (RuntimeException e) {
            log.error("[Job {}] Could not prepare the job input.", jobId, e);
            return JobTransition.fail(JobStatus.PROCESSING, "Failed to prepare job input: " + reasonOf(e));
        }

        final String folder = StorageKeys.folderPrefix(properties.storage().keyPrefix(), profile.companyName(), jobId);
        log.info("[Job {}] Generating {} for '{}' ({}) under '{}'.", jobId, snapshot.expectedTypes(),
                 profile.companyName(), profile.industry(), folder);

        final List<TaskOutcome> outcomes = fanOut(jobId, snapshot.expectedTypes(), profile, folder);
        return aggregate(outcomes, snapshot.expectedTypes());
    }

    private List<TaskOutcome> fanOut(final String jobId, final List<ArtifactType> types,
                                     final AssessmentProfile profile, final String folder) {
        final Map<ArtifactType, Future<TaskOutcome>> futures = new LinkedHashMap<>();
        final Map<ArtifactType, TaskOutcome> outcomes = new LinkedHashMap<>();
        for (final ArtifactType type : types) {
            try {
                futures.put(type, generationExecutor.submit(() -> generateOne(jobId, type, profile, folder)));
            } catch (TaskRejectedException e) {
                log.error("[Job {}] Generation pool rejected the {} task.", jobId, type.wireName(), e);
                outcomes.put(type, TaskOutcome.failure(type, "generation capacity exhausted"));
            }
        }

        final Duration timeout = properties.generation().timeout();
        final long deadline = System.nanoTime() + timeout.toNanos();
        boolean interrupted = false;
        for (final Map.Entry<ArtifactType, Future<TaskOutcome>> entry : futures.entrySet()) {
            final ArtifactType type = entry.getKey();
            final Future<TaskOutcome> future = entry.getValue();
            if (interrupted) {
                future.cancel(true);
                outcomes.put(type, TaskOutcome.failure(type, "run interrupted"));
                continue;
            }
            try {
                final long remaining = Math.max(0L, deadline - System.nanoTime());
                outcomes.put(type, future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                log.error("[Job {}] The {} task did not finish within {}.", jobId, type.wireName(), timeout);
                outcomes.put(type, TaskOutcome.failure(type, "timed out after " + timeout.toSeconds() + "s"));
            } catch (CancellationException e) {
                log.error("[Job {}] The {} task was cancelled before it finished.", jobId, type.wireName());
                outcomes.put(type, TaskOutcome.failure(type, "cancelled"));
            } catch (ExecutionException e) {
                log.error("[Job {}] The {} task failed unexpectedly.", jobId, type.wireName(), e.getCause());
                outcomes.put(type, TaskOutcome.failure(type, reasonOf(e.getCause())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                future.cancel(true);
                outcomes.put(type, TaskOutcome.failure(type, "run interrupted"));
            }
        }
        return types.stream().map(outcomes::get).toList();
    }

    TaskOutcome generateOne(final String jobId, final ArtifactType type, final AssessmentProfile profile,
                            final String folder) {
        final long started = System.nanoTime();
        final Instant generatedAt = clock.instant();
        try {
            final ReportGenerator generator = generatorRegistry.getGenerator(type).orElseThrow(
                    () -> new ReportGenerationException("No generator registered for " + type.wireName()));
            final GeneratedReport report = generator.generate(jobId, profile);

            final String key = StorageKeys.artifactKey(folder, type, generatedAt);
            final String container = storageService.putIfAbsent(key, report.content(), report.contentType());

            final Map<String, Object> metadata = new LinkedHashMap<>(report.metadata());
            metadata.put("generated_at", generatedAt.toString());
            metadata.put("duration_ms", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            log.info("[Job {}] {} report stored at {}.", jobId, type.wireName(), key);
            return TaskOutcome.success(type, new ReportArtifact(type, container, key, metadata));
        } catch (Exception e) {
            log.error("[Job {}] {} report failed.", jobId, type.wireName(), e);
            return TaskOutcome.failure(type, reasonOf(e));
        }
    }

    static JobTransition aggregate(final List<TaskOutcome> outcomes, final List<ArtifactType> expected) {
        final List<ReportArtifact> artifacts = new ArrayList<>();
        outcomes.stream().filter(TaskOutcome::succeeded).forEach(outcome -> artifacts.add(outcome.artifact()));

        if (artifacts.isEmpty()) {
            final String reasons = outcomes.stream()
                                           .map(outcome -> outcome.type().wireName() + ": " + outcome.failureReason())
                                           .collect(Collectors.joining("; "));
            return JobTransition.fail(JobStatus.PROCESSING, "All report generation tasks failed (" + reasons + ")");
        }
        final JobStatus status = artifacts.size() == expected.size() ? JobStatus.COMPLETED : JobStatus.PARTIAL;
        return JobTransition.finish(status, artifacts);
    }

    private static String reasonOf(final Throwable e) {
        if (e == null) {
            return "unknown error";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
