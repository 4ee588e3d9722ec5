package com.eyelevel.reportjobs.scheduler;

import com.eyelevel.reportjobs.config.ReportJobsProperties;
import com.eyelevel.reportjobs.model.JobStatus;
import com.eyelevel.reportjobs.service.store.JobStore;
import com.eyelevel.reportjobs.service.store.JobTransition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Fails jobs that stopped making progress, so a polling client always ends up seeing a terminal status.
 * <p>
 * A PENDING job is stale when no worker claimed it in time (lost trigger, crashed local pool). A PROCESSING
 * job is stale when its run died or its terminal write kept failing. Each job is failed with the same
 * conditional write the orchestrator uses, so a run that finishes concurrently wins or loses cleanly.
 */
@Slf4j
@Component
public class StaleJobScheduler {

    private final JobStore jobStore;
    private final ReportJobsProperties.Stale stale;
    private final Clock clock;

    public StaleJobScheduler(final JobStore jobStore, final ReportJobsProperties properties, final Clock clock) {
        this.jobStore = jobStore;
        this.stale = properties.stale();
        this.clock = clock;
        if (stale.processingTimeout().compareTo(properties.generation().timeout()) <= 0) {
            log.warn("app.reports.stale.processing-timeout ({}) should exceed app.reports.generation.timeout ({}); "
                             + "running jobs may be failed while still generating.", stale.processingTimeout(),
                     properties.generation().timeout());
        }
    }

    @Scheduled(cron = "${app.reports.stale.cron}")
    public void failStaleJobs() {
        final Instant now = clock.instant();
        final int pending = failStale(JobStatus.PENDING, now, stale.pendingTimeout(),
                                      "Job was not picked up for processing within %s.");
        final int processing = failStale(JobStatus.PROCESSING, now, stale.processingTimeout(),
                                         "Job made no progress for %s and was abandoned.");
        if (pending + processing > 0) {
            log.info("Finished stale job cleanup. Marked {} PENDING and {} PROCESSING jobs as FAILED.", pending,
                     processing);
        }
    }

    private int failStale(final JobStatus status, final Instant now, final Duration timeout, final String reason) {
        final Instant threshold = now.minus(timeout);
        final List<String> staleIds = jobStore.findStale(status, threshold);
        if (staleIds.isEmpty()) {
            log.debug("No stale {} jobs last updated before {}.", status, threshold);
            return 0;
        }

        log.warn("Found {} stale {} jobs to mark as FAILED.", staleIds.size(), status);
        int failed = 0;
        for (final String jobId : staleIds) {
            try {
                if (jobStore.update(jobId, JobTransition.fail(status, String.format(reason, timeout)))) {
                    failed++;
                }
            } catch (DataAccessException e) {
                log.error("[Job {}] Could not mark stale job as FAILED; will retry on the next run.", jobId, e);
            }
        }
        return failed;
    }
}
