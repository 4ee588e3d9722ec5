package com.eyelevel.reportjobs.service.orchestration;

import com.eyelevel.reportjobs.exception.JobFinalizationException;
import com.eyelevel.reportjobs.service.store.JobStore;
import com.eyelevel.reportjobs.service.store.JobTransition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Performs the single terminal write of a job run. Store failures are retried with exponential backoff;
 * the artifacts of a run are already in blob storage at this point and are only reachable through this write.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobFinalizer {

    private final JobStore jobStore;

    /**
     * @return {@code true} if the job took the terminal status, {@code false} if it had already left PROCESSING.
     * @throws JobFinalizationException if the store kept failing after every retry.
     */
    @Retryable(retryFor = {DataAccessException.class, TransactionException.class},
               maxAttemptsExpression = "#{${app.reports.finalization.retry.attempts:4} + 1}",
               backoff = @Backoff(delayExpression = "#{${app.reports.finalization.retry.delay-ms:200}}",
                                  multiplierExpression = "#{${app.reports.finalization.retry.multiplier:2.0}}"),
               listeners = {"jobFinalizationRetryListener"})
    public boolean finalizeJob(final String jobId, final JobTransition transition) {
        log.debug("[Job {}] Writing terminal status {}.", jobId, transition.to());
        return jobStore.update(jobId, transition);
    }

    @Recover
    public boolean recover(final RuntimeException e, final String jobId, final JobTransition transition) {
        if (e instanceof DataAccessException || e instanceof TransactionException) {
            log.error("[Job {}] Terminal status {} could not be written after all retry attempts.", jobId,
                      transition.to(), e);
            throw new JobFinalizationException("Failed to record terminal status " + transition.to() + " for job "
                                                       + jobId, e);
        }
        throw e;
    }
}
