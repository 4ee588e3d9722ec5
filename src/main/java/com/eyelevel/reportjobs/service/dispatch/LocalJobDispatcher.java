package com.eyelevel.reportjobs.service.dispatch;

import com.eyelevel.reportjobs.exception.JobDispatchException;
import com.eyelevel.reportjobs.service.orchestration.ReportOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Runs the orchestrator on an in-process thread pool. Jobs dispatched this way are lost if the process stops
 * before they finish; the stale job sweeper then fails them.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.reports.dispatch.backend", havingValue = "local", matchIfMissing = true)
public class LocalJobDispatcher implements JobDispatcher {

    private final ReportOrchestrator orchestrator;
    private final AsyncTaskExecutor dispatchExecutor;

    public LocalJobDispatcher(final ReportOrchestrator orchestrator,
                              @Qualifier("reportDispatchExecutor") final AsyncTaskExecutor dispatchExecutor) {
        this.orchestrator = orchestrator;
        this.dispatchExecutor = dispatchExecutor;
        log.info("Jobs will be orchestrated in-process.");
    }

    @Override
    public void dispatch(final String jobId) {
        try {
            dispatchExecutor.execute(() -> runSafely(jobId));
        } catch (TaskRejectedException e) {
            throw new JobDispatchException(jobId, "Dispatch queue is full; job could not be scheduled.", e);
        }
        log.info("[Job {}] Dispatched to the local worker pool.", jobId);
    }

    private void runSafely(final String jobId) {
        try {
            orchestrator.run(jobId);
        } catch (RuntimeException e) {
            log.error("[Job {}] Orchestration aborted. The job will be failed by the stale job sweeper.", jobId, e);
        }
    }
}
