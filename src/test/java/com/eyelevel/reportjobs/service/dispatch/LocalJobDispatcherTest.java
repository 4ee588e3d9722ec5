package com.eyelevel.reportjobs.service.dispatch;

import com.eyelevel.reportjobs.exception.JobDispatchException;
import com.eyelevel.reportjobs.service.orchestration.ReportOrchestrator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.core.task.support.TaskExecutorAdapter;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class LocalJobDispatcherTest {

    @Mock
    private ReportOrchestrator orchestrator;

    @Test
    @DisplayName("Hands the job to the orchestrator on the dispatch pool")
    void dispatches() {
        final LocalJobDispatcher dispatcher = new LocalJobDispatcher(orchestrator,
                                                                     new TaskExecutorAdapter(new SyncTaskExecutor()));

        dispatcher.dispatch("job-1");

        verify(orchestrator).run("job-1");
    }

    @Test
    @DisplayName("An orchestration error stays on the worker thread")
    void orchestrationErrorIsContained() {
        doThrow(new IllegalStateException("boom")).when(orchestrator).run("job-1");
        final LocalJobDispatcher dispatcher = new LocalJobDispatcher(orchestrator,
                                                                     new TaskExecutorAdapter(new SyncTaskExecutor()));

        assertThatCode(() -> dispatcher.dispatch("job-1")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("A full pool is reported as a dispatch failure")
    void rejected() {
        final LocalJobDispatcher dispatcher = new LocalJobDispatcher(orchestrator, new TaskExecutorAdapter(task -> {
            throw new TaskRejectedException("queue full");
        }));

        assertThatThrownBy(() -> dispatcher.dispatch("job-1"))
                .isInstanceOf(JobDispatchException.class)
                .hasMessageContaining("Dispatch queue is full");
        verify(orchestrator, never()).run("job-1");
    }
}
