package com.eyelevel.reportjobs.scheduler;

import com.eyelevel.reportjobs.model.JobStatus;
import com.eyelevel.reportjobs.service.store.JobStore;
import com.eyelevel.reportjobs.service.store.JobTransition;
import com.eyelevel.reportjobs.support.MutableClock;
import com.eyelevel.reportjobs.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StaleJobSchedulerTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    @Mock
    private JobStore jobStore;

    private StaleJobScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new StaleJobScheduler(jobStore, TestProperties.defaults(), new MutableClock(NOW));
    }

    @Test
    @DisplayName("Stale PENDING and PROCESSING jobs are failed with their own thresholds")
    void failsStaleJobs() {
        // given
        when(jobStore.findStale(JobStatus.PENDING, NOW.minus(Duration.ofMinutes(15)))).thenReturn(List.of("p-1"));
        when(jobStore.findStale(JobStatus.PROCESSING, NOW.minus(Duration.ofMinutes(30)))).thenReturn(List.of("r-1"));
        when(jobStore.update(any(), any())).thenReturn(true);

        // when
        scheduler.failStaleJobs();

        // then
        final ArgumentCaptor<JobTransition> pending = ArgumentCaptor.forClass(JobTransition.class);
        verify(jobStore).update(eq("p-1"), pending.capture());
        assertThat(pending.getValue().from()).containsExactly(JobStatus.PENDING);
        assertThat(pending.getValue().errorMessage()).contains("not picked up");

        final ArgumentCaptor<JobTransition> processing = ArgumentCaptor.forClass(JobTransition.class);
        verify(jobStore).update(eq("r-1"), processing.capture());
        assertThat(processing.getValue().from()).containsExactly(JobStatus.PROCESSING);
        assertThat(processing.getValue().to()).isEqualTo(JobStatus.FAILED);
    }

    @Test
    @DisplayName("Nothing is written when no job is stale")
    void nothingStale() {
        when(jobStore.findStale(any(), any())).thenReturn(List.of());

        scheduler.failStaleJobs();

        verify(jobStore, never()).update(any(), any());
    }

    @Test
    @DisplayName("A store error on one job does not stop the others")
    void continuesAfterStoreError() {
        when(jobStore.findStale(JobStatus.PENDING, NOW.minus(Duration.ofMinutes(15)))).thenReturn(List.of("a", "b"));
        when(jobStore.findStale(JobStatus.PROCESSING, NOW.minus(Duration.ofMinutes(30)))).thenReturn(List.of());
        when(jobStore.update(eq("a"), any())).thenThrow(new CannotAcquireLockException("locked"));
        when(jobStore.update(eq("b"), any())).thenReturn(true);

        assertThatCode(() -> scheduler.failStaleJobs()).doesNotThrowAnyException();
        verify(jobStore).update(eq("b"), any());
    }
}
