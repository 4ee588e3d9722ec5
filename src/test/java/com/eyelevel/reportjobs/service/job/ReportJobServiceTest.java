package com.eyelevel.reportjobs.service.job;

import com.eyelevel.reportjobs.common.json.jackson.JacksonJsonSerializer;
import com.eyelevel.reportjobs.dto.status.ArtifactView;
import com.eyelevel.reportjobs.dto.status.JobStatusResponse;
import com.eyelevel.reportjobs.dto.submit.JobSubmissionResponse;
import com.eyelevel.reportjobs.exception.ArtifactAccessException;
import com.eyelevel.reportjobs.exception.InvalidJobInputException;
import com.eyelevel.reportjobs.exception.JobAdmissionException;
import com.eyelevel.reportjobs.exception.JobDispatchException;
import com.eyelevel.reportjobs.exception.JobNotFoundException;
import com.eyelevel.reportjobs.exception.JobStatusException;
import com.eyelevel.reportjobs.model.ArtifactType;
import com.eyelevel.reportjobs.model.JobStatus;
import com.eyelevel.reportjobs.model.ReportArtifact;
import com.eyelevel.reportjobs.model.ReportJob;
import com.eyelevel.reportjobs.service.access.AccessHandle;
import com.eyelevel.reportjobs.service.access.ArtifactAccessService;
import com.eyelevel.reportjobs.service.dispatch.JobDispatcher;
import com.eyelevel.reportjobs.service.store.JobSnapshot;
import com.eyelevel.reportjobs.service.store.JobStore;
import com.eyelevel.reportjobs.service.store.JobTransition;
import com.eyelevel.reportjobs.support.TestProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReportJobServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-01T10:00:00Z");
    private static final String JOB_ID = "0c7d2a4e-1b3f-4e5a-8c6d-7e8f9a0b1c2d";
    private static final String FOLDER = "reports/acme/" + JOB_ID + "/";

    @Mock
    private JobStore jobStore;

    @Mock
    private JobDispatcher jobDispatcher;

    @Mock
    private ArtifactAccessService artifactAccessService;

    private ReportJobService reportJobService;

    @BeforeEach
    void setUp() {
        reportJobService = new ReportJobService(jobStore, jobDispatcher, artifactAccessService,
                                                new JacksonJsonSerializer(new ObjectMapper()),
                                                TestProperties.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ObjectNode assessment() {
        final ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.putObject("responses").put("company-name", "Acme");
        return payload;
    }

    private static ReportArtifact artifact(final ArtifactType type) {
        final ReportArtifact artifact = new ReportArtifact(type, TestProperties.BUCKET,
                                                           FOLDER + type.wireName() + "_report_20250601_100500.pdf",
                                                           Map.of("company_name", "Acme"));
        artifact.setJobId(JOB_ID);
        return artifact;
    }

    private static JobSnapshot snapshot(final JobStatus status, final String error, final ArtifactType... produced) {
        return new JobSnapshot(JOB_ID, status, NOW, NOW.plusSeconds(30), "{}",
                               List.of(ArtifactType.EXECUTIVE, ArtifactType.TECHNICAL, ArtifactType.COMPLIANCE),
                               error, Arrays.stream(produced).map(ReportJobServiceTest::artifact).toList());
    }

    private void givenHandlesAreIssued() {
        when(artifactAccessService.issue(eq(TestProperties.BUCKET), anyString(), eq(Duration.ofSeconds(900))))
                .thenAnswer(inv -> new AccessHandle("https://signed.example/" + inv.getArgument(1), 900,
                                                    NOW.plusSeconds(900)));
    }

    @Nested
    @DisplayName("submit")
    class Submit {

        @Test
        @DisplayName("Records a PENDING job, dispatches it and returns the poll URL")
        void admitsAndDispatches() {
            // when
            final JobSubmissionResponse response = reportJobService.submit(assessment());

            // then
            final ArgumentCaptor<ReportJob> captor = ArgumentCaptor.forClass(ReportJob.class);
            verify(jobStore).create(captor.capture());
            final ReportJob job = captor.getValue();
            assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
            assertThat(job.getInput()).isEqualTo("{\"responses\":{\"company-name\":\"Acme\"}}");
            assertThat(job.expectedArtifactTypes()).containsExactly(ArtifactType.EXECUTIVE, ArtifactType.TECHNICAL,
                                                                    ArtifactType.COMPLIANCE);
            assertThat(job.getCreatedAt()).isEqualTo(NOW);
            assertThat(job.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofDays(7)));
            verify(jobDispatcher).dispatch(job.getId());

            assertThat(response.jobId()).isEqualTo(job.getId());
            assertThat(response.status()).isEqualTo(JobStatus.PENDING);
            assertThat(response.estimatedCompletion()).isEqualTo("~3 minutes");
            assertThat(response.checkStatusUrl()).isEqualTo("/?job_id=" + job.getId());
        }

        @Test
        @DisplayName("Rejects a payload that is not a JSON object")
        void rejectsNonObject() {
            assertThatThrownBy(() -> reportJobService.submit(JsonNodeFactory.instance.arrayNode()))
                    .isInstanceOf(InvalidJobInputException.class);
            verify(jobStore, never()).create(any());
            verify(jobDispatcher, never()).dispatch(anyString());
        }

        @Test
        @DisplayName("A failed store write is an admission error and nothing is dispatched")
        void storeWriteFails() {
            doThrow(new DataAccessResourceFailureException("database unavailable")).when(jobStore).create(any());

            assertThatThrownBy(() -> reportJobService.submit(assessment()))
                    .isInstanceOf(JobAdmissionException.class)
                    .hasMessageContaining("database unavailable");
            verify(jobDispatcher, never()).dispatch(anyString());
        }

        @Test
        @DisplayName("A failed dispatch marks the job FAILED before the error is returned")
        void dispatchFails() {
            // given
            doThrow(new IllegalStateException("queue unreachable")).when(jobDispatcher).dispatch(anyString());

            // when / then
            assertThatThrownBy(() -> reportJobService.submit(assessment()))
                    .isInstanceOf(JobDispatchException.class)
                    .hasMessageContaining("queue unreachable");

            final ArgumentCaptor<JobTransition> captor = ArgumentCaptor.forClass(JobTransition.class);
            verify(jobStore).update(anyString(), captor.capture());
            assertThat(captor.getValue().from()).containsExactly(JobStatus.PENDING);
            assertThat(captor.getValue().to()).isEqualTo(JobStatus.FAILED);
            assertThat(captor.getValue().errorMessage()).contains("queue unreachable");
        }
    }

    @Nested
    @DisplayName("status")
    class Status {

        @Test
        @DisplayName("A PENDING job reports progress and nothing else")
        void pending() {
            when(jobStore.get(JOB_ID)).thenReturn(snapshot(JobStatus.PENDING, null));

            final JobStatusResponse response = reportJobService.status(JOB_ID);

            assertThat(response.status()).isEqualTo(JobStatus.PENDING);
            assertThat(response.message()).isEqualTo("Job is queued and will start shortly.");
            assertThat(response.artifacts()).isNull();
            assertThat(response.errorMessage()).isNull();
        }

        @Test
        @DisplayName("A FAILED job reports its error message")
        void failed() {
            when(jobStore.get(JOB_ID)).thenReturn(snapshot(JobStatus.FAILED, "All report generation tasks failed"));

            final JobStatusResponse response = reportJobService.status(JOB_ID);

            assertThat(response.errorMessage()).isEqualTo("All report generation tasks failed");
            assertThat(response.artifacts()).isNull();
        }

        @Test
        @DisplayName("A COMPLETED job lists every artifact with a fresh access handle")
        void completed() {
            // given
            when(jobStore.get(JOB_ID)).thenReturn(snapshot(JobStatus.COMPLETED, null, ArtifactType.EXECUTIVE,
                                                           ArtifactType.TECHNICAL, ArtifactType.COMPLIANCE));
            givenHandlesAreIssued();

            // when
            final JobStatusResponse response = reportJobService.status(JOB_ID);

            // then
            assertThat(response.message()).isEqualTo("All 3 reports generated successfully.");
            assertThat(response.artifactCount()).isEqualTo(3);
            assertThat(response.missingTypes()).isNull();
            assertThat(response.artifacts()).allSatisfy(view -> {
                assertThat(view.accessHandle()).isEqualTo("https://signed.example/" + view.storageKey());
                assertThat(view.expiresIn()).isEqualTo(900);
            });
            assertThat(response.primaryArtifact().type()).isEqualTo(ArtifactType.EXECUTIVE);
            assertThat(response.folder().prefix()).isEqualTo(FOLDER);
            assertThat(response.folder().container()).isEqualTo(TestProperties.BUCKET);
            assertThat(response.folder().description()).contains("Acme");
        }

        @Test
        @DisplayName("A PARTIAL job names the missing types")
        void partial() {
            when(jobStore.get(JOB_ID)).thenReturn(snapshot(JobStatus.PARTIAL, null, ArtifactType.EXECUTIVE,
                                                           ArtifactType.COMPLIANCE));
            givenHandlesAreIssued();

            final JobStatusResponse response = reportJobService.status(JOB_ID);

            assertThat(response.missingTypes()).containsExactly(ArtifactType.TECHNICAL);
            assertThat(response.message()).isEqualTo("2 of 3 reports generated; missing technical.");
            assertThat(response.artifacts()).extracting(ArtifactView::type)
                                            .containsExactly(ArtifactType.EXECUTIVE, ArtifactType.COMPLIANCE);
        }

        @Test
        @DisplayName("A handle that cannot be issued fails the whole read")
        void handleIssuanceFails() {
            when(jobStore.get(JOB_ID)).thenReturn(snapshot(JobStatus.COMPLETED, null, ArtifactType.EXECUTIVE,
                                                           ArtifactType.TECHNICAL, ArtifactType.COMPLIANCE));
            when(artifactAccessService.issue(anyString(), anyString(), any()))
                    .thenThrow(new ArtifactAccessException("k", new IllegalStateException("no credentials")));

            assertThatThrownBy(() -> reportJobService.status(JOB_ID)).isInstanceOf(JobStatusException.class);
        }

        @Test
        @DisplayName("An unknown job id propagates as JobNotFoundException")
        void unknown() {
            when(jobStore.get(JOB_ID)).thenThrow(new JobNotFoundException(JOB_ID));

            assertThatThrownBy(() -> reportJobService.status(JOB_ID)).isInstanceOf(JobNotFoundException.class);
        }

        @Test
        @DisplayName("A store read failure is reported as a status error")
        void storeReadFails() {
            when(jobStore.get(JOB_ID)).thenThrow(new DataAccessResourceFailureException("timeout"));

            assertThatThrownBy(() -> reportJobService.status(JOB_ID))
                    .isInstanceOf(JobStatusException.class)
                    .hasMessage("Failed to check job status: timeout");
        }
    }
}
