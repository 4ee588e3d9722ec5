package com.eyelevel.reportjobs.service.store;

import com.eyelevel.reportjobs.model.ArtifactType;
import com.eyelevel.reportjobs.model.JobStatus;
import com.eyelevel.reportjobs.model.ReportArtifact;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobTransitionTest {

    private static ReportArtifact artifact(final ArtifactType type) {
        return new ReportArtifact(type, "bucket", "reports/acme/job/" + type.wireName() + "_report.pdf", Map.of());
    }

    @Test
    @DisplayName("start claims a PENDING job and carries nothing")
    void startTransition() {
        final JobTransition start = JobTransition.start();

        assertThat(start.from()).containsExactly(JobStatus.PENDING);
        assertThat(start.to()).isEqualTo(JobStatus.PROCESSING);
        assertThat(start.artifacts()).isEmpty();
        assertThat(start.errorMessage()).isNull();
        assertThat(start.isTerminal()).isFalse();
    }

    @Test
    @DisplayName("A terminal source status is rejected")
    void rejectsTerminalSource() {
        assertThatThrownBy(() -> new JobTransition(EnumSet.of(JobStatus.COMPLETED), JobStatus.FAILED, List.of(),
                                                   "late failure"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("read-only");
    }

    @Test
    @DisplayName("FAILED requires a message and no artifacts")
    void failedInvariants() {
        assertThatThrownBy(() -> JobTransition.fail(JobStatus.PROCESSING, " "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobTransition(EnumSet.of(JobStatus.PROCESSING), JobStatus.FAILED,
                                                   List.of(artifact(ArtifactType.EXECUTIVE)), "boom"))
                .isInstanceOf(IllegalArgumentException.class);

        final JobTransition fail = JobTransition.fail(JobStatus.PENDING, "dispatch failed");
        assertThat(fail.isTerminal()).isTrue();
        assertThat(fail.errorMessage()).isEqualTo("dispatch failed");
    }

    @Test
    @DisplayName("COMPLETED and PARTIAL require at least one artifact and no error")
    void successInvariants() {
        assertThatThrownBy(() -> JobTransition.finish(JobStatus.COMPLETED, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobTransition(EnumSet.of(JobStatus.PROCESSING), JobStatus.PARTIAL,
                                                   List.of(artifact(ArtifactType.EXECUTIVE)), "oops"))
                .isInstanceOf(IllegalArgumentException.class);

        final JobTransition partial = JobTransition.finish(JobStatus.PARTIAL, List.of(artifact(ArtifactType.TECHNICAL)));
        assertThat(partial.artifacts()).hasSize(1);
    }

    @Test
    @DisplayName("Two artifacts of one type are rejected")
    void rejectsDuplicateTypes() {
        assertThatThrownBy(() -> JobTransition.finish(JobStatus.COMPLETED, List.of(artifact(ArtifactType.EXECUTIVE),
                                                                                   artifact(ArtifactType.EXECUTIVE))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    @DisplayName("Target status must differ from every source status")
    void rejectsSelfTransition() {
        assertThatThrownBy(() -> new JobTransition(EnumSet.of(JobStatus.PENDING, JobStatus.PROCESSING),
                                                   JobStatus.PROCESSING, List.of(), null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
