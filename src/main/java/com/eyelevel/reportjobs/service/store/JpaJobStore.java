package com.eyelevel.reportjobs.service.store;

import com.eyelevel.reportjobs.exception.JobAlreadyExistsException;
import com.eyelevel.reportjobs.exception.JobNotFoundException;
import com.eyelevel.reportjobs.model.ArtifactType;
import com.eyelevel.reportjobs.model.JobStatus;
import com.eyelevel.reportjobs.model.ReportArtifact;
import com.eyelevel.reportjobs.model.ReportJob;
import com.eyelevel.reportjobs.repository.ReportArtifactRepository;
import com.eyelevel.reportjobs.repository.ReportJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link JobStore} backed by a relational database through Spring Data JPA.
 * <p>
 * Transitions are a single guarded {@code UPDATE ... WHERE status IN (...)}; artifacts are inserted in the
 * same transaction, so a reader that sees a terminal status always sees its complete artifact list.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaJobStore implements JobStore {

    private final ReportJobRepository jobRepository;
    private final ReportArtifactRepository artifactRepository;
    private final Clock clock;

    @Override
    @Transactional
    public void create(final ReportJob job) {
        if (jobRepository.existsById(job.getId())) {
            throw new JobAlreadyExistsException(job.getId());
        }
        try {
            jobRepository.saveAndFlush(job);
        } catch (DataIntegrityViolationException e) {
            throw new JobAlreadyExistsException(job.getId());
        }
        log.debug("[Job {}] Record created with status {}.", job.getId(), job.getStatus());
    }

    @Override
    @Transactional(readOnly = true)
    public JobSnapshot get(final String jobId) {
        // Job first, artifacts second: artifacts are committed no later than the terminal status.
        final ReportJob job = jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        final List<ReportArtifact> artifacts = job.getStatus().isTerminal()
                ? artifactRepository.findAllByJobId(jobId)
                : List.of();
        return JobSnapshot.of(job, artifacts);
    }

    @Override
    @Transactional
    public boolean update(final String jobId, final JobTransition transition) {
        final ReportJob job = jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        verifyCompleteness(job, transition);

        final Instant now = clock.instant();
        final int updated = jobRepository.transition(jobId, transition.from(), transition.to(),
                                                     transition.errorMessage(), now);
        if (updated == 0) {
            log.warn("[Job {}] Transition {} -> {} rejected; current status is {}.", jobId, transition.from(),
                     transition.to(), job.getStatus());
            return false;
        }

        if (!transition.artifacts().isEmpty()) {
            // Fresh rows every time, so a retried transition never reuses entities from a rolled-back attempt.
            final List<ReportArtifact> rows = transition.artifacts().stream().map(artifact -> {
                final ReportArtifact row = new ReportArtifact(artifact.getArtifactType(), artifact.getContainer(),
                                                              artifact.getStorageKey(), artifact.getMetadata());
                row.setJobId(jobId);
                row.setCreatedAt(now);
                return row;
            }).toList();
            artifactRepository.saveAll(rows);
        }
        log.info("[Job {}] Status changed to {} with {} artifact(s).", jobId, transition.to(),
                 transition.artifacts().size());
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> findStale(final JobStatus status, final Instant before) {
        return jobRepository.findIdsByStatusAndUpdatedAtBefore(status, before);
    }

    @Override
    @Transactional
    public int purgeExpired(final Instant now) {
        final List<String> expired = jobRepository.findExpiredIds(now);
        if (expired.isEmpty()) {
            return 0;
        }
        artifactRepository.deleteAllByJobIdIn(expired);
        return jobRepository.deleteAllByIdIn(expired);
    }

    private void verifyCompleteness(final ReportJob job, final JobTransition transition) {
        if (transition.to() != JobStatus.COMPLETED && transition.to() != JobStatus.PARTIAL) {
            return;
        }
        final List<ArtifactType> expected = job.expectedArtifactTypes();
        final Set<ArtifactType> produced = transition.artifacts().stream()
                                                     .map(ReportArtifact::getArtifactType)
                                                     .collect(Collectors.toCollection(() -> EnumSet.noneOf(ArtifactType.class)));
        if (!expected.containsAll(produced)) {
            throw new IllegalArgumentException("Job " + job.getId() + " does not expect artifact types " + produced);
        }
        final boolean complete = produced.containsAll(expected);
        if (complete != (transition.to() == JobStatus.COMPLETED)) {
            throw new IllegalArgumentException("Status " + transition.to() + " does not match artifacts " + produced
                                                       + " for expected types " + expected);
        }
    }
}
