package com.eyelevel.reportjobs.service.store;

import com.eyelevel.reportjobs.exception.JobAlreadyExistsException;
import com.eyelevel.reportjobs.exception.JobNotFoundException;
import com.eyelevel.reportjobs.model.JobStatus;
import com.eyelevel.reportjobs.model.ReportJob;

import java.time.Instant;
import java.util.List;

/**
 * Durable, keyed storage of job records. Every write after creation is conditional on the job's current
 * status, which is the only coordination between the ingress side and the worker side.
 */
public interface JobStore {

    /**
     * Records a new job.
     *
     * @throws JobAlreadyExistsException if a job with the same id exists.
     */
    void create(ReportJob job);

    /**
     * @throws JobNotFoundException if no job has this id.
     */
    JobSnapshot get(String jobId);

    /**
     * Applies a transition atomically, together with any artifacts it carries.
     *
     * @return {@code true} if the transition was applied, {@code false} if the job's status was not one of the
     * transition's source statuses.
     * @throws JobNotFoundException     if no job has this id.
     * @throws IllegalArgumentException if the artifacts do not match the target status for this job's
     *                                  expected types.
     */
    boolean update(String jobId, JobTransition transition);

    /**
     * Ids of jobs in {@code status} whose last write is older than {@code before}.
     */
    List<String> findStale(JobStatus status, Instant before);

    /**
     * Deletes every job, with its artifacts, whose retention horizon has passed.
     *
     * @return the number of jobs deleted.
     */
    int purgeExpired(Instant now);
}
