package com.eyelevel.reportjobs.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Defines the lifecycle states of a {@link ReportJob}.
 */
public enum JobStatus {
    /**
     * The job has been admitted and handed off, but no worker has started it yet.
     */
    PENDING,
    /**
     * A worker has picked up the job and its generation tasks are running.
     */
    PROCESSING,
    /**
     * Every expected artifact was produced.
     */
    COMPLETED,
    /**
     * At least one artifact was produced, but not all of them.
     */
    PARTIAL,
    /**
     * No artifact was produced, or the job could not be handed off.
     */
    FAILED;

    public static final Set<JobStatus> ACTIVE = EnumSet.of(PENDING, PROCESSING);

    public boolean isTerminal() {
        return !ACTIVE.contains(this);
    }
}
