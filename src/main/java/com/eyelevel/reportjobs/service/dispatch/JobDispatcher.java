package com.eyelevel.reportjobs.service.dispatch;

import com.eyelevel.reportjobs.exception.JobDispatchException;

/**
 * Hands a recorded job off for asynchronous orchestration. Returning normally means the hand-off was accepted,
 * not that the job has started.
 */
public interface JobDispatcher {

    /**
     * @throws JobDispatchException if the hand-off was not accepted.
     */
    void dispatch(String jobId);
}
