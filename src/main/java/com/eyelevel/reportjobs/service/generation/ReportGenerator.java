package com.eyelevel.reportjobs.service.generation;

import com.eyelevel.reportjobs.exception.ReportGenerationException;
import com.eyelevel.reportjobs.model.ArtifactType;

/**
 * Produces one kind of report. Implementations must be safe to call concurrently for different jobs.
 */
public interface ReportGenerator {

    ArtifactType type();

    /**
     * Renders the report for one job.
     *
     * @param jobId   Used for logging only.
     * @param profile The facts derived from the job's assessment.
     * @throws ReportGenerationException if the report cannot be produced.
     */
    GeneratedReport generate(String jobId, AssessmentProfile profile);
}
