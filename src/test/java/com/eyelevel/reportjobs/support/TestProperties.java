package com.eyelevel.reportjobs.support;

import com.eyelevel.reportjobs.config.ReportJobsProperties;
import com.eyelevel.reportjobs.model.ArtifactType;

import java.time.Duration;
import java.util.List;

public final class TestProperties {

    public static final String BUCKET = "test-report-bucket";

    private TestProperties() {
    }

    public static ReportJobsProperties defaults() {
        return withTimeout(Duration.ofSeconds(30));
    }

    public static ReportJobsProperties withTimeout(final Duration generationTimeout) {
        return build(generationTimeout, "report_job", 4, 10, 6, 20);
    }

    public static ReportJobsProperties withPools(final int dispatchThreads, final int dispatchQueue,
                                                 final int generationThreads, final int generationQueue) {
        return build(Duration.ofSeconds(30), "report_job", dispatchThreads, dispatchQueue, generationThreads,
                     generationQueue);
    }

    public static ReportJobsProperties withTableName(final String tableName) {
        return build(Duration.ofSeconds(30), tableName, 4, 10, 6, 20);
    }

    private static ReportJobsProperties build(final Duration generationTimeout, final String tableName,
                                              final int dispatchThreads, final int dispatchQueue,
                                              final int generationThreads, final int generationQueue) {
        return new ReportJobsProperties(
                List.of(ArtifactType.EXECUTIVE, ArtifactType.TECHNICAL, ArtifactType.COMPLIANCE),
                ArtifactType.EXECUTIVE,
                "~3 minutes",
                new ReportJobsProperties.Store(tableName, Duration.ofDays(7)),
                new ReportJobsProperties.Storage(BUCKET, "reports/", "AES256", null),
                new ReportJobsProperties.Access(Duration.ofSeconds(900)),
                new ReportJobsProperties.Dispatch(ReportJobsProperties.DispatchBackend.LOCAL, "report-jobs-queue",
                                                  dispatchThreads, dispatchQueue),
                new ReportJobsProperties.Generation(generationTimeout, generationThreads, generationQueue),
                new ReportJobsProperties.Stale(Duration.ofMinutes(15), Duration.ofMinutes(30)));
    }
}
