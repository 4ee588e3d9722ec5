package com.eyelevel.reportjobs.service.dispatch;

import com.eyelevel.reportjobs.config.ReportJobsProperties;
import com.eyelevel.reportjobs.exception.JobDispatchException;
import io.awspring.cloud.sqs.operations.SqsTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Publishes the job id to an SQS queue consumed by {@link com.eyelevel.reportjobs.consumer.ReportJobConsumer}.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.reports.dispatch.backend", havingValue = "sqs")
public class SqsJobDispatcher implements JobDispatcher {

    private static final String JOB_ID_FIELD = "job_id";

    private final SqsTemplate sqsTemplate;
    private final String queueName;

    public SqsJobDispatcher(final SqsTemplate sqsTemplate, final ReportJobsProperties properties) {
        this.sqsTemplate = sqsTemplate;
        this.queueName = properties.dispatch().queueName();
        log.info("Jobs will be dispatched to SQS queue '{}'.", queueName);
    }

    @Override
    public void dispatch(final String jobId) {
        try {
            sqsTemplate.send(to -> to.queue(queueName).payload(Map.of(JOB_ID_FIELD, jobId)));
        } catch (RuntimeException e) {
            throw new JobDispatchException(jobId, "Failed to queue job for processing: " + e.getMessage(), e);
        }
        log.info("[Job {}] Sent to queue '{}'.", jobId, queueName);
    }
}
