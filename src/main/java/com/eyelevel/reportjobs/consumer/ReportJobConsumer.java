package com.eyelevel.reportjobs.consumer;

import com.eyelevel.reportjobs.exception.MessageProcessingFailedException;
import com.eyelevel.reportjobs.service.orchestration.ReportOrchestrator;
import io.awspring.cloud.sqs.annotation.SqsListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Consumes report job triggers from SQS and runs the orchestrator for each.
 * <p>
 * Redelivered messages are harmless: the orchestrator only proceeds if it can claim the job from PENDING.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.reports.dispatch.backend", havingValue = "sqs")
public class ReportJobConsumer {

    private final ReportOrchestrator orchestrator;

    @SqsListener(value = "${app.reports.dispatch.queue-name}", factory = "reportJobContainerFactory")
    public void processJobMessage(@Payload final Map<String, Object> message) {
        log.debug("Received new message on report job queue: {}", message);

        final Object idObject = message.get("job_id");
        if (!(idObject instanceof String jobId) || jobId.isBlank()) {
            log.error("[FATAL] SQS message is invalid or missing 'job_id'. Message will be dropped. Payload: {}",
                      message);
            return;
        }

        try {
            orchestrator.run(jobId);
        } catch (final Exception e) {
            log.error("[Job {}] Orchestration failed. Re-throwing to trigger SQS redelivery.", jobId, e);
            throw new MessageProcessingFailedException("Orchestration failed for job " + jobId, e);
        }
    }
}
