package com.eyelevel.reportjobs.config;

import io.awspring.cloud.sqs.config.SqsMessageListenerContainerFactory;
import io.awspring.cloud.sqs.listener.acknowledgement.handler.AcknowledgementMode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

import java.time.Duration;

@Configuration
@ConditionalOnProperty(name = "app.reports.dispatch.backend", havingValue = "sqs")
public class SqsListenerConfig {

    /**
     * Container factory for the report job queue. A message is acknowledged only after the orchestrator
     * run it triggered returns, so a crashed worker leaves the message to be redelivered.
     */
    @Bean("reportJobContainerFactory")
    public SqsMessageListenerContainerFactory<Object> reportJobContainerFactory(final SqsAsyncClient sqsAsyncClient,
                                                                               @Value("${app.sqs.listener.report-job-queue.concurrency-limit:4}")
                                                                               final int concurrency,
                                                                               @Value("${app.sqs.listener.report-job-queue.max-messages-per-poll:4}")
                                                                               final int maxMessagesPerPoll,
                                                                               @Value("${app.sqs.listener.report-job-queue.poll-timeout-seconds:20}")
                                                                               final int pollTimeoutSeconds) {

        final SqsMessageListenerContainerFactory<Object> factory = new SqsMessageListenerContainerFactory<>();
        factory.setSqsAsyncClient(sqsAsyncClient);
        factory.configure(options -> options.acknowledgementMode(AcknowledgementMode.ON_SUCCESS)
                                            .maxConcurrentMessages(concurrency).maxMessagesPerPoll(maxMessagesPerPoll)
                                            .pollTimeout(Duration.ofSeconds(pollTimeoutSeconds)));
        return factory;
    }
}
