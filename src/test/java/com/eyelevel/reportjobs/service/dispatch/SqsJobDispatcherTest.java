package com.eyelevel.reportjobs.service.dispatch;

import com.eyelevel.reportjobs.exception.JobDispatchException;
import com.eyelevel.reportjobs.support.TestProperties;
import io.awspring.cloud.sqs.operations.SqsSendOptions;
import io.awspring.cloud.sqs.operations.SqsTemplate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.RETURNS_SELF;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SqsJobDispatcherTest {

    @Mock
    private SqsTemplate sqsTemplate;

    @Test
    @DisplayName("Sends the job id to the configured queue")
    @SuppressWarnings({"unchecked", "rawtypes"})
    void sendsJobId() {
        final SqsJobDispatcher dispatcher = new SqsJobDispatcher(sqsTemplate, TestProperties.defaults());

        dispatcher.dispatch("job-1");

        final ArgumentCaptor<Consumer> captor = ArgumentCaptor.forClass(Consumer.class);
        verify(sqsTemplate).send(captor.capture());
        final SqsSendOptions<Object> options = mock(SqsSendOptions.class, RETURNS_SELF);
        captor.getValue().accept(options);
        verify(options).queue("report-jobs-queue");
        verify(options).payload(Map.of("job_id", "job-1"));
    }

    @Test
    @DisplayName("A send failure becomes a dispatch failure for the job")
    @SuppressWarnings({"unchecked", "rawtypes"})
    void sendFails() {
        when(sqsTemplate.send(any(Consumer.class))).thenThrow(new IllegalStateException("queue does not exist"));
        final SqsJobDispatcher dispatcher = new SqsJobDispatcher(sqsTemplate, TestProperties.defaults());

        assertThatThrownBy(() -> dispatcher.dispatch("job-1"))
                .isInstanceOf(JobDispatchException.class)
                .hasMessageContaining("queue does not exist");
    }
}
