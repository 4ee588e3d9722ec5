package com.eyelevel.reportjobs.service.generation.render;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component("htmlToPdfRetryListener")
public class HtmlToPdfRetryListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(final RetryContext context, final RetryCallback<T, E> callback,
                                                 final Throwable throwable) {
        log.warn("PDF rendering failed on attempt {}: {}", context.getRetryCount(), throwable.getMessage());
    }
}
