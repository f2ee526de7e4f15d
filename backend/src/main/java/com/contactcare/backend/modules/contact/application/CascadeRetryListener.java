package com.contactcare.backend.modules.contact.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Component(CascadeRetryListener.BEAN_NAME)
public class CascadeRetryListener implements RetryListener {

    public static final String BEAN_NAME = "cascadeRetryListener";

    private static final Logger log = LoggerFactory.getLogger(CascadeRetryListener.class);

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
        if (throwable instanceof ScheduleLockUnavailableException lockFailure) {
            log.warn("[Cascade][{}] attempt={} schedule={} locked elsewhere",
                    lockFailure.getOperation(),
                    context.getRetryCount(),
                    lockFailure.getContactScheduleId());
        }
    }
}
