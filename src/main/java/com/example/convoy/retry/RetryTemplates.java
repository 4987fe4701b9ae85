package com.example.convoy.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.support.RetryTemplate;

/**
 * Factory for the retry template wrapped around upstream calls: classified
 * retries with exponential backoff and a cap on attempts.
 */
public final class RetryTemplates {

        private static final Logger LOGGER = LoggerFactory.getLogger(RetryTemplates.class);

        private RetryTemplates() {
        }

        public static RetryTemplate upstream(int maxAttempts, long initialIntervalMs, double multiplier,
                        long maxIntervalMs) {
                return upstream(maxAttempts, initialIntervalMs, multiplier, maxIntervalMs, new ThreadWaitSleeper());
        }

        public static RetryTemplate upstream(int maxAttempts, long initialIntervalMs, double multiplier,
                        long maxIntervalMs, Sleeper sleeper) {
                ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
                backOffPolicy.setInitialInterval(initialIntervalMs);
                backOffPolicy.setMultiplier(multiplier);
                backOffPolicy.setMaxInterval(maxIntervalMs);
                backOffPolicy.setSleeper(sleeper);

                RetryTemplate template = new RetryTemplate();
                template.setRetryPolicy(new UpstreamRetryPolicy(maxAttempts));
                template.setBackOffPolicy(backOffPolicy);
                template.registerListener(new LoggingRetryListener());
                return template;
        }

        private static class LoggingRetryListener implements RetryListener {

                @Override
                public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                Throwable throwable) {
                        if (ErrorClassifier.isRetryable(throwable)) {
                                LOGGER.warn("Retryable upstream error on attempt {}: {}", context.getRetryCount(),
                                                throwable.getMessage());
                        } else {
                                LOGGER.error("Non-retryable upstream error: {}", throwable.getMessage());
                        }
                }
        }
}
