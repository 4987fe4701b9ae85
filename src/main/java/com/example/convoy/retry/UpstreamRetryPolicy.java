package com.example.convoy.retry;

import org.springframework.retry.RetryContext;
import org.springframework.retry.policy.SimpleRetryPolicy;

/**
 * Attempt-capped retry policy driven by {@link ErrorClassifier} rather than
 * by exception types.
 */
public class UpstreamRetryPolicy extends SimpleRetryPolicy {

        public UpstreamRetryPolicy(int maxAttempts) {
                super(maxAttempts);
        }

        @Override
        public boolean canRetry(RetryContext context) {
                Throwable lastError = context.getLastThrowable();
                if (lastError != null && !ErrorClassifier.isRetryable(lastError)) {
                        return false;
                }
                return context.getRetryCount() < getMaxAttempts();
        }
}
