package com.example.convoy.retry;

import java.util.Set;

import com.example.convoy.exceptions.UpstreamApiException;

/**
 * Decides whether a failure from an upstream client is worth retrying.
 * Server errors, conflicts, failed preconditions and rate limiting are
 * transient; everything else, including exceptions outside the upstream
 * family, propagates immediately.
 */
public final class ErrorClassifier {

        private static final Set<Integer> RETRYABLE_CLIENT_STATUSES = Set.of(409, 412, 429);

        private ErrorClassifier() {
        }

        public static boolean isRetryable(Throwable error) {
                if (!(error instanceof UpstreamApiException)) {
                        return false;
                }
                int status = ((UpstreamApiException) error).getStatusCode();
                return status >= 500 || RETRYABLE_CLIENT_STATUSES.contains(status);
        }
}
