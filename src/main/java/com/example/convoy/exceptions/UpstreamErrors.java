package com.example.convoy.exceptions;

import java.util.function.Supplier;

import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Runs a REST call and translates Spring client errors into the upstream
 * exception family.
 */
public final class UpstreamErrors {

        private UpstreamErrors() {
        }

        public static <T> T call(String description, Supplier<T> call) {
                try {
                        return call.get();
                } catch (RestClientResponseException e) {
                        throw UpstreamApiException.of(e.getStatusCode().value(),
                                        description + " failed: " + e.getStatusText());
                } catch (ResourceAccessException e) {
                        throw new RequestFailedException(RequestFailedException.TRANSPORT_FAILURE_STATUS,
                                        description + " failed: " + e.getMessage(), e);
                }
        }
}
