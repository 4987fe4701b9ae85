package com.example.convoy.exceptions;

/**
 * Base of the exception family raised by upstream API clients (the resource
 * API and the CouchDB document store). Carries the HTTP status code the
 * retry classification is based on.
 */
public class UpstreamApiException extends RuntimeException {

        private final int statusCode;

        public UpstreamApiException(int statusCode, String message) {
                super(message);
                this.statusCode = statusCode;
        }

        public UpstreamApiException(int statusCode, String message, Throwable cause) {
                super(message, cause);
                this.statusCode = statusCode;
        }

        public int getStatusCode() {
                return statusCode;
        }

        /**
         * Picks the most specific subclass for the given status.
         */
        public static UpstreamApiException of(int statusCode, String message) {
                switch (statusCode) {
                        case 403:
                                return new ForbiddenException(message);
                        case 404:
                                return new ResourceNotFoundException(message);
                        case 409:
                                return new ConflictException(message);
                        case 412:
                                return new PreconditionFailedException(message);
                        case 422:
                                return new UnprocessableEntityException(message);
                        default:
                                return new RequestFailedException(statusCode, message);
                }
        }
}
