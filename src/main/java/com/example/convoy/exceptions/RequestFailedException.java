package com.example.convoy.exceptions;

/**
 * Any upstream failure without a dedicated subclass, including transport
 * failures which are reported with status 503.
 */
public class RequestFailedException extends UpstreamApiException {

        public static final int TRANSPORT_FAILURE_STATUS = 503;

        public RequestFailedException(int statusCode, String message) {
                super(statusCode, message);
        }

        public RequestFailedException(int statusCode, String message, Throwable cause) {
                super(statusCode, message, cause);
        }
}
