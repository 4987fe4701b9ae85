package com.example.convoy.exceptions;

public class ForbiddenException extends UpstreamApiException {

        public ForbiddenException(String message) {
                super(403, message);
        }
}
