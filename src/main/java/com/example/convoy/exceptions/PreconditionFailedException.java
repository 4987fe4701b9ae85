package com.example.convoy.exceptions;

public class PreconditionFailedException extends UpstreamApiException {

        public PreconditionFailedException(String message) {
                super(412, message);
        }
}
