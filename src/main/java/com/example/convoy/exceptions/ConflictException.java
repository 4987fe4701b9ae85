package com.example.convoy.exceptions;

public class ConflictException extends UpstreamApiException {

        public ConflictException(String message) {
                super(409, message);
        }
}
