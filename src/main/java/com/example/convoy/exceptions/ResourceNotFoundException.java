package com.example.convoy.exceptions;

public class ResourceNotFoundException extends UpstreamApiException {

        public ResourceNotFoundException(String message) {
                super(404, message);
        }
}
