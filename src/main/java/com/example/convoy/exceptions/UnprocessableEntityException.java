package com.example.convoy.exceptions;

public class UnprocessableEntityException extends UpstreamApiException {

        public UnprocessableEntityException(String message) {
                super(422, message);
        }
}
