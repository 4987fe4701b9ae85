package com.example.convoy.exceptions;

/**
 * Fatal startup problem: a backend is unreachable, a self-check failed or a
 * required resource could not be created. The process should not start.
 */
public class ConfigurationException extends RuntimeException {

        public ConfigurationException(String message) {
                super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
                super(message, cause);
        }
}
