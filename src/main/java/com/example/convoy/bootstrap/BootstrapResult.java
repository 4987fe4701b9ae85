package com.example.convoy.bootstrap;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of creating one startup resource.
 */
@Getter
@AllArgsConstructor
@ToString
public class BootstrapResult {

    public enum Outcome {
        OK, FAILED
    }

    private final String resource;
    private final Outcome outcome;
    private final Exception error;

    public static BootstrapResult ok(String resource) {
        return new BootstrapResult(resource, Outcome.OK, null);
    }

    public static BootstrapResult failed(String resource, Exception error) {
        return new BootstrapResult(resource, Outcome.FAILED, error);
    }

    public boolean isFailed() {
        return outcome == Outcome.FAILED;
    }
}
