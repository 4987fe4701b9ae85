package com.example.convoy.feed;

import java.time.Duration;

/**
 * How the feed waits after an empty batch.
 */
@FunctionalInterface
public interface IdleStrategy {

        void idle(Duration interval) throws InterruptedException;

        /**
         * Waits on the shutdown signal so a shutdown request cuts the idle
         * period short.
         */
        static IdleStrategy waitingOn(ShutdownSignal signal) {
                return signal::await;
        }
}
