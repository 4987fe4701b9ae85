package com.example.convoy.feed;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative "kill requested" flag shared between whoever stops the process
 * and the feed loop. Once requested it stays requested.
 */
public class ShutdownSignal {

        private final CountDownLatch latch = new CountDownLatch(1);

        public void request() {
                latch.countDown();
        }

        public boolean isRequested() {
                return latch.getCount() == 0;
        }

        /**
         * Blocks for up to {@code timeout}, returning early when shutdown is
         * requested.
         *
         * @return whether shutdown was requested
         */
        public boolean await(Duration timeout) throws InterruptedException {
                return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
}
