// AuctionProcessor.java
package com.example.convoy.service;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;

import com.example.convoy.feed.ChangeFeed;
import com.example.convoy.feed.ShutdownSignal;
import com.example.convoy.mapping.DedupStore;
import com.example.convoy.metrics.FeedMetrics;
import com.example.convoy.models.ChangeEvent;

import io.prometheus.client.Histogram;

/**
 * AuctionProcessor drains the change feed on its own daemon thread, hands
 * every new auction to the {@link DerivedRecordCreator} and records it in the
 * auctions mapping once that succeeded. One failing auction is logged and
 * skipped; the feed keeps going. A failing feed ends the run and is reported
 * to the feed failure handler.
 */
public class AuctionProcessor {

        private static final Logger LOGGER = LoggerFactory.getLogger(AuctionProcessor.class);
        public static final String PROCESSED_MARKER = "1";

        private final ChangeFeed changeFeed;
        private final DedupStore dedupStore;
        private final DerivedRecordCreator recordCreator;
        private final RetryTemplate upstreamRetryTemplate;
        private final ShutdownSignal shutdownSignal;
        private final FeedMetrics metrics;
        private final Duration shutdownTimeout;
        private final ExecutorService executor;
        private volatile Runnable feedFailureHandler = () -> {
        };

        public AuctionProcessor(ChangeFeed changeFeed, DedupStore dedupStore, DerivedRecordCreator recordCreator,
                        RetryTemplate upstreamRetryTemplate, ShutdownSignal shutdownSignal, FeedMetrics metrics,
                        Duration shutdownTimeout) {
                this.changeFeed = changeFeed;
                this.dedupStore = dedupStore;
                this.recordCreator = recordCreator;
                this.upstreamRetryTemplate = upstreamRetryTemplate;
                this.shutdownSignal = shutdownSignal;
                this.metrics = metrics;
                this.shutdownTimeout = shutdownTimeout;
                this.executor = Executors.newSingleThreadExecutor(runnable -> {
                        Thread thread = new Thread(runnable, "convoy-feed");
                        thread.setDaemon(true);
                        return thread;
                });
        }

        /**
         * Called on the feed thread when the feed stops because of an error
         * rather than a shutdown request.
         */
        public void onFeedFailure(Runnable handler) {
                this.feedFailureHandler = handler;
        }

        public void start() {
                executor.submit(this::run);
                LOGGER.info("Change feed processing started in a daemon thread");
        }

        /**
         * Processes the feed until it ends, either on shutdown or because a
         * poll failed for good.
         *
         * @return number of auctions processed successfully
         */
        public long run() {
                long processed = 0;
                try {
                        for (ChangeEvent auction : changeFeed) {
                                if (processEvent(auction)) {
                                        processed++;
                                }
                        }
                        LOGGER.info("Change feed ended after {} processed auctions", processed);
                } catch (RuntimeException e) {
                        LOGGER.error("Change feed stopped by a non-recoverable error after {} processed auctions",
                                        processed, e);
                        feedFailureHandler.run();
                }
                return processed;
        }

        /**
         * @return whether a record was handled and the auction marked processed
         */
        public boolean processEvent(ChangeEvent auction) {
                String auctionId = auction.getId();
                Histogram.Timer timer = metrics.processDuration().startTimer();
                try {
                        if (dedupStore.has(auctionId)) {
                                LOGGER.info("Auction {} already processed, skipping", auctionId);
                                metrics.duplicatesSkipped().inc();
                                return false;
                        }
                        LOGGER.info("Processing auction {} in status {}", auctionId, auction.getRawStatus());
                        upstreamRetryTemplate.execute(context -> recordCreator.create(auction));
                        dedupStore.put(auctionId, PROCESSED_MARKER);
                        metrics.eventsProcessed().inc();
                        return true;
                } catch (RuntimeException e) {
                        metrics.eventsFailed().inc();
                        LOGGER.error("Failed to process auction {}, skipping it", auctionId, e);
                        return false;
                } finally {
                        timer.observeDuration();
                }
        }

        public void shutdown() {
                LOGGER.info("Shutdown requested, stopping change feed...");
                shutdownSignal.request();
                executor.shutdown();
                try {
                        if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                                executor.shutdownNow();
                                if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                                        LOGGER.error("Change feed thread did not terminate gracefully.");
                                }
                        }
                } catch (InterruptedException ie) {
                        executor.shutdownNow();
                        Thread.currentThread().interrupt();
                }
        }
}
