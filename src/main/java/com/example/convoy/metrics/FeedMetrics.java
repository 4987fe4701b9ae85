package com.example.convoy.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;

/**
 * Prometheus collectors for the change feed and auction processing.
 */
public class FeedMetrics {

        private final Counter polls;
        private final Counter eventsReceived;
        private final Counter duplicatesSkipped;
        private final Counter eventsProcessed;
        private final Counter eventsFailed;
        private final Histogram processDuration;

        public FeedMetrics(CollectorRegistry registry) {
                this.polls = Counter.build().name("convoy_feed_polls_total")
                                .help("Number of change feed polls.").register(registry);
                this.eventsReceived = Counter.build().name("convoy_feed_events_received_total")
                                .help("Auction documents received from the change feed.").register(registry);
                this.duplicatesSkipped = Counter.build().name("convoy_feed_duplicates_skipped_total")
                                .help("Auctions skipped because the auctions mapping already had them.")
                                .register(registry);
                this.eventsProcessed = Counter.build().name("convoy_events_processed_total")
                                .help("Auctions processed successfully.").register(registry);
                this.eventsFailed = Counter.build().name("convoy_events_failed_total")
                                .help("Auctions whose processing failed and was skipped.").register(registry);
                this.processDuration = Histogram.build().name("convoy_event_process_duration_seconds")
                                .help("Histogram for tracking auction processing duration.")
                                .buckets(0.0, 0.05, 0.1, 0.2, 0.5, 0.7, 1, 2, 5).register(registry);
        }

        public Counter polls() {
                return polls;
        }

        public Counter eventsReceived() {
                return eventsReceived;
        }

        public Counter duplicatesSkipped() {
                return duplicatesSkipped;
        }

        public Counter eventsProcessed() {
                return eventsProcessed;
        }

        public Counter eventsFailed() {
                return eventsFailed;
        }

        public Histogram processDuration() {
                return processDuration;
        }
}
