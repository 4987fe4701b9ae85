package com.example.convoy.feed;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;

import com.example.convoy.checkpoint.CursorCheckpointStore;
import com.example.convoy.checkpoint.NoCheckpointStore;
import com.example.convoy.couch.ChangeRow;
import com.example.convoy.couch.ChangesBatch;
import com.example.convoy.couch.ChangesQuery;
import com.example.convoy.couch.DocumentStore;
import com.example.convoy.mapping.DedupStore;
import com.example.convoy.metrics.FeedMetrics;
import com.example.convoy.models.ChangeEvent;

import lombok.Builder;
import lombok.NonNull;

/**
 * Polls the filtered change feed of the auctions database and yields every
 * auction the auctions mapping has not seen yet, in feed order.
 * <p>
 * Each {@link #iterator()} is a fresh, lazy and unbounded run starting from
 * the checkpointed cursor, or from the origin when there is none. The cursor
 * moves to the {@code last_seq} of every poll, empty or not. It is
 * checkpointed right away after an empty poll, and only once the caller asks
 * for more after the last event of a non-empty batch. A started batch
 * is always drained before a shutdown request is honoured: the signal is
 * checked once a non-empty batch has been fully consumed and around the idle
 * wait that follows an empty batch.
 * <p>
 * Polls go through the upstream retry template, so transient failures are
 * retried with backoff and anything else ends the iteration with the
 * exception.
 */
@Builder
public class ChangeFeed implements Iterable<ChangeEvent> {

        private static final Logger LOGGER = LoggerFactory.getLogger(ChangeFeed.class);

        public static final String ORIGIN = "0";
        public static final int DEFAULT_LIMIT = 100;
        public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofSeconds(10);

        @NonNull
        private final DocumentStore documentStore;
        @NonNull
        private final DedupStore dedupStore;
        @NonNull
        private final ShutdownSignal shutdownSignal;
        @NonNull
        private final RetryTemplate retryTemplate;
        @NonNull
        private final FeedMetrics metrics;
        private final IdleStrategy idleStrategy;
        @Builder.Default
        private final CursorCheckpointStore checkpointStore = new NoCheckpointStore();
        @Builder.Default
        private final FeedMode mode = FeedMode.CONTINUOUS;
        @Builder.Default
        private final int limit = DEFAULT_LIMIT;
        @Builder.Default
        private final Duration idleTimeout = DEFAULT_IDLE_TIMEOUT;
        @Builder.Default
        private final String filter = FilterScript.FILTER_REFERENCE;

        @Override
        public Iterator<ChangeEvent> iterator() {
                String start = checkpointStore.load().orElse(ORIGIN);
                LOGGER.info("Starting {} change feed from cursor {}", mode, start);
                return new FeedIterator(start);
        }

        public Stream<ChangeEvent> stream() {
                return StreamSupport.stream(spliterator(), false);
        }

        private IdleStrategy idleStrategy() {
                return idleStrategy != null ? idleStrategy : IdleStrategy.waitingOn(shutdownSignal);
        }

        private class FeedIterator implements Iterator<ChangeEvent> {

                private final Deque<ChangeEvent> pending = new ArrayDeque<>();
                private String cursor;
                private boolean batchDrained;
                private boolean finished;

                FeedIterator(String cursor) {
                        this.cursor = cursor;
                }

                @Override
                public boolean hasNext() {
                        while (pending.isEmpty() && !finished) {
                                advance();
                        }
                        return !pending.isEmpty();
                }

                @Override
                public ChangeEvent next() {
                        if (!hasNext()) {
                                throw new NoSuchElementException("Change feed has ended");
                        }
                        return pending.poll();
                }

                private void advance() {
                        if (batchDrained) {
                                // every event of the previous batch has been handed out and handled
                                checkpointStore.save(cursor);
                        }
                        if (batchDrained && shutdownSignal.isRequested()) {
                                LOGGER.info("Shutdown requested, stopping change feed at cursor {}", cursor);
                                finished = true;
                                return;
                        }

                        ChangesBatch batch = poll();
                        cursor = batch.getLastSeq();

                        if (!batch.isEmpty()) {
                                enqueue(batch);
                                batchDrained = true;
                                return;
                        }

                        batchDrained = false;
                        checkpointStore.save(cursor);
                        if (shutdownSignal.isRequested()) {
                                LOGGER.info("Shutdown requested, stopping change feed at cursor {}", cursor);
                                finished = true;
                                return;
                        }
                        if (mode == FeedMode.SINGLE_PASS) {
                                LOGGER.info("Change feed caught up at cursor {}", cursor);
                                finished = true;
                                return;
                        }
                        idle();
                }

                private ChangesBatch poll() {
                        ChangesQuery query = new ChangesQuery(cursor, limit, filter, true);
                        ChangesBatch batch = retryTemplate.execute(context -> documentStore.changes(query));
                        metrics.polls().inc();
                        LOGGER.debug("Polled {} changes since {}, last_seq {}", batch.getResults().size(), cursor,
                                        batch.getLastSeq());
                        return batch;
                }

                private void enqueue(ChangesBatch batch) {
                        for (ChangeRow row : batch.getResults()) {
                                if (row.getDoc() == null) {
                                        LOGGER.warn("Change {} at seq {} carries no document, skipping", row.getId(),
                                                        row.getSeq());
                                        continue;
                                }
                                ChangeEvent event = new ChangeEvent(row.getSeq(), row.getDoc());
                                metrics.eventsReceived().inc();
                                if (alreadyProcessed(event)) {
                                        metrics.duplicatesSkipped().inc();
                                        LOGGER.info("Auction {} already processed, skipping", event.getId());
                                        continue;
                                }
                                pending.add(event);
                        }
                }

                private boolean alreadyProcessed(ChangeEvent event) {
                        try {
                                return dedupStore.has(event.getId());
                        } catch (RuntimeException e) {
                                // processing re-checks the mapping before acting
                                LOGGER.warn("Auctions mapping lookup failed for {}: {}", event.getId(), e.getMessage());
                                return false;
                        }
                }

                private void idle() {
                        try {
                                idleStrategy().idle(idleTimeout);
                        } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                                LOGGER.info("Change feed interrupted while idle at cursor {}", cursor);
                                finished = true;
                                return;
                        }
                        if (shutdownSignal.isRequested()) {
                                LOGGER.info("Shutdown requested, stopping change feed at cursor {}", cursor);
                                finished = true;
                        }
                }
        }
}
