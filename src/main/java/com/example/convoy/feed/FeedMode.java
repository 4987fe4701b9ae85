package com.example.convoy.feed;

/**
 * How long a {@link ChangeFeed} iteration runs.
 */
public enum FeedMode {

    /** Poll forever, idling between empty batches, until shutdown is requested. */
    CONTINUOUS,

    /** Stop at the first empty batch: a one-off catch-up of everything pending. */
    SINGLE_PASS
}
