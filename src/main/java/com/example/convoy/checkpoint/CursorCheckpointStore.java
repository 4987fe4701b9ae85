package com.example.convoy.checkpoint;

import java.util.Optional;

/**
 * Durable home for the change feed cursor. The auctions mapping stays the
 * real guard against reprocessing; a checkpoint only shortens the replay
 * after a restart.
 */
public interface CursorCheckpointStore {

        Optional<String> load();

        void save(String cursor);
}
