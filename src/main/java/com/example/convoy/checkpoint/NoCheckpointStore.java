package com.example.convoy.checkpoint;

import java.util.Optional;

/**
 * Keeps nothing: every run replays the feed from its origin.
 */
public class NoCheckpointStore implements CursorCheckpointStore {

        @Override
        public Optional<String> load() {
                return Optional.empty();
        }

        @Override
        public void save(String cursor) {
        }
}
