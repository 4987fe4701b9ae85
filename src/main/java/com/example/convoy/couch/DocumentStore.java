package com.example.convoy.couch;

import java.util.Map;
import java.util.Optional;

/**
 * What the feed needs from the document database: read a document by ID,
 * upsert a document and query the change feed.
 */
public interface DocumentStore {

        Optional<Map<String, Object>> get(String id);

        /**
         * Upserts the document and stores the new revision in it.
         *
         * @return the saved document
         */
        Map<String, Object> save(Map<String, Object> document);

        ChangesBatch changes(ChangesQuery query);
}
