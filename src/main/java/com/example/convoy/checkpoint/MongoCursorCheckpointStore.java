package com.example.convoy.checkpoint;

import java.util.Date;
import java.util.Optional;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.convoy.models.CursorCheckpoint;
import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.UpdateOptions;

/**
 * Stores the feed cursor in a MongoDB collection, one document per feed.
 */
public class MongoCursorCheckpointStore implements CursorCheckpointStore {

        private static final Logger LOGGER = LoggerFactory.getLogger(MongoCursorCheckpointStore.class);
        static final String APP_NAME = "convoy";

        private final MongoCollection<Document> checkpointCollection;
        private final String feedName;

        public MongoCursorCheckpointStore(MongoCollection<Document> checkpointCollection, String feedName) {
                this.checkpointCollection = checkpointCollection;
                this.feedName = feedName;
        }

        @Override
        public Optional<String> load() {
                Document checkpointDoc = checkpointCollection.find(Filters.eq("feedName", feedName)).first();
                if (checkpointDoc == null) {
                        LOGGER.info("No cursor checkpoint for feed {}, starting from the origin", feedName);
                        return Optional.empty();
                }
                CursorCheckpoint checkpoint = CursorCheckpoint.fromDocument(checkpointDoc);
                LOGGER.info("Found cursor checkpoint {}", checkpoint);
                return Optional.ofNullable(checkpoint.getCursor());
        }

        /**
         * Upserts the cursor. A failed write is logged and ignored: the next
         * poll writes a newer cursor and a stale one only means more replay.
         */
        @Override
        public void save(String cursor) {
                CursorCheckpoint checkpoint = new CursorCheckpoint(feedName, cursor, new Date(), APP_NAME);
                try {
                        checkpointCollection.updateOne(Filters.eq("feedName", feedName),
                                        new Document("$set", checkpoint.toDocument()), new UpdateOptions().upsert(true));
                } catch (MongoException e) {
                        LOGGER.warn("Could not save cursor checkpoint {}: {}", cursor, e.getMessage());
                }
        }
}
