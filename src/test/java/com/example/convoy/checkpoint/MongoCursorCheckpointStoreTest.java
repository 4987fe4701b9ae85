package com.example.convoy.checkpoint;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Date;
import java.util.Optional;

import org.bson.Document;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.mongodb.MongoException;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.UpdateOptions;

public class MongoCursorCheckpointStoreTest {

        @Mock
        private MongoCollection<Document> checkpointCollection;

        @Mock
        private FindIterable<Document> findIterable;

        private MongoCursorCheckpointStore checkpointStore;

        @BeforeEach
        public void setUp() {
                MockitoAnnotations.openMocks(this);
                when(checkpointCollection.find(any(Bson.class))).thenReturn(findIterable);
                checkpointStore = new MongoCursorCheckpointStore(checkpointCollection, "convoy_feed");
        }

        @Test
        public void testLoadReturnsStoredCursor() {
                Document checkpointDoc = new Document("feedName", "convoy_feed").append("cursor", "42-abc")
                                .append("date", new Date()).append("appName", "convoy");
                when(findIterable.first()).thenReturn(checkpointDoc);

                assertEquals(Optional.of("42-abc"), checkpointStore.load());
        }

        @Test
        public void testLoadWithoutCheckpointIsEmpty() {
                when(findIterable.first()).thenReturn(null);

                assertTrue(checkpointStore.load().isEmpty());
        }

        @Test
        public void testSaveUpsertsTheCursor() {
                checkpointStore.save("43");

                ArgumentCaptor<Document> update = ArgumentCaptor.forClass(Document.class);
                ArgumentCaptor<UpdateOptions> options = ArgumentCaptor.forClass(UpdateOptions.class);
                verify(checkpointCollection, times(1)).updateOne(any(Bson.class), update.capture(), options.capture());

                Document set = update.getValue().get("$set", Document.class);
                assertEquals("43", set.getString("cursor"));
                assertEquals("convoy_feed", set.getString("feedName"));
                assertEquals(MongoCursorCheckpointStore.APP_NAME, set.getString("appName"));
                assertTrue(options.getValue().isUpsert());
        }

        @Test
        public void testSaveFailureIsNotFatal() {
                when(checkpointCollection.updateOne(any(Bson.class), any(Bson.class), any(UpdateOptions.class)))
                                .thenThrow(new MongoException("not primary"));

                checkpointStore.save("44");

                verify(checkpointCollection, times(1)).updateOne(any(Bson.class), any(Bson.class),
                                any(UpdateOptions.class));
        }
}
