package com.example.convoy.config;

import java.util.concurrent.TimeUnit;

import org.bson.Document;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.convoy.checkpoint.CursorCheckpointStore;
import com.example.convoy.checkpoint.MongoCursorCheckpointStore;
import com.example.convoy.checkpoint.NoCheckpointStore;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.WriteConcern;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;

/**
 * Where the feed cursor is kept between runs. Off by default: the auctions
 * mapping alone prevents reprocessing, a checkpoint only shortens the replay.
 */
@Configuration
public class CheckpointConfig {

        @Configuration
        @ConditionalOnProperty(name = "convoy.checkpoint.enabled", havingValue = "true")
        static class MongoCheckpointConfig {

                @Bean(destroyMethod = "close")
                public MongoClient checkpointMongoClient(ConvoyProperties properties) {
                        MongoClientSettings clientSettings = MongoClientSettings.builder()
                                        .applyConnectionString(new ConnectionString(properties.getCheckpoint().getUri()))
                                        .applyToSocketSettings(builder -> builder.connectTimeout(30, TimeUnit.SECONDS))
                                        .retryWrites(true)
                                        .writeConcern(WriteConcern.MAJORITY).applicationName("convoy").build();

                        return MongoClients.create(clientSettings);
                }

                @Bean
                public MongoCollection<Document> checkpointCollection(MongoClient checkpointMongoClient,
                                ConvoyProperties properties) {
                        ConvoyProperties.Checkpoint checkpoint = properties.getCheckpoint();
                        return checkpointMongoClient.getDatabase(checkpoint.getDatabase())
                                        .getCollection(checkpoint.getCollection(), Document.class);
                }

                @Bean
                public CursorCheckpointStore cursorCheckpointStore(MongoCollection<Document> checkpointCollection,
                                ConvoyProperties properties) {
                        return new MongoCursorCheckpointStore(checkpointCollection, properties.getFeed().getName());
                }
        }

        @Configuration
        @ConditionalOnProperty(name = "convoy.checkpoint.enabled", havingValue = "false", matchIfMissing = true)
        static class NoCheckpointConfig {

                @Bean
                public CursorCheckpointStore cursorCheckpointStore() {
                        return new NoCheckpointStore();
                }
        }
}
