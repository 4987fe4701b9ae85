package com.example.convoy.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

import com.example.convoy.bootstrap.BootstrappedClients;
import com.example.convoy.bootstrap.ClientBootstrap;
import com.example.convoy.checkpoint.CursorCheckpointStore;
import com.example.convoy.couch.DocumentStore;
import com.example.convoy.exceptions.ConfigurationException;
import com.example.convoy.feed.ChangeFeed;
import com.example.convoy.feed.FilterDocumentInstaller;
import com.example.convoy.feed.ShutdownSignal;
import com.example.convoy.mapping.DedupStore;
import com.example.convoy.metrics.FeedMetrics;
import com.example.convoy.service.AuctionProcessor;
import com.example.convoy.service.ContractRecordCreator;
import com.example.convoy.service.DerivedRecordCreator;

@Configuration
public class FeedConfig {

        @Value("${spring.lifecycle.timeout-per-shutdown-phase:30s}")
        private String shutdownTimeout;

        @Bean
        public BootstrappedClients bootstrappedClients(RestTemplateBuilder restTemplateBuilder,
                        ConvoyProperties properties) {
                return new ClientBootstrap(restTemplateBuilder).bootstrap(properties);
        }

        @Bean
        public DocumentStore documentStore(BootstrappedClients clients) {
                return clients.getDocumentStore();
        }

        @Bean(destroyMethod = "close")
        public DedupStore dedupStore(BootstrappedClients clients) {
                return clients.getDedupStore();
        }

        @Bean
        public FilterDocumentInstaller filterDocumentInstaller(DocumentStore documentStore) {
                return new FilterDocumentInstaller(documentStore);
        }

        @Bean
        public ChangeFeed changeFeed(DocumentStore documentStore, DedupStore dedupStore,
                        ShutdownSignal shutdownSignal, RetryTemplate upstreamRetryTemplate, FeedMetrics feedMetrics,
                        CursorCheckpointStore cursorCheckpointStore, ConvoyProperties properties) {
                ConvoyProperties.Feed feed = properties.getFeed();
                return ChangeFeed.builder()
                                .documentStore(documentStore)
                                .dedupStore(dedupStore)
                                .shutdownSignal(shutdownSignal)
                                .retryTemplate(upstreamRetryTemplate)
                                .metrics(feedMetrics)
                                .checkpointStore(cursorCheckpointStore)
                                .mode(feed.getMode())
                                .limit(feed.getLimit())
                                .idleTimeout(feed.getIdleTimeout())
                                .build();
        }

        @Bean
        public DerivedRecordCreator derivedRecordCreator(BootstrappedClients clients) {
                return new ContractRecordCreator(clients.resourceClient("contract")
                                .orElseThrow(() -> new ConfigurationException("contracts resource is not configured")));
        }

        @Bean
        public AuctionProcessor auctionProcessor(ChangeFeed changeFeed, DedupStore dedupStore,
                        DerivedRecordCreator derivedRecordCreator, RetryTemplate upstreamRetryTemplate,
                        ShutdownSignal shutdownSignal, FeedMetrics feedMetrics) {
                return new AuctionProcessor(changeFeed, dedupStore, derivedRecordCreator, upstreamRetryTemplate,
                                shutdownSignal, feedMetrics, DurationStyle.detectAndParse(shutdownTimeout));
        }
}
