package com.example.convoy.bootstrap;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;

import com.example.convoy.config.ConvoyProperties;
import com.example.convoy.couch.CouchDbDocumentStore;
import com.example.convoy.couch.CouchDbSettings;
import com.example.convoy.couch.DocumentStore;
import com.example.convoy.exceptions.ConfigurationException;
import com.example.convoy.mapping.DedupStore;
import com.example.convoy.mapping.DedupStoreSettings;
import com.example.convoy.mapping.DedupStores;

/**
 * Creates the resource clients, the auctions database handle and the
 * auctions mapping. Every resource is attempted and its outcome logged
 * before the first failure, if any, is raised, so a broken start shows
 * everything that is wrong at once.
 */
public class ClientBootstrap {

        private static final Logger LOGGER = LoggerFactory.getLogger(ClientBootstrap.class);
        private static final Marker CHECK = MarkerFactory.getMarker("CHECK");

        public static final List<String> SECTIONS = List.of("auctions", "lots", "assets", "contracts");
        static final String COUCHDB = "couchdb";
        static final String AUCTIONS_MAPPING = "auctions_mapping";

        private final RestTemplateBuilder restTemplateBuilder;
        private final Function<CouchDbSettings, DocumentStore> documentStoreFactory;
        private final Function<DedupStoreSettings, DedupStore> dedupStoreFactory;

        public ClientBootstrap(RestTemplateBuilder restTemplateBuilder) {
                this(restTemplateBuilder, settings -> CouchDbDocumentStore.open(settings, restTemplateBuilder),
                                settings -> DedupStores.open(settings, true));
        }

        public ClientBootstrap(RestTemplateBuilder restTemplateBuilder,
                        Function<CouchDbSettings, DocumentStore> documentStoreFactory,
                        Function<DedupStoreSettings, DedupStore> dedupStoreFactory) {
                this.restTemplateBuilder = restTemplateBuilder;
                this.documentStoreFactory = documentStoreFactory;
                this.dedupStoreFactory = dedupStoreFactory;
        }

        public BootstrappedClients bootstrap(ConvoyProperties properties) {
                List<BootstrapResult> results = new ArrayList<>();
                Map<String, ResourceClient> clients = new LinkedHashMap<>();

                List<String> sections = new ArrayList<>();
                for (String section : SECTIONS) {
                        if (properties.getResources().containsKey(section)) {
                                sections.add(section);
                        }
                }
                LOGGER.info("Clients for such resources will be initialized {}", sections);

                for (String section : sections) {
                        String clientName = section + "_client";
                        ConvoyProperties.Resource resource = properties.getResources().get(section);
                        try {
                                clients.put(clientName, ResourceClient.create(section, resource.getApi().getUrl(),
                                                resource.getApi().getToken(), resource.getApi().getVersion(),
                                                resource.getDs(), restTemplateBuilder));
                                results.add(check(BootstrapResult.ok(clientName)));
                        } catch (Exception e) {
                                results.add(check(BootstrapResult.failed(clientName, e)));
                        }
                }
                ResourceClient auctionsClient = clients.get("auctions_client");
                if (auctionsClient == null || !auctionsClient.hasDocumentService()) {
                        LOGGER.warn("Document Service configuration is not available.");
                }

                DocumentStore documentStore = null;
                try {
                        ConvoyProperties.Db db = properties.getDb();
                        documentStore = documentStoreFactory.apply(new CouchDbSettings(db.getHost(), db.getPort(),
                                        db.getName(), db.getLogin(), db.getPassword()));
                        results.add(check(BootstrapResult.ok(COUCHDB)));
                } catch (Exception e) {
                        results.add(check(BootstrapResult.failed(COUCHDB, e)));
                }

                DedupStore dedupStore = null;
                try {
                        dedupStore = dedupStoreFactory.apply(properties.getAuctionsMapping().toSettings());
                        results.add(check(BootstrapResult.ok(AUCTIONS_MAPPING)));
                } catch (Exception e) {
                        results.add(check(BootstrapResult.failed(AUCTIONS_MAPPING, e)));
                }

                for (BootstrapResult result : results) {
                        if (result.isFailed()) {
                                if (dedupStore != null) {
                                        dedupStore.close();
                                }
                                throw asConfigurationError(result);
                        }
                }
                return new BootstrappedClients(clients, documentStore, dedupStore, results);
        }

        private static BootstrapResult check(BootstrapResult result) {
                if (result.isFailed()) {
                        LOGGER.info(CHECK, "{} - failed", result.getResource());
                        LOGGER.error("{} could not be initialized", result.getResource(), result.getError());
                } else {
                        LOGGER.info(CHECK, "{} - ok", result.getResource());
                }
                return result;
        }

        private static ConfigurationException asConfigurationError(BootstrapResult failed) {
                Exception error = failed.getError();
                if (error instanceof ConfigurationException) {
                        return (ConfigurationException) error;
                }
                return new ConfigurationException(failed.getResource() + " could not be initialized: "
                                + error.getMessage(), error);
        }
}
