package com.example.convoy.bootstrap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;

import com.example.convoy.config.ConvoyProperties;
import com.example.convoy.couch.DocumentStore;
import com.example.convoy.exceptions.ConfigurationException;
import com.example.convoy.mapping.DedupStore;
import com.example.convoy.mapping.DedupStoreSettings;

class ClientBootstrapTest {

        private ConvoyProperties properties;
        private DocumentStore documentStore;
        private DedupStore dedupStore;
        private List<DedupStoreSettings> openedMappings;

        @BeforeEach
        void setUp() {
                properties = new ConvoyProperties();
                documentStore = mock(DocumentStore.class);
                dedupStore = mock(DedupStore.class);
                openedMappings = new ArrayList<>();
        }

        private void resource(String section, String url, String token) {
                ConvoyProperties.Resource resource = new ConvoyProperties.Resource();
                resource.getApi().setUrl(url);
                resource.getApi().setToken(token);
                properties.getResources().put(section, resource);
        }

        private ClientBootstrap bootstrap(RuntimeException couchFailure, RuntimeException mappingFailure) {
                return new ClientBootstrap(new RestTemplateBuilder(), settings -> {
                        if (couchFailure != null) {
                                throw couchFailure;
                        }
                        return documentStore;
                }, settings -> {
                        openedMappings.add(settings);
                        if (mappingFailure != null) {
                                throw mappingFailure;
                        }
                        return dedupStore;
                });
        }

        @Test
        void testCreatesConfiguredClientsAndStores() {
                resource("auctions", "http://registry", "auctions-token");
                resource("contracts", "http://registry/", "contracts-token");

                BootstrappedClients clients = bootstrap(null, null).bootstrap(properties);

                assertEquals(4, clients.getResults().size());
                assertTrue(clients.getResults().stream().noneMatch(BootstrapResult::isFailed));
                assertTrue(clients.resourceClient("auction").isPresent());
                assertEquals("contracts", clients.resourceClient("contract").get().getResource());
                assertTrue(clients.resourceClient("lot").isEmpty());
                assertSame(documentStore, clients.getDocumentStore());
                assertSame(dedupStore, clients.getDedupStore());
        }

        @Test
        void testUnknownSectionsAreIgnored() {
                resource("auctions", "http://registry", "auctions-token");
                resource("bids", "http://registry", "bids-token");

                BootstrappedClients clients = bootstrap(null, null).bootstrap(properties);

                assertEquals(1, clients.getResourceClients().size());
        }

        @Test
        void testAttemptsEverythingBeforeRaisingTheFirstFailure() {
                resource("auctions", "http://registry", "auctions-token");
                resource("contracts", "http://registry", "");

                ConfigurationException thrown = assertThrows(ConfigurationException.class,
                                () -> bootstrap(new IllegalStateException("couch is down"), null).bootstrap(properties));

                assertTrue(thrown.getMessage().startsWith("contracts_client"));
                assertTrue(thrown.getCause() instanceof IllegalArgumentException);
                assertEquals(1, openedMappings.size());
                verify(dedupStore).close();
        }

        @Test
        void testMappingConfigurationErrorIsRaisedAsIs() {
                resource("auctions", "http://registry", "auctions-token");
                ConfigurationException mappingFailure = new ConfigurationException("auctions mapping self-check failed");

                ConfigurationException thrown = assertThrows(ConfigurationException.class,
                                () -> bootstrap(null, mappingFailure).bootstrap(properties));

                assertSame(mappingFailure, thrown);
        }

        @Test
        void testMappingSettingsComeFromProperties() {
                properties.getAuctionsMapping().setHost("redis");
                properties.getAuctionsMapping().setName("3");

                bootstrap(null, null).bootstrap(properties);

                DedupStoreSettings settings = openedMappings.get(0);
                assertTrue(settings instanceof DedupStoreSettings.Networked);
                assertEquals(3, ((DedupStoreSettings.Networked) settings).getDatabase());
        }
}
