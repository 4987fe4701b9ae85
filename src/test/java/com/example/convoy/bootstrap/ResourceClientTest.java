package com.example.convoy.bootstrap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import com.example.convoy.exceptions.PreconditionFailedException;
import com.example.convoy.exceptions.ResourceNotFoundException;

class ResourceClientTest {

        private MockRestServiceServer server;
        private ResourceClient client;

        @BeforeEach
        void setUp() {
                RestTemplate restTemplate = new RestTemplateBuilder().rootUri("http://registry/api/2.5").build();
                server = MockRestServiceServer.bindTo(restTemplate).build();
                client = new ResourceClient("contracts", restTemplate, Map.of());
        }

        @Test
        void testCreateWrapsAndUnwrapsData() {
                server.expect(requestTo("http://registry/api/2.5/contracts"))
                                .andExpect(method(HttpMethod.POST))
                                .andExpect(content().json("{\"data\":{\"relatedProcessID\":\"a1\"}}"))
                                .andRespond(withSuccess("{\"data\":{\"id\":\"c1\",\"relatedProcessID\":\"a1\"}}",
                                                MediaType.APPLICATION_JSON));

                Map<String, Object> created = client.create(Map.of("relatedProcessID", "a1"));

                server.verify();
                assertEquals("c1", created.get("id"));
        }

        @Test
        void testGetMissingResource() {
                server.expect(requestTo("http://registry/api/2.5/contracts/c9"))
                                .andRespond(withStatus(HttpStatus.NOT_FOUND));

                assertThrows(ResourceNotFoundException.class, () -> client.get("c9"));
        }

        @Test
        void testPreconditionFailedIsClassified() {
                server.expect(requestTo("http://registry/api/2.5/contracts"))
                                .andRespond(withStatus(HttpStatus.PRECONDITION_FAILED));

                assertThrows(PreconditionFailedException.class, () -> client.create(Map.of()));
        }

        @Test
        void testCreateRequiresUrlAndToken() {
                RestTemplateBuilder builder = new RestTemplateBuilder();

                assertThrows(IllegalArgumentException.class,
                                () -> ResourceClient.create("lots", "", "token", "2.5", Map.of(), builder));
                assertThrows(IllegalArgumentException.class,
                                () -> ResourceClient.create("lots", "http://registry", null, "2.5", Map.of(), builder));
        }

        @Test
        void testClientNameAndDocumentService() {
                assertEquals("contracts_client", ResourceClient.clientName("contract"));
                assertFalse(client.hasDocumentService());
                assertTrue(new ResourceClient("auctions", new RestTemplate(), Map.of("url", "http://ds"))
                                .hasDocumentService());
        }
}
