package com.example.convoy.bootstrap;

import java.util.Collections;
import java.util.Map;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

import com.example.convoy.exceptions.UpstreamErrors;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Client for one resource collection of the registry API ({@code auctions},
 * {@code lots}, {@code assets}, {@code contracts}). Payloads travel wrapped in
 * a {@code data} envelope; the API token is sent as the basic-auth user.
 * Errors surface as the upstream exception family.
 */
public class ResourceClient {

        private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT = new ParameterizedTypeReference<>() {
        };
        private static final TypeReference<Map<String, Object>> DATA_TYPE = new TypeReference<>() {
        };
        private static final ObjectMapper MAPPER = new ObjectMapper();

        private final String resource;
        private final RestTemplate restTemplate;
        private final Map<String, String> documentServiceConfig;

        public ResourceClient(String resource, RestTemplate restTemplate, Map<String, String> documentServiceConfig) {
                this.resource = resource;
                this.restTemplate = restTemplate;
                this.documentServiceConfig = documentServiceConfig == null ? Collections.emptyMap()
                                : documentServiceConfig;
        }

        public static ResourceClient create(String resource, String url, String token, String version,
                        Map<String, String> documentServiceConfig, RestTemplateBuilder builder) {
                if (!StringUtils.hasText(url)) {
                        throw new IllegalArgumentException("API url is not configured for " + resource);
                }
                if (!StringUtils.hasText(token)) {
                        throw new IllegalArgumentException("API token is not configured for " + resource);
                }
                String rootUri = StringUtils.trimTrailingCharacter(url, '/') + "/api/" + version;
                RestTemplate restTemplate = builder.rootUri(rootUri).basicAuthentication(token, "").build();
                return new ResourceClient(resource, restTemplate, documentServiceConfig);
        }

        /**
         * Name a resource client is registered under, e.g. {@code contract} -&gt;
         * {@code contracts_client}.
         */
        public static String clientName(String resourceType) {
                return resourceType + "s_client";
        }

        public String getResource() {
                return resource;
        }

        public boolean hasDocumentService() {
                return !documentServiceConfig.isEmpty();
        }

        public Map<String, Object> get(String id) {
                return unwrap(UpstreamErrors.call("GET " + resource + "/" + id,
                                () -> restTemplate.exchange("/{resource}/{id}", HttpMethod.GET, HttpEntity.EMPTY,
                                                JSON_OBJECT, resource, id).getBody()));
        }

        public Map<String, Object> create(Map<String, Object> data) {
                return unwrap(UpstreamErrors.call("POST " + resource,
                                () -> restTemplate.exchange("/{resource}", HttpMethod.POST, new HttpEntity<>(wrap(data)),
                                                JSON_OBJECT, resource).getBody()));
        }

        private static Map<String, Object> wrap(Map<String, Object> data) {
                return Collections.singletonMap("data", data);
        }

        private static Map<String, Object> unwrap(Map<String, Object> body) {
                if (body == null || !(body.get("data") instanceof Map)) {
                        return Collections.emptyMap();
                }
                return MAPPER.convertValue(body.get("data"), DATA_TYPE);
        }
}
