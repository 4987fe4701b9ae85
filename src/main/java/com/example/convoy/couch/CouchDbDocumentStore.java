package com.example.convoy.couch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.example.convoy.exceptions.ConfigurationException;
import com.example.convoy.exceptions.ResourceNotFoundException;
import com.example.convoy.exceptions.UpstreamErrors;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * {@link DocumentStore} backed by one CouchDB database, spoken to over its
 * HTTP API.
 */
public class CouchDbDocumentStore implements DocumentStore {

        private static final Logger LOGGER = LoggerFactory.getLogger(CouchDbDocumentStore.class);
        private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT = new ParameterizedTypeReference<>() {
        };

        private static final ObjectMapper MAPPER = new ObjectMapper();
        private static final TypeReference<List<Map<String, Object>>> RESULTS_TYPE = new TypeReference<>() {
        };
        private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
        };

        private final RestTemplate restTemplate;
        private final String database;

        public CouchDbDocumentStore(RestTemplate restTemplate, String database) {
                this.restTemplate = restTemplate;
                this.database = database;
        }

        /**
         * Connects to the server and makes sure the database exists, creating
         * it when missing.
         *
         * @throws ConfigurationException when the server cannot be reached or
         *                                the database cannot be created
         */
        public static CouchDbDocumentStore open(CouchDbSettings settings, RestTemplateBuilder builder) {
                RestTemplateBuilder configured = builder.rootUri(settings.baseUrl());
                if (settings.isAuthorized()) {
                        configured = configured.basicAuthentication(settings.getLogin(), settings.getPassword());
                        LOGGER.info("couchdb - authorized");
                } else {
                        LOGGER.info("couchdb without user");
                }
                CouchDbDocumentStore store = new CouchDbDocumentStore(configured.build(), settings.getName());
                store.createDatabaseIfMissing();
                return store;
        }

        void createDatabaseIfMissing() {
                try {
                        restTemplate.exchange("/{db}", HttpMethod.PUT, HttpEntity.EMPTY, JSON_OBJECT, database);
                        LOGGER.info("Created database {}", database);
                } catch (HttpClientErrorException e) {
                        if (e.getStatusCode().value() != HttpStatus.PRECONDITION_FAILED.value()) {
                                LOGGER.error("Database error: {}", e.getMessage());
                                throw new ConfigurationException("Cannot create database " + database, e);
                        }
                        LOGGER.info("Using existing database {}", database);
                } catch (RestClientException e) {
                        LOGGER.error("Database error: {}", e.getMessage());
                        throw new ConfigurationException("Cannot reach database " + database, e);
                }
        }

        @Override
        public Optional<Map<String, Object>> get(String id) {
                try {
                        Map<String, Object> document = UpstreamErrors.call("GET " + id,
                                        () -> restTemplate.exchange("/{db}/{id}", HttpMethod.GET, HttpEntity.EMPTY,
                                                        JSON_OBJECT, database, id).getBody());
                        return Optional.ofNullable(document);
                } catch (ResourceNotFoundException e) {
                        return Optional.empty();
                }
        }

        @Override
        public Map<String, Object> save(Map<String, Object> document) {
                Object id = document.get("_id");
                Map<String, Object> response;
                if (id == null) {
                        response = UpstreamErrors.call("POST document",
                                        () -> restTemplate.exchange("/{db}", HttpMethod.POST,
                                                        new HttpEntity<>(document), JSON_OBJECT, database).getBody());
                        if (response != null) {
                                document.put("_id", response.get("id"));
                        }
                } else {
                        response = UpstreamErrors.call("PUT " + id,
                                        () -> restTemplate.exchange("/{db}/{id}", HttpMethod.PUT,
                                                        new HttpEntity<>(document), JSON_OBJECT, database, id)
                                                        .getBody());
                }
                if (response != null && response.get("rev") != null) {
                        document.put("_rev", response.get("rev"));
                }
                return document;
        }

        @Override
        public ChangesBatch changes(ChangesQuery query) {
                Map<String, Object> response = UpstreamErrors.call("GET _changes since " + query.getSince(),
                                () -> restTemplate.exchange(
                                                "/{db}/_changes?since={since}&limit={limit}&filter={filter}&include_docs={docs}",
                                                HttpMethod.GET, HttpEntity.EMPTY, JSON_OBJECT, database,
                                                query.getSince(), query.getLimit(), query.getFilter(),
                                                query.isIncludeDocs()).getBody());
                if (response == null) {
                        return new ChangesBatch(Collections.emptyList(), query.getSince());
                }

                List<ChangeRow> rows = new ArrayList<>();
                List<Map<String, Object>> results = MAPPER.convertValue(
                                response.getOrDefault("results", Collections.emptyList()), RESULTS_TYPE);
                for (Map<String, Object> result : results) {
                        rows.add(new ChangeRow(String.valueOf(result.get("seq")), (String) result.get("id"),
                                        MAPPER.convertValue(result.get("doc"), DOCUMENT_TYPE)));
                }
                Object lastSeq = response.get("last_seq");
                return new ChangesBatch(rows, lastSeq != null ? String.valueOf(lastSeq) : query.getSince());
        }
}
