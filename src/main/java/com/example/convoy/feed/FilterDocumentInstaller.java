package com.example.convoy.feed;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.convoy.couch.DocumentStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Publishes the convoy feed filter into the design document, writing only
 * when the stored script differs from the one rendered for the configured
 * procurement method types. Safe to call on every start.
 */
public class FilterDocumentInstaller {

        private static final Logger LOGGER = LoggerFactory.getLogger(FilterDocumentInstaller.class);
        private static final ObjectMapper MAPPER = new ObjectMapper();
        private static final TypeReference<Map<String, Object>> FILTERS_TYPE = new TypeReference<>() {
        };

        private final DocumentStore documentStore;

        public FilterDocumentInstaller(DocumentStore documentStore) {
                this.documentStore = documentStore;
        }

        /**
         * @return whether the filter document had to be written
         */
        public boolean install(List<String> basicTypes, List<String> lokiTypes) {
                String script = FilterScript.render(basicTypes, lokiTypes);

                Map<String, Object> filtersDoc = documentStore.get(FilterScript.FILTER_DOC_ID)
                                .<Map<String, Object>>map(HashMap::new)
                                .orElseGet(FilterDocumentInstaller::emptyFiltersDoc);
                Object rawFilters = filtersDoc.get("filters");
                Map<String, Object> filters = rawFilters instanceof Map
                                ? new HashMap<>(MAPPER.convertValue(rawFilters, FILTERS_TYPE))
                                : new HashMap<>();

                boolean written = false;
                if (!script.equals(filters.get(FilterScript.FILTER_NAME))) {
                        filters.put(FilterScript.FILTER_NAME, script);
                        filtersDoc.put("filters", filters);
                        documentStore.save(filtersDoc);
                        written = true;
                        LOGGER.info("Filter doc '{}' saved.", FilterScript.FILTER_NAME);
                } else {
                        LOGGER.info("Filter doc '{}' exist.", FilterScript.FILTER_NAME);
                }
                LOGGER.info("Added filters doc to db.");
                return written;
        }

        private static Map<String, Object> emptyFiltersDoc() {
                Map<String, Object> doc = new HashMap<>();
                doc.put("_id", FilterScript.FILTER_DOC_ID);
                doc.put("filters", new HashMap<String, Object>());
                return doc;
        }
}
