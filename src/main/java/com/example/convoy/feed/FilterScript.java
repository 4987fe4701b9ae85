package com.example.convoy.feed;

import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * The CouchDB filter function that lets through auctions ready for a
 * contract. Basic-track auctions pass on {@code pending.verification} and on
 * a terminal status with a merchandising object; loki-track auctions pass
 * only on the latter.
 */
public final class FilterScript {

        public static final String FILTER_DOC_ID = "_design/auction_filters";
        public static final String FILTER_NAME = "convoy_feed";
        public static final String FILTER_REFERENCE = "auction_filters/" + FILTER_NAME;

        private static final ObjectMapper MAPPER = new ObjectMapper();

        private static final String TEMPLATE = "\n"
                        + "function(doc, req) {\n"
                        + "    if (doc.doc_type == 'Auction') {\n"
                        + "\n"
                        + "        // basic lots auctions\n"
                        + "        if (%s.indexOf(doc.procurementMethodType) >= 0) {\n"
                        + "\n"
                        + "            if (doc.status == 'pending.verification') {\n"
                        + "                return true;\n"
                        + "            } else if (['complete', 'cancelled', 'unsuccessful'].indexOf(doc.status) >= 0 && doc.merchandisingObject) {\n"
                        + "                return true;\n"
                        + "            };\n"
                        + "\n"
                        + "        // loki lots auctions\n"
                        + "        } else if (%s.indexOf(doc.procurementMethodType) >= 0) {\n"
                        + "\n"
                        + "            if (['complete', 'cancelled', 'unsuccessful'].indexOf(doc.status) >= 0 && doc.merchandisingObject) {\n"
                        + "                return true;\n"
                        + "            };\n"
                        + "\n"
                        + "        };\n"
                        + "\n"
                        + "    }\n"
                        + "    return false;\n"
                        + "}\n";

        private FilterScript() {
        }

        public static String render(List<String> basicTypes, List<String> lokiTypes) {
                return String.format(TEMPLATE, jsonArray(basicTypes), jsonArray(lokiTypes));
        }

        private static String jsonArray(List<String> values) {
                try {
                        return MAPPER.writeValueAsString(values == null ? List.of() : values);
                } catch (JsonProcessingException e) {
                        throw new IllegalArgumentException("Cannot render procurement method types " + values, e);
                }
        }
}
