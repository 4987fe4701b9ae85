package com.example.convoy.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * An auction document delivered by the change feed, together with the feed
 * sequence it was observed at. The document itself stays a field map; the
 * accessors below cover the fields the feed and processing rely on.
 */
@Getter
@EqualsAndHashCode(of = {"id", "seq"})
@ToString(of = {"id", "seq", "docType", "status", "procurementMethodType"})
public class ChangeEvent {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> OBJECT_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<Map<String, Object>>> OBJECT_LIST_TYPE = new TypeReference<>() {
    };

    private final String seq;
    private final String id;
    private final String docType;
    private final String procurementMethodType;
    private final AuctionStatus status;
    private final String rawStatus;
    private final Map<String, Object> document;

    public ChangeEvent(String seq, Map<String, Object> document) {
        this.seq = seq;
        this.document = Collections.unmodifiableMap(new LinkedHashMap<>(document));
        this.id = (String) (document.containsKey("id") ? document.get("id") : document.get("_id"));
        this.docType = (String) document.get("doc_type");
        this.procurementMethodType = (String) document.get("procurementMethodType");
        this.rawStatus = (String) document.get("status");
        this.status = AuctionStatus.fromValue(rawStatus);
    }

    public Object get(String field) {
        return document.get(field);
    }

    public boolean has(String field) {
        return document.containsKey(field);
    }

    public Object getMode() {
        return document.get("mode");
    }

    public Object getMerchandisingObject() {
        return document.get("merchandisingObject");
    }

    public Map<String, Object> getContractTerms() {
        Object terms = document.get("contractTerms");
        return terms instanceof Map ? MAPPER.convertValue(terms, OBJECT_TYPE) : Collections.emptyMap();
    }

    public List<Map<String, Object>> getContracts() {
        Object contracts = document.get("contracts");
        return contracts instanceof List ? MAPPER.convertValue(contracts, OBJECT_LIST_TYPE) : Collections.emptyList();
    }
}
