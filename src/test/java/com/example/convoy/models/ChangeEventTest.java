package com.example.convoy.models;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

class ChangeEventTest {

        @Test
        void testReadsAuctionFields() {
                Map<String, Object> doc = new HashMap<>();
                doc.put("_id", "a1");
                doc.put("doc_type", "Auction");
                doc.put("procurementMethodType", "rubble");
                doc.put("status", "pending.verification");

                ChangeEvent event = new ChangeEvent("5", doc);

                assertEquals("a1", event.getId());
                assertEquals("5", event.getSeq());
                assertEquals("Auction", event.getDocType());
                assertEquals("rubble", event.getProcurementMethodType());
                assertEquals(AuctionStatus.PENDING_VERIFICATION, event.getStatus());
                assertTrue(event.getContracts().isEmpty());
                assertTrue(event.getContractTerms().isEmpty());
        }

        @Test
        void testPublicIdWinsOverDocumentId() {
                Map<String, Object> doc = new HashMap<>();
                doc.put("_id", "internal");
                doc.put("id", "public");

                assertEquals("public", new ChangeEvent("1", doc).getId());
        }

        @Test
        void testUnknownStatusAndImmutableDocument() {
                Map<String, Object> doc = new HashMap<>();
                doc.put("_id", "a1");
                doc.put("status", "active.tendering");

                ChangeEvent event = new ChangeEvent("1", doc);
                doc.put("status", "complete");

                assertEquals(AuctionStatus.UNKNOWN, event.getStatus());
                assertEquals("active.tendering", event.get("status"));
                assertThrows(UnsupportedOperationException.class, () -> event.getDocument().put("x", 1));
        }
}
