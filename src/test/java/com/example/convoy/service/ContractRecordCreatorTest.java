package com.example.convoy.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.example.convoy.bootstrap.ResourceClient;
import com.example.convoy.models.ChangeEvent;

class ContractRecordCreatorTest {

        private ResourceClient contractsClient;
        private ContractRecordCreator creator;

        @BeforeEach
        void setUp() {
                contractsClient = mock(ResourceClient.class);
                creator = new ContractRecordCreator(contractsClient);
        }

        private static Map<String, Object> auction(boolean withContracts) {
                Map<String, Object> doc = new HashMap<>();
                doc.put("_id", "a1");
                doc.put("doc_type", "Auction");
                doc.put("status", "complete");
                doc.put("merchandisingObject", "lot-7");
                doc.put("contractTerms", Map.of("type", "yoke"));
                if (withContracts) {
                        Map<String, Object> first = new HashMap<>();
                        first.put("id", "c0");
                        first.put("contractID", "UA-0");
                        Map<String, Object> last = new HashMap<>();
                        last.put("id", "c1");
                        last.put("contractID", "UA-1");
                        last.put("status", "active");
                        last.put("dateModified", "2018-01-01");
                        last.put("value", Map.of("amount", 100));
                        last.put("dateSigned", null);
                        doc.put("contracts", List.of(first, last));
                }
                return doc;
        }

        @Test
        void testBuildsContractFromLastAuctionContract() {
                ChangeEvent event = new ChangeEvent("1", auction(true));

                Map<String, Object> contract = ContractRecordCreator.makeContract(event, event.getContracts().get(1));

                assertEquals("yoke", contract.get("contractType"));
                assertEquals("a1", contract.get("relatedProcessID"));
                assertEquals("lot-7", contract.get("merchandisingObject"));
                assertEquals("UA-1", contract.get("contractID"));
                assertEquals(Map.of("amount", 100), contract.get("value"));
                assertFalse(contract.containsKey("id"));
                assertFalse(contract.containsKey("status"));
                assertFalse(contract.containsKey("dateModified"));
                assertFalse(contract.containsKey("dateSigned"));
                assertFalse(contract.containsKey("mode"));
        }

        @Test
        void testTestModeAuctionsMakeTestContracts() {
                Map<String, Object> doc = auction(true);
                doc.put("mode", "test");
                ChangeEvent event = new ChangeEvent("1", doc);

                Map<String, Object> contract = ContractRecordCreator.makeContract(event, event.getContracts().get(1));

                assertEquals("test", contract.get("mode"));
        }

        @Test
        void testCreatePostsContractAndReturnsItsId() {
                when(contractsClient.create(anyMap())).thenReturn(Map.of("id", "new-contract"));

                Optional<String> created = creator.create(new ChangeEvent("1", auction(true)));

                assertEquals(Optional.of("new-contract"), created);
                verify(contractsClient).create(anyMap());
        }

        @Test
        void testAuctionWithoutContractsCreatesNothing() {
                Optional<String> created = creator.create(new ChangeEvent("1", auction(false)));

                assertTrue(created.isEmpty());
                verify(contractsClient, never()).create(anyMap());
        }
}
