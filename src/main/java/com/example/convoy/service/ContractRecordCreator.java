package com.example.convoy.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.convoy.bootstrap.ResourceClient;
import com.example.convoy.models.ChangeEvent;

/**
 * Registers a contract for an auction, built from the auction's contract
 * terms and its last contract.
 */
public class ContractRecordCreator implements DerivedRecordCreator {

        private static final Logger LOGGER = LoggerFactory.getLogger(ContractRecordCreator.class);

        // owned by the auction's contract, not by the registered one
        private static final Set<String> SKIPPED_CONTRACT_FIELDS = Set.of("id", "status", "date", "dateModified");

        private final ResourceClient contractsClient;

        public ContractRecordCreator(ResourceClient contractsClient) {
                this.contractsClient = contractsClient;
        }

        @Override
        public Optional<String> create(ChangeEvent auction) {
                List<Map<String, Object>> contracts = auction.getContracts();
                if (contracts.isEmpty()) {
                        LOGGER.info("Auction {} ({}) has no contracts, nothing to register", auction.getId(),
                                        auction.getRawStatus());
                        return Optional.empty();
                }

                Map<String, Object> contract = makeContract(auction, contracts.get(contracts.size() - 1));
                Map<String, Object> created = contractsClient.create(contract);
                String contractId = (String) created.get("id");
                LOGGER.info("Created contract {} for auction {}", contractId, auction.getId());
                return Optional.ofNullable(contractId);
        }

        static Map<String, Object> makeContract(ChangeEvent auction, Map<String, Object> lastContract) {
                Map<String, Object> contract = new LinkedHashMap<>();
                contract.put("contractType", auction.getContractTerms().get("type"));
                contract.put("relatedProcessID", auction.getId());
                if (auction.has("merchandisingObject")) {
                        contract.put("merchandisingObject", auction.getMerchandisingObject());
                }
                if (auction.getMode() != null) {
                        contract.put("mode", "test");
                }
                for (Map.Entry<String, Object> field : lastContract.entrySet()) {
                        if (field.getValue() != null && !SKIPPED_CONTRACT_FIELDS.contains(field.getKey())) {
                                contract.put(field.getKey(), field.getValue());
                        }
                }
                return contract;
        }
}
