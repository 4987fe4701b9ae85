package com.example.convoy.bootstrap;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.example.convoy.couch.DocumentStore;
import com.example.convoy.mapping.DedupStore;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Everything {@link ClientBootstrap} created, keyed the way processing looks
 * resource clients up ({@code contracts_client}, {@code auctions_client}, ...).
 */
@Getter
@AllArgsConstructor
public class BootstrappedClients {

    private final Map<String, ResourceClient> resourceClients;
    private final DocumentStore documentStore;
    private final DedupStore dedupStore;
    private final List<BootstrapResult> results;

    public Optional<ResourceClient> resourceClient(String resourceType) {
        return Optional.ofNullable(resourceClients.get(ResourceClient.clientName(resourceType)));
    }
}
