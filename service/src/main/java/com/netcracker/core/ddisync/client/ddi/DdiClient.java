package com.netcracker.core.ddisync.client.ddi;

import com.netcracker.core.ddisync.model.AttributeValue;
import com.netcracker.core.ddisync.model.BatchCreateResult;
import com.netcracker.core.ddisync.model.ExtensibleAttributeDefinition;
import com.netcracker.core.ddisync.model.NetworkCreateRequest;
import com.netcracker.core.ddisync.model.NetworkView;
import com.netcracker.core.ddisync.model.TargetNetwork;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous access to the remote DDI store.
 * <p>
 * Futures complete exceptionally with {@link com.netcracker.core.ddisync.exception.AuthenticationException}
 * on 401 and with {@link com.netcracker.core.ddisync.exception.TransientException} once retries are exhausted.
 * The client owns pooled connections and must be closed.
 */
public interface DdiClient extends AutoCloseable {

    /**
     * Probes {@code GET grid}. Completes with {@code false} instead of failing.
     */
    CompletableFuture<Boolean> testConnection();

    CompletableFuture<List<NetworkView>> getNetworkViews();

    /**
     * Drains every page of networks in the view, following {@code next_page_id} until the store stops
     * returning one. A store that never stops paging is a protocol violation and is not guarded against.
     */
    CompletableFuture<List<TargetNetwork>> listNetworksBatched(String networkView);

    CompletableFuture<Optional<TargetNetwork>> getNetworkBySubnet(String subnet, String networkView);

    CompletableFuture<List<TargetNetwork>> searchNetworksByAttribute(String attributeName,
                                                                     String attributeValue,
                                                                     String networkView);

    /**
     * @return reference assigned by the store
     */
    CompletableFuture<String> createNetwork(String networkView, NetworkCreateRequest request);

    /**
     * Null {@code comment} or {@code extattrs} leave the corresponding field untouched.
     */
    CompletableFuture<String> updateNetwork(String ref, String comment, Map<String, AttributeValue> extattrs);

    /**
     * Creates networks in fixed-size concurrent batches with a pause between batches.
     * Individual failures are counted, never propagated; created + failed always equals the input size.
     */
    CompletableFuture<BatchCreateResult> createNetworksBatch(List<NetworkCreateRequest> networks, String networkView);

    CompletableFuture<List<ExtensibleAttributeDefinition>> getExtensibleAttributes();

    CompletableFuture<String> createExtensibleAttribute(ExtensibleAttributeDefinition definition);

    @Override
    void close();
}
