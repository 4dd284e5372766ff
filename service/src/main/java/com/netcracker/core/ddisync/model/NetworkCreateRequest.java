package com.netcracker.core.ddisync.model;

import java.util.Map;

public record NetworkCreateRequest(String subnet, String comment, Map<String, AttributeValue> extattrs) {

    public NetworkCreateRequest {
        extattrs = extattrs == null ? Map.of() : Map.copyOf(extattrs);
    }

    public static NetworkCreateRequest from(NetworkRecord network) {
        return new NetworkCreateRequest(network.subnet(), network.generatedComment(),
                network.isMapped() ? network.mappedAttributes() : Map.of());
    }
}
