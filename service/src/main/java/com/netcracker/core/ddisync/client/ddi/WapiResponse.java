package com.netcracker.core.ddisync.client.ddi;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Successful store response. For 201 the body is replaced by the newly assigned reference.
 */
record WapiResponse(int statusCode, JsonNode body, String ref) {

    static WapiResponse ok(JsonNode body) {
        return new WapiResponse(200, body, null);
    }

    static WapiResponse created(String ref) {
        return new WapiResponse(201, null, ref);
    }
}
