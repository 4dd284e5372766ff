package com.netcracker.core.ddisync.client.ddi;

import io.vertx.core.http.HttpMethod;

import java.util.LinkedHashMap;
import java.util.Map;

final class WapiRequest {
    private final HttpMethod method;
    private final String endpoint;
    private final Map<String, String> params = new LinkedHashMap<>();
    private Object body;

    private WapiRequest(HttpMethod method, String endpoint) {
        this.method = method;
        this.endpoint = endpoint;
    }

    static WapiRequest get(String endpoint) {
        return new WapiRequest(HttpMethod.GET, endpoint);
    }

    static WapiRequest of(HttpMethod method, String endpoint) {
        return new WapiRequest(method, endpoint);
    }

    WapiRequest param(String name, String value) {
        params.put(name, value);
        return this;
    }

    WapiRequest body(Object body) {
        this.body = body;
        return this;
    }

    HttpMethod method() {
        return method;
    }

    String endpoint() {
        return endpoint;
    }

    Map<String, String> params() {
        return params;
    }

    Object body() {
        return body;
    }
}
