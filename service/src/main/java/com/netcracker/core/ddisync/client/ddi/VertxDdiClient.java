package com.netcracker.core.ddisync.client.ddi;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.netcracker.core.ddisync.configuration.DdiClientSettings;
import com.netcracker.core.ddisync.configuration.DdiTargetConfig;
import com.netcracker.core.ddisync.exception.AuthenticationException;
import com.netcracker.core.ddisync.exception.DdiSyncException;
import com.netcracker.core.ddisync.exception.TransientException;
import com.netcracker.core.ddisync.model.AttributeValue;
import com.netcracker.core.ddisync.model.BatchCreateResult;
import com.netcracker.core.ddisync.model.ExtensibleAttributeDefinition;
import com.netcracker.core.ddisync.model.NetworkCreateRequest;
import com.netcracker.core.ddisync.model.NetworkView;
import com.netcracker.core.ddisync.model.TargetNetwork;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpMethod;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link DdiClient} over the Vert.x {@link WebClient}.
 * <p>
 * Every call takes a throttle token, then a connection slot, then is dispatched. 200 returns the body,
 * 201 the new reference, 401 fails at once; anything else, transport errors and timeouts included,
 * is retried up to {@code maxAttempts} with a growing delay. Each attempt is bounded by {@code requestTimeout}
 * in total, not only between received chunks.
 */
@Slf4j
public final class VertxDdiClient implements DdiClient {
    static final String NETWORK_FIELDS = "network,comment,extattrs";
    static final String VIEW_FIELDS = "name,comment";
    static final String ATTRIBUTE_FIELDS = "name,type,comment";
    private static final String NETWORK_PREFIX = "network/";

    private final Vertx vertx;
    private final DdiTargetConfig target;
    private final DdiClientSettings settings;
    private final TokenBucket throttle;
    private final BackoffStrategy backoff;
    private final ConnectionLimiter connectionLimiter;
    private final String baseUrl;
    private final String authorization;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile WebClient webClient;

    public VertxDdiClient(Vertx vertx, DdiTargetConfig target, DdiClientSettings settings) {
        this(vertx, target, settings, new TokenBucket(settings.getRateLimitPerSecond()), new LinearBackoff());
    }

    VertxDdiClient(Vertx vertx,
                   DdiTargetConfig target,
                   DdiClientSettings settings,
                   TokenBucket throttle,
                   BackoffStrategy backoff) {
        this.vertx = Objects.requireNonNull(vertx, "vertx");
        this.target = Objects.requireNonNull(target, "target");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.throttle = Objects.requireNonNull(throttle, "throttle");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.connectionLimiter = new ConnectionLimiter(settings.getMaxConnections());
        this.baseUrl = target.baseUrl();
        this.authorization = "Basic " + Base64.getEncoder().encodeToString(
                (target.getUsername() + ":" + target.getPassword()).getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public CompletableFuture<Boolean> testConnection() {
        return execute(WapiRequest.get("grid"))
                .handle((response, err) -> {
                    if (err != null) {
                        log.debug("Connectivity probe to '{}' failed", baseUrl, unwrap(err));
                        return false;
                    }
                    return true;
                });
    }

    @Override
    public CompletableFuture<List<NetworkView>> getNetworkViews() {
        return execute(WapiRequest.get("networkview").param("_return_fields", VIEW_FIELDS))
                .thenApply(response -> WapiResponseParser.networkViews(response.body()));
    }

    @Override
    public CompletableFuture<List<TargetNetwork>> listNetworksBatched(String networkView) {
        return fetchPage(networkView, null, new ArrayList<>(), 1);
    }

    private CompletableFuture<List<TargetNetwork>> fetchPage(String networkView,
                                                             String pageId,
                                                             List<TargetNetwork> accumulated,
                                                             int pageNumber) {
        WapiRequest request = WapiRequest.get("network")
                .param("network_view", networkView)
                .param("_return_fields", NETWORK_FIELDS)
                .param("_max_results", String.valueOf(settings.getPageSize()))
                .param("_paging", "1")
                .param("_return_as_object", "1");
        if (pageId != null) {
            request.param("_page_id", pageId);
        }
        return execute(request).thenCompose(response -> {
            WapiResponseParser.Page page = WapiResponseParser.page(response.body());
            accumulated.addAll(page.networks());
            log.debug("Fetched page {} of view '{}': {} networks, next page: {}",
                    pageNumber, networkView, page.networks().size(), page.nextPageId() != null);
            if (page.nextPageId() == null) {
                return CompletableFuture.completedFuture(Collections.unmodifiableList(accumulated));
            }
            return fetchPage(networkView, page.nextPageId(), accumulated, pageNumber + 1);
        });
    }

    @Override
    public CompletableFuture<Optional<TargetNetwork>> getNetworkBySubnet(String subnet, String networkView) {
        WapiRequest request = WapiRequest.get("network")
                .param("network", subnet)
                .param("network_view", networkView)
                .param("_return_fields", NETWORK_FIELDS);
        return execute(request).thenApply(response ->
                WapiResponseParser.networks(response.body()).stream().findFirst());
    }

    @Override
    public CompletableFuture<List<TargetNetwork>> searchNetworksByAttribute(String attributeName,
                                                                            String attributeValue,
                                                                            String networkView) {
        WapiRequest request = WapiRequest.get("network")
                .param("network_view", networkView)
                .param("_return_fields", NETWORK_FIELDS)
                .param("*" + attributeName, attributeValue);
        return execute(request).thenApply(response -> WapiResponseParser.networks(response.body()));
    }

    @Override
    public CompletableFuture<String> createNetwork(String networkView, NetworkCreateRequest network) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("network", network.subnet());
        body.put("network_view", networkView);
        body.put("comment", network.comment() == null ? "" : network.comment());
        if (!network.extattrs().isEmpty()) {
            body.put("extattrs", network.extattrs());
        }
        return execute(WapiRequest.of(HttpMethod.POST, "network").body(body)).thenApply(VertxDdiClient::refOf);
    }

    @Override
    public CompletableFuture<String> updateNetwork(String ref, String comment, Map<String, AttributeValue> extattrs) {
        Objects.requireNonNull(ref, "ref");
        Map<String, Object> body = new LinkedHashMap<>();
        if (comment != null) {
            body.put("comment", comment);
        }
        if (extattrs != null) {
            body.put("extattrs", extattrs);
        }
        String endpoint = ref.startsWith(NETWORK_PREFIX) ? ref : NETWORK_PREFIX + ref;
        return execute(WapiRequest.of(HttpMethod.PUT, endpoint).body(body)).thenApply(response -> {
            String updatedRef = refOf(response);
            return updatedRef.isEmpty() ? ref : updatedRef;
        });
    }

    @Override
    public CompletableFuture<BatchCreateResult> createNetworksBatch(List<NetworkCreateRequest> networks,
                                                                    String networkView) {
        List<NetworkCreateRequest> snapshot = List.copyOf(networks);
        BatchAccumulator accumulator = new BatchAccumulator();
        return runBatch(snapshot, networkView, 0, accumulator).thenApply(v -> {
            BatchCreateResult result = accumulator.result();
            log.info("Batch create into view '{}' finished: created={}, failed={}, total={}",
                    networkView, result.createdCount(), result.failedCount(), snapshot.size());
            return result;
        });
    }

    private CompletableFuture<Void> runBatch(List<NetworkCreateRequest> networks,
                                             String networkView,
                                             int from,
                                             BatchAccumulator accumulator) {
        if (from >= networks.size()) {
            return CompletableFuture.completedFuture(null);
        }
        int to = Math.min(from + settings.getBatchSize(), networks.size());
        List<CompletableFuture<Void>> inFlight = new ArrayList<>(to - from);
        for (NetworkCreateRequest network : networks.subList(from, to)) {
            CompletableFuture<String> created;
            try {
                created = createNetwork(networkView, network);
            } catch (RuntimeException e) {
                created = CompletableFuture.failedFuture(e);
            }
            inFlight.add(created.handle((ref, err) -> {
                if (err == null) {
                    accumulator.created();
                } else {
                    Throwable cause = unwrap(err);
                    log.warn("Failed to create network '{}' in view '{}'", network.subnet(), networkView, cause);
                    accumulator.failed("Failed to create network %s: %s".formatted(network.subnet(), cause.getMessage()));
                }
                return null;
            }));
        }
        log.debug("Dispatched batch [{}, {}) of {} networks into view '{}'", from, to, networks.size(), networkView);
        return CompletableFuture.allOf(inFlight.toArray(CompletableFuture[]::new))
                .thenCompose(v -> to < networks.size() ? delay(settings.getBatchPause()) : CompletableFuture.completedFuture(null))
                .thenCompose(v -> runBatch(networks, networkView, to, accumulator));
    }

    @Override
    public CompletableFuture<List<ExtensibleAttributeDefinition>> getExtensibleAttributes() {
        return execute(WapiRequest.get("extensibleattributedef").param("_return_fields", ATTRIBUTE_FIELDS))
                .thenApply(response -> WapiResponseParser.attributeDefinitions(response.body()));
    }

    @Override
    public CompletableFuture<String> createExtensibleAttribute(ExtensibleAttributeDefinition definition) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", definition.name());
        body.put("type", definition.type());
        body.put("comment", definition.comment() == null ? "" : definition.comment());
        return execute(WapiRequest.of(HttpMethod.POST, "extensibleattributedef").body(body))
                .thenApply(VertxDdiClient::refOf);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        WebClient client = webClient;
        if (client != null) {
            client.close();
        }
        log.info("DDI client for '{}' closed", baseUrl);
    }

    public boolean isClosed() {
        return closed.get();
    }

    CompletableFuture<WapiResponse> execute(WapiRequest request) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("DDI client is closed"));
        }
        CompletableFuture<WapiResponse> result = new CompletableFuture<>();
        long waitNanos = throttle.reserve();
        if (waitNanos > 0) {
            log.debug("Throttling {} {} for {} ms", request.method(), request.endpoint(), TimeUnit.NANOSECONDS.toMillis(waitNanos));
            vertx.setTimer(Math.max(1, TimeUnit.NANOSECONDS.toMillis(waitNanos)), id -> attempt(request, 1, result));
        } else {
            attempt(request, 1, result);
        }
        return result;
    }

    private void attempt(WapiRequest request, int attempt, CompletableFuture<WapiResponse> result) {
        if (closed.get()) {
            result.completeExceptionally(new IllegalStateException("DDI client is closed"));
            return;
        }
        connectionLimiter.acquire().thenRun(() -> {
            AtomicBoolean settled = new AtomicBoolean(false);
            long timeoutMillis = settings.getRequestTimeout().toMillis();
            long timerId = vertx.setTimer(timeoutMillis, id -> {
                if (settled.compareAndSet(false, true)) {
                    connectionLimiter.release();
                    retryOrFail(request, attempt, TransientException.NO_STATUS, null,
                            new TimeoutException("Request timed out after " + timeoutMillis + " ms"), result);
                }
            });
            try {
                send(request).onComplete(ar -> {
                    if (!settled.compareAndSet(false, true)) {
                        log.debug("Discarding late response for {} {}", request.method(), request.endpoint());
                        return;
                    }
                    vertx.cancelTimer(timerId);
                    connectionLimiter.release();
                    if (ar.succeeded()) {
                        try {
                            handleResponse(request, attempt, ar.result(), result);
                        } catch (RuntimeException e) {
                            log.error("Unreadable response for {} {}", request.method(), request.endpoint(), e);
                            result.completeExceptionally(e);
                        }
                    } else {
                        retryOrFail(request, attempt, TransientException.NO_STATUS, null, ar.cause(), result);
                    }
                });
            } catch (RuntimeException e) {
                if (settled.compareAndSet(false, true)) {
                    vertx.cancelTimer(timerId);
                    connectionLimiter.release();
                    retryOrFail(request, attempt, TransientException.NO_STATUS, null, e, result);
                }
            }
        });
    }

    private void handleResponse(WapiRequest request,
                                int attempt,
                                HttpResponse<Buffer> response,
                                CompletableFuture<WapiResponse> result) {
        int status = response.statusCode();
        switch (status) {
            case 200 -> result.complete(WapiResponse.ok(WapiResponseParser.readBody(response.bodyAsString())));
            case 201 -> result.complete(WapiResponse.created(
                    WapiResponseParser.readRef(response.getHeader("Location"), response.bodyAsString())));
            case 401 -> {
                log.error("Authentication failed for {} {} as '{}'", request.method(), request.endpoint(), target.getUsername());
                result.completeExceptionally(new AuthenticationException(
                        "Authentication failed for user '%s' at %s".formatted(target.getUsername(), baseUrl)));
            }
            default -> retryOrFail(request, attempt, status, response.bodyAsString(), null, result);
        }
    }

    private void retryOrFail(WapiRequest request,
                             int attempt,
                             int status,
                             String body,
                             Throwable cause,
                             CompletableFuture<WapiResponse> result) {
        String reason = status == TransientException.NO_STATUS
                ? "Connection error: " + (cause != null ? cause.getMessage() : "unknown")
                : "Request failed: %d - %s".formatted(status, body);
        if (attempt >= settings.getMaxAttempts()) {
            log.warn("{} {} failed after {} attempts: {}", request.method(), request.endpoint(), attempt, reason);
            result.completeExceptionally(new TransientException(reason, status, body, cause));
            return;
        }
        Duration delay = backoff.next(attempt, settings.getRetryDelay());
        log.warn("{} {} failed on attempt {}/{}. Retrying in {}. Cause: {}",
                request.method(), request.endpoint(), attempt, settings.getMaxAttempts(), delay, reason);
        if (delay.isZero()) {
            attempt(request, attempt + 1, result);
        } else {
            vertx.setTimer(Math.max(1, delay.toMillis()), id -> attempt(request, attempt + 1, result));
        }
    }

    private io.vertx.core.Future<HttpResponse<Buffer>> send(WapiRequest request) {
        HttpRequest<Buffer> httpRequest = webClient()
                .requestAbs(request.method(), baseUrl + request.endpoint())
                .putHeader(HttpHeaders.AUTHORIZATION.toString(), authorization)
                .putHeader(HttpHeaders.ACCEPT.toString(), "application/json")
                .timeout(settings.getRequestTimeout().toMillis());
        request.params().forEach(httpRequest::addQueryParam);
        log.debug("Dispatching {} {} params={}", request.method(), request.endpoint(), request.params());
        if (request.body() == null) {
            return httpRequest.send();
        }
        try {
            byte[] payload = WapiResponseParser.OBJECT_MAPPER.writeValueAsBytes(request.body());
            return httpRequest
                    .putHeader(HttpHeaders.CONTENT_TYPE.toString(), "application/json")
                    .sendBuffer(Buffer.buffer(payload));
        } catch (JsonProcessingException e) {
            throw new DdiSyncException("Failed to serialize request body for " + request.endpoint(), e);
        }
    }

    private WebClient webClient() {
        WebClient client = webClient;
        if (client == null) {
            synchronized (this) {
                client = webClient;
                if (client == null) {
                    client = WebClient.create(vertx, webClientOptions(target, settings));
                    webClient = client;
                    log.info("DDI connection pool opened for '{}' (per-host={}, total={})",
                            baseUrl, settings.getMaxConnectionsPerHost(), settings.getMaxConnections());
                }
            }
        }
        return client;
    }

    static WebClientOptions webClientOptions(DdiTargetConfig target, DdiClientSettings settings) {
        return new WebClientOptions()
                .setMaxPoolSize(settings.getMaxConnectionsPerHost())
                .setConnectTimeout((int) settings.getConnectTimeout().toMillis())
                .setKeepAlive(true)
                .setTrustAll(target.isTrustAll())
                .setVerifyHost(!target.isTrustAll())
                .setUserAgent("ddi-sync-manager");
    }

    private CompletableFuture<Void> delay(Duration duration) {
        if (duration.isZero()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> done = new CompletableFuture<>();
        vertx.setTimer(Math.max(1, duration.toMillis()), id -> done.complete(null));
        return done;
    }

    private static String refOf(WapiResponse response) {
        if (response.ref() != null) {
            return response.ref();
        }
        JsonNode body = response.body();
        if (body != null && body.isTextual()) {
            return body.asText();
        }
        return "";
    }

    static Throwable unwrap(Throwable err) {
        return err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
    }

    private static final class BatchAccumulator {
        private int created;
        private int failed;
        private final List<String> errors = new ArrayList<>();

        synchronized void created() {
            created++;
        }

        synchronized void failed(String error) {
            failed++;
            errors.add(error);
        }

        synchronized BatchCreateResult result() {
            return new BatchCreateResult(created, failed, errors);
        }
    }
}
