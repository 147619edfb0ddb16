package com.waymark.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.github.benmanes.caffeine.cache.Ticker;
import com.waymark.cache.CacheResult;
import com.waymark.cache.ResponseCache;
import com.waymark.exception.ApiException;
import com.waymark.exception.ClientErrorException;
import com.waymark.exception.ClientValidationException;
import com.waymark.exception.NotFoundException;
import com.waymark.exception.RequestTimeoutException;
import com.waymark.exception.ServerErrorException;
import com.waymark.exception.TransportException;
import com.waymark.exception.UnexpectedApiException;
import com.waymark.model.dto.CacheStatistics;
import com.waymark.ratelimit.RateLimiter;
import com.waymark.retry.RetryExecutor;
import io.netty.channel.ConnectTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * HTTP client for one remote API with response caching, rate limiting and retries.
 *
 * <p>GET responses are served from the {@link ResponseCache} when possible. Every network
 * attempt first takes a token from the {@link RateLimiter}. Server errors, timeouts and
 * connection failures are retried with exponential backoff up to {@code maxRetries} total
 * attempts; other 4xx responses and unexpected failures fail immediately.
 *
 * <p>The underlying connection is opened lazily on first use, exactly once, and reused
 * until {@link #close()}.
 */
@Slf4j
public class ResilientClient implements AutoCloseable {

    private static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https");

    private final ClientSettings settings;
    private final String baseUrl;
    private final HttpConnectionFactory connectionFactory;
    private final ObjectMapper objectMapper;
    private final RateLimiter rateLimiter;
    private final ResponseCache cache;
    private final RetryExecutor retryExecutor;

    private final ReentrantLock connectionLock = new ReentrantLock();
    private volatile HttpConnection connection;
    private volatile ConnectionState connectionState = ConnectionState.UNSET;

    public ResilientClient(ClientSettings settings) {
        this(settings, JsonPayloads.newObjectMapper());
    }

    public ResilientClient(ClientSettings settings, ObjectMapper objectMapper) {
        this(settings, new ReactorHttpConnectionFactory(objectMapper), objectMapper);
    }

    /**
     * Use a caller-owned {@link WebClient}; {@link #close()} leaves it untouched.
     */
    public ResilientClient(ClientSettings settings, WebClient webClient) {
        this(settings, HttpConnectionFactory.injected(webClient), JsonPayloads.newObjectMapper());
    }

    public ResilientClient(ClientSettings settings, HttpConnectionFactory connectionFactory,
                           ObjectMapper objectMapper) {
        this.baseUrl = validateBaseUrl(settings.getBaseUrl());
        settings.validate();
        this.settings = settings.toBuilder().baseUrl(baseUrl).build();
        this.connectionFactory = connectionFactory;
        this.objectMapper = objectMapper;
        this.rateLimiter = new RateLimiter(settings.getRateLimitCallsPerPeriod(),
                settings.getRateLimitPeriod(), settings.getBurstMultiplier());
        this.retryExecutor = new RetryExecutor(settings.getMaxRetries(), settings.getBackoff());

        if (settings.isCacheEnabled()) {
            this.cache = new ResponseCache(settings.getCacheTtl(), settings.getCacheMaxSize(),
                    settings.getCleanupInterval(), Ticker.systemTicker(),
                    objectMapper);
            this.cache.startCleanup();
        } else {
            this.cache = null;
        }

        log.info("HTTP client initialized: baseUrl={} timeout={} maxRetries={} rateLimit={}/{} cacheEnabled={}",
                baseUrl, settings.getTimeout(), settings.getMaxRetries(),
                settings.getRateLimitCallsPerPeriod(), settings.getRateLimitPeriod(), settings.isCacheEnabled());
    }

    public Mono<JsonNode> get(String endpoint) {
        return get(endpoint, Map.of(), false);
    }

    public Mono<JsonNode> get(String endpoint, Map<String, ?> params) {
        return get(endpoint, params, false);
    }

    public Mono<JsonNode> get(String endpoint, Map<String, ?> params, boolean skipCache) {
        return request(ApiRequest.builder()
                .method(HttpMethod.GET)
                .endpoint(endpoint)
                .params(params)
                .skipCache(skipCache)
                .build());
    }

    public Mono<JsonNode> post(String endpoint, Object jsonBody) {
        return request(ApiRequest.builder().method(HttpMethod.POST).endpoint(endpoint).jsonBody(jsonBody).build());
    }

    public Mono<JsonNode> put(String endpoint, Object jsonBody) {
        return request(ApiRequest.builder().method(HttpMethod.PUT).endpoint(endpoint).jsonBody(jsonBody).build());
    }

    public Mono<JsonNode> patch(String endpoint, Object jsonBody) {
        return request(ApiRequest.builder().method(HttpMethod.PATCH).endpoint(endpoint).jsonBody(jsonBody).build());
    }

    public Mono<JsonNode> delete(String endpoint) {
        return request(ApiRequest.of(HttpMethod.DELETE, endpoint));
    }

    /**
     * Execute a request with caching, rate limiting and retries.
     *
     * @return the decoded payload; fails with an {@link ApiException} subtype
     */
    public Mono<JsonNode> request(ApiRequest request) {
        return Mono.defer(() -> {
            if (connectionState == ConnectionState.CLOSED) {
                return Mono.error(new IllegalStateException("Client is closed: " + baseUrl));
            }
            if (request.getJsonBody() != null && request.getFormData() != null && !request.getFormData().isEmpty()) {
                return Mono.error(new IllegalArgumentException("A request carries either a JSON body or form data, not both"));
            }

            String url = buildUrl(request.getEndpoint());
            Map<String, ?> params = request.getParams() != null ? request.getParams() : Map.of();
            HttpHeaders headers = buildHeaders(request.getHeaders());

            boolean cacheable = HttpMethod.GET.equals(request.getMethod()) && cache != null;
            String cacheKey = cacheable ? cache.generateKey(url, params) : null;
            if (cacheable && !request.isSkipCache()) {
                CacheResult cached = cache.get(cacheKey);
                if (cached.isHit()) {
                    log.debug("Cache hit: url={} params={}", url, params);
                    JsonNode payload = cached.valueAs();
                    // Callers get their own copy; the cached tree is never handed out.
                    JsonNode copy = payload != null ? payload.deepCopy() : NullNode.getInstance();
                    return Mono.just(copy);
                }
            }

            URI uri = buildUri(url, params);
            long startNanos = System.nanoTime();
            return retryExecutor.execute(request.getMethod().name() + " " + url,
                            attempt -> executeAttempt(request, uri, headers, attempt, startNanos),
                            ResilientClient::isRetryable)
                    .doOnNext(payload -> {
                        if (cacheable) {
                            cache.set(cacheKey, payload.deepCopy());
                        }
                        log.debug("Request successful: method={} url={}", request.getMethod().name(), url);
                    });
        });
    }

    /**
     * Release the connection if this client opened it, and stop the cache sweep.
     * Further requests fail; calling this again has no effect.
     */
    @Override
    public void close() {
        HttpConnection current;
        connectionLock.lock();
        try {
            if (connectionState == ConnectionState.CLOSED) {
                return;
            }
            current = connection;
            connection = null;
            connectionState = ConnectionState.CLOSED;
        } finally {
            connectionLock.unlock();
        }

        if (current != null) {
            current.close();
        }
        if (cache != null) {
            cache.close();
        }
        log.debug("HTTP client closed: baseUrl={}", baseUrl);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public ClientSettings getSettings() {
        return settings;
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public Optional<ResponseCache> getCache() {
        return Optional.ofNullable(cache);
    }

    public Optional<CacheStatistics> getCacheStats() {
        return getCache().map(ResponseCache::getStats);
    }

    public ConnectionState getConnectionState() {
        return connectionState;
    }

    HttpConnection connection() {
        HttpConnection current = connection;
        if (current != null) {
            return current;
        }

        connectionLock.lock();
        try {
            if (connectionState == ConnectionState.CLOSED) {
                throw new IllegalStateException("Client is closed: " + baseUrl);
            }
            if (connection == null) {
                connectionState = ConnectionState.INITIALIZING;
                try {
                    connection = connectionFactory.open(settings);
                } catch (RuntimeException e) {
                    connectionState = ConnectionState.UNSET;
                    throw e;
                }
                connectionState = ConnectionState.READY;
                log.debug("HTTP connection ready: baseUrl={} owned={}", baseUrl, connection.isOwned());
            }
            return connection;
        } finally {
            connectionLock.unlock();
        }
    }

    private Mono<JsonNode> executeAttempt(ApiRequest request, URI uri, HttpHeaders headers,
                                          int attempt, long startNanos) {
        return rateLimiter.acquire()
                .then(Mono.defer(() -> {
                    log.debug("Making request: method={} url={} hasBody={} attempt={}",
                            request.getMethod().name(), uri, request.hasBody(), attempt + 1);

                    WebClient.RequestBodySpec spec = connection().getWebClient()
                            .method(request.getMethod())
                            .uri(uri)
                            .headers(h -> h.putAll(headers));

                    return withBody(spec, request)
                            .exchangeToMono(response -> readResponse(response, attempt, startNanos))
                            .timeout(settings.getTimeout());
                }))
                .onErrorMap(error -> !(error instanceof ApiException),
                        error -> classify(error, attempt, startNanos));
    }

    private WebClient.RequestHeadersSpec<?> withBody(WebClient.RequestBodySpec spec, ApiRequest request) {
        if (request.getJsonBody() != null) {
            return spec.contentType(MediaType.APPLICATION_JSON).bodyValue(request.getJsonBody());
        }
        if (request.getFormData() != null && !request.getFormData().isEmpty()) {
            MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
            request.getFormData().forEach(form::add);
            return spec.body(BodyInserters.fromFormData(form));
        }
        return spec;
    }

    private Mono<JsonNode> readResponse(ClientResponse response, int attempt, long startNanos) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> {
                    if (status < 400) {
                        return Mono.just(JsonPayloads.parse(objectMapper, body));
                    }
                    return Mono.error(statusFailure(status, body, attempt, startNanos));
                });
    }

    private ApiException statusFailure(int status, String body, int attempt, long startNanos) {
        String excerpt = JsonPayloads.excerpt(body);
        Duration elapsed = elapsedSince(startNanos);
        if (status == 404) {
            return new NotFoundException(excerpt, attempt + 1, elapsed);
        }
        if (status < 500) {
            return new ClientErrorException(status, excerpt, attempt + 1, elapsed);
        }
        return new ServerErrorException(status, excerpt, attempt + 1, elapsed);
    }

    private ApiException classify(Throwable error, int attempt, long startNanos) {
        Duration elapsed = elapsedSince(startNanos);
        if (isTimeout(error)) {
            return new RequestTimeoutException(settings.getTimeout(), attempt + 1, elapsed, error);
        }
        if (error instanceof WebClientRequestException || error instanceof IOException) {
            Throwable root = error.getCause() != null ? error.getCause() : error;
            return new TransportException(String.valueOf(root.getMessage()), attempt + 1, elapsed, error);
        }
        log.error("Unexpected error in request: baseUrl={} attempt={}", baseUrl, attempt + 1, error);
        return new UnexpectedApiException(attempt + 1, elapsed, error);
    }

    private static boolean isTimeout(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof TimeoutException
                    || current instanceof SocketTimeoutException
                    || current instanceof io.netty.handler.timeout.TimeoutException
                    || current instanceof ConnectTimeoutException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    private static boolean isRetryable(Throwable error) {
        return error instanceof ApiException && ((ApiException) error).isRetryable();
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private String buildUrl(String endpoint) {
        String path = endpoint == null ? "" : endpoint;
        if (!path.startsWith("/")) {
            path = "/" + path;
        }
        return baseUrl + path;
    }

    /**
     * Query values are expanded as URI variables, so every reserved character in them,
     * {@code +} included, is percent-encoded.
     */
    private URI buildUri(String url, Map<String, ?> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(url);
        Map<String, Object> values = new HashMap<>();
        params.forEach((name, value) -> {
            if (value instanceof Iterable<?>) {
                for (Object item : (Iterable<?>) value) {
                    addQueryParam(builder, values, name, item);
                }
            } else {
                addQueryParam(builder, values, name, value);
            }
        });
        return builder.encode().buildAndExpand(values).toUri();
    }

    private static void addQueryParam(UriComponentsBuilder builder, Map<String, Object> values,
                                      String name, Object value) {
        if (value == null) {
            return;
        }
        String variable = "q" + values.size();
        values.put(variable, value);
        builder.queryParam(name, "{" + variable + "}");
    }

    private HttpHeaders buildHeaders(Map<String, String> customHeaders) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, settings.getUserAgent());
        headers.set(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        if (settings.getApiKey() != null && !settings.getApiKey().isBlank()) {
            headers.setBearerAuth(settings.getApiKey());
        }
        if (customHeaders != null) {
            customHeaders.forEach(headers::set);
        }
        return headers;
    }

    /**
     * Reject anything but an absolute http(s) URL with a host, so requests cannot be
     * redirected to other protocols.
     *
     * @return the URL without trailing slashes
     */
    static String validateBaseUrl(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new ClientValidationException("Invalid URL: base URL is empty");
        }
        URI uri;
        try {
            uri = new URI(baseUrl.trim());
        } catch (URISyntaxException e) {
            throw new ClientValidationException("Invalid URL '" + baseUrl + "': " + e.getReason());
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase();
        if (!ALLOWED_SCHEMES.contains(scheme)) {
            throw new ClientValidationException("Invalid URL scheme '" + scheme + "'. Only http/https allowed.");
        }
        if (uri.getRawAuthority() == null || uri.getRawAuthority().isBlank()) {
            throw new ClientValidationException("Invalid URL: missing network location in '" + baseUrl + "'");
        }
        String normalized = baseUrl.trim();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
