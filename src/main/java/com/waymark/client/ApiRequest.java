package com.waymark.client;

import lombok.Builder;
import lombok.Value;
import org.springframework.http.HttpMethod;

import java.util.Map;

/**
 * One logical call to a remote API, relative to the client's base URL.
 */
@Value
@Builder(toBuilder = true)
public class ApiRequest {

    @Builder.Default
    HttpMethod method = HttpMethod.GET;

    String endpoint;

    /**
     * Query parameters; iterable values become repeated parameters.
     */
    @Builder.Default
    Map<String, ?> params = Map.of();

    /**
     * Serialized as JSON. Mutually exclusive with {@link #formData}.
     */
    Object jsonBody;

    @Builder.Default
    Map<String, String> formData = Map.of();

    /**
     * Applied after the client's default headers, so they win on conflict.
     */
    @Builder.Default
    Map<String, String> headers = Map.of();

    /**
     * Bypass the cache lookup. A successful GET still refreshes the cached entry.
     */
    boolean skipCache;

    public static ApiRequest of(HttpMethod method, String endpoint) {
        return ApiRequest.builder().method(method).endpoint(endpoint).build();
    }

    public boolean hasBody() {
        return jsonBody != null || (formData != null && !formData.isEmpty());
    }
}
