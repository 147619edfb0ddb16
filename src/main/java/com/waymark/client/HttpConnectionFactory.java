package com.waymark.client;

import org.springframework.web.reactive.function.client.WebClient;

/**
 * Opens the connection a {@link ResilientClient} uses for all of its requests.
 * Called at most once per client.
 */
@FunctionalInterface
public interface HttpConnectionFactory {

    HttpConnection open(ClientSettings settings);

    /**
     * A factory handing out a caller-owned {@link WebClient} that the client must not close.
     */
    static HttpConnectionFactory injected(WebClient webClient) {
        return settings -> HttpConnection.borrowed(webClient);
    }
}
