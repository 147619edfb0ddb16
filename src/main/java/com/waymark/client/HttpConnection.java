package com.waymark.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Disposable;

/**
 * A {@link WebClient} together with the network resources behind it.
 *
 * <p>An owned connection releases its resources on {@link #close()}. A borrowed one was
 * supplied by the caller, who keeps ownership; closing it does nothing.
 */
@Slf4j
public final class HttpConnection {

    private final WebClient webClient;
    private final Disposable resources;

    private HttpConnection(WebClient webClient, Disposable resources) {
        this.webClient = webClient;
        this.resources = resources;
    }

    public static HttpConnection owned(WebClient webClient, Disposable resources) {
        return new HttpConnection(webClient, resources);
    }

    public static HttpConnection borrowed(WebClient webClient) {
        return new HttpConnection(webClient, null);
    }

    public WebClient getWebClient() {
        return webClient;
    }

    public boolean isOwned() {
        return resources != null;
    }

    public void close() {
        if (resources != null && !resources.isDisposed()) {
            resources.dispose();
            log.debug("HTTP connection resources released");
        }
    }
}
