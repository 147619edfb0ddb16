package com.waymark.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.net.URI;

/**
 * Opens a {@link WebClient} backed by a dedicated Reactor Netty connection pool.
 * The pool is owned by the returned connection and disposed when the client closes.
 */
@Slf4j
public class ReactorHttpConnectionFactory implements HttpConnectionFactory {

    private static final int MAX_CONNECT_TIMEOUT_MILLIS = 10_000;

    private final ObjectMapper objectMapper;

    public ReactorHttpConnectionFactory(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public HttpConnection open(ClientSettings settings) {
        String host = URI.create(settings.getBaseUrl()).getHost();
        ConnectionProvider connectionProvider = ConnectionProvider.builder("waymark-" + host)
                .build();

        int connectTimeoutMillis = (int) Math.min(settings.getTimeout().toMillis(), MAX_CONNECT_TIMEOUT_MILLIS);
        HttpClient httpClient = HttpClient.create(connectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
                .responseTimeout(settings.getTimeout());

        WebClient webClient = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs()
                        .jackson2JsonEncoder(new Jackson2JsonEncoder(objectMapper, MediaType.APPLICATION_JSON)))
                .build();

        log.info("Opened HTTP connection pool: host={} connectTimeoutMs={} responseTimeout={}",
                host, connectTimeoutMillis, settings.getTimeout());
        return HttpConnection.owned(webClient, connectionProvider);
    }
}
