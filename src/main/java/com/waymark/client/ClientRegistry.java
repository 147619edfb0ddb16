package com.waymark.client;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

/**
 * Named clients, one per remote API destination. Closing the registry closes every client.
 */
@Slf4j
public class ClientRegistry implements AutoCloseable {

    private final Map<String, ResilientClient> clients;

    public ClientRegistry(Map<String, ResilientClient> clients) {
        this.clients = Collections.unmodifiableMap(new LinkedHashMap<>(clients));
    }

    public Optional<ResilientClient> find(String name) {
        return Optional.ofNullable(clients.get(name));
    }

    public ResilientClient get(String name) {
        return find(name).orElseThrow(() -> new NoSuchElementException("No client configured with name: " + name));
    }

    public Set<String> names() {
        return clients.keySet();
    }

    @Override
    public void close() {
        clients.forEach((name, client) -> {
            log.debug("Closing client: name={}", name);
            client.close();
        });
    }
}
