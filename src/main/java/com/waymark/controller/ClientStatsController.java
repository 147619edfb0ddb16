package com.waymark.controller;

import com.waymark.client.ClientRegistry;
import com.waymark.client.ResilientClient;
import com.waymark.model.dto.ClientStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Observability and cache management for the configured clients.
 */
@Slf4j
@RestController
@RequestMapping("/v1/clients")
public class ClientStatsController {

    private final ClientRegistry clientRegistry;

    public ClientStatsController(ClientRegistry clientRegistry) {
        this.clientRegistry = clientRegistry;
    }

    /**
     * List configured client names.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> listClients() {
        return ResponseEntity.ok(Map.of("clients", clientRegistry.names()));
    }

    /**
     * Cache statistics, rate limiter state and connection state of one client.
     */
    @GetMapping("/{name}/stats")
    public ResponseEntity<ClientStatus> getStats(@PathVariable String name) {
        return clientRegistry.find(name)
                .map(client -> ResponseEntity.ok(toStatus(name, client)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Clear one client's response cache.
     */
    @PostMapping("/{name}/cache/clear")
    public ResponseEntity<Map<String, String>> clearCache(@PathVariable String name) {
        return clientRegistry.find(name)
                .map(client -> {
                    log.info("Cache clear requested: client={}", name);
                    boolean cleared = client.getCache()
                            .map(cache -> {
                                cache.clear();
                                return true;
                            })
                            .orElse(false);
                    return ResponseEntity.ok(Map.of(
                            "status", "success",
                            "message", cleared ? "Cache cleared" : "Caching is disabled for this client"
                    ));
                })
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private ClientStatus toStatus(String name, ResilientClient client) {
        return ClientStatus.builder()
                .name(name)
                .baseUrl(client.getBaseUrl())
                .connectionState(client.getConnectionState().name())
                .rateLimitWaitSeconds(client.getRateLimiter().getWaitTime().toNanos() / 1_000_000_000.0)
                .availableTokens(client.getRateLimiter().getAvailableTokens())
                .cacheEnabled(client.getCache().isPresent())
                .cache(client.getCacheStats().orElse(null))
                .build();
    }
}
