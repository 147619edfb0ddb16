package com.waymark.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.waymark.client.ClientRegistry;
import com.waymark.client.ResilientClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds one {@link ResilientClient} per destination configured under {@code waymark.clients}.
 */
@Slf4j
@Configuration
public class ClientRegistryConfiguration {

    private final WaymarkProperties properties;

    public ClientRegistryConfiguration(WaymarkProperties properties) {
        this.properties = properties;
    }

    @Bean(destroyMethod = "close")
    public ClientRegistry clientRegistry(ObjectMapper objectMapper) {
        Map<String, ResilientClient> clients = new LinkedHashMap<>();
        try {
            properties.getClients().forEach((name, config) -> {
                log.info("Configuring client: name={} baseUrl={}", name, config.getBaseUrl());
                clients.put(name, new ResilientClient(config.toSettings(), objectMapper));
            });
        } catch (RuntimeException e) {
            clients.values().forEach(ResilientClient::close);
            throw e;
        }
        return new ClientRegistry(clients);
    }
}
