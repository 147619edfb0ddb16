package com.waymark.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.waymark.client.JsonPayloads;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Shared ObjectMapper, used both for the HTTP endpoints and for encoding request bodies
 * and decoding payloads in every client.
 */
@Configuration
public class JacksonConfiguration {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return JsonPayloads.newObjectMapper();
    }
}
