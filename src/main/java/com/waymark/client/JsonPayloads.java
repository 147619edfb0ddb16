package com.waymark.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

/**
 * JSON handling for response payloads.
 */
@Slf4j
public final class JsonPayloads {

    /**
     * Field holding the body of a successful response that was not valid JSON.
     */
    public static final String RAW_RESPONSE_FIELD = "raw_response";

    private static final int EXCERPT_LENGTH = 500;

    private JsonPayloads() {
    }

    public static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Parse a response body, wrapping it as {@code {"raw_response": body}} when it is not JSON.
     */
    public static JsonNode parse(ObjectMapper mapper, String body) {
        try {
            JsonNode node = mapper.readTree(body);
            if (node != null && !node.isMissingNode()) {
                return node;
            }
        } catch (JsonProcessingException e) {
            log.debug("Response is not JSON, returning raw text: {}", e.getOriginalMessage());
        }
        ObjectNode raw = mapper.createObjectNode();
        raw.put(RAW_RESPONSE_FIELD, body);
        return raw;
    }

    public static String excerpt(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= EXCERPT_LENGTH ? body : body.substring(0, EXCERPT_LENGTH) + "...";
    }
}
