package com.waymark.config;

import com.waymark.client.ClientSettings;
import com.waymark.retry.BackoffPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for Waymark: one entry per remote API destination.
 */
@Data
@Component
@ConfigurationProperties(prefix = "waymark")
public class WaymarkProperties {

    private Map<String, ClientConfig> clients = new LinkedHashMap<>();

    @Data
    public static class ClientConfig {
        private String baseUrl;
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(30);
        private int maxRetries = 3;
        private RateLimitConfig rateLimit = new RateLimitConfig();
        private CacheConfig cache = new CacheConfig();
        private BackoffConfig backoff = new BackoffConfig();

        public ClientSettings toSettings() {
            return ClientSettings.builder()
                    .baseUrl(baseUrl)
                    .apiKey(apiKey)
                    .timeout(timeout)
                    .maxRetries(maxRetries)
                    .rateLimitCallsPerPeriod(rateLimit.getCallsPerPeriod())
                    .rateLimitPeriod(rateLimit.getPeriod())
                    .burstMultiplier(rateLimit.getBurstMultiplier())
                    .cacheEnabled(cache.isEnabled())
                    .cacheTtl(cache.getTtl())
                    .cacheMaxSize(cache.getMaxSize())
                    .cleanupInterval(cache.getCleanupInterval())
                    .backoff(backoff.toPolicy())
                    .build();
        }
    }

    @Data
    public static class RateLimitConfig {
        private int callsPerPeriod = 100;
        private Duration period = Duration.ofSeconds(60);
        private double burstMultiplier = 1.0;
    }

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        private Duration ttl = Duration.ofHours(1);
        private int maxSize = 1000;
        private Duration cleanupInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class BackoffConfig {
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double exponentialBase = 2.0;
        private double jitterFactor = 0.5;

        BackoffPolicy toPolicy() {
            return BackoffPolicy.builder()
                    .baseDelay(baseDelay)
                    .maxDelay(maxDelay)
                    .exponentialBase(exponentialBase)
                    .jitterFactor(jitterFactor)
                    .build();
        }
    }
}
