package com.didvault.api.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rate limiting configuration using Bucket4j.
 *
 * One bucket per caller and tier:
 * - default: 100 requests per minute
 * - strict: 10 requests per minute for revocation, cancellation and acceptance
 * - high volume: 500 requests per minute for audit reads
 */
@Configuration
@ConfigurationProperties(prefix = "didvault.rate-limit")
public class RateLimitConfig {

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    private long defaultLimit = 100;
    private long strictLimit = 10;
    private long highVolumeLimit = 500;
    private Duration period = Duration.ofMinutes(1);

    public long getDefaultLimit() { return defaultLimit; }
    public void setDefaultLimit(long defaultLimit) { this.defaultLimit = defaultLimit; }
    public long getStrictLimit() { return strictLimit; }
    public void setStrictLimit(long strictLimit) { this.strictLimit = strictLimit; }
    public long getHighVolumeLimit() { return highVolumeLimit; }
    public void setHighVolumeLimit(long highVolumeLimit) { this.highVolumeLimit = highVolumeLimit; }
    public Duration getPeriod() { return period; }
    public void setPeriod(Duration period) { this.period = period; }

    public Bucket resolveBucket(String clientId) {
        return buckets.computeIfAbsent(clientId, key -> createBucket(defaultLimit));
    }

    public Bucket resolveStrictBucket(String clientId) {
        return buckets.computeIfAbsent(clientId + ":strict", key -> createBucket(strictLimit));
    }

    public Bucket resolveHighVolumeBucket(String clientId) {
        return buckets.computeIfAbsent(clientId + ":high", key -> createBucket(highVolumeLimit));
    }

    /**
     * Clear rate limit buckets for a client.
     */
    public void clearBucket(String clientId) {
        buckets.remove(clientId);
        buckets.remove(clientId + ":strict");
        buckets.remove(clientId + ":high");
    }

    private Bucket createBucket(long capacity) {
        Bandwidth limit = Bandwidth.classic(capacity, Refill.greedy(capacity, period));
        return Bucket.builder().addLimit(limit).build();
    }
}
