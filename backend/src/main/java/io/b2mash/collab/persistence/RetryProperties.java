package io.b2mash.collab.persistence;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Retry settings for persistence operations.
 *
 * @param maxAttempts total attempts including the first one
 * @param baseDelay delay before the second attempt; later delays grow by {@code multiplier}
 * @param multiplier backoff growth factor between attempts
 */
@ConfigurationProperties(prefix = "collab.persistence.retry")
public record RetryProperties(
    @DefaultValue("3") int maxAttempts,
    @DefaultValue("300ms") Duration baseDelay,
    @DefaultValue("2.0") double multiplier) {}
