package com.orderdesk.config;

import io.github.resilience4j.core.IntervalFunction;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Automatic retry of failed bus subscribes, bound to {@code orderdesk.subscription.*}.
 *
 * <p>Each failed channel is retried with exponential backoff up to {@code retryMaxAttempts}
 * times. After that it stays failed until the next reconnect.
 */
@Configuration
@ConfigurationProperties(prefix = "orderdesk.subscription")
@Getter
@Setter
public class SubscriptionConfig {

    private Duration retryInitialDelay = Duration.ofMillis(500);

    private double retryMultiplier = 2.0;

    private Duration retryMaxDelay = Duration.ofSeconds(10);

    private int retryMaxAttempts = 5;

    public IntervalFunction retryBackoff() {
        return IntervalFunction.ofExponentialBackoff(
                retryInitialDelay.toMillis(), retryMultiplier, retryMaxDelay.toMillis());
    }
}
