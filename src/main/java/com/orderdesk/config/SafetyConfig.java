package com.orderdesk.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Kill switch and circuit breaker source-of-truth settings, bound to {@code orderdesk.safety.*}.
 *
 * <p>The submit timeout bounds the authoritative reads made while the trader waits on the
 * confirm button; the init timeout is used at session start and on reconnect.
 */
@Configuration
@ConfigurationProperties(prefix = "orderdesk.safety")
@Getter
@Setter
public class SafetyConfig {

    /** Redis key holding the kill switch state JSON. Also the pub/sub channel name. */
    private String killSwitchKey = "kill_switch:state";

    /** Redis key holding the circuit breaker state JSON. Also the pub/sub channel name. */
    private String circuitBreakerKey = "circuit_breaker:state";

    private Duration submitFetchTimeout = Duration.ofMillis(500);

    private Duration initFetchTimeout = Duration.ofSeconds(2);
}
