package com.orderdesk.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "orderdesk.order-entry")
@Getter
@Setter
public class OrderEntryConfig {

    /** How long an unsubmitted draft survives in Redis for reconnect recovery. */
    private Duration pendingFormTtl = Duration.ofHours(24);
}
