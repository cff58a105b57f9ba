package com.orderdesk.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Periodic refresh cadence for REST-sourced data, bound to {@code orderdesk.refresh.*}. */
@Configuration
@ConfigurationProperties(prefix = "orderdesk.refresh")
@Getter
@Setter
public class RefreshConfig {

    private Duration positionInterval = Duration.ofSeconds(5);

    private Duration buyingPowerInterval = Duration.ofSeconds(10);

    private Duration riskLimitsInterval = Duration.ofSeconds(240);

    /** Upper bound on each REST fetch made when the trader confirms an order. */
    private Duration confirmFetchTimeout = Duration.ofSeconds(2);
}
