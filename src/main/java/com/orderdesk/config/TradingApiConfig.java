package com.orderdesk.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configuration for the execution gateway REST API, bound to {@code orderdesk.trading-api.*}.
 *
 * <p>Provides the {@link RestClient} used by {@link com.orderdesk.client.HttpTradingClient}
 * for positions, account, risk limits, recent fills and order submission.
 */
@Configuration
@ConfigurationProperties(prefix = "orderdesk.trading-api")
@Getter
@Setter
public class TradingApiConfig {

    private static final Logger log = LoggerFactory.getLogger(TradingApiConfig.class);

    private String baseUrl = "http://localhost:8002";

    private Duration connectTimeout = Duration.ofSeconds(2);

    private Duration readTimeout = Duration.ofSeconds(5);

    @Bean
    public RestClient tradingApiRestClient() {
        log.info("Creating trading API client for {}", baseUrl);
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);
        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build();
    }
}
