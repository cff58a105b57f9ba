package com.orderdesk.config;

import com.orderdesk.staleness.DataField;
import com.orderdesk.staleness.StalenessPolicy;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Maximum ages for safety-relevant data, bound to {@code orderdesk.staleness.*}.
 *
 * <p>A value older than its threshold is unusable for order validation. Risk limits are
 * refreshed every 4 minutes so they never reach their 5 minute threshold in normal operation.
 */
@Configuration
@ConfigurationProperties(prefix = "orderdesk.staleness")
@Getter
@Setter
public class StalenessConfig {

    private Duration position = Duration.ofSeconds(30);

    private Duration price = Duration.ofSeconds(30);

    private Duration buyingPower = Duration.ofSeconds(60);

    private Duration riskLimits = Duration.ofSeconds(300);

    @Bean
    public StalenessPolicy stalenessPolicy() {
        Map<DataField, Duration> thresholds = new EnumMap<>(DataField.class);
        thresholds.put(DataField.POSITION, position);
        thresholds.put(DataField.PRICE, price);
        thresholds.put(DataField.BUYING_POWER, buyingPower);
        thresholds.put(DataField.RISK_LIMITS, riskLimits);
        return new StalenessPolicy(thresholds);
    }
}
