package com.orderdesk.observability;

import com.orderdesk.event.OrderEntryEvent;
import com.orderdesk.event.RiskEvent;
import com.orderdesk.session.OrderEntrySessionManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for order entry.
 * <ul>
 *   <li><b>orderdesk.orders.submitted</b> (counter): orders accepted by the gateway</li>
 *   <li><b>orderdesk.orders.rejected</b> (counter): orders refused by the gateway or failed in flight</li>
 *   <li><b>orderdesk.orders.blocked</b> (counter, tags stage/code): orders stopped by a check</li>
 *   <li><b>orderdesk.safety.transitions</b> (counter, tag type): safety switch classification changes</li>
 *   <li><b>orderdesk.sessions.active</b> (gauge): open order-entry sessions</li>
 * </ul>
 */
@Service
public class OrderEntryMetrics {

    private static final Logger log = LoggerFactory.getLogger(OrderEntryMetrics.class);

    private final MeterRegistry meterRegistry;
    private final Counter ordersSubmittedCounter;
    private final Counter ordersRejectedCounter;

    public OrderEntryMetrics(MeterRegistry meterRegistry, OrderEntrySessionManager sessionManager) {
        this.meterRegistry = meterRegistry;

        this.ordersSubmittedCounter = Counter.builder("orderdesk.orders.submitted")
                .description("Orders accepted by the execution gateway")
                .register(meterRegistry);

        this.ordersRejectedCounter = Counter.builder("orderdesk.orders.rejected")
                .description("Orders rejected by the gateway or failed during submission")
                .register(meterRegistry);

        meterRegistry.gauge("orderdesk.sessions.active", sessionManager, OrderEntrySessionManager::activeSessionCount);
    }

    @EventListener
    @Order(20)
    public void onOrderEntryEvent(OrderEntryEvent event) {
        switch (event.getEventType()) {
            case SUBMITTED -> ordersSubmittedCounter.increment();
            case REJECTED -> ordersRejectedCounter.increment();
            case BLOCKED -> blockedCounter("preview", event.getDetail()).increment();
            case ABORTED -> blockedCounter("confirm", event.getDetail()).increment();
            default -> log.debug("Unhandled order entry event {}", event.getEventType());
        }
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        Counter.builder("orderdesk.safety.transitions")
                .description("Safety switch transitions and confirm-time order blocks")
                .tag("type", event.getEventType().name())
                .register(meterRegistry)
                .increment();
    }

    private Counter blockedCounter(String stage, String code) {
        return Counter.builder("orderdesk.orders.blocked")
                .description("Orders blocked by a safety or validation check")
                .tag("stage", stage)
                .tag("code", code != null ? code : "UNKNOWN")
                .register(meterRegistry);
    }
}
