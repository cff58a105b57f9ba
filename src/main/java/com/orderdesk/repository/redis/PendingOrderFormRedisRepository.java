package com.orderdesk.repository.redis;

import com.orderdesk.config.OrderEntryConfig;
import com.orderdesk.config.RedisConfig;
import com.orderdesk.market.Decimals;
import com.orderdesk.market.SymbolValidator;
import com.orderdesk.oms.OrderForm;
import com.orderdesk.oms.OrderIntent;
import com.orderdesk.oms.OrderSide;
import com.orderdesk.oms.OrderType;
import com.orderdesk.oms.TimeInForce;
import com.orderdesk.safety.IsoTimestamps;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Redis repository for unsubmitted order drafts.
 *
 * <p>Lets a trader who reconnects mid-entry recover the ticket and, with it, the intent ID
 * already issued for it. Re-confirming the recovered draft therefore reuses the same
 * client order ID.
 *
 * <p>Key format: orderdesk:pending-form:{sessionId}
 * Value: JSON map of strings (client_order_id, symbol, side, quantity, order_type,
 * limit_price, stop_price, time_in_force, created_at).
 */
@Repository
@RequiredArgsConstructor
public class PendingOrderFormRedisRepository {

    private static final Logger log = LoggerFactory.getLogger(PendingOrderFormRedisRepository.class);

    private final RedisTemplate<String, Object> redisTemplate;
    private final OrderEntryConfig orderEntryConfig;

    public void save(String sessionId, OrderIntent intent) {
        OrderForm form = intent.form();
        Map<String, Object> data = new HashMap<>();
        data.put("client_order_id", intent.intentId());
        putIfPresent(data, "symbol", form.symbol());
        putIfPresent(data, "side", form.side() != null ? form.side().wireValue() : null);
        putIfPresent(data, "quantity", plain(form.quantity()));
        putIfPresent(data, "order_type", form.orderType() != null ? form.orderType().wireValue() : null);
        putIfPresent(data, "limit_price", plain(form.limitPrice()));
        putIfPresent(data, "stop_price", plain(form.stopPrice()));
        putIfPresent(data, "time_in_force", form.timeInForce() != null ? form.timeInForce().wireValue() : null);
        data.put("created_at", intent.createdAt().toString());

        redisTemplate.opsForValue().set(keyFor(sessionId), data, orderEntryConfig.getPendingFormTtl());
        log.debug("Pending order form saved for session {} (intent {})", sessionId, intent.intentId());
    }

    /**
     * Loads the saved draft. Absent fields stay blank. A record without a client order ID,
     * or with any field present but unreadable, is deleted and treated as absent so that
     * the saved intent ID is never attached to a ticket other than the one it was issued for.
     */
    public Optional<OrderIntent> restore(String sessionId) {
        String key = keyFor(sessionId);
        Object value = redisTemplate.opsForValue().get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (!(value instanceof Map<?, ?> data) || !(data.get("client_order_id") instanceof String intentId)
                || intentId.isBlank()) {
            log.warn("Discarding corrupt pending order form for session {}", sessionId);
            redisTemplate.delete(key);
            return Optional.empty();
        }

        List<String> unreadable = new ArrayList<>();
        OrderForm form = OrderForm.builder()
                .symbol(read(data, "symbol", SymbolValidator::tryNormalize, unreadable))
                .side(read(data, "side", OrderSide::fromWire, unreadable))
                .quantity(read(data, "quantity", raw -> Decimals.parse(raw).filter(qty -> qty.signum() > 0), unreadable))
                .orderType(read(data, "order_type", OrderType::fromWire, unreadable))
                .limitPrice(read(data, "limit_price", Decimals::parse, unreadable))
                .stopPrice(read(data, "stop_price", Decimals::parse, unreadable))
                .timeInForce(read(data, "time_in_force", TimeInForce::fromWire, unreadable))
                .build();
        if (!unreadable.isEmpty()) {
            log.warn("Discarding pending order form for session {} (intent {}): unreadable {}",
                    sessionId, intentId, unreadable);
            redisTemplate.delete(key);
            return Optional.empty();
        }
        Instant createdAt = IsoTimestamps.parse(text(data, "created_at")).orElse(Instant.EPOCH);

        log.info("Restored pending order form for session {} (intent {})", sessionId, intentId);
        return Optional.of(new OrderIntent(intentId, form, createdAt));
    }

    public void clear(String sessionId) {
        redisTemplate.delete(keyFor(sessionId));
    }

    static String keyFor(String sessionId) {
        return RedisConfig.KEY_PREFIX_PENDING_FORM + sessionId;
    }

    /** Parses a present field, recording its name when it does not parse. Absent fields read as null. */
    private static <T> T read(
            Map<?, ?> data, String field, Function<String, Optional<T>> parser, List<String> unreadable) {
        String raw = text(data, field);
        if (raw == null) {
            return null;
        }
        Optional<T> parsed = parser.apply(raw);
        if (parsed.isEmpty()) {
            unreadable.add(field);
        }
        return parsed.orElse(null);
    }

    private static String text(Map<?, ?> data, String field) {
        Object value = data.get(field);
        return value != null ? value.toString() : null;
    }

    private static String plain(BigDecimal value) {
        return value != null ? value.toPlainString() : null;
    }

    private static void putIfPresent(Map<String, Object> data, String field, String value) {
        if (value != null) {
            data.put(field, value);
        }
    }
}
