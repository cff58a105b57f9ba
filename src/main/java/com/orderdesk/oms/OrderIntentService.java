package com.orderdesk.oms;

import com.orderdesk.repository.redis.PendingOrderFormRedisRepository;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

/**
 * Issues and remembers the intent ID for the session's current order draft.
 *
 * <p>The same form always maps to the same intent until the order is accepted or the
 * draft is discarded, so a re-confirm after a timeout or rejection reuses the client order
 * ID. A changed form gets a new ID. The current intent is mirrored to Redis so it survives
 * a reconnect; a Redis failure only costs that recovery and is logged.
 */
public class OrderIntentService {

    private static final Logger log = LoggerFactory.getLogger(OrderIntentService.class);

    private final String sessionId;
    private final PendingOrderFormRedisRepository pendingFormRepository;
    private final Clock clock;

    private final AtomicReference<OrderIntent> current = new AtomicReference<>();

    public OrderIntentService(String sessionId, PendingOrderFormRedisRepository pendingFormRepository, Clock clock) {
        this.sessionId = sessionId;
        this.pendingFormRepository = pendingFormRepository;
        this.clock = clock;
    }

    public OrderIntent getOrCreate(OrderForm form) {
        OrderIntent existing = current.get();
        if (existing != null && existing.matches(form)) {
            return existing;
        }
        OrderIntent intent = new OrderIntent(newIntentId(), form, clock.instant());
        current.set(intent);
        persist(intent);
        log.debug("Issued intent {} for session {}", intent.intentId(), sessionId);
        return intent;
    }

    public Optional<OrderIntent> current() {
        return Optional.ofNullable(current.get());
    }

    /** Forgets the current intent. Called once the order is accepted or the draft is abandoned. */
    public void discard() {
        current.set(null);
        try {
            pendingFormRepository.clear(sessionId);
        } catch (DataAccessException e) {
            log.warn("Failed to clear pending order form for session {}: {}", sessionId, e.getMessage());
        }
    }

    /** Reloads a draft saved by an earlier connection of this session, if any. */
    public Optional<OrderIntent> restore() {
        Optional<OrderIntent> restored;
        try {
            restored = pendingFormRepository.restore(sessionId);
        } catch (DataAccessException e) {
            log.warn("Failed to restore pending order form for session {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
        restored.ifPresent(current::set);
        return restored;
    }

    private void persist(OrderIntent intent) {
        try {
            pendingFormRepository.save(sessionId, intent);
        } catch (DataAccessException e) {
            log.warn("Failed to persist pending order form for session {}: {}", sessionId, e.getMessage());
        }
    }

    private static String newIntentId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
