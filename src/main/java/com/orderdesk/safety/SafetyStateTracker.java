package com.orderdesk.safety;

import com.orderdesk.event.RiskEvent;
import com.orderdesk.event.RiskEventType;
import com.orderdesk.event.RiskLevel;
import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Per-session, fail-closed view of the kill switch and circuit breaker.
 *
 * <p>Fed two ways:
 * <ul>
 *   <li>{@link #applyPush} for pub/sub notifications</li>
 *   <li>{@link #fetchAuthoritative} for bounded reads from the source of truth</li>
 * </ul>
 *
 * <p>Both switches start as unverified UNSAFE and only become SAFE through the parser.
 * An authoritative result replaces the cached state unless a push arrived while the fetch
 * was in flight and the result is SAFE. A blocking result is always applied.
 *
 * <p>Publishes a {@link RiskEvent} whenever a switch changes between safe, confirmed
 * unsafe and unverified.
 */
public class SafetyStateTracker {

    private static final Logger log = LoggerFactory.getLogger(SafetyStateTracker.class);

    private final String sessionId;
    private final SafetyStateSource source;
    private final SafetyStateParser parser;
    private final ApplicationEventPublisher eventPublisher;

    private final Map<SafetySwitch, AtomicReference<SafetyState>> states = new EnumMap<>(SafetySwitch.class);
    private final Map<SafetySwitch, AtomicLong> pushSequence = new EnumMap<>(SafetySwitch.class);
    private final List<Consumer<SafetyState>> listeners = new CopyOnWriteArrayList<>();

    private volatile boolean initialized;
    private volatile boolean disposed;

    public SafetyStateTracker(
            String sessionId,
            SafetyStateSource source,
            SafetyStateParser parser,
            ApplicationEventPublisher eventPublisher) {
        this.sessionId = sessionId;
        this.source = source;
        this.parser = parser;
        this.eventPublisher = eventPublisher;
        for (SafetySwitch safetySwitch : SafetySwitch.values()) {
            states.put(safetySwitch, new AtomicReference<>(SafetyState.uninitialized(safetySwitch)));
            pushSequence.put(safetySwitch, new AtomicLong());
        }
    }

    // ========================================================================
    // Push path
    // ========================================================================

    /** Parses a pub/sub payload and makes it the current state. Never throws. */
    public SafetyState applyPush(SafetySwitch safetySwitch, String raw) {
        SafetyState state = parser.parse(safetySwitch, raw);
        pushSequence.get(safetySwitch).incrementAndGet();
        update(state);
        return state;
    }

    // ========================================================================
    // Authoritative path
    // ========================================================================

    /**
     * Reads the switch from the source of truth, bounded by {@code timeout}.
     *
     * <p>The returned future never completes exceptionally: timeouts and errors complete it
     * with an unverified UNSAFE state. Callers at confirm time use the returned state
     * directly, never the cache.
     */
    public CompletableFuture<SafetyState> fetchAuthoritative(SafetySwitch safetySwitch, Duration timeout) {
        long sequenceAtStart = pushSequence.get(safetySwitch).get();
        CompletableFuture<SafetyState> fetched;
        try {
            fetched = source.fetch(safetySwitch)
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .handle((raw, error) -> error == null
                            ? parser.parse(safetySwitch, raw.orElse(null))
                            : failedFetch(safetySwitch, error));
        } catch (RuntimeException e) {
            fetched = CompletableFuture.completedFuture(failedFetch(safetySwitch, e));
        }
        return fetched.thenApply(state -> {
            boolean pushedSince = pushSequence.get(safetySwitch).get() != sequenceAtStart;
            if (!pushedSince || state.isBlocking()) {
                update(state);
            } else {
                log.debug("Discarding authoritative {} result superseded by a push", safetySwitch);
            }
            return state;
        });
    }

    /**
     * Fetches both switches at session start. Until this completes every order check
     * blocks with "Safety state loading". Never completes exceptionally.
     */
    public CompletableFuture<Void> initialize(Duration timeout) {
        CompletableFuture<SafetyState> killSwitch = fetchAuthoritative(SafetySwitch.KILL_SWITCH, timeout);
        CompletableFuture<SafetyState> circuitBreaker = fetchAuthoritative(SafetySwitch.CIRCUIT_BREAKER, timeout);
        return CompletableFuture.allOf(killSwitch, circuitBreaker).thenRun(() -> {
            initialized = true;
            log.info(
                    "Safety state initialized for session {}: kill switch {}, circuit breaker {}",
                    sessionId,
                    killSwitch.join().getStatus(),
                    circuitBreaker.join().getStatus());
        });
    }

    // ========================================================================
    // Queries
    // ========================================================================

    public SafetyState current(SafetySwitch safetySwitch) {
        return states.get(safetySwitch).get();
    }

    public boolean isInitialized() {
        return initialized;
    }

    public void addListener(Consumer<SafetyState> listener) {
        listeners.add(listener);
    }

    /** Stops applying results; late fetches and pushes are discarded. */
    public void dispose() {
        disposed = true;
        listeners.clear();
    }

    // ========================================================================
    // Internal
    // ========================================================================

    private SafetyState failedFetch(SafetySwitch safetySwitch, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException) {
            log.warn("{} state fetch timed out for session {}", safetySwitch.getDisplayName(), sessionId);
            return SafetyState.unverified(safetySwitch, "state fetch timed out");
        }
        log.warn(
                "{} state fetch failed for session {}: {}",
                safetySwitch.getDisplayName(),
                sessionId,
                cause.getMessage());
        return SafetyState.unverified(safetySwitch, "state fetch failed");
    }

    private void update(SafetyState state) {
        if (disposed) {
            return;
        }
        SafetyState previous = states.get(state.getSafetySwitch()).getAndSet(state);
        if (!classify(previous).equals(classify(state))) {
            publishTransition(state);
        }
        for (Consumer<SafetyState> listener : listeners) {
            try {
                listener.accept(state);
            } catch (RuntimeException e) {
                log.error("Safety state listener failed for session {}", sessionId, e);
            }
        }
    }

    private void publishTransition(SafetyState state) {
        RiskEventType type;
        RiskLevel level;
        if (state.isSafe()) {
            type = RiskEventType.SAFETY_STATE_RESTORED;
            level = RiskLevel.INFO;
        } else if (!state.isVerified()) {
            type = RiskEventType.SAFETY_STATE_UNVERIFIED;
            level = RiskLevel.WARNING;
        } else if (state.getSafetySwitch() == SafetySwitch.KILL_SWITCH) {
            type = RiskEventType.KILL_SWITCH_ENGAGED;
            level = RiskLevel.CRITICAL;
        } else {
            type = RiskEventType.CIRCUIT_BREAKER_TRIPPED;
            level = RiskLevel.CRITICAL;
        }

        Map<String, Object> details = new HashMap<>();
        details.put("switch", state.getSafetySwitch().name());
        details.put("status", state.getStatus().name());
        if (state.getReason() != null) {
            details.put("reason", state.getReason());
        }

        log.info("Session {}: {}", sessionId, state.describe());
        eventPublisher.publishEvent(new RiskEvent(this, type, level, sessionId, state.describe(), details));
    }

    private static String classify(SafetyState state) {
        if (state.isSafe()) {
            return "SAFE";
        }
        return state.isVerified() ? state.getStatus().name() : "UNVERIFIED";
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
