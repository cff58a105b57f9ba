package com.orderdesk.oms;

import com.orderdesk.client.OrderRequest;
import com.orderdesk.client.SubmissionResponse;
import com.orderdesk.client.TraderIdentity;
import com.orderdesk.client.TradingClient;
import com.orderdesk.event.OrderEntryEvent;
import com.orderdesk.event.OrderEntryEventType;
import com.orderdesk.event.RiskEvent;
import com.orderdesk.event.RiskEventType;
import com.orderdesk.event.RiskLevel;
import com.orderdesk.exception.SessionDisposedException;
import com.orderdesk.market.ConnectionTracker;
import com.orderdesk.market.PositionBook;
import com.orderdesk.safety.SafetyState;
import com.orderdesk.safety.SafetyStateTracker;
import com.orderdesk.safety.SafetySwitch;
import com.orderdesk.staleness.FieldSnapshot;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import lombok.Builder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Turns a previewed order form into at most one submitted order per intent.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>{@link #preview}: checks against cached data, then obtains the intent for the form</li>
 *   <li>{@link #confirm}: refetches positions, buying power and risk limits, reads both
 *       safety switches from the source of truth, and re-runs every check on the fresh data</li>
 *   <li>final check of kill switch, circuit breaker and connection</li>
 *   <li>submission with the intent ID as client order ID</li>
 * </ol>
 *
 * <p>Only the form that was previewed may be confirmed. A second confirm while one is in
 * flight is refused, so one intent is never dispatched twice concurrently.
 */
public class OrderSubmissionPipeline {

    private static final Logger log = LoggerFactory.getLogger(OrderSubmissionPipeline.class);

    private final String sessionId;
    private final TraderIdentity identity;
    private final SafetyStateTracker safetyTracker;
    private final ConnectionTracker connectionTracker;
    private final TradingDataCache dataCache;
    private final OrderSafetyChecks safetyChecks;
    private final OrderIntentService intentService;
    private final TradingClient tradingClient;
    private final Executor executor;
    private final Duration safetyFetchTimeout;
    private final Duration dataFetchTimeout;
    private final Clock clock;
    private final ApplicationEventPublisher eventPublisher;

    private final AtomicReference<OrderEntryState> state = new AtomicReference<>(OrderEntryState.DRAFTING);
    private final AtomicReference<OrderIntent> previewed = new AtomicReference<>();

    private volatile boolean disposed;

    @Builder
    public OrderSubmissionPipeline(
            String sessionId,
            TraderIdentity identity,
            SafetyStateTracker safetyTracker,
            ConnectionTracker connectionTracker,
            TradingDataCache dataCache,
            OrderSafetyChecks safetyChecks,
            OrderIntentService intentService,
            TradingClient tradingClient,
            Executor executor,
            Duration safetyFetchTimeout,
            Duration dataFetchTimeout,
            Clock clock,
            ApplicationEventPublisher eventPublisher) {
        this.sessionId = sessionId;
        this.identity = identity;
        this.safetyTracker = safetyTracker;
        this.connectionTracker = connectionTracker;
        this.dataCache = dataCache;
        this.safetyChecks = safetyChecks;
        this.intentService = intentService;
        this.tradingClient = tradingClient;
        this.executor = executor;
        this.safetyFetchTimeout = safetyFetchTimeout;
        this.dataFetchTimeout = dataFetchTimeout;
        this.clock = clock;
        this.eventPublisher = eventPublisher;
    }

    // ========================================================================
    // Preview
    // ========================================================================

    /**
     * Runs every check against cached data. No network call is made. On success the form
     * is bound to an intent, reusing the previous one if the form is unchanged.
     *
     * @throws SessionDisposedException if the session has been disposed
     */
    public OrderPreview preview(OrderForm form) {
        if (disposed) {
            throw new SessionDisposedException(sessionId);
        }
        OrderEntryState current = state.get();
        if (current == OrderEntryState.CONFIRMING) {
            return OrderPreview.blocked(submissionInProgress());
        }

        OrderCheckResult result = safetyChecks.evaluate(cachedInput(form), clock.instant());
        if (result.isBlocked()) {
            if (!state.compareAndSet(current, OrderEntryState.ABORTED)) {
                return OrderPreview.blocked(submissionInProgress());
            }
            previewed.set(null);
            log.info("Preview blocked for session {}: {}", sessionId, result.getBlock());
            publishOrderEvent(OrderEntryEventType.BLOCKED, null, form, result.getBlock().getCode());
            return OrderPreview.blocked(result.getBlock());
        }

        OrderIntent intent = intentService.getOrCreate(form);
        previewed.set(intent);
        if (!state.compareAndSet(current, OrderEntryState.PREVIEWING)) {
            return OrderPreview.blocked(submissionInProgress());
        }
        log.info("Order previewed for session {}: {} {} {} (intent {})",
                sessionId, form.side(), form.quantity(), form.symbol(), intent.intentId());
        return OrderPreview.ready(intent, result);
    }

    // ========================================================================
    // Confirm
    // ========================================================================

    /**
     * Re-validates against fresh data and submits.
     *
     * <p>The returned future completes with an ABORTED result when a check blocks, REJECTED
     * when the gateway refuses or the call fails, and SUBMITTED when it accepts. It
     * completes exceptionally only with {@link SessionDisposedException}.
     */
    public CompletableFuture<OrderSubmissionResult> confirm(OrderForm form) {
        if (disposed) {
            return CompletableFuture.failedFuture(new SessionDisposedException(sessionId));
        }
        OrderEntryState current = state.get();
        if (current == OrderEntryState.CONFIRMING) {
            return CompletableFuture.completedFuture(OrderSubmissionResult.aborted(null, submissionInProgress()));
        }
        OrderIntent intent = previewed.get();
        if (current != OrderEntryState.PREVIEWING || intent == null) {
            return CompletableFuture.completedFuture(OrderSubmissionResult.aborted(
                    null, OrderBlock.validation("ORDER_NOT_PREVIEWED", "Preview the order before confirming")));
        }
        if (!intent.matches(form)) {
            previewed.set(null);
            state.compareAndSet(OrderEntryState.PREVIEWING, OrderEntryState.ABORTED);
            OrderBlock block =
                    OrderBlock.validation("FORM_CHANGED", "Order details changed. Please preview again.");
            log.info("Confirm aborted for session {}: form changed since preview", sessionId);
            publishOrderEvent(OrderEntryEventType.ABORTED, intent.intentId(), form, block.getCode());
            return CompletableFuture.completedFuture(OrderSubmissionResult.aborted(intent.intentId(), block));
        }
        if (!state.compareAndSet(OrderEntryState.PREVIEWING, OrderEntryState.CONFIRMING)) {
            return CompletableFuture.completedFuture(OrderSubmissionResult.aborted(null, submissionInProgress()));
        }

        log.info("Confirming order for session {} (intent {})", sessionId, intent.intentId());
        return validateFreshAndSubmit(intent).handle((result, error) -> {
            if (error == null) {
                return result;
            }
            Throwable cause = unwrap(error);
            if (cause instanceof SessionDisposedException disposedError) {
                throw disposedError;
            }
            log.error("Order submission failed for session {} (intent {})", sessionId, intent.intentId(), cause);
            finish(OrderEntryState.REJECTED);
            String message = "Order failed: " + cause.getMessage();
            publishOrderEvent(OrderEntryEventType.REJECTED, intent.intentId(), intent.form(), message);
            return OrderSubmissionResult.rejected(intent.intentId(), message);
        });
    }

    /** Leaves the confirmation dialog without submitting. */
    public void cancelPreview() {
        if (state.compareAndSet(OrderEntryState.PREVIEWING, OrderEntryState.DRAFTING)) {
            previewed.set(null);
        }
    }

    /** Drops the preview when the ticket no longer matches what was previewed. */
    public void onFormEdited(OrderForm form) {
        OrderIntent intent = previewed.get();
        if (intent != null && !intent.matches(form)) {
            cancelPreview();
        }
    }

    /** Reloads the draft left by an earlier connection of this session. */
    public Optional<OrderIntent> restorePendingForm() {
        return intentService.restore();
    }

    public OrderEntryState state() {
        return state.get();
    }

    public void dispose() {
        disposed = true;
        previewed.set(null);
    }

    // ========================================================================
    // Internal
    // ========================================================================

    private CompletableFuture<OrderSubmissionResult> validateFreshAndSubmit(OrderIntent intent) {
        CompletableFuture<Optional<FieldSnapshot<PositionBook>>> positions =
                fetchData("positions", () -> tradingClient.fetchPositions(identity));
        CompletableFuture<Optional<FieldSnapshot<BigDecimal>>> buyingPower =
                fetchData("buying power", () -> tradingClient.fetchBuyingPower(identity));
        CompletableFuture<Optional<FieldSnapshot<RiskLimits>>> riskLimits =
                fetchData("risk limits", () -> tradingClient.fetchRiskLimits(identity));
        CompletableFuture<SafetyState> killSwitch =
                safetyTracker.fetchAuthoritative(SafetySwitch.KILL_SWITCH, safetyFetchTimeout);
        CompletableFuture<SafetyState> circuitBreaker =
                safetyTracker.fetchAuthoritative(SafetySwitch.CIRCUIT_BREAKER, safetyFetchTimeout);

        return CompletableFuture.allOf(positions, buyingPower, riskLimits, killSwitch, circuitBreaker)
                .thenCompose(ignored -> {
                    if (disposed) {
                        throw new SessionDisposedException(sessionId);
                    }
                    if (positions.join().isEmpty()) {
                        return abort(intent, OrderBlock.transientIo("POSITION_UNVERIFIED", "Unable to refresh positions"));
                    }
                    if (buyingPower.join().isEmpty()) {
                        return abort(
                                intent, OrderBlock.transientIo("BUYING_POWER_UNVERIFIED", "Unable to refresh buying power"));
                    }
                    if (riskLimits.join().isEmpty()) {
                        return abort(
                                intent, OrderBlock.transientIo("RISK_LIMITS_UNVERIFIED", "Unable to refresh risk limits"));
                    }
                    dataCache.updatePositions(positions.join().get());
                    dataCache.updateBuyingPower(buyingPower.join().get());
                    dataCache.updateRiskLimits(riskLimits.join().get());

                    OrderCheckInput input = OrderCheckInput.builder()
                            .form(intent.form())
                            .safetyInitialized(safetyTracker.isInitialized())
                            .connectionReadWrite(connectionTracker.isReadWrite())
                            .killSwitch(killSwitch.join())
                            .circuitBreaker(circuitBreaker.join())
                            .positions(positions.join().get())
                            .lastPrice(dataCache.priceFor(intent.form().symbol()))
                            .buyingPower(buyingPower.join().get())
                            .riskLimits(riskLimits.join().get())
                            .build();
                    OrderCheckResult result = safetyChecks.evaluate(input, clock.instant());
                    if (result.isBlocked()) {
                        return abort(intent, result.getBlock());
                    }

                    // Last look right before dispatch: a push may have landed since the fetch
                    Optional<OrderBlock> finalBlock = safetyChecks.finalCheck(
                            safetyTracker.current(SafetySwitch.KILL_SWITCH),
                            safetyTracker.current(SafetySwitch.CIRCUIT_BREAKER),
                            connectionTracker.isReadWrite());
                    if (finalBlock.isPresent()) {
                        return abort(intent, finalBlock.get());
                    }
                    return submit(intent);
                });
    }

    private CompletableFuture<OrderSubmissionResult> submit(OrderIntent intent) {
        OrderRequest request = OrderRequest.from(intent.form(), intent.intentId());
        return CompletableFuture.supplyAsync(() -> tradingClient.submitOrder(identity, request), executor)
                .thenApply(response -> handleResponse(intent, response));
    }

    private OrderSubmissionResult handleResponse(OrderIntent intent, SubmissionResponse response) {
        if (response.isAccepted()) {
            finish(OrderEntryState.SUBMITTED);
            intentService.discard();
            log.info("Order submitted for session {}: {} {} {} (intent {}, status {})",
                    sessionId, intent.form().side(), intent.form().quantity(), intent.form().symbol(),
                    intent.intentId(), response.status());
            publishOrderEvent(OrderEntryEventType.SUBMITTED, intent.intentId(), intent.form(), response.status());
            return OrderSubmissionResult.submitted(intent.intentId(), response.status());
        }
        String message = response.message() != null ? response.message() : "Order rejected: " + response.status();
        finish(OrderEntryState.REJECTED);
        log.warn("Order rejected for session {} (intent {}): {}", sessionId, intent.intentId(), message);
        publishOrderEvent(OrderEntryEventType.REJECTED, intent.intentId(), intent.form(), message);
        return OrderSubmissionResult.rejected(intent.intentId(), message);
    }

    private CompletableFuture<OrderSubmissionResult> abort(OrderIntent intent, OrderBlock block) {
        finish(OrderEntryState.ABORTED);
        log.warn("Order blocked at confirm for session {} (intent {}): {}", sessionId, intent.intentId(), block);
        eventPublisher.publishEvent(new RiskEvent(
                this,
                RiskEventType.ORDER_BLOCKED,
                RiskLevel.WARNING,
                sessionId,
                block.getMessage(),
                Map.of("code", block.getCode(), "intentId", intent.intentId())));
        publishOrderEvent(OrderEntryEventType.ABORTED, intent.intentId(), intent.form(), block.getCode());
        return CompletableFuture.completedFuture(OrderSubmissionResult.aborted(intent.intentId(), block));
    }

    /** Fetch bounded by the confirm timeout. Completes empty on failure, never exceptionally. */
    private <T> CompletableFuture<Optional<FieldSnapshot<T>>> fetchData(String what, Supplier<FieldSnapshot<T>> fetch) {
        return CompletableFuture.supplyAsync(fetch, executor)
                .orTimeout(dataFetchTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((snapshot, error) -> {
                    if (error != null) {
                        log.warn("Confirm-time {} fetch failed for session {}: {}", what, sessionId, unwrap(error).toString());
                        return Optional.empty();
                    }
                    return Optional.ofNullable(snapshot);
                });
    }

    private OrderCheckInput cachedInput(OrderForm form) {
        return OrderCheckInput.builder()
                .form(form)
                .safetyInitialized(safetyTracker.isInitialized())
                .connectionReadWrite(connectionTracker.isReadWrite())
                .killSwitch(safetyTracker.current(SafetySwitch.KILL_SWITCH))
                .circuitBreaker(safetyTracker.current(SafetySwitch.CIRCUIT_BREAKER))
                .positions(dataCache.positions())
                .lastPrice(dataCache.priceFor(form.symbol()))
                .buyingPower(dataCache.buyingPower())
                .riskLimits(dataCache.riskLimits())
                .build();
    }

    private void finish(OrderEntryState terminal) {
        state.compareAndSet(OrderEntryState.CONFIRMING, terminal);
        previewed.set(null);
    }

    private void publishOrderEvent(OrderEntryEventType type, String intentId, OrderForm form, String detail) {
        eventPublisher.publishEvent(new OrderEntryEvent(this, type, sessionId, intentId, form.symbol(), detail));
    }

    private static OrderBlock submissionInProgress() {
        return OrderBlock.validation("SUBMISSION_IN_PROGRESS", "Order submission in progress");
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
