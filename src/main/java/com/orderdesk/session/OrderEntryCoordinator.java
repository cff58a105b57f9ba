package com.orderdesk.session;

import com.orderdesk.client.FillRecord;
import com.orderdesk.client.TraderIdentity;
import com.orderdesk.client.TradingClient;
import com.orderdesk.config.RefreshConfig;
import com.orderdesk.config.SafetyConfig;
import com.orderdesk.exception.SessionDisposedException;
import com.orderdesk.market.Channels;
import com.orderdesk.market.ConnectionState;
import com.orderdesk.market.ConnectionTracker;
import com.orderdesk.market.MarketPayloadParser;
import com.orderdesk.market.PositionBook;
import com.orderdesk.market.PriceTick;
import com.orderdesk.market.SymbolValidator;
import com.orderdesk.oms.OrderForm;
import com.orderdesk.oms.OrderIntent;
import com.orderdesk.oms.OrderPreview;
import com.orderdesk.oms.OrderSubmissionPipeline;
import com.orderdesk.oms.OrderSubmissionResult;
import com.orderdesk.oms.TradingDataCache;
import com.orderdesk.safety.SafetyStateTracker;
import com.orderdesk.safety.SafetySwitch;
import com.orderdesk.staleness.FieldSnapshot;
import com.orderdesk.subscription.MessageHandler;
import com.orderdesk.subscription.SubscriptionCoordinator;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.Builder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

/**
 * Per-session façade for order entry.
 *
 * <p>Owns the session's subscriptions, safety tracker, data cache and submission pipeline.
 * Inbound bus messages are parsed here and routed to the tracker, the cache and the
 * {@link OrderEntryListener}.
 *
 * <p>Channel owners:
 * <ul>
 *   <li>{@code kill_switch}, {@code circuit_breaker}, {@code connection}, {@code positions}:
 *       held for the life of the session</li>
 *   <li>{@code selected_symbol}: the price channel of the symbol on the order ticket</li>
 *   <li>{@code watchlist}: price channels of watchlist rows</li>
 * </ul>
 *
 * <p>Symbol selection is last-wins. Each call bumps a selection version, and a subscribe
 * that completes after a newer selection is rolled back instead of applied.
 */
public class OrderEntryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(OrderEntryCoordinator.class);

    static final String OWNER_KILL_SWITCH = "kill_switch";
    static final String OWNER_CIRCUIT_BREAKER = "circuit_breaker";
    static final String OWNER_CONNECTION = "connection";
    static final String OWNER_POSITIONS = "positions";
    static final String OWNER_SELECTED_SYMBOL = "selected_symbol";
    static final String OWNER_WATCHLIST = "watchlist";

    static final String INIT_FAILED_MESSAGE = "Initialization failed - please refresh";

    static final int RECENT_FILLS_LIMIT = 50;

    private final String sessionId;
    private final TraderIdentity identity;
    private final SubscriptionCoordinator subscriptions;
    private final SafetyStateTracker safetyTracker;
    private final ConnectionTracker connectionTracker;
    private final TradingDataCache dataCache;
    private final OrderSubmissionPipeline pipeline;
    private final TradingClient tradingClient;
    private final MarketPayloadParser payloadParser;
    private final TaskScheduler scheduler;
    private final Executor executor;
    private final SafetyConfig safetyConfig;
    private final RefreshConfig refreshConfig;
    private final Clock clock;
    private final OrderEntryListener listener;

    private final MessageHandler priceHandler = this::onPriceMessage;
    private final MessageHandler positionsHandler = this::onPositionsMessage;
    private final MessageHandler killSwitchHandler = raw -> onSafetyMessage(SafetySwitch.KILL_SWITCH, raw);
    private final MessageHandler circuitBreakerHandler = raw -> onSafetyMessage(SafetySwitch.CIRCUIT_BREAKER, raw);
    private final MessageHandler connectionHandler = this::onConnectionMessage;

    /** Guards selectedSymbol and selectedChannel together with the version check. */
    private final ReentrantLock selectionLock = new ReentrantLock();
    private final AtomicLong selectionVersion = new AtomicLong();
    private volatile String selectedSymbol;
    private String selectedChannel;

    private final Set<String> watchlistSymbols = ConcurrentHashMap.newKeySet();

    private final List<ScheduledFuture<?>> refreshTasks = new CopyOnWriteArrayList<>();
    private final AtomicBoolean positionRefreshInFlight = new AtomicBoolean();
    private final AtomicBoolean buyingPowerRefreshInFlight = new AtomicBoolean();
    private final AtomicBoolean riskLimitsRefreshInFlight = new AtomicBoolean();

    private final AtomicBoolean disposed = new AtomicBoolean();
    private volatile boolean initialized;

    @Builder
    public OrderEntryCoordinator(
            String sessionId,
            TraderIdentity identity,
            SubscriptionCoordinator subscriptions,
            SafetyStateTracker safetyTracker,
            ConnectionTracker connectionTracker,
            TradingDataCache dataCache,
            OrderSubmissionPipeline pipeline,
            TradingClient tradingClient,
            MarketPayloadParser payloadParser,
            TaskScheduler scheduler,
            Executor executor,
            SafetyConfig safetyConfig,
            RefreshConfig refreshConfig,
            Clock clock,
            OrderEntryListener listener) {
        this.sessionId = sessionId;
        this.identity = identity;
        this.subscriptions = subscriptions;
        this.safetyTracker = safetyTracker;
        this.connectionTracker = connectionTracker;
        this.dataCache = dataCache;
        this.pipeline = pipeline;
        this.tradingClient = tradingClient;
        this.payloadParser = payloadParser;
        this.scheduler = scheduler;
        this.executor = executor;
        this.safetyConfig = safetyConfig;
        this.refreshConfig = refreshConfig;
        this.clock = clock;
        this.listener = listener;
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    /**
     * Starts the session:
     * <ol>
     *   <li>subscribes to the kill switch and circuit breaker channels</li>
     *   <li>reads both switches from the source of truth</li>
     *   <li>subscribes to connection state and the user's positions</li>
     *   <li>loads risk limits, buying power and positions, then schedules their refresh</li>
     * </ol>
     *
     * <p>Order checks block with "Safety state loading" until step 2 completes. If any step
     * fails, everything acquired so far is released and the listener is told trading is
     * blocked.
     */
    public CompletableFuture<Void> initialize() {
        if (disposed.get()) {
            return CompletableFuture.failedFuture(new SessionDisposedException(sessionId));
        }
        safetyTracker.addListener(listener::onSafetyState);

        CompletableFuture<Void> safetyChannels = CompletableFuture.allOf(
                subscriptions.acquire(safetyConfig.getKillSwitchKey(), OWNER_KILL_SWITCH, killSwitchHandler),
                subscriptions.acquire(safetyConfig.getCircuitBreakerKey(), OWNER_CIRCUIT_BREAKER, circuitBreakerHandler));

        return safetyChannels
                .thenCompose(ignored -> safetyTracker.initialize(safetyConfig.getInitFetchTimeout()))
                .thenCompose(ignored -> CompletableFuture.allOf(
                        subscriptions.acquire(Channels.CONNECTION_STATE, OWNER_CONNECTION, connectionHandler),
                        subscriptions.acquire(
                                Channels.positions(identity.userId()), OWNER_POSITIONS, positionsHandler)))
                .thenCompose(ignored -> CompletableFuture.allOf(
                        refreshRiskLimits(), refreshBuyingPower(), refreshPositions()))
                .thenRun(() -> {
                    if (disposed.get()) {
                        throw new SessionDisposedException(sessionId);
                    }
                    scheduleRefreshes();
                    initialized = true;
                    log.info("Order entry session {} initialized for user {}", sessionId, identity.userId());
                })
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        onInitializationFailed(unwrap(error));
                    }
                });
    }

    /**
     * Tears the session down: cancels refreshes, rejects pending subscribes, unsubscribes
     * every channel and discards any result that arrives afterwards. Idempotent.
     */
    public CompletableFuture<Void> dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return CompletableFuture.completedFuture(null);
        }
        selectionVersion.incrementAndGet();
        cancelRefreshes();
        pipeline.dispose();
        safetyTracker.dispose();
        watchlistSymbols.clear();
        log.info("Disposing order entry session {}", sessionId);
        return subscriptions.dispose();
    }

    // ========================================================================
    // Symbol selection
    // ========================================================================

    /**
     * Makes {@code rawSymbol} the order ticket's symbol, or clears the selection when it is
     * null or blank. The previous symbol's channel is released before the new one is
     * acquired; only the latest call's channel survives.
     *
     * @throws IllegalArgumentException if the symbol is not a valid ticker; no channel is touched
     */
    public CompletableFuture<Void> selectSymbol(String rawSymbol) {
        if (disposed.get()) {
            return CompletableFuture.failedFuture(new SessionDisposedException(sessionId));
        }
        String symbol = rawSymbol == null || rawSymbol.isBlank() ? null : SymbolValidator.normalize(rawSymbol);

        long version;
        String previousChannel;
        selectionLock.lock();
        try {
            if (symbol != null && symbol.equals(selectedSymbol)
                    && subscriptions.ownersOf(Channels.price(symbol)).contains(OWNER_SELECTED_SYMBOL)) {
                return CompletableFuture.completedFuture(null);
            }
            version = selectionVersion.incrementAndGet();
            previousChannel = selectedChannel;
            selectedChannel = null;
            selectedSymbol = symbol;
            dataCache.clearPrice();
        } finally {
            selectionLock.unlock();
        }

        CompletableFuture<Void> released = previousChannel != null
                ? subscriptions.release(previousChannel, OWNER_SELECTED_SYMBOL)
                : CompletableFuture.completedFuture(null);
        if (symbol == null) {
            return released.thenRun(() -> {
                if (selectionVersion.get() == version) {
                    listener.onSymbolChanged(null);
                }
            });
        }

        String channel = Channels.price(symbol);
        return released.thenCompose(ignored -> {
            if (selectionVersion.get() != version) {
                log.debug("Selection of {} superseded before subscribe", symbol);
                return CompletableFuture.<Void>completedFuture(null);
            }
            return subscriptions.acquire(channel, OWNER_SELECTED_SYMBOL, priceHandler)
                    .handle((done, error) -> settleSelection(version, symbol, channel, error))
                    .thenCompose(Function.identity());
        });
    }

    public Optional<String> selectedSymbol() {
        return Optional.ofNullable(selectedSymbol);
    }

    // ========================================================================
    // Watchlist
    // ========================================================================

    public CompletableFuture<Void> watchlistSubscribe(String rawSymbol) {
        if (disposed.get()) {
            return CompletableFuture.failedFuture(new SessionDisposedException(sessionId));
        }
        String symbol = SymbolValidator.normalize(rawSymbol);
        watchlistSymbols.add(symbol);
        return subscriptions.acquire(Channels.price(symbol), OWNER_WATCHLIST, priceHandler);
    }

    public CompletableFuture<Void> watchlistUnsubscribe(String rawSymbol) {
        String symbol = SymbolValidator.normalize(rawSymbol);
        if (!watchlistSymbols.remove(symbol)) {
            return CompletableFuture.completedFuture(null);
        }
        return subscriptions.release(Channels.price(symbol), OWNER_WATCHLIST);
    }

    public Set<String> watchlistSymbols() {
        return Set.copyOf(watchlistSymbols);
    }

    // ========================================================================
    // Orders
    // ========================================================================

    public OrderPreview preview(OrderForm form) {
        return pipeline.preview(form);
    }

    public CompletableFuture<OrderSubmissionResult> confirm(OrderForm form) {
        return pipeline.confirm(form);
    }

    public void cancelPreview() {
        pipeline.cancelPreview();
    }

    public void onFormEdited(OrderForm form) {
        pipeline.onFormEdited(form);
    }

    /** Recovers a draft saved before a reconnect; the caller puts it back on the ticket. */
    public Optional<OrderIntent> restorePendingForm() {
        return pipeline.restorePendingForm();
    }

    public CompletableFuture<List<FillRecord>> refreshRecentFills() {
        if (disposed.get()) {
            return CompletableFuture.failedFuture(new SessionDisposedException(sessionId));
        }
        return CompletableFuture.supplyAsync(() -> tradingClient.fetchRecentFills(identity, RECENT_FILLS_LIMIT), executor)
                .thenApply(fills -> {
                    if (!disposed.get()) {
                        listener.onFills(fills);
                    }
                    return fills;
                });
    }

    public boolean isInitialized() {
        return initialized;
    }

    public boolean isDisposed() {
        return disposed.get();
    }

    public String getSessionId() {
        return sessionId;
    }

    // ========================================================================
    // Bus handlers
    // ========================================================================

    private void onPriceMessage(String raw) {
        Optional<PriceTick> parsed = payloadParser.parsePriceTick(raw);
        if (parsed.isEmpty() || disposed.get()) {
            return;
        }
        PriceTick tick = parsed.get();
        listener.onPriceTick(tick);
        if (tick.symbol().equals(selectedSymbol)) {
            dataCache.updatePrice(tick);
            listener.onSelectedPrice(tick);
        }
    }

    private void onPositionsMessage(String raw) {
        if (disposed.get()) {
            return;
        }
        applyPositions(payloadParser.parsePositions(raw));
    }

    private void onSafetyMessage(SafetySwitch safetySwitch, String raw) {
        safetyTracker.applyPush(safetySwitch, raw);
    }

    private void onConnectionMessage(String raw) {
        if (disposed.get()) {
            return;
        }
        ConnectionState state = payloadParser.parseConnectionState(raw);
        boolean reconnected = connectionTracker.apply(state);
        listener.onConnectionState(state);
        if (reconnected && initialized) {
            recoverAfterReconnect();
        }
    }

    /**
     * Re-reads both switches, then restores every live channel and retries failed ones.
     * Completes normally even if some step fails.
     */
    CompletableFuture<Void> recoverAfterReconnect() {
        log.info("Connection restored for session {}, re-verifying safety state and resubscribing", sessionId);
        Duration timeout = safetyConfig.getInitFetchTimeout();
        return CompletableFuture.allOf(
                        safetyTracker.fetchAuthoritative(SafetySwitch.KILL_SWITCH, timeout),
                        safetyTracker.fetchAuthoritative(SafetySwitch.CIRCUIT_BREAKER, timeout))
                .thenCompose(ignored -> subscriptions.resubscribeAll())
                .thenCompose(ignored -> subscriptions.retryFailed())
                .exceptionally(error -> {
                    log.warn("Reconnect recovery incomplete for session {}: {}", sessionId, unwrap(error).getMessage());
                    return null;
                });
    }

    // ========================================================================
    // Periodic refresh
    // ========================================================================

    CompletableFuture<Void> refreshPositions() {
        return refresh("positions", positionRefreshInFlight, () -> tradingClient.fetchPositions(identity), this::applyPositions);
    }

    CompletableFuture<Void> refreshBuyingPower() {
        return refresh("buying power", buyingPowerRefreshInFlight,
                () -> tradingClient.fetchBuyingPower(identity), dataCache::updateBuyingPower);
    }

    CompletableFuture<Void> refreshRiskLimits() {
        return refresh("risk limits", riskLimitsRefreshInFlight,
                () -> tradingClient.fetchRiskLimits(identity), dataCache::updateRiskLimits);
    }

    /**
     * Runs one fetch unless the previous one for the same data is still in flight, in which
     * case the tick is skipped. Failures are logged; the cached value then ages out.
     */
    private <T> CompletableFuture<Void> refresh(
            String what, AtomicBoolean inFlight, Supplier<FieldSnapshot<T>> fetch, Consumer<FieldSnapshot<T>> apply) {
        if (disposed.get()) {
            return CompletableFuture.completedFuture(null);
        }
        if (!inFlight.compareAndSet(false, true)) {
            log.debug("Skipping {} refresh for session {}: previous still in flight", what, sessionId);
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> refreshed;
        try {
            refreshed = CompletableFuture.supplyAsync(fetch, executor).thenAccept(snapshot -> {
                if (!disposed.get()) {
                    apply.accept(snapshot);
                }
            });
        } catch (RuntimeException e) {
            refreshed = CompletableFuture.failedFuture(e);
        }
        return refreshed
                .exceptionally(error -> {
                    log.warn("{} refresh failed for session {}: {}", what, sessionId, unwrap(error).getMessage());
                    return null;
                })
                .whenComplete((ignored, error) -> inFlight.set(false));
    }

    private void scheduleRefreshes() {
        schedule(this::refreshPositions, refreshConfig.getPositionInterval());
        schedule(this::refreshBuyingPower, refreshConfig.getBuyingPowerInterval());
        schedule(this::refreshRiskLimits, refreshConfig.getRiskLimitsInterval());
    }

    private void schedule(Runnable task, Duration interval) {
        refreshTasks.add(scheduler.scheduleAtFixedRate(task, clock.instant().plus(interval), interval));
    }

    private void cancelRefreshes() {
        for (ScheduledFuture<?> task : refreshTasks) {
            task.cancel(false);
        }
        refreshTasks.clear();
    }

    // ========================================================================
    // Internal
    // ========================================================================

    private void applyPositions(FieldSnapshot<PositionBook> snapshot) {
        dataCache.updatePositions(snapshot);
        if (snapshot.hasValue()) {
            listener.onPositions(snapshot.value());
        }
    }

    /**
     * Applies a finished selected-symbol acquire if it is still the latest selection, and
     * rolls it back otherwise. A superseded acquire keeps its channel when the latest
     * selection is the same symbol (A, B, A in quick succession), since both share the one
     * owner. After dispose the selection fails, since the subscription layer has already
     * dropped every channel. A failed acquire is still recorded as the selected channel so the next
     * selection releases the owner left in the retry set.
     */
    private CompletableFuture<Void> settleSelection(long version, String symbol, String channel, Throwable error) {
        if (disposed.get()) {
            return CompletableFuture.failedFuture(new SessionDisposedException(sessionId));
        }
        boolean current;
        boolean sharedWithLatest;
        selectionLock.lock();
        try {
            current = selectionVersion.get() == version;
            sharedWithLatest = !current && symbol.equals(selectedSymbol);
            if (current) {
                selectedChannel = channel;
            }
        } finally {
            selectionLock.unlock();
        }

        if (sharedWithLatest) {
            log.debug("Selection of {} superseded by a reselection of the same symbol", symbol);
            return CompletableFuture.completedFuture(null);
        }
        if (!current) {
            log.debug("Selection of {} superseded, releasing {}", symbol, channel);
            return subscriptions.release(channel, OWNER_SELECTED_SYMBOL);
        }
        if (error != null) {
            log.warn("Subscribe to {} failed for session {}: {}", channel, sessionId, unwrap(error).getMessage());
            return CompletableFuture.failedFuture(unwrap(error));
        }
        listener.onSymbolChanged(symbol);
        return CompletableFuture.completedFuture(null);
    }

    private void onInitializationFailed(Throwable cause) {
        cancelRefreshes();
        if (cause instanceof SessionDisposedException) {
            log.info("Order entry session {} disposed during initialization", sessionId);
            return;
        }
        log.error("Initialization failed for order entry session {}", sessionId, cause);
        subscriptions.release(safetyConfig.getKillSwitchKey(), OWNER_KILL_SWITCH);
        subscriptions.release(safetyConfig.getCircuitBreakerKey(), OWNER_CIRCUIT_BREAKER);
        subscriptions.release(Channels.CONNECTION_STATE, OWNER_CONNECTION);
        subscriptions.release(Channels.positions(identity.userId()), OWNER_POSITIONS);
        listener.onTradingBlocked(INIT_FAILED_MESSAGE);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
