package com.orderdesk.unit.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderdesk.client.FillRecord;
import com.orderdesk.client.TraderIdentity;
import com.orderdesk.client.TradingClient;
import com.orderdesk.config.RefreshConfig;
import com.orderdesk.config.SafetyConfig;
import com.orderdesk.exception.SessionDisposedException;
import com.orderdesk.exception.TransientIoException;
import com.orderdesk.market.ConnectionState;
import com.orderdesk.market.ConnectionTracker;
import com.orderdesk.market.MarketPayloadParser;
import com.orderdesk.market.PositionBook;
import com.orderdesk.market.PriceTick;
import com.orderdesk.oms.OrderIntentService;
import com.orderdesk.oms.OrderSafetyChecks;
import com.orderdesk.oms.OrderSubmissionPipeline;
import com.orderdesk.oms.RiskLimits;
import com.orderdesk.oms.TradingDataCache;
import com.orderdesk.repository.redis.PendingOrderFormRedisRepository;
import com.orderdesk.safety.SafetyState;
import com.orderdesk.safety.SafetyStateParser;
import com.orderdesk.safety.SafetyStateSource;
import com.orderdesk.safety.SafetyStateTracker;
import com.orderdesk.safety.SafetySwitch;
import com.orderdesk.session.OrderEntryCoordinator;
import com.orderdesk.session.OrderEntryListener;
import com.orderdesk.staleness.FieldSnapshot;
import com.orderdesk.staleness.StalenessPolicy;
import com.orderdesk.subscription.SubscriptionCoordinator;
import com.orderdesk.unit.support.FakeMessageBus;
import com.orderdesk.unit.support.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

/**
 * Unit tests for OrderEntryCoordinator wired to an in-memory bus: session startup and its
 * failure path, last-wins symbol selection, channel sharing with the watchlist, message
 * routing, reconnect recovery and teardown.
 */
@ExtendWith(MockitoExtension.class)
class OrderEntryCoordinatorTest {

    private static final Instant NOW = Instant.parse("2025-03-14T15:00:00Z");
    private static final TraderIdentity IDENTITY = new TraderIdentity("user-1", "trader");

    private static final String KILL_SWITCH_CHANNEL = "kill_switch:state";
    private static final String CIRCUIT_BREAKER_CHANNEL = "circuit_breaker:state";
    private static final String CONNECTION_CHANNEL = "connection:state";
    private static final String POSITIONS_CHANNEL = "positions:user-1";
    private static final String AAPL = "price.updated.AAPL";
    private static final String MSFT = "price.updated.MSFT";

    @Mock
    private SafetyStateSource safetySource;

    @Mock
    private TradingClient tradingClient;

    @Mock
    private PendingOrderFormRedisRepository pendingFormRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Mock
    private TaskScheduler scheduler;

    @Mock
    private ScheduledFuture<?> scheduledFuture;

    @Mock
    private OrderEntryListener listener;

    private FakeMessageBus bus;
    private SafetyStateTracker safetyTracker;
    private TradingDataCache dataCache;
    private RefreshConfig refreshConfig;
    private OrderEntryCoordinator coordinator;

    private final List<Runnable> queuedTasks = new ArrayList<>();
    private boolean queueTasks;
    private final Executor executor = task -> {
        if (queueTasks) {
            queuedTasks.add(task);
        } else {
            task.run();
        }
    };

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        bus = new FakeMessageBus();
        SubscriptionCoordinator subscriptions = new SubscriptionCoordinator("session-1", bus);
        safetyTracker = new SafetyStateTracker(
                "session-1", safetySource, new SafetyStateParser(new ObjectMapper()), eventPublisher);
        ConnectionTracker connectionTracker = new ConnectionTracker();
        dataCache = new TradingDataCache();
        refreshConfig = new RefreshConfig();

        lenient().when(safetySource.fetch(SafetySwitch.KILL_SWITCH))
                .thenReturn(CompletableFuture.completedFuture(Optional.of("{\"state\":\"ACTIVE\"}")));
        lenient().when(safetySource.fetch(SafetySwitch.CIRCUIT_BREAKER))
                .thenReturn(CompletableFuture.completedFuture(Optional.of("{\"state\":\"OPEN\"}")));
        lenient().when(tradingClient.fetchPositions(IDENTITY))
                .thenReturn(FieldSnapshot.of(PositionBook.empty(), NOW));
        lenient().when(tradingClient.fetchBuyingPower(IDENTITY))
                .thenReturn(FieldSnapshot.of(new BigDecimal("50000"), NOW));
        lenient().when(tradingClient.fetchRiskLimits(IDENTITY)).thenReturn(FieldSnapshot.of(
                RiskLimits.builder()
                        .maxPositionPerSymbol(new BigDecimal("1000"))
                        .maxNotionalPerOrder(new BigDecimal("100000"))
                        .build(),
                NOW));
        lenient().doReturn(scheduledFuture)
                .when(scheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));

        OrderSubmissionPipeline pipeline = OrderSubmissionPipeline.builder()
                .sessionId("session-1")
                .identity(IDENTITY)
                .safetyTracker(safetyTracker)
                .connectionTracker(connectionTracker)
                .dataCache(dataCache)
                .safetyChecks(new OrderSafetyChecks(StalenessPolicy.defaults()))
                .intentService(new OrderIntentService("session-1", pendingFormRepository, clock))
                .tradingClient(tradingClient)
                .executor(executor)
                .safetyFetchTimeout(Duration.ofSeconds(5))
                .dataFetchTimeout(Duration.ofSeconds(5))
                .clock(clock)
                .eventPublisher(eventPublisher)
                .build();

        coordinator = OrderEntryCoordinator.builder()
                .sessionId("session-1")
                .identity(IDENTITY)
                .subscriptions(subscriptions)
                .safetyTracker(safetyTracker)
                .connectionTracker(connectionTracker)
                .dataCache(dataCache)
                .pipeline(pipeline)
                .tradingClient(tradingClient)
                .payloadParser(new MarketPayloadParser(new ObjectMapper()))
                .scheduler(scheduler)
                .executor(executor)
                .safetyConfig(new SafetyConfig())
                .refreshConfig(refreshConfig)
                .clock(clock)
                .listener(listener)
                .build();
    }

    private static String tick(String symbol, String price) {
        return "{\"symbol\":\"" + symbol + "\",\"price\":\"" + price + "\",\"timestamp\":\"2025-03-14T15:00:00Z\"}";
    }

    // ==============================
    // INITIALIZATION
    // ==============================

    @Nested
    @DisplayName("Initialization")
    class Initialization {

        @Test
        @DisplayName("Subscribes session channels, loads data and schedules refreshes")
        void initializeSucceeds() {
            coordinator.initialize().join();

            assertThat(coordinator.isInitialized()).isTrue();
            assertThat(bus.activeChannels()).containsExactlyInAnyOrder(
                    KILL_SWITCH_CHANNEL, CIRCUIT_BREAKER_CHANNEL, CONNECTION_CHANNEL, POSITIONS_CHANNEL);
            assertThat(safetyTracker.isInitialized()).isTrue();
            assertThat(dataCache.buyingPower().value()).isEqualByComparingTo("50000");
            assertThat(dataCache.riskLimits().hasValue()).isTrue();
            verify(listener).onPositions(PositionBook.empty());
            verify(scheduler).scheduleAtFixedRate(
                    any(Runnable.class), eq(NOW.plus(Duration.ofSeconds(5))), eq(Duration.ofSeconds(5)));
            verify(scheduler, times(3))
                    .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        }

        @Test
        @DisplayName("Failed channel subscribe releases everything and blocks trading")
        void initializeFails() {
            bus.failSubscribesTo(POSITIONS_CHANNEL);

            CompletableFuture<Void> init = coordinator.initialize();

            assertThatThrownBy(init::join).hasCauseInstanceOf(TransientIoException.class);
            assertThat(coordinator.isInitialized()).isFalse();
            assertThat(bus.activeChannels()).isEmpty();
            verify(listener).onTradingBlocked("Initialization failed - please refresh");
            verify(scheduler, never()).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        }

        @Test
        @DisplayName("Failed initial REST load leaves that data stale but does not fail startup")
        void restLoadFailureIsNotFatal() {
            when(tradingClient.fetchRiskLimits(IDENTITY)).thenThrow(new TransientIoException("risk API down"));

            coordinator.initialize().join();

            assertThat(coordinator.isInitialized()).isTrue();
            assertThat(dataCache.riskLimits().hasValue()).isFalse();
            verify(listener, never()).onTradingBlocked(anyString());
        }

        @Test
        @DisplayName("Safety listener receives the initial authoritative states")
        void safetyListenerNotified() {
            coordinator.initialize().join();

            ArgumentCaptor<SafetyState> states = ArgumentCaptor.forClass(SafetyState.class);
            verify(listener, times(2)).onSafetyState(states.capture());
            assertThat(states.getAllValues()).allMatch(SafetyState::isSafe);
        }
    }

    // ==============================
    // SYMBOL SELECTION
    // ==============================

    @Nested
    @DisplayName("Symbol selection")
    class SymbolSelection {

        @Test
        @DisplayName("Selecting a symbol subscribes its normalized price channel")
        void selectSubscribes() {
            coordinator.selectSymbol(" aapl ").join();

            assertThat(bus.isActive(AAPL)).isTrue();
            assertThat(coordinator.selectedSymbol()).contains("AAPL");
            verify(listener).onSymbolChanged("AAPL");
        }

        @Test
        @DisplayName("Invalid symbol is rejected before any channel is touched")
        void invalidSymbolRejected() {
            coordinator.selectSymbol("AAPL").join();

            assertThatThrownBy(() -> coordinator.selectSymbol("AAPL; DROP")).isInstanceOf(IllegalArgumentException.class);

            assertThat(coordinator.selectedSymbol()).contains("AAPL");
            assertThat(bus.isActive(AAPL)).isTrue();
        }

        @Test
        @DisplayName("Reselecting the current symbol does not resubscribe")
        void reselectIsNoOp() {
            coordinator.selectSymbol("AAPL").join();
            coordinator.selectSymbol("aapl").join();

            assertThat(bus.subscribeCount(AAPL)).isEqualTo(1);
            verify(listener, times(1)).onSymbolChanged("AAPL");
        }

        @Test
        @DisplayName("Switching symbols releases the previous channel")
        void switchReleasesPrevious() {
            coordinator.selectSymbol("AAPL").join();
            coordinator.selectSymbol("MSFT").join();

            assertThat(bus.activeChannels()).containsExactly(MSFT);
            assertThat(bus.unsubscribeCount(AAPL)).isEqualTo(1);
        }

        @Test
        @DisplayName("Rapid A then B with subscribes landing in reverse order leaves only B")
        void rapidSwitchLastWins() {
            bus.holdSubscribes();
            CompletableFuture<Void> first = coordinator.selectSymbol("AAPL");
            CompletableFuture<Void> second = coordinator.selectSymbol("MSFT");

            bus.completeSubscribe(MSFT);
            bus.completeSubscribe(AAPL);

            first.join();
            second.join();
            assertThat(bus.activeChannels()).containsExactly(MSFT);
            assertThat(coordinator.selectedSymbol()).contains("MSFT");
            verify(listener, never()).onSymbolChanged("AAPL");
            verify(listener).onSymbolChanged("MSFT");
        }

        @Test
        @DisplayName("Rapid A, B, A keeps A subscribed through the shared in-flight subscribe")
        void rapidSwitchBackKeepsChannel() {
            bus.holdSubscribes();
            coordinator.selectSymbol("AAPL");
            coordinator.selectSymbol("MSFT");
            CompletableFuture<Void> last = coordinator.selectSymbol("AAPL");

            assertThat(bus.heldCount(AAPL)).isEqualTo(1);
            bus.completeSubscribe(AAPL);
            bus.completeSubscribe(MSFT);

            last.join();
            assertThat(bus.activeChannels()).containsExactly(AAPL);
            assertThat(bus.unsubscribeCount(AAPL)).isZero();
            assertThat(coordinator.selectedSymbol()).contains("AAPL");
        }

        @Test
        @DisplayName("Clearing the selection releases the channel and notifies the listener")
        void clearSelection() {
            coordinator.selectSymbol("AAPL").join();

            coordinator.selectSymbol(null).join();

            assertThat(bus.activeChannels()).isEmpty();
            assertThat(coordinator.selectedSymbol()).isEmpty();
            verify(listener).onSymbolChanged(null);
        }

        @Test
        @DisplayName("Failed subscribe surfaces the error and a later reselect succeeds")
        void failedSubscribeCanBeRetried() {
            bus.failSubscribesTo(AAPL);

            assertThatThrownBy(() -> coordinator.selectSymbol("AAPL").join())
                    .hasCauseInstanceOf(TransientIoException.class);

            bus.acceptSubscribesTo(AAPL);
            coordinator.selectSymbol("AAPL").join();

            assertThat(bus.isActive(AAPL)).isTrue();
            verify(listener).onSymbolChanged("AAPL");
        }
    }

    // ==============================
    // WATCHLIST AND PRICE ROUTING
    // ==============================

    @Nested
    @DisplayName("Watchlist and price routing")
    class WatchlistAndPrices {

        @Test
        @DisplayName("Watchlist and ticket share one subscription for the same symbol")
        void sharedChannel() {
            coordinator.watchlistSubscribe("AAPL").join();
            coordinator.selectSymbol("AAPL").join();
            coordinator.selectSymbol("MSFT").join();

            assertThat(bus.isActive(AAPL)).isTrue();
            assertThat(bus.subscribeCount(AAPL)).isEqualTo(1);

            coordinator.watchlistUnsubscribe("aapl").join();

            assertThat(bus.isActive(AAPL)).isFalse();
            assertThat(coordinator.watchlistSymbols()).isEmpty();
        }

        @Test
        @DisplayName("Only ticks for the selected symbol update the order price")
        void selectedPriceRouting() {
            coordinator.selectSymbol("AAPL").join();
            coordinator.watchlistSubscribe("MSFT").join();

            bus.publish(MSFT, tick("MSFT", "410"));
            assertThat(dataCache.priceFor("AAPL").hasValue()).isFalse();
            verify(listener, never()).onSelectedPrice(any(PriceTick.class));

            bus.publish(AAPL, tick("AAPL", "187.25"));
            assertThat(dataCache.priceFor("AAPL").value()).isEqualByComparingTo("187.25");
            verify(listener, times(2)).onPriceTick(any(PriceTick.class));
            verify(listener).onSelectedPrice(any(PriceTick.class));
        }

        @Test
        @DisplayName("Switching symbols discards the previous symbol's price")
        void switchClearsPrice() {
            coordinator.selectSymbol("AAPL").join();
            bus.publish(AAPL, tick("AAPL", "187.25"));

            coordinator.selectSymbol("MSFT").join();

            assertThat(dataCache.priceFor("AAPL").hasValue()).isFalse();
            assertThat(dataCache.priceFor("MSFT").hasValue()).isFalse();
        }
    }

    // ==============================
    // BUS MESSAGES AND RECONNECT
    // ==============================

    @Nested
    @DisplayName("Bus messages and reconnect")
    class BusMessages {

        @Test
        @DisplayName("Kill switch push updates the tracker and the listener")
        void killSwitchPush() {
            coordinator.initialize().join();

            bus.publish(KILL_SWITCH_CHANNEL, "{\"state\":\"ENGAGED\",\"reason\":\"Manual halt\"}");

            assertThat(safetyTracker.current(SafetySwitch.KILL_SWITCH).isBlocking()).isTrue();
            ArgumentCaptor<SafetyState> states = ArgumentCaptor.forClass(SafetyState.class);
            verify(listener, times(3)).onSafetyState(states.capture());
            assertThat(states.getValue().describe()).isEqualTo("Kill switch engaged: Manual halt");
        }

        @Test
        @DisplayName("Positions push replaces the cached book")
        void positionsPush() {
            coordinator.initialize().join();

            bus.publish(POSITIONS_CHANNEL,
                    "{\"positions\":[{\"symbol\":\"AAPL\",\"qty\":\"100\",\"current_price\":\"187\"}],"
                            + "\"timestamp\":\"2025-03-14T15:00:05Z\"}");

            assertThat(dataCache.positions().value().quantityOf("AAPL")).isEqualByComparingTo("100");
            assertThat(dataCache.positions().observedAt()).isEqualTo(Instant.parse("2025-03-14T15:00:05Z"));
        }

        @Test
        @DisplayName("Reconnect re-verifies safety state and restores dropped channels")
        void reconnectRecovers() {
            coordinator.initialize().join();
            coordinator.selectSymbol("AAPL").join();
            bus.publish(CONNECTION_CHANNEL, "{\"state\":\"DISCONNECTED\"}");
            bus.dropSubscription(AAPL);
            bus.dropSubscription(POSITIONS_CHANNEL);

            bus.publish(CONNECTION_CHANNEL, "{\"state\":\"CONNECTED\"}");

            assertThat(bus.isActive(AAPL)).isTrue();
            assertThat(bus.isActive(POSITIONS_CHANNEL)).isTrue();
            verify(safetySource, times(2)).fetch(SafetySwitch.KILL_SWITCH);
            verify(listener).onConnectionState(ConnectionState.CONNECTED);
        }

        @Test
        @DisplayName("Degraded to connected is not treated as a reconnect")
        void degradedIsNotReconnect() {
            coordinator.initialize().join();
            bus.publish(CONNECTION_CHANNEL, "{\"state\":\"CONNECTED\"}");
            int subscribesBefore = bus.subscribeCount(KILL_SWITCH_CHANNEL);

            bus.publish(CONNECTION_CHANNEL, "{\"state\":\"DEGRADED\"}");
            bus.publish(CONNECTION_CHANNEL, "{\"state\":\"CONNECTED\"}");

            assertThat(bus.subscribeCount(KILL_SWITCH_CHANNEL)).isEqualTo(subscribesBefore);
        }
    }

    // ==============================
    // REFRESH, FILLS AND TEARDOWN
    // ==============================

    @Nested
    @DisplayName("Refresh, fills and teardown")
    class RefreshAndTeardown {

        @Test
        @DisplayName("Refresh tick is skipped while the previous fetch is still running")
        void refreshSkipsWhileInFlight() {
            coordinator.initialize().join();
            ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
            verify(scheduler).scheduleAtFixedRate(
                    task.capture(), any(Instant.class), eq(refreshConfig.getPositionInterval()));

            queueTasks = true;
            task.getValue().run();
            task.getValue().run();

            assertThat(queuedTasks).hasSize(1);
            queuedTasks.get(0).run();
            verify(tradingClient, times(2)).fetchPositions(IDENTITY);
        }

        @Test
        @DisplayName("Recent fills are delivered to the listener")
        void recentFills() {
            List<FillRecord> fills = List.of(new FillRecord(
                    "AAPL", "buy", new BigDecimal("10"), new BigDecimal("187.25"), NOW, "intent-1"));
            when(tradingClient.fetchRecentFills(IDENTITY, 50)).thenReturn(fills);

            assertThat(coordinator.refreshRecentFills().join()).isEqualTo(fills);
            verify(listener).onFills(fills);
        }

        @Test
        @DisplayName("Dispose unsubscribes everything, cancels refreshes and refuses further calls")
        void disposeTearsDown() {
            coordinator.initialize().join();
            coordinator.selectSymbol("AAPL").join();

            coordinator.dispose().join();
            coordinator.dispose().join();

            assertThat(coordinator.isDisposed()).isTrue();
            assertThat(bus.activeChannels()).isEmpty();
            verify(scheduledFuture, times(3)).cancel(false);
            assertThatThrownBy(() -> coordinator.selectSymbol("MSFT").join())
                    .hasCauseInstanceOf(SessionDisposedException.class);
        }

        @Test
        @DisplayName("Dispose during a pending selection leaves nothing subscribed")
        void disposeDuringSelection() {
            bus.holdSubscribes();
            CompletableFuture<Void> selection = coordinator.selectSymbol("AAPL");

            coordinator.dispose().join();
            bus.completeSubscribe(AAPL);

            assertThat(selection).isCompletedExceptionally();
            assertThat(bus.isActive(AAPL)).isFalse();
            verify(listener, never()).onSymbolChanged(anyString());
        }
    }
}
