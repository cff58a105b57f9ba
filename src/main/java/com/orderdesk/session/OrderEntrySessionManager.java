package com.orderdesk.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderdesk.client.TraderIdentity;
import com.orderdesk.client.TradingClient;
import com.orderdesk.config.RefreshConfig;
import com.orderdesk.config.SafetyConfig;
import com.orderdesk.config.SubscriptionConfig;
import com.orderdesk.exception.ProgrammingInvariantException;
import com.orderdesk.market.ConnectionTracker;
import com.orderdesk.market.MarketPayloadParser;
import com.orderdesk.oms.OrderIntentService;
import com.orderdesk.oms.OrderSafetyChecks;
import com.orderdesk.oms.OrderSubmissionPipeline;
import com.orderdesk.oms.TradingDataCache;
import com.orderdesk.repository.redis.PendingOrderFormRedisRepository;
import com.orderdesk.safety.SafetyStateParser;
import com.orderdesk.safety.SafetyStateSource;
import com.orderdesk.safety.SafetyStateTracker;
import com.orderdesk.staleness.StalenessPolicy;
import com.orderdesk.subscription.MessageBus;
import com.orderdesk.subscription.RedisMessageBus;
import com.orderdesk.subscription.SubscriptionCoordinator;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Registry of live order-entry sessions.
 *
 * <p>Each session gets its own {@link OrderEntryCoordinator} with its own bus view,
 * subscription bookkeeping, safety tracker, data cache and pipeline. Nothing per-session is
 * shared between sessions, so two tabs of the same user never see each other's intents.
 * All sessions are disposed on shutdown.
 */
@Service
public class OrderEntrySessionManager {

    private static final Logger log = LoggerFactory.getLogger(OrderEntrySessionManager.class);

    private final RedisMessageListenerContainer listenerContainer;
    private final Executor executor;
    private final TaskScheduler scheduler;
    private final SafetyStateSource safetyStateSource;
    private final SafetyStateParser safetyStateParser;
    private final MarketPayloadParser payloadParser;
    private final TradingClient tradingClient;
    private final PendingOrderFormRedisRepository pendingFormRepository;
    private final StalenessPolicy stalenessPolicy;
    private final SafetyConfig safetyConfig;
    private final RefreshConfig refreshConfig;
    private final SubscriptionConfig subscriptionConfig;
    private final Clock clock;
    private final ApplicationEventPublisher eventPublisher;

    private final Map<String, OrderEntryCoordinator> sessions = new ConcurrentHashMap<>();

    public OrderEntrySessionManager(
            RedisMessageListenerContainer listenerContainer,
            @Qualifier("orderEntryExecutor") Executor executor,
            @Qualifier("orderEntryScheduler") TaskScheduler scheduler,
            SafetyStateSource safetyStateSource,
            ObjectMapper objectMapper,
            MarketPayloadParser payloadParser,
            TradingClient tradingClient,
            PendingOrderFormRedisRepository pendingFormRepository,
            StalenessPolicy stalenessPolicy,
            SafetyConfig safetyConfig,
            RefreshConfig refreshConfig,
            SubscriptionConfig subscriptionConfig,
            Clock clock,
            ApplicationEventPublisher eventPublisher) {
        this.listenerContainer = listenerContainer;
        this.executor = executor;
        this.scheduler = scheduler;
        this.safetyStateSource = safetyStateSource;
        this.safetyStateParser = new SafetyStateParser(objectMapper);
        this.payloadParser = payloadParser;
        this.tradingClient = tradingClient;
        this.pendingFormRepository = pendingFormRepository;
        this.stalenessPolicy = stalenessPolicy;
        this.safetyConfig = safetyConfig;
        this.refreshConfig = refreshConfig;
        this.subscriptionConfig = subscriptionConfig;
        this.clock = clock;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Creates and starts the coordinator for {@code sessionId}. The returned coordinator is
     * usable immediately; its order checks block until initialization completes.
     *
     * @throws ProgrammingInvariantException if the session is already open
     */
    public OrderEntryCoordinator open(String sessionId, String userId, String role, OrderEntryListener listener) {
        OrderEntryCoordinator coordinator = createCoordinator(sessionId, new TraderIdentity(userId, role), listener);
        OrderEntryCoordinator existing = sessions.putIfAbsent(sessionId, coordinator);
        if (existing != null) {
            throw new ProgrammingInvariantException(
                    "Order entry session already open: " + sessionId, Map.of("sessionId", sessionId));
        }
        log.info("Opening order entry session {} for user {}", sessionId, userId);
        coordinator.initialize().whenComplete((ignored, error) -> {
            if (error != null) {
                log.warn("Order entry session {} started blocked: {}", sessionId, error.getMessage());
            }
        });
        return coordinator;
    }

    public CompletableFuture<Void> close(String sessionId) {
        OrderEntryCoordinator coordinator = sessions.remove(sessionId);
        if (coordinator == null) {
            return CompletableFuture.completedFuture(null);
        }
        log.info("Closing order entry session {}", sessionId);
        return coordinator.dispose();
    }

    public Optional<OrderEntryCoordinator> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Disposing {} order entry sessions", sessions.size());
        for (String sessionId : sessions.keySet()) {
            close(sessionId);
        }
    }

    OrderEntryCoordinator createCoordinator(String sessionId, TraderIdentity identity, OrderEntryListener listener) {
        MessageBus bus = new RedisMessageBus(listenerContainer, executor);
        SubscriptionCoordinator subscriptions = new SubscriptionCoordinator(sessionId, bus, scheduler, clock, subscriptionConfig);
        SafetyStateTracker safetyTracker =
                new SafetyStateTracker(sessionId, safetyStateSource, safetyStateParser, eventPublisher);
        ConnectionTracker connectionTracker = new ConnectionTracker();
        TradingDataCache dataCache = new TradingDataCache();

        OrderSubmissionPipeline pipeline = OrderSubmissionPipeline.builder()
                .sessionId(sessionId)
                .identity(identity)
                .safetyTracker(safetyTracker)
                .connectionTracker(connectionTracker)
                .dataCache(dataCache)
                .safetyChecks(new OrderSafetyChecks(stalenessPolicy))
                .intentService(new OrderIntentService(sessionId, pendingFormRepository, clock))
                .tradingClient(tradingClient)
                .executor(executor)
                .safetyFetchTimeout(safetyConfig.getSubmitFetchTimeout())
                .dataFetchTimeout(refreshConfig.getConfirmFetchTimeout())
                .clock(clock)
                .eventPublisher(eventPublisher)
                .build();

        return OrderEntryCoordinator.builder()
                .sessionId(sessionId)
                .identity(identity)
                .subscriptions(subscriptions)
                .safetyTracker(safetyTracker)
                .connectionTracker(connectionTracker)
                .dataCache(dataCache)
                .pipeline(pipeline)
                .tradingClient(tradingClient)
                .payloadParser(payloadParser)
                .scheduler(scheduler)
                .executor(executor)
                .safetyConfig(safetyConfig)
                .refreshConfig(refreshConfig)
                .clock(clock)
                .listener(listener != null ? listener : new OrderEntryListener() {})
                .build();
    }
}
