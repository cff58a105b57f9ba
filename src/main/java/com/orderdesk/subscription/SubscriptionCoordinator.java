package com.orderdesk.subscription;

import com.orderdesk.config.SubscriptionConfig;
import com.orderdesk.exception.BaseException;
import com.orderdesk.exception.ProgrammingInvariantException;
import com.orderdesk.exception.SessionDisposedException;
import com.orderdesk.exception.TransientIoException;
import io.github.resilience4j.core.IntervalFunction;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

/**
 * Sole owner of the bus subscriptions of one order-entry session.
 *
 * <p>Logical owners (e.g., "watchlist", "selected_symbol") acquire and release channels by
 * owner ID. A channel is subscribed on the bus exactly once, when its owner set goes from
 * empty to non-empty, and unsubscribed when it becomes empty again. Every owner of a
 * channel must supply the same handler; a different handler is a caller bug and fails fast
 * with {@link ProgrammingInvariantException}.
 *
 * <p>Concurrent acquirers of a channel whose subscribe is still in flight all wait on the
 * same pending future. If the subscribe fails, every owner recorded for the channel is
 * rolled back, the channel is remembered for {@link #retryFailed()}, and every waiter sees
 * a {@link TransientIoException}. When a scheduler is supplied, failed channels are also
 * retried automatically with exponential backoff until the attempt budget runs out.
 *
 * <p>All bookkeeping maps are guarded by one lock. Bus calls and future completion happen
 * outside it.
 */
public class SubscriptionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionCoordinator.class);

    private final String sessionId;
    private final MessageBus bus;

    private final ReentrantLock lock = new ReentrantLock();

    /** Channel to its current owners. Present with an empty set only while an orphaned subscribe is in flight. */
    private final Map<String, Set<String>> channelOwners = new HashMap<>();

    private final Map<String, MessageHandler> channelHandlers = new HashMap<>();

    private final Map<String, CompletableFuture<Void>> pendingSubscribes = new HashMap<>();

    private final Set<String> subscribedChannels = new LinkedHashSet<>();

    /** Channels whose subscribe failed, with the owners and handler to restore on retry. */
    private final Map<String, FailedSubscription> failedSubscriptions = new LinkedHashMap<>();

    /** Automatic retry attempts made per failed channel since its last successful subscribe. */
    private final Map<String, Integer> retryAttempts = new HashMap<>();

    private final Map<String, ScheduledFuture<?>> scheduledRetries = new HashMap<>();

    private final TaskScheduler scheduler;
    private final Clock clock;
    private final IntervalFunction retryBackoff;
    private final int retryMaxAttempts;

    private boolean disposed;

    /** Coordinator without automatic retry; failed channels wait for {@link #retryFailed()}. */
    public SubscriptionCoordinator(String sessionId, MessageBus bus) {
        this.sessionId = sessionId;
        this.bus = bus;
        this.scheduler = null;
        this.clock = Clock.systemUTC();
        this.retryBackoff = null;
        this.retryMaxAttempts = 0;
    }

    /**
     * Coordinator that retries failed subscribes on {@code scheduler}. The scheduler must run
     * tasks on its own threads, never inline from {@code schedule}.
     */
    public SubscriptionCoordinator(
            String sessionId, MessageBus bus, TaskScheduler scheduler, Clock clock, SubscriptionConfig config) {
        this.sessionId = sessionId;
        this.bus = bus;
        this.scheduler = scheduler;
        this.clock = clock;
        this.retryBackoff = config.retryBackoff();
        this.retryMaxAttempts = config.getRetryMaxAttempts();
    }

    // ========================================================================
    // Acquire / release
    // ========================================================================

    /**
     * Adds {@code owner} to {@code channel}, subscribing on the bus if it is the first owner.
     *
     * <p>The returned future completes when the channel is live, or exceptionally with
     * {@link TransientIoException} if the subscribe failed (the owner is then not registered),
     * or with {@link CancellationException} if the session is disposed first.
     *
     * @throws ProgrammingInvariantException if the channel is held with a different handler
     */
    public CompletableFuture<Void> acquire(String channel, String owner, MessageHandler handler) {
        Registration registration;
        lock.lock();
        try {
            if (disposed) {
                return CompletableFuture.failedFuture(new SessionDisposedException(sessionId));
            }
            registration = register(channel, Set.of(owner), handler);
        } finally {
            lock.unlock();
        }
        return await(registration, channel, handler);
    }

    /**
     * Removes {@code owner} from {@code channel}. The bus subscription is dropped only when no
     * owner remains. If a subscribe is still in flight, the channel is left orphaned and is
     * unsubscribed as soon as that subscribe completes.
     */
    public CompletableFuture<Void> release(String channel, String owner) {
        lock.lock();
        try {
            if (disposed) {
                return CompletableFuture.completedFuture(null);
            }

            FailedSubscription failed = failedSubscriptions.get(channel);
            if (failed != null) {
                failed.owners().remove(owner);
                if (failed.owners().isEmpty()) {
                    failedSubscriptions.remove(channel);
                    cancelRetry(channel);
                }
            }

            Set<String> owners = channelOwners.get(channel);
            if (owners == null || !owners.remove(owner) || !owners.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }

            if (pendingSubscribes.containsKey(channel)) {
                log.debug("Last owner left {} while subscribe pending; will unsubscribe on completion", channel);
                return CompletableFuture.completedFuture(null);
            }

            channelOwners.remove(channel);
            channelHandlers.remove(channel);
            subscribedChannels.remove(channel);
            failedSubscriptions.remove(channel);
            cancelRetry(channel);
        } finally {
            lock.unlock();
        }
        return unsubscribeLogged(channel);
    }

    // ========================================================================
    // Reconnect recovery
    // ========================================================================

    /**
     * Re-issues the bus subscription of every live channel with its recorded handler.
     * A channel that fails is moved to the failed set; the others are unaffected. A channel
     * whose last owner leaves while its re-subscribe is in flight is unsubscribed again
     * once that re-subscribe lands.
     */
    public CompletableFuture<Void> resubscribeAll() {
        List<String> targets;
        lock.lock();
        try {
            if (disposed) {
                return CompletableFuture.completedFuture(null);
            }
            targets = new ArrayList<>(subscribedChannels);
        } finally {
            lock.unlock();
        }

        if (targets.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        log.info("Session {}: re-subscribing {} channels after reconnect", sessionId, targets.size());

        List<CompletableFuture<Void>> attempts = new ArrayList<>();
        for (String channel : targets) {
            MessageHandler handler;
            lock.lock();
            try {
                Set<String> owners = channelOwners.get(channel);
                if (disposed || !subscribedChannels.contains(channel) || owners == null || owners.isEmpty()) {
                    continue;
                }
                handler = channelHandlers.get(channel);
            } finally {
                lock.unlock();
            }
            attempts.add(callSubscribe(channel, handler).handle((ignored, error) -> {
                if (error != null) {
                    log.warn("Failed to resubscribe {}: {}", channel, rootMessage(error));
                    demoteToFailed(channel, handler, error);
                } else {
                    onResubscribed(channel);
                }
                return null;
            }));
        }
        return CompletableFuture.allOf(attempts.toArray(new CompletableFuture[0]));
    }

    /**
     * Re-acquires every failed channel for all of its recorded owners at once, restarting
     * the automatic retry budget. A channel that fails again stays in the failed set.
     */
    public CompletableFuture<Void> retryFailed() {
        List<String> channels;
        lock.lock();
        try {
            if (disposed) {
                return CompletableFuture.completedFuture(null);
            }
            channels = new ArrayList<>(failedSubscriptions.keySet());
            channels.forEach(this::cancelRetry);
        } finally {
            lock.unlock();
        }

        if (channels.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        log.info("Session {}: retrying {} failed subscriptions", sessionId, channels.size());

        List<CompletableFuture<Void>> attempts = new ArrayList<>();
        for (String channel : channels) {
            attempts.add(retryChannel(channel));
        }
        return CompletableFuture.allOf(attempts.toArray(new CompletableFuture[0]));
    }

    /** Number of channels with an automatic retry waiting on the scheduler. */
    public int scheduledRetryCount() {
        lock.lock();
        try {
            return (int) scheduledRetries.values().stream().filter(task -> !task.isDone()).count();
        } finally {
            lock.unlock();
        }
    }

    // ========================================================================
    // Teardown
    // ========================================================================

    /**
     * Unsubscribes every live channel, cancels every pending subscribe and scheduled retry,
     * and marks the coordinator disposed. Results of subscribes still in flight are discarded (and the
     * channel unsubscribed) when they arrive.
     */
    public CompletableFuture<Void> dispose() {
        List<String> toUnsubscribe;
        List<CompletableFuture<Void>> pending;
        lock.lock();
        try {
            if (disposed) {
                return CompletableFuture.completedFuture(null);
            }
            disposed = true;
            toUnsubscribe = new ArrayList<>(subscribedChannels);
            pending = new ArrayList<>(pendingSubscribes.values());
            channelOwners.clear();
            channelHandlers.clear();
            pendingSubscribes.clear();
            subscribedChannels.clear();
            failedSubscriptions.clear();
            scheduledRetries.values().forEach(task -> task.cancel(false));
            scheduledRetries.clear();
            retryAttempts.clear();
        } finally {
            lock.unlock();
        }

        CancellationException cancelled = new CancellationException("Order entry session " + sessionId + " disposed");
        pending.forEach(future -> future.completeExceptionally(cancelled));

        List<CompletableFuture<Void>> unsubscribes = new ArrayList<>();
        for (String channel : toUnsubscribe) {
            unsubscribes.add(unsubscribeLogged(channel).exceptionally(error -> null));
        }
        log.info("Session {}: subscription coordinator disposed ({} channels released)", sessionId, toUnsubscribe.size());
        return CompletableFuture.allOf(unsubscribes.toArray(new CompletableFuture[0]));
    }

    // ========================================================================
    // Queries
    // ========================================================================

    public boolean isSubscribed(String channel) {
        lock.lock();
        try {
            return subscribedChannels.contains(channel);
        } finally {
            lock.unlock();
        }
    }

    public Set<String> ownersOf(String channel) {
        lock.lock();
        try {
            Set<String> owners = channelOwners.get(channel);
            return owners == null ? Set.of() : Set.copyOf(owners);
        } finally {
            lock.unlock();
        }
    }

    public boolean hasPendingSubscribe(String channel) {
        lock.lock();
        try {
            return pendingSubscribes.containsKey(channel);
        } finally {
            lock.unlock();
        }
    }

    public Set<String> subscribedChannels() {
        lock.lock();
        try {
            return Set.copyOf(subscribedChannels);
        } finally {
            lock.unlock();
        }
    }

    public Set<String> failedChannels() {
        lock.lock();
        try {
            return Set.copyOf(failedSubscriptions.keySet());
        } finally {
            lock.unlock();
        }
    }

    public boolean isDisposed() {
        lock.lock();
        try {
            return disposed;
        } finally {
            lock.unlock();
        }
    }

    // ========================================================================
    // Internal
    // ========================================================================

    /** Must hold the lock. Validates the handler before touching any state. */
    private Registration register(String channel, Set<String> owners, MessageHandler handler) {
        MessageHandler existing = channelHandlers.get(channel);
        if (existing != null && !existing.equals(handler)) {
            throw new ProgrammingInvariantException(
                    "Handler mismatch for channel " + channel + ": owners " + owners + " supplied a different handler",
                    Map.of("channel", channel, "owners", List.copyOf(owners)));
        }

        CompletableFuture<Void> pending = pendingSubscribes.get(channel);
        boolean needSubscribe = false;
        if (pending == null && !channelOwners.containsKey(channel)) {
            channelOwners.put(channel, new HashSet<>());
            pending = new CompletableFuture<>();
            pendingSubscribes.put(channel, pending);
            needSubscribe = true;
        }

        channelOwners.get(channel).addAll(owners);
        channelHandlers.putIfAbsent(channel, handler);

        FailedSubscription failed = failedSubscriptions.get(channel);
        if (failed != null) {
            failed.owners().removeAll(owners);
            if (failed.owners().isEmpty()) {
                failedSubscriptions.remove(channel);
            }
        }
        return new Registration(pending, needSubscribe);
    }

    private CompletableFuture<Void> await(Registration registration, String channel, MessageHandler handler) {
        if (registration.needSubscribe()) {
            callSubscribe(channel, handler).whenComplete((ignored, error) -> {
                if (error == null) {
                    onSubscribed(channel, registration.pending());
                } else {
                    onSubscribeFailed(channel, handler, registration.pending(), error);
                }
            });
        }
        if (registration.pending() == null) {
            return CompletableFuture.completedFuture(null);
        }
        return registration.pending().copy();
    }

    private void onSubscribed(String channel, CompletableFuture<Void> pending) {
        boolean late;
        boolean orphaned = false;
        lock.lock();
        try {
            late = disposed;
            if (!late) {
                pendingSubscribes.remove(channel);
                Set<String> owners = channelOwners.get(channel);
                retryAttempts.remove(channel);
                if (owners != null && !owners.isEmpty()) {
                    subscribedChannels.add(channel);
                } else {
                    channelOwners.remove(channel);
                    channelHandlers.remove(channel);
                    orphaned = true;
                }
            }
        } finally {
            lock.unlock();
        }

        if (late) {
            log.info("Session disposed during subscribe, unsubscribing {}", channel);
            unsubscribeLogged(channel);
            return;
        }
        if (orphaned) {
            log.info("All owners released {} during subscribe, unsubscribing orphan", channel);
            unsubscribeLogged(channel);
        }
        pending.complete(null);
    }

    private void onSubscribeFailed(
            String channel, MessageHandler handler, CompletableFuture<Void> pending, Throwable error) {
        lock.lock();
        try {
            if (disposed) {
                return;
            }
            pendingSubscribes.remove(channel);
            channelHandlers.remove(channel);
            Set<String> owners = channelOwners.remove(channel);
            if (owners != null && !owners.isEmpty()) {
                recordFailed(channel, owners, handler);
            }
        } finally {
            lock.unlock();
        }
        log.warn("Failed to subscribe to {}: {}", channel, rootMessage(error));
        scheduleRetry(channel, error);
        pending.completeExceptionally(TransientIoException.forChannel(channel, unwrap(error)));
    }

    private void demoteToFailed(String channel, MessageHandler handler, Throwable error) {
        lock.lock();
        try {
            if (disposed || !subscribedChannels.remove(channel)) {
                return;
            }
            channelHandlers.remove(channel);
            Set<String> owners = channelOwners.remove(channel);
            if (owners != null && !owners.isEmpty()) {
                recordFailed(channel, owners, handler);
            }
        } finally {
            lock.unlock();
        }
        scheduleRetry(channel, error);
    }

    /** Undoes a re-subscribe that landed after its channel was released or the session disposed. */
    private void onResubscribed(String channel) {
        boolean untracked;
        lock.lock();
        try {
            untracked = disposed || !channelOwners.containsKey(channel);
        } finally {
            lock.unlock();
        }
        if (untracked) {
            log.info("Channel {} released during re-subscribe, unsubscribing", channel);
            unsubscribeLogged(channel);
        }
    }

    private CompletableFuture<Void> retryChannel(String channel) {
        Registration registration;
        FailedSubscription current = null;
        lock.lock();
        try {
            if (disposed) {
                return CompletableFuture.completedFuture(null);
            }
            current = failedSubscriptions.remove(channel);
            if (current == null || current.owners().isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }
            registration = register(channel, current.owners(), current.handler());
        } catch (ProgrammingInvariantException e) {
            log.error("Cannot retry {}: {}", channel, e.getMessage());
            failedSubscriptions.put(channel, current);
            return CompletableFuture.completedFuture(null);
        } finally {
            lock.unlock();
        }
        int ownerCount = current.owners().size();
        return await(registration, channel, current.handler()).handle((ignored, error) -> {
            if (error == null) {
                log.info("Retried subscription for {} with {} owner(s)", channel, ownerCount);
            } else {
                log.warn("Retry failed for {}: {}", channel, rootMessage(error));
            }
            return null;
        });
    }

    /** Schedules the next automatic retry of a failed channel, if the budget allows one. */
    private void scheduleRetry(String channel, Throwable error) {
        if (scheduler == null) {
            return;
        }
        if (!BaseException.isRetryable(error)) {
            log.warn("Not retrying {} automatically: {}", channel, rootMessage(error));
            return;
        }
        lock.lock();
        try {
            if (disposed || !failedSubscriptions.containsKey(channel)) {
                return;
            }
            ScheduledFuture<?> existing = scheduledRetries.get(channel);
            if (existing != null && !existing.isDone()) {
                return;
            }
            int attempt = retryAttempts.getOrDefault(channel, 0) + 1;
            if (attempt > retryMaxAttempts) {
                log.warn("Giving up automatic retry of {} after {} attempts; waiting for reconnect",
                        channel, retryMaxAttempts);
                return;
            }
            retryAttempts.put(channel, attempt);
            long delayMillis = retryBackoff.apply(attempt);
            scheduledRetries.put(channel, scheduler.schedule(
                    () -> runScheduledRetry(channel), clock.instant().plusMillis(delayMillis)));
            log.info("Session {}: retry {} of {} for {} in {}ms", sessionId, attempt, retryMaxAttempts, channel, delayMillis);
        } finally {
            lock.unlock();
        }
    }

    private void runScheduledRetry(String channel) {
        lock.lock();
        try {
            scheduledRetries.remove(channel);
        } finally {
            lock.unlock();
        }
        retryChannel(channel);
    }

    /** Must hold the lock. */
    private void cancelRetry(String channel) {
        ScheduledFuture<?> task = scheduledRetries.remove(channel);
        if (task != null) {
            task.cancel(false);
        }
        retryAttempts.remove(channel);
    }

    /** Must hold the lock. */
    private void recordFailed(String channel, Set<String> owners, MessageHandler handler) {
        FailedSubscription existing = failedSubscriptions.get(channel);
        if (existing != null && existing.handler().equals(handler)) {
            existing.owners().addAll(owners);
        } else {
            failedSubscriptions.put(channel, new FailedSubscription(new HashSet<>(owners), handler));
        }
    }

    private CompletableFuture<Void> callSubscribe(String channel, MessageHandler handler) {
        try {
            return bus.subscribe(channel, handler);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<Void> unsubscribeLogged(String channel) {
        CompletableFuture<Void> call;
        try {
            call = bus.unsubscribe(channel);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        return call.whenComplete((ignored, error) -> {
            if (error != null) {
                log.warn("Failed to unsubscribe {}: {}", channel, rootMessage(error));
            }
        });
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = unwrap(error);
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private record Registration(CompletableFuture<Void> pending, boolean needSubscribe) {}

    private record FailedSubscription(Set<String> owners, MessageHandler handler) {}
}
