package dk.cloudcreate.domainkit.eventsourced.aggregates.bus;

import dk.cloudcreate.domainkit.eventsourced.aggregates.DomainEvent;
import org.slf4j.*;
import reactor.core.Disposable;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.*;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import static dk.cloudcreate.domainkit.common.FailFast.*;
import static dk.cloudcreate.domainkit.common.MessageFormatter.msg;

/**
 * In-process {@link NotificationEventBus} that supports both synchronous and asynchronous subscribers.<br>
 * <ul>
 *     <li>Synchronous subscribers ({@link #subscribe(Consumer)}) are called on the publishing thread, in the order they subscribed.</li>
 *     <li>Asynchronous subscribers ({@link #subscribeAsync(Consumer)}) are called on a Reactor {@link Scheduler}. Each asynchronous
 *     subscriber receives the events in the order they were published.</li>
 * </ul>
 * A subscriber that throws an exception is reported to the {@link OnErrorHandler} and doesn't affect the delivery to other subscribers.
 * <pre>{@code
 * var bus = new LocalNotificationEventBus("OrderEvents");
 * bus.subscribe(OrderAccepted.class, orderAccepted -> ...);
 * }</pre>
 */
public class LocalNotificationEventBus implements NotificationEventBus, AutoCloseable {
    private static final Logger log                      = LoggerFactory.getLogger(LocalNotificationEventBus.class);
    public static final  int    DEFAULT_PARALLEL_THREADS = 3;

    private final    String                  busName;
    private final    OnErrorHandler          onErrorHandler;
    private final    Scheduler               asyncSubscriberScheduler;
    private final    List<SyncSubscription>  syncSubscriptions  = new CopyOnWriteArrayList<>();
    private final    List<AsyncSubscription> asyncSubscriptions = new CopyOnWriteArrayList<>();
    private volatile boolean                 closed;

    /**
     * Create a bus that logs subscriber failures
     *
     * @param busName the name of the bus (also used as name of the asynchronous subscriber threads)
     */
    public LocalNotificationEventBus(String busName) {
        this(busName, DEFAULT_PARALLEL_THREADS, null);
    }

    public LocalNotificationEventBus(String busName, OnErrorHandler onErrorHandler) {
        this(busName, DEFAULT_PARALLEL_THREADS, onErrorHandler);
    }

    /**
     * @param busName         the name of the bus (also used as name of the asynchronous subscriber threads)
     * @param parallelThreads the number of threads available to asynchronous subscribers
     * @param onErrorHandler  the handler called when a subscriber fails - if <code>null</code> the failure is logged
     */
    public LocalNotificationEventBus(String busName, int parallelThreads, OnErrorHandler onErrorHandler) {
        this.busName = requireNonBlank(busName, "No busName provided");
        requireTrue(parallelThreads > 0, "parallelThreads must be > 0");
        this.onErrorHandler = onErrorHandler != null ? onErrorHandler : this::logSubscriberFailure;
        this.asyncSubscriberScheduler = Schedulers.newParallel(busName, parallelThreads, true);
    }

    public String busName() {
        return busName;
    }

    @Override
    public void publish(DomainEvent event) {
        requireNonNull(event, "No event provided");
        requireFalse(closed, msg("Cannot publish to the closed bus '{}'", busName));
        log.trace("[{}] Publishing {} to {} sync and {} async subscriber(s)",
                  busName,
                  event.getClass().getSimpleName(),
                  syncSubscriptions.size(),
                  asyncSubscriptions.size());
        for (var subscription : syncSubscriptions) {
            deliver(subscription.subscriber, event);
        }
        synchronized (asyncSubscriptions) {
            for (var subscription : asyncSubscriptions) {
                var result = subscription.events.tryEmitNext(event);
                if (result.isFailure()) {
                    log.error("[{}] Failed to hand over {} to an async subscriber: {}", busName, event.getClass().getSimpleName(), result);
                }
            }
        }
    }

    /**
     * Add a synchronous subscriber
     */
    @Override
    public Disposable subscribe(Consumer<DomainEvent> subscriber) {
        requireNonNull(subscriber, "No subscriber provided");
        var subscription = new SyncSubscription(subscriber);
        syncSubscriptions.add(subscription);
        return subscription;
    }

    /**
     * Add an asynchronous subscriber
     *
     * @param subscriber the subscriber
     * @return the subscription - {@link Disposable#dispose()} it to unsubscribe
     */
    public Disposable subscribeAsync(Consumer<DomainEvent> subscriber) {
        requireNonNull(subscriber, "No subscriber provided");
        var subscription = new AsyncSubscription(subscriber);
        asyncSubscriptions.add(subscription);
        return subscription;
    }

    public boolean hasSubscribers() {
        return !syncSubscriptions.isEmpty() || !asyncSubscriptions.isEmpty();
    }

    /**
     * Remove all subscribers and stop the asynchronous subscriber threads
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        log.debug("[{}] Closing", busName);
        syncSubscriptions.forEach(SyncSubscription::dispose);
        asyncSubscriptions.forEach(AsyncSubscription::dispose);
        asyncSubscriberScheduler.dispose();
    }

    private void deliver(Consumer<DomainEvent> subscriber, DomainEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            onErrorHandler.handle(subscriber, event, e);
        }
    }

    private void logSubscriberFailure(Consumer<DomainEvent> failingSubscriber, DomainEvent event, Exception error) {
        log.error(msg("[{}] Subscriber {} failed to handle {}", busName, failingSubscriber.getClass().getName(), event.getClass().getName()), error);
    }

    private class SyncSubscription implements Disposable {
        private final    Consumer<DomainEvent> subscriber;
        private volatile boolean               disposed;

        private SyncSubscription(Consumer<DomainEvent> subscriber) {
            this.subscriber = subscriber;
        }

        @Override
        public void dispose() {
            disposed = true;
            syncSubscriptions.remove(this);
        }

        @Override
        public boolean isDisposed() {
            return disposed;
        }
    }

    private class AsyncSubscription implements Disposable {
        private final Sinks.Many<DomainEvent> events = Sinks.many().unicast().onBackpressureBuffer();
        private final Disposable              subscription;

        private AsyncSubscription(Consumer<DomainEvent> subscriber) {
            subscription = events.asFlux()
                                 .publishOn(asyncSubscriberScheduler)
                                 .subscribe(event -> deliver(subscriber, event));
        }

        @Override
        public void dispose() {
            synchronized (asyncSubscriptions) {
                asyncSubscriptions.remove(this);
                events.tryEmitComplete();
            }
            subscription.dispose();
        }

        @Override
        public boolean isDisposed() {
            return subscription.isDisposed();
        }
    }
}
