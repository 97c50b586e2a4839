package dk.cloudcreate.domainkit.eventsourced.aggregates.store.inmemory;

import dk.cloudcreate.domainkit.eventsourced.aggregates.ConcurrencyException;
import dk.cloudcreate.domainkit.eventsourced.aggregates.store.*;
import org.slf4j.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import static dk.cloudcreate.domainkit.common.FailFast.*;
import static dk.cloudcreate.domainkit.common.MessageFormatter.msg;

/**
 * Thread safe in-memory {@link EventStoreRepository} and {@link AggregateManifestRepository}.<br>
 * All reads and writes are guarded by one lock. {@link #executeAtomically(Runnable)} holds the lock for the duration of the
 * work and records an undo action for every write, so a failing <code>work</code> leaves both the events and the manifest
 * as they were before the call.
 * <p>
 * Records are copied on the way in and on the way out.
 * <p>
 * {@link #close()} doesn't discard any data, so one instance can be shared by many repositories
 */
public class InMemoryEventStore implements EventStoreRepository, AggregateManifestRepository {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final ReentrantLock                  lock          = new ReentrantLock();
    private final Map<String, List<StoredEvent>> eventStreams  = new HashMap<>();
    private final Map<String, Long>              manifest      = new HashMap<>();
    private final ThreadLocal<Deque<Runnable>>   activeUndoLog = new ThreadLocal<>();
    private final Clock                          clock;

    public InMemoryEventStore() {
        this(Clock.systemUTC());
    }

    public InMemoryEventStore(Clock clock) {
        this.clock = requireNonNull(clock, "No clock provided");
    }

    @Override
    public List<StoredEvent> getAllAggregateEvents(Object aggregateId) {
        var key = toKey(aggregateId);
        lock.lock();
        try {
            return eventStreams.getOrDefault(key, List.of())
                               .stream()
                               .map(StoredEvent::copy)
                               .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<StoredEvent> getLastAggregateEvent(Object aggregateId) {
        var key = toKey(aggregateId);
        lock.lock();
        try {
            var eventStream = eventStreams.get(key);
            if (eventStream == null || eventStream.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(eventStream.get(eventStream.size() - 1).copy());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void save(StoredEvent storedEvent) {
        requireNonNull(storedEvent, "No storedEvent provided");
        requireNonNull(storedEvent.aggregateId(), "The storedEvent has no aggregateId");
        requireNonNull(storedEvent.event(), "The storedEvent has no event");
        requireTrue(storedEvent.version() > 0, msg("The storedEvent for aggregate '{}' has version {}, versions must be positive", storedEvent.aggregateId(), storedEvent.version()));
        lock.lock();
        try {
            var eventStream = eventStreams.computeIfAbsent(storedEvent.aggregateId(), key -> new ArrayList<>());
            var lastVersion = eventStream.isEmpty() ? 0 : eventStream.get(eventStream.size() - 1).version();
            if (storedEvent.version() <= lastVersion) {
                throw new EventStoreException(msg("An event with version {} already exists for aggregate '{}'", storedEvent.version(), storedEvent.aggregateId()));
            }
            if (storedEvent.timestamp() == null) {
                storedEvent.timestamp(OffsetDateTime.now(clock));
            }
            var persistedEvent = storedEvent.copy();
            eventStream.add(persistedEvent);
            log.trace("Stored event with version {} for aggregate '{}'", storedEvent.version(), storedEvent.aggregateId());
            recordUndo(() -> eventStream.remove(persistedEvent));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void updateManifest(Object aggregateId, long expectedVersion, long newVersion) {
        var key = toKey(aggregateId);
        requireTrue(newVersion > expectedVersion, msg("newVersion {} must be greater than expectedVersion {}", newVersion, expectedVersion));
        lock.lock();
        try {
            long currentVersion = manifest.getOrDefault(key, 0L);
            if (currentVersion != expectedVersion) {
                throw new ConcurrencyException(aggregateId, expectedVersion, currentVersion);
            }
            manifest.put(key, newVersion);
            log.trace("Updated manifest for aggregate '{}' from version {} to {}", key, expectedVersion, newVersion);
            recordUndo(() -> {
                if (currentVersion == 0) {
                    manifest.remove(key);
                } else {
                    manifest.put(key, currentVersion);
                }
            });
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long getManifestVersion(Object aggregateId) {
        var key = toKey(aggregateId);
        lock.lock();
        try {
            return manifest.getOrDefault(key, 0L);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void executeAtomically(Runnable work) {
        requireNonNull(work, "No work provided");
        lock.lock();
        try {
            if (activeUndoLog.get() != null) {
                work.run();
                return;
            }
            var undoLog = new ArrayDeque<Runnable>();
            activeUndoLog.set(undoLog);
            try {
                work.run();
            } catch (RuntimeException | Error e) {
                log.debug("Undoing {} write(s) due to: {}", undoLog.size(), e.getMessage());
                undoLog.forEach(Runnable::run);
                throw e;
            } finally {
                activeUndoLog.remove();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * The number of aggregates that have at least one stored event
     */
    public int numberOfAggregates() {
        lock.lock();
        try {
            return (int) eventStreams.values().stream().filter(eventStream -> !eventStream.isEmpty()).count();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        log.trace("close() called - no resources to release");
    }

    private void recordUndo(Runnable undo) {
        var undoLog = activeUndoLog.get();
        if (undoLog != null) {
            // Undo actions are run in reverse order
            undoLog.push(undo);
        }
    }

    private static String toKey(Object aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        return String.valueOf(aggregateId);
    }
}
