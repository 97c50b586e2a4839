package dk.cloudcreate.domainkit.eventsourced.aggregates.store.inmemory;

import dk.cloudcreate.domainkit.eventsourced.aggregates.ConcurrencyException;
import dk.cloudcreate.domainkit.eventsourced.aggregates.store.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.*;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class InMemoryEventStoreTest {
    private static final Instant NOW = Instant.parse("2024-01-01T10:15:30Z");

    private InMemoryEventStore eventStore;

    @BeforeEach
    void setup() {
        eventStore = new InMemoryEventStore(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void stored_events_are_returned_in_version_order_per_aggregate() {
        // Given
        eventStore.save(storedEvent("order-1", 1));
        eventStore.save(storedEvent("order-2", 1));
        eventStore.save(storedEvent("order-1", 2));

        // When
        var events = eventStore.getAllAggregateEvents("order-1");

        // Then
        assertThat(events).extracting(StoredEvent::version).containsExactly(1L, 2L);
        assertThat(events).allSatisfy(event -> assertThat(event.timestamp()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC)));
        assertThat(eventStore.getLastAggregateEvent("order-1")).map(StoredEvent::version).contains(2L);
        assertThat(eventStore.getLastAggregateEvent("order-3")).isEmpty();
        assertThat(eventStore.getAllAggregateEvents("order-3")).isEmpty();
        assertThat(eventStore.numberOfAggregates()).isEqualTo(2);
    }

    @Test
    void stored_events_cannot_be_rewritten_through_the_saved_or_returned_instances() {
        // Given
        var saved = storedEvent("order-1", 1);
        eventStore.save(saved);

        // When
        saved.version(42).event("{\"tampered\":true}");
        eventStore.getAllAggregateEvents("order-1").get(0).version(99);
        eventStore.getLastAggregateEvent("order-1").orElseThrow().event("{\"tampered\":true}");

        // Then
        var lastEvent = eventStore.getLastAggregateEvent("order-1").orElseThrow();
        assertThat(lastEvent.version()).isEqualTo(1L);
        assertThat(lastEvent.event()).isEqualTo("{}");
        assertThat(eventStore.getAllAggregateEvents("order-1")).extracting(StoredEvent::version).containsExactly(1L);
        assertThatThrownBy(() -> eventStore.save(storedEvent("order-1", 1)))
                .isInstanceOf(EventStoreException.class);
    }

    @Test
    void a_version_that_already_exists_is_rejected() {
        // Given
        eventStore.save(storedEvent("order-1", 1));

        // Then
        assertThatThrownBy(() -> eventStore.save(storedEvent("order-1", 1)))
                .isInstanceOf(EventStoreException.class);
    }

    @Test
    void the_manifest_only_advances_from_the_expected_version() {
        // Given
        assertThat(eventStore.getManifestVersion("order-1")).isEqualTo(0);
        eventStore.updateManifest("order-1", 0, 2);

        // When
        var thrown = catchThrowableOfType(() -> eventStore.updateManifest("order-1", 1, 3), ConcurrencyException.class);

        // Then
        assertThat(thrown.expectedVersion).isEqualTo(1);
        assertThat(thrown.actualVersion).isEqualTo(2);
        assertThat(thrown.aggregateId).isEqualTo("order-1");
        assertThat(eventStore.getManifestVersion("order-1")).isEqualTo(2);

        eventStore.updateManifest("order-1", 2, 3);
        assertThat(eventStore.getManifestVersion("order-1")).isEqualTo(3);
    }

    @Test
    void a_failing_atomic_block_undoes_all_of_its_writes() {
        // Given
        eventStore.executeAtomically(() -> {
            eventStore.updateManifest("order-1", 0, 1);
            eventStore.save(storedEvent("order-1", 1));
        });

        // When
        assertThatThrownBy(() -> eventStore.executeAtomically(() -> {
            eventStore.updateManifest("order-1", 1, 3);
            eventStore.save(storedEvent("order-1", 2));
            eventStore.save(storedEvent("order-1", 2));
        })).isInstanceOf(EventStoreException.class);

        // Then
        assertThat(eventStore.getManifestVersion("order-1")).isEqualTo(1);
        assertThat(eventStore.getAllAggregateEvents("order-1")).extracting(StoredEvent::version).containsExactly(1L);
    }

    @Test
    void a_failing_atomic_block_for_a_new_aggregate_removes_its_manifest_entry() {
        // When
        assertThatThrownBy(() -> eventStore.executeAtomically(() -> {
            eventStore.updateManifest("order-1", 0, 1);
            throw new IllegalStateException("append failed");
        })).isInstanceOf(IllegalStateException.class);

        // Then
        assertThat(eventStore.getManifestVersion("order-1")).isEqualTo(0);
        eventStore.updateManifest("order-1", 0, 1);
    }

    @Test
    void close_keeps_the_stored_data() {
        // Given
        eventStore.save(storedEvent("order-1", 1));

        // When
        eventStore.close();

        // Then
        assertThat(eventStore.getAllAggregateEvents("order-1")).hasSize(1);
    }

    private StoredEvent storedEvent(String aggregateId, long version) {
        return eventStore.newStoredEvent()
                         .aggregateId(aggregateId)
                         .version(version)
                         .eventId(UUID.randomUUID())
                         .event("{}");
    }
}
