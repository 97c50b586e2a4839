package dk.cloudcreate.domainkit.eventsourced.aggregates.repository;

import dk.cloudcreate.domainkit.eventsourced.aggregates.DomainEvent;

import java.util.Objects;

/**
 * Published on the notification bus for every {@link DataChange} announced by an {@link ObservableRepository}
 */
public final class ReadModelChangedEvent implements DomainEvent {
    public final DataChange.ChangeType changeType;
    public final Object                id;
    public final Object                item;

    public ReadModelChangedEvent(DataChange.ChangeType changeType, Object id, Object item) {
        this.changeType = changeType;
        this.id = id;
        this.item = item;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReadModelChangedEvent)) return false;
        var that = (ReadModelChangedEvent) o;
        return changeType == that.changeType && Objects.equals(id, that.id) && Objects.equals(item, that.item);
    }

    @Override
    public int hashCode() {
        return Objects.hash(changeType, id, item);
    }

    @Override
    public String toString() {
        return "ReadModelChangedEvent{" +
                "changeType=" + changeType +
                ", id=" + id +
                '}';
    }
}
