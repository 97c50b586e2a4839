package dk.cloudcreate.domainkit.eventsourced.aggregates.repository;

import java.util.Objects;

import static dk.cloudcreate.domainkit.common.FailFast.requireNonNull;

/**
 * A change made to an item owned by an {@link ObservableRepository}
 */
public final class DataChange {
    public enum ChangeType {
        Saved,
        Deleted
    }

    public final ChangeType changeType;
    public final Object     id;
    /**
     * The changed item - <code>null</code> when an item was deleted by id only
     */
    public final Object     item;

    private DataChange(ChangeType changeType, Object id, Object item) {
        this.changeType = requireNonNull(changeType, "No changeType provided");
        this.id = requireNonNull(id, "No id provided");
        this.item = item;
    }

    public static DataChange saved(Object id, Object item) {
        return new DataChange(ChangeType.Saved, id, requireNonNull(item, "No item provided"));
    }

    public static DataChange deleted(Object id, Object item) {
        return new DataChange(ChangeType.Deleted, id, item);
    }

    /**
     * Convert this change to the {@link ReadModelChangedEvent} published on the notification bus
     */
    public ReadModelChangedEvent asDomainEvent() {
        return new ReadModelChangedEvent(changeType, id, item);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataChange)) return false;
        var that = (DataChange) o;
        return changeType == that.changeType && id.equals(that.id) && Objects.equals(item, that.item);
    }

    @Override
    public int hashCode() {
        return Objects.hash(changeType, id, item);
    }

    @Override
    public String toString() {
        return "DataChange{" +
                "changeType=" + changeType +
                ", id=" + id +
                '}';
    }
}
