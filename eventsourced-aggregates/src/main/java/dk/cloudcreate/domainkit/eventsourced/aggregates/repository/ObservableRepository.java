package dk.cloudcreate.domainkit.eventsourced.aggregates.repository;

import reactor.core.publisher.Flux;

/**
 * Capability of repositories (and read model builders) that announce the changes they make to the data they own.<br>
 * The {@link dk.cloudcreate.domainkit.eventsourced.aggregates.context.DomainContext} republishes each change on the
 * relevant notification bus as {@link DataChange#asDomainEvent()}. The stream completes when its owner is closed.
 */
public interface ObservableRepository {
    Flux<DataChange> changes();
}
