package dk.cloudcreate.domainkit.eventsourced.aggregates.readmodel;

import reactor.core.Disposable;

import java.util.*;

import static dk.cloudcreate.domainkit.common.FailFast.requireNonNull;

/**
 * Unmodifiable list of the {@link ReadModelBuilder}'s created for one aggregate type, together with the subscriptions that
 * republish the changes announced by observable builders.<br>
 * Whoever receives the instance owns both: {@link #close()} disposes the change subscriptions and closes the builders.
 */
public final class ReadModelBuilders extends AbstractList<ReadModelBuilder> implements AutoCloseable {
    private final List<ReadModelBuilder> builders;
    private final Disposable.Composite   changeSubscriptions;
    private       boolean                closed;

    public ReadModelBuilders(List<ReadModelBuilder> builders, Disposable.Composite changeSubscriptions) {
        this.builders = List.copyOf(requireNonNull(builders, "No builders provided"));
        this.changeSubscriptions = requireNonNull(changeSubscriptions, "No changeSubscriptions provided");
    }

    @Override
    public ReadModelBuilder get(int index) {
        return builders.get(index);
    }

    @Override
    public int size() {
        return builders.size();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Disposes the change subscriptions and closes every builder, in registration order. Calling it again has no effect
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        changeSubscriptions.dispose();
        builders.forEach(ReadModelBuilder::close);
    }
}
