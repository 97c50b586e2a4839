package dk.cloudcreate.domainkit.eventsourced.aggregates;

import java.lang.annotation.*;

/**
 * Methods annotated with this Annotation will automatically be called when an event is being applied or rehydrated on to an
 * {@link EventSourcedAggregateRoot} instance, or when an event is delivered to a
 * {@link dk.cloudcreate.domainkit.eventsourced.aggregates.readmodel.PatternMatchingReadModelBuilder}
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface EventHandler {
}
