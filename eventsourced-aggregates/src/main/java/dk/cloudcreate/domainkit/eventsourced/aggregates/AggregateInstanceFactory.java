package dk.cloudcreate.domainkit.eventsourced.aggregates;

import org.objenesis.*;
import org.objenesis.instantiator.ObjectInstantiator;

import java.lang.reflect.InvocationTargetException;
import java.util.concurrent.*;

import static dk.cloudcreate.domainkit.common.FailFast.requireNonNull;
import static dk.cloudcreate.domainkit.common.MessageFormatter.msg;

/**
 * Factory that helps the repositories create a new blank instance of a given {@link AggregateRoot} type.
 *
 * @see #defaultConstructorFactory()
 * @see #objenesisFactory()
 */
public interface AggregateInstanceFactory {
    /**
     * An {@link AggregateInstanceFactory} that calls the default no-arguments constructor on the concrete aggregate type
     */
    DefaultConstructorAggregateInstanceFactory DEFAULT_CONSTRUCTOR_FACTORY = new DefaultConstructorAggregateInstanceFactory();
    /**
     * An {@link AggregateInstanceFactory} that uses {@link Objenesis} to create a new instance of the aggregate<br>
     * <b>Please note: Objenesis doesn't initialize fields nor call any constructors</b>, so your aggregate design needs to take
     * this into consideration.<br>
     * All concrete aggregates that extend {@link EventSourcedAggregateRoot} have been prepared to be initialized by {@link Objenesis}
     */
    ObjenesisAggregateInstanceFactory          OBJENESIS_FACTORY           = new ObjenesisAggregateInstanceFactory();

    <AGGREGATE> AGGREGATE create(Class<AGGREGATE> aggregateImplementationType);

    static AggregateInstanceFactory defaultConstructorFactory() {
        return DEFAULT_CONSTRUCTOR_FACTORY;
    }

    static AggregateInstanceFactory objenesisFactory() {
        return OBJENESIS_FACTORY;
    }

    /**
     * {@link AggregateInstanceFactory} that calls the default no-arguments constructor (which may be private) on the concrete aggregate type
     */
    class DefaultConstructorAggregateInstanceFactory implements AggregateInstanceFactory {
        @Override
        public <AGGREGATE> AGGREGATE create(Class<AGGREGATE> aggregateImplementationType) {
            requireNonNull(aggregateImplementationType, "You must provide an aggregateImplementationType");
            try {
                var constructor = aggregateImplementationType.getDeclaredConstructor();
                constructor.setAccessible(true);
                return constructor.newInstance();
            } catch (NoSuchMethodException e) {
                throw new AggregateException(msg("Aggregate type '{}' doesn't have a default no-arguments constructor", aggregateImplementationType.getName()), e);
            } catch (InvocationTargetException e) {
                throw new AggregateException(msg("The default constructor of aggregate type '{}' failed", aggregateImplementationType.getName()), e.getCause());
            } catch (ReflectiveOperationException e) {
                throw new AggregateException(msg("Failed to create an instance of aggregate type '{}'", aggregateImplementationType.getName()), e);
            }
        }
    }

    /**
     * {@link AggregateInstanceFactory} that uses {@link Objenesis} to create a new instance of the aggregate without calling any constructor
     */
    class ObjenesisAggregateInstanceFactory implements AggregateInstanceFactory {
        private final Objenesis                                      objenesis       = new ObjenesisStd();
        private final ConcurrentMap<Class<?>, ObjectInstantiator<?>> instantiatorMap = new ConcurrentHashMap<>();

        @SuppressWarnings("unchecked")
        @Override
        public <AGGREGATE> AGGREGATE create(Class<AGGREGATE> aggregateImplementationType) {
            requireNonNull(aggregateImplementationType, "You must provide an aggregateImplementationType");
            return (AGGREGATE) instantiatorMap.computeIfAbsent(aggregateImplementationType,
                                                               objenesis::getInstantiatorOf)
                                              .newInstance();
        }
    }
}
