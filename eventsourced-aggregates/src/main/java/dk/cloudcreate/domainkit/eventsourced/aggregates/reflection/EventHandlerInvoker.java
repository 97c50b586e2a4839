package dk.cloudcreate.domainkit.eventsourced.aggregates.reflection;

import dk.cloudcreate.domainkit.eventsourced.aggregates.AggregateException;

import java.lang.annotation.Annotation;
import java.lang.reflect.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.Consumer;

import static dk.cloudcreate.domainkit.common.FailFast.requireNonNull;
import static dk.cloudcreate.domainkit.common.MessageFormatter.msg;

/**
 * Invokes single argument methods, annotated with a given annotation, on a target object based on the type of the argument.<br>
 * When more than one annotated method accepts an argument, the method with the most specific parameter type is invoked.<br>
 * Methods may be private and may be declared in any super class of the target.
 * <pre>{@code
 * var invoker = new EventHandlerInvoker(this, EventHandler.class);
 * invoker.invoke(event, unmatchedEvent -> {
 *     // ignore
 * });
 * }</pre>
 */
public final class EventHandlerInvoker {
    private static final ConcurrentMap<Class<?>, ConcurrentMap<Class<? extends Annotation>, List<Method>>> handlerMethodsCache = new ConcurrentHashMap<>();

    private final Object                                    target;
    private final List<Method>                              handlerMethods;
    private final ConcurrentMap<Class<?>, Optional<Method>> resolvedHandlerMethods = new ConcurrentHashMap<>();

    public EventHandlerInvoker(Object target, Class<? extends Annotation> handlerAnnotation) {
        this.target = requireNonNull(target, "No target provided");
        requireNonNull(handlerAnnotation, "No handlerAnnotation provided");
        this.handlerMethods = handlerMethodsCache.computeIfAbsent(target.getClass(), type -> new ConcurrentHashMap<>())
                                                 .computeIfAbsent(handlerAnnotation, annotation -> findHandlerMethods(target.getClass(), annotation));
    }

    /**
     * Invoke the handler method that best matches the type of the <code>argument</code>
     *
     * @param argument         the argument (e.g. an event)
     * @param unmatchedHandler called with the <code>argument</code> if no handler method matched it
     * @return true if a handler method was invoked, otherwise false
     */
    public boolean invoke(Object argument, Consumer<Object> unmatchedHandler) {
        requireNonNull(argument, "No argument provided");
        requireNonNull(unmatchedHandler, "No unmatchedHandler provided");
        var handlerMethod = resolvedHandlerMethods.computeIfAbsent(argument.getClass(), this::resolveMostSpecificHandlerMethod);
        if (handlerMethod.isEmpty()) {
            unmatchedHandler.accept(argument);
            return false;
        }
        try {
            handlerMethod.get().invoke(target, argument);
            return true;
        } catch (InvocationTargetException e) {
            var cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new AggregateException(msg("Handler method '{}' failed for argument of type '{}'",
                                             handlerMethod.get(),
                                             argument.getClass().getName()),
                                         cause);
        } catch (IllegalAccessException e) {
            throw new AggregateException(msg("Couldn't invoke handler method '{}'", handlerMethod.get()), e);
        }
    }

    /**
     * Does the target have any handler method that accepts the given argument type
     */
    public boolean hasHandlerFor(Class<?> argumentType) {
        requireNonNull(argumentType, "No argumentType provided");
        return resolvedHandlerMethods.computeIfAbsent(argumentType, this::resolveMostSpecificHandlerMethod).isPresent();
    }

    private Optional<Method> resolveMostSpecificHandlerMethod(Class<?> argumentType) {
        Method mostSpecific = null;
        for (var method : handlerMethods) {
            var parameterType = method.getParameterTypes()[0];
            if (!parameterType.isAssignableFrom(argumentType)) {
                continue;
            }
            if (mostSpecific == null || mostSpecific.getParameterTypes()[0].isAssignableFrom(parameterType) && mostSpecific.getParameterTypes()[0] != parameterType) {
                mostSpecific = method;
            }
        }
        return Optional.ofNullable(mostSpecific);
    }

    private static List<Method> findHandlerMethods(Class<?> targetType, Class<? extends Annotation> handlerAnnotation) {
        var methods    = new ArrayList<Method>();
        var signatures = new HashSet<String>();
        var type       = targetType;
        while (type != null && type != Object.class) {
            for (var method : type.getDeclaredMethods()) {
                if (method.isBridge() || method.isSynthetic() || !method.isAnnotationPresent(handlerAnnotation)) {
                    continue;
                }
                if (method.getParameterCount() != 1) {
                    throw new AggregateException(msg("Method '{}' annotated with @{} must have exactly one parameter",
                                                     method,
                                                     handlerAnnotation.getSimpleName()));
                }
                // Overridden methods are only included once (the most specialized version)
                if (signatures.add(method.getName() + "(" + method.getParameterTypes()[0].getName() + ")")) {
                    method.setAccessible(true);
                    methods.add(method);
                }
            }
            type = type.getSuperclass();
        }
        return List.copyOf(methods);
    }
}
