package dk.cloudcreate.domainkit.common.functional;

/**
 * Variant of {@link java.util.function.Function} that is allowed to throw checked exceptions
 *
 * @param <T> the argument type
 * @param <R> the result type
 */
@FunctionalInterface
public interface CheckedFunction<T, R> {
    R apply(T arg) throws Exception;
}
