package dk.cloudcreate.domainkit.common.functional;

/**
 * Variant of {@link java.util.function.Consumer} that is allowed to throw checked exceptions
 *
 * @param <T> the argument type
 */
@FunctionalInterface
public interface CheckedConsumer<T> {
    void accept(T arg) throws Exception;
}
