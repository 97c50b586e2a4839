package dk.cloudcreate.domainkit.common.types;

import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;

import static dk.cloudcreate.domainkit.common.FailFast.requireNonNull;

/**
 * Base class for single value types that wrap a {@link CharSequence}, such as aggregate ids and
 * {@code AggregateType}'s.<br>
 * Two instances are equal if they're of the same concrete type and wrap the same value.
 * <p>
 * Example:
 * <pre>{@code
 * public class OrderId extends CharSequenceType<OrderId> {
 *     public OrderId(CharSequence value) {
 *         super(value);
 *     }
 *
 *     public static OrderId random() {
 *         return new OrderId(UUID.randomUUID().toString());
 *     }
 * }
 * }</pre>
 *
 * @param <CONCRETE_TYPE> the concrete sub type
 */
public abstract class CharSequenceType<CONCRETE_TYPE extends CharSequenceType<CONCRETE_TYPE>> implements CharSequence, Comparable<CONCRETE_TYPE>, Serializable {
    private final String value;

    protected CharSequenceType(CharSequence value) {
        this.value = requireNonNull(value, "You must provide a value").toString();
    }

    /**
     * The raw value
     */
    @JsonValue
    public String value() {
        return value;
    }

    @Override
    public int length() {
        return value.length();
    }

    @Override
    public char charAt(int index) {
        return value.charAt(index);
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return value.subSequence(start, end);
    }

    @Override
    public int compareTo(CONCRETE_TYPE o) {
        return value.compareTo(o.value());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((CharSequenceType<?>) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
