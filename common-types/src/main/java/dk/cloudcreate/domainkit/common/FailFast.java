package dk.cloudcreate.domainkit.common;

import static dk.cloudcreate.domainkit.common.MessageFormatter.msg;

/**
 * Collection of argument/state checks that fail fast with an {@link IllegalArgumentException}.<br>
 * Typically used as a static import:
 * <pre>{@code
 * this.eventStore = requireNonNull(eventStore, "No eventStore provided");
 * }</pre>
 */
public final class FailFast {
    private FailFast() {
    }

    /**
     * Require that the <code>objectThatMayNotBeNull</code> isn't null
     *
     * @param objectThatMayNotBeNull the object that must not be null
     * @param message                the message used in the {@link IllegalArgumentException}
     * @param <T>                    the type of the object
     * @return the <code>objectThatMayNotBeNull</code> (never null)
     * @throws IllegalArgumentException if <code>objectThatMayNotBeNull</code> is null
     */
    public static <T> T requireNonNull(T objectThatMayNotBeNull, String message) {
        if (objectThatMayNotBeNull == null) {
            throw new IllegalArgumentException(message);
        }
        return objectThatMayNotBeNull;
    }

    public static <T> T requireNonNull(T objectThatMayNotBeNull) {
        return requireNonNull(objectThatMayNotBeNull, "Object may not be null");
    }

    /**
     * Require that the <code>mustBeTrue</code> is true
     *
     * @param mustBeTrue the boolean that must be true
     * @param message    the message used in the {@link IllegalArgumentException}
     * @return true
     * @throws IllegalArgumentException if <code>mustBeTrue</code> is false
     */
    public static boolean requireTrue(boolean mustBeTrue, String message) {
        if (!mustBeTrue) {
            throw new IllegalArgumentException(message);
        }
        return true;
    }

    public static boolean requireFalse(boolean mustBeFalse, String message) {
        if (mustBeFalse) {
            throw new IllegalArgumentException(message);
        }
        return false;
    }

    /**
     * Require that the <code>characterSequence</code> isn't null, empty or only contains whitespace
     *
     * @param characterSequence the character sequence to check
     * @param message           the message used in the {@link IllegalArgumentException}
     * @param <T>               the type of character sequence
     * @return the <code>characterSequence</code>
     * @throws IllegalArgumentException if <code>characterSequence</code> is null or blank
     */
    public static <T extends CharSequence> T requireNonBlank(T characterSequence, String message) {
        if (characterSequence == null || characterSequence.toString().isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return characterSequence;
    }

    @SuppressWarnings("unchecked")
    public static <T> T requireMustBeInstanceOf(Object objectThatMustBeAnInstanceOf, Class<T> mustBeAnInstanceOf) {
        requireNonNull(objectThatMustBeAnInstanceOf, "No object provided");
        requireNonNull(mustBeAnInstanceOf, "No mustBeAnInstanceOf class provided");
        if (!mustBeAnInstanceOf.isInstance(objectThatMustBeAnInstanceOf)) {
            throw new IllegalArgumentException(msg("Expected '{}' to be an instance of '{}'",
                                                   objectThatMustBeAnInstanceOf.getClass().getName(),
                                                   mustBeAnInstanceOf.getName()));
        }
        return (T) objectThatMustBeAnInstanceOf;
    }
}
