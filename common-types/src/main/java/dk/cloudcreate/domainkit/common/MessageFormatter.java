package dk.cloudcreate.domainkit.common;

/**
 * Formats messages using the same <code>{}</code> placeholder syntax as SLF4J, so exception messages
 * and log statements read the same way:
 * <pre>{@code
 * throw new AggregateException(msg("Couldn't find '{}' with id '{}'", aggregateType, aggregateId));
 * }</pre>
 */
public final class MessageFormatter {
    private MessageFormatter() {
    }

    /**
     * Replace each <code>{}</code> placeholder in <code>message</code> with the corresponding <code>messageArguments</code>
     *
     * @param message          the message containing <code>{}</code> placeholders
     * @param messageArguments the arguments
     * @return the formatted message
     */
    public static String msg(String message, Object... messageArguments) {
        FailFast.requireNonNull(message, "You must supply a message");
        return org.slf4j.helpers.MessageFormatter.arrayFormat(message, messageArguments).getMessage();
    }
}
