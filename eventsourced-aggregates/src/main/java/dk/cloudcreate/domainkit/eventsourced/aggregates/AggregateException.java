package dk.cloudcreate.domainkit.eventsourced.aggregates;

/**
 * Base exception for all aggregate related failures
 */
public class AggregateException extends RuntimeException {
    public AggregateException(String message) {
        super(message);
    }

    public AggregateException(String message, Throwable cause) {
        super(message, cause);
    }

    public AggregateException(Throwable cause) {
        super(cause);
    }
}
