package dk.cloudcreate.domainkit.common.transaction;

/**
 * Thrown when an operation isn't allowed in the {@link UnitOfWork}'s current {@link UnitOfWorkStatus}, or when the
 * underlying commit fails
 */
public class UnitOfWorkException extends RuntimeException {
    public UnitOfWorkException() {
    }

    public UnitOfWorkException(String message) {
        super(message);
    }

    public UnitOfWorkException(String message, Throwable cause) {
        super(message, cause);
    }

    public UnitOfWorkException(Throwable cause) {
        super(cause);
    }
}
