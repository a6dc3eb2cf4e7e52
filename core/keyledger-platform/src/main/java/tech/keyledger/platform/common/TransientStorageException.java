package tech.keyledger.platform.common;

/**
 * Thrown when the license or activation store could not complete an operation in time
 * (connection loss, lock timeout, constraint race). Nothing from the failed attempt is
 * committed and the caller may retry.
 */
public class TransientStorageException extends RuntimeException {

    public TransientStorageException(String message) {
        super(message);
    }

    public TransientStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
