package me.golemcore.verifybot.domain.model;

/**
 * A shared state file could not be written after all attempts. The current
 * batch is abandoned without advancing the cursor.
 */
public class StorageException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
