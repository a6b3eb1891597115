package io.classtimer.exception;

/**
 * Thrown when a storage operation fails.
 */
public class StorageException extends ClassTimerException {

    private final StorageErrorCode code;
    private final String key;

    public StorageException(StorageErrorCode code, String key, String message) {
        super(message);
        this.code = code;
        this.key = key;
    }

    public StorageException(StorageErrorCode code, String key, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.key = key;
    }

    public StorageErrorCode getCode() {
        return code;
    }

    public String getKey() {
        return key;
    }
}
