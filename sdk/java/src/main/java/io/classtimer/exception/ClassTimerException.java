package io.classtimer.exception;

/**
 * Base exception for all classroom timer SDK errors.
 */
public class ClassTimerException extends RuntimeException {

    public ClassTimerException(String message) {
        super(message);
    }

    public ClassTimerException(String message, Throwable cause) {
        super(message, cause);
    }
}
