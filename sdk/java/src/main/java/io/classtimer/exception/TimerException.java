package io.classtimer.exception;

/**
 * Base exception for timer errors. Every timer error carries an {@link ErrorCode}.
 */
public class TimerException extends ClassTimerException {

    private final ErrorCode errorCode;

    public TimerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
