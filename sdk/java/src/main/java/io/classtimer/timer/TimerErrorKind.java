package io.classtimer.timer;

import io.classtimer.exception.ErrorCode;

/**
 * Kinds of validation failure reported by {@link TimerResult}.
 */
public enum TimerErrorKind {
    INVALID_DURATION(ErrorCode.TIMER_INVALID_DURATION),
    INVALID_FORMAT(ErrorCode.GENERAL_INVALID_ARGUMENT);

    private final ErrorCode errorCode;

    TimerErrorKind(ErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
