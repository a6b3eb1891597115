package io.classtimer.exception;

import io.classtimer.timer.TimerStatus;

/**
 * Thrown when a timer action is not allowed from the current status.
 */
public class InvalidTimerStateException extends TimerException {

    private final TimerStatus status;

    public InvalidTimerStateException(TimerStatus status, String message) {
        super(ErrorCode.TIMER_STATE_INVALID, message + " (current status: " + status + ")");
        this.status = status;
    }

    public TimerStatus getStatus() {
        return status;
    }
}
