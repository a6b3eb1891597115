package io.classtimer.exception;

/**
 * Thrown when a duration is not a positive whole number of seconds or exceeds 24 hours.
 */
public class InvalidDurationException extends TimerException {

    public InvalidDurationException(String message) {
        super(ErrorCode.TIMER_INVALID_DURATION, message);
    }
}
