package io.classtimer.exception;

/**
 * Thrown when a time string does not match {@code MM:SS} or {@code MMM:SS}.
 */
public class InvalidFormatException extends TimerException {

    private final String input;

    public InvalidFormatException(String input, String message) {
        super(ErrorCode.GENERAL_INVALID_ARGUMENT, message);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
