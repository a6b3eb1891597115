package io.classtimer.exception;

/**
 * Stable error codes reported by timer errors, in the {@code DOMAIN_NNN} format.
 */
public enum ErrorCode {
    TIMER_INVALID_DURATION("TIMER_001", "Invalid timer duration"),
    TIMER_STATE_INVALID("TIMER_002", "Invalid timer state"),
    GENERAL_INVALID_ARGUMENT("GENERAL_003", "Invalid argument");

    private final String code;
    private final String description;

    ErrorCode(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return code;
    }
}
