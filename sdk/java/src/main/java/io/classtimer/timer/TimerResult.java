package io.classtimer.timer;

import io.classtimer.exception.InvalidDurationException;
import io.classtimer.exception.InvalidFormatException;
import io.classtimer.exception.TimerException;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a validation or parse: either a value, or an error kind with a message.
 *
 * <pre>
 * TimerResult&lt;Integer&gt; result = DurationParser.parseTimeString("05:30");
 * if (result.isSuccess()) {
 *     int seconds = result.getValue();
 * } else {
 *     TimerErrorKind kind = result.getErrorKind();
 * }
 * </pre>
 *
 * @param <T> the type of the success value
 */
public final class TimerResult<T> {

    private final T value;
    private final TimerErrorKind errorKind;
    private final String message;
    private final String input;

    private TimerResult(T value, TimerErrorKind errorKind, String message, String input) {
        this.value = value;
        this.errorKind = errorKind;
        this.message = message;
        this.input = input;
    }

    public static <T> TimerResult<T> success(T value) {
        return new TimerResult<>(Objects.requireNonNull(value, "value"), null, null, null);
    }

    public static <T> TimerResult<T> failure(TimerErrorKind errorKind, String message) {
        return failure(errorKind, message, null);
    }

    /**
     * Creates a failure that remembers the rejected input.
     *
     * @param errorKind the kind of failure
     * @param message the error message
     * @param input the rejected input, may be null
     * @param <T> the success type
     * @return a failed result
     */
    public static <T> TimerResult<T> failure(TimerErrorKind errorKind, String message, String input) {
        return new TimerResult<>(null, Objects.requireNonNull(errorKind, "errorKind"), message, input);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public boolean isFailure() {
        return errorKind != null;
    }

    /**
     * Gets the success value.
     *
     * @return the value
     * @throws NoSuchElementException if this result is a failure
     */
    public T getValue() {
        if (isFailure()) {
            throw new NoSuchElementException("No value present: " + message);
        }
        return value;
    }

    /**
     * Gets the error kind.
     *
     * @return the error kind
     * @throws NoSuchElementException if this result is a success
     */
    public TimerErrorKind getErrorKind() {
        if (isSuccess()) {
            throw new NoSuchElementException("No error present");
        }
        return errorKind;
    }

    public String getMessage() {
        return message;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    /**
     * Maps the success value, passing failures through unchanged.
     *
     * @param mapper the mapping function
     * @param <R> the new success type
     * @return the mapped result
     */
    public <R> TimerResult<R> map(Function<? super T, ? extends R> mapper) {
        if (isFailure()) {
            return new TimerResult<>(null, errorKind, message, input);
        }
        return success(mapper.apply(value));
    }

    /**
     * Chains another validation on the success value.
     *
     * @param mapper the next step
     * @param <R> the new success type
     * @return the result of the next step, or this failure
     */
    public <R> TimerResult<R> flatMap(Function<? super T, TimerResult<R>> mapper) {
        if (isFailure()) {
            return new TimerResult<>(null, errorKind, message, input);
        }
        return mapper.apply(value);
    }

    /**
     * Gets the value, or throws the exception matching the error kind.
     *
     * @return the value
     * @throws InvalidDurationException on an INVALID_DURATION failure
     * @throws InvalidFormatException on an INVALID_FORMAT failure
     */
    public T orElseThrow() {
        if (isSuccess()) {
            return value;
        }
        throw toException();
    }

    private TimerException toException() {
        return switch (errorKind) {
            case INVALID_DURATION -> new InvalidDurationException(message);
            case INVALID_FORMAT -> new InvalidFormatException(input, message);
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimerResult<?> that = (TimerResult<?>) o;
        return Objects.equals(value, that.value)
            && errorKind == that.errorKind
            && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, errorKind, message);
    }

    @Override
    public String toString() {
        return isSuccess()
            ? "TimerResult{value=" + value + "}"
            : "TimerResult{error=" + errorKind + ", message='" + message + "'}";
    }
}
