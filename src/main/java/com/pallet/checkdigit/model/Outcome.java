package com.pallet.checkdigit.model;

import java.util.Optional;
import java.util.function.Function;

/**
 * Explicit result of a store operation.
 *
 * <ul>
 *   <li>OK      - the operation succeeded, {@link #value()} holds the result</li>
 *   <li>INVALID - the caller supplied something unusable (unknown building, bad check digit);
 *                 retrying the same call will not help</li>
 *   <li>FAILED  - storage was unavailable or returned an error; prior state is unchanged and
 *                 the caller may retry</li>
 * </ul>
 *
 * @param <T> result type
 */
public final class Outcome<T> {

    public enum Status { OK, INVALID, FAILED }

    private final Status status;
    private final T value;
    private final String message;
    private final Throwable cause;

    private Outcome(Status status, T value, String message, Throwable cause) {
        this.status = status;
        this.value = value;
        this.message = message;
        this.cause = cause;
    }

    public static <T> Outcome<T> ok(T value) {
        return new Outcome<>(Status.OK, value, null, null);
    }

    public static <T> Outcome<T> invalid(String message) {
        return new Outcome<>(Status.INVALID, null, message, null);
    }

    public static <T> Outcome<T> failed(String message, Throwable cause) {
        return new Outcome<>(Status.FAILED, null, message, cause);
    }

    public Status status() {
        return status;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public boolean isRetryable() {
        return status == Status.FAILED;
    }

    /**
     * @return the value of a successful outcome
     * @throws IllegalStateException if the outcome is not OK
     */
    public T value() {
        if (status != Status.OK) {
            throw new IllegalStateException("Outcome is " + status + ": " + message);
        }
        return value;
    }

    public Optional<T> toOptional() {
        return status == Status.OK ? Optional.ofNullable(value) : Optional.empty();
    }

    public String message() {
        return message;
    }

    public Throwable cause() {
        return cause;
    }

    /** Maps the value of an OK outcome; INVALID and FAILED pass through unchanged. */
    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        if (status != Status.OK) {
            return status == Status.INVALID ? invalid(message) : failed(message, cause);
        }
        return ok(mapper.apply(value));
    }

    @Override
    public String toString() {
        return status == Status.OK
                ? "Outcome{OK, value=" + value + '}'
                : "Outcome{" + status + ", message='" + message + "'}";
    }
}
