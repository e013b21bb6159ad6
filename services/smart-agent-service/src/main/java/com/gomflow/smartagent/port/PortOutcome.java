package com.gomflow.smartagent.port;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of calling an external recognition port.
 *
 * OK carries a usable value, DEGRADED carries whatever came back plus the reason it is not
 * usable, UNAVAILABLE carries only the reason. Fusion reads the status, never exceptions.
 */
public final class PortOutcome<T> {

    public enum Status {
        OK,
        DEGRADED,
        UNAVAILABLE
    }

    private final Status status;
    private final T value;
    private final String reason;

    private PortOutcome(Status status, T value, String reason) {
        this.status = status;
        this.value = value;
        this.reason = reason;
    }

    public static <T> PortOutcome<T> ok(T value) {
        return new PortOutcome<>(Status.OK, Objects.requireNonNull(value, "value"), null);
    }

    public static <T> PortOutcome<T> degraded(T value, String reason) {
        return new PortOutcome<>(Status.DEGRADED, value, reason);
    }

    public static <T> PortOutcome<T> unavailable(String reason) {
        return new PortOutcome<>(Status.UNAVAILABLE, null, reason);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    public boolean isUnavailable() {
        return status == Status.UNAVAILABLE;
    }

    /**
     * The value for OK outcomes only; degraded payloads are reachable through {@link #getRawValue()}.
     */
    public Optional<T> getValue() {
        return isOk() ? Optional.of(value) : Optional.empty();
    }

    public Optional<T> getRawValue() {
        return Optional.ofNullable(value);
    }

    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public String toString() {
        return "PortOutcome{" + status + (reason != null ? ", reason=" + reason : "") + "}";
    }
}
