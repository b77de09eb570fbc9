package com.vidnyan.pyguard.domain.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Typed result of one pipeline stage.
 * SKIPPED and ERROR carry a reason; only OK carries a value.
 */
public record StageOutcome<T>(
    Status status,
    T value,
    String reason,
    Throwable cause
) {

    public enum Status {
        OK,
        SKIPPED,
        ERROR
    }

    public static <T> StageOutcome<T> ok(T value) {
        return new StageOutcome<>(Status.OK, Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> StageOutcome<T> skipped(String reason) {
        return new StageOutcome<>(Status.SKIPPED, null, reason, null);
    }

    public static <T> StageOutcome<T> error(String reason, Throwable cause) {
        return new StageOutcome<>(Status.ERROR, null, reason, cause);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    /**
     * Runs the next stage on success; SKIPPED and ERROR pass through unchanged.
     */
    public <U> StageOutcome<U> then(Function<? super T, StageOutcome<U>> next) {
        if (status != Status.OK) {
            return new StageOutcome<>(status, null, reason, cause);
        }
        return next.apply(value);
    }

    public <U> StageOutcome<U> map(Function<? super T, ? extends U> mapper) {
        return then(v -> StageOutcome.ok(mapper.apply(v)));
    }
}
