package io.github.byzatic.minicron.base_exceptions;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a cron expression cannot be turned into a schedule.
 * Raised synchronously at registration time, never deferred to the first tick.
 */
public class CronParseException extends Exception {
    private final Reason reason;
    private final String expression;

    public CronParseException(@NotNull Reason reason, @Nullable String expression, String message) {
        super(message);
        this.reason = reason;
        this.expression = expression;
    }

    public CronParseException(@NotNull Reason reason, @Nullable String expression, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.expression = expression;
    }

    public @NotNull Reason getReason() {
        return reason;
    }

    /**
     * The expression as passed by the caller, may be {@code null}.
     */
    public @Nullable String getExpression() {
        return expression;
    }

    public enum Reason {
        FIELD_COUNT_MISMATCH,
        INVALID_FIELD,
        VALUE_OUT_OF_RANGE,
        UNSATISFIABLE,
        UNSUPPORTED_ALIAS
    }
}
