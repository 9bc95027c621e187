package io.github.byzatic.minicron.cron;

import org.jetbrains.annotations.NotNull;

/**
 * One schedule field: either the wildcard or a single concrete value.
 */
public final class CronField {
    private static final CronField WILDCARD = new CronField(true, 0);

    private final boolean wildcard;
    private final int value;

    private CronField(boolean wildcard, int value) {
        this.wildcard = wildcard;
        this.value = value;
    }

    public static @NotNull CronField wildcard() {
        return WILDCARD;
    }

    public static @NotNull CronField of(int value) {
        return new CronField(false, value);
    }

    public boolean isWildcard() {
        return wildcard;
    }

    /**
     * @throws IllegalStateException for the wildcard, which carries no value
     */
    public int getValue() {
        if (wildcard) throw new IllegalStateException("Wildcard field has no value");
        return value;
    }

    public boolean matches(int candidate) {
        return wildcard || value == candidate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CronField that = (CronField) o;
        return wildcard == that.wildcard && value == that.value;
    }

    @Override
    public int hashCode() {
        return wildcard ? -1 : value;
    }

    @Override
    public String toString() {
        return wildcard ? "*" : String.valueOf(value);
    }
}
