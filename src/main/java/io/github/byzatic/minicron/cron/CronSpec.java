package io.github.byzatic.minicron.cron;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import io.github.byzatic.minicron.base_exceptions.CronParseException;
import io.github.byzatic.minicron.base_exceptions.CronParseException.Reason;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.LocalDateTime;
import java.time.Month;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable 5-field schedule: {@code minute hour day-of-month month day-of-week}.
 * <p>
 * Each field is either {@code *} or a plain non-negative integer. Ranges, steps and lists
 * ({@code 1-5}, {@code *}/5, {@code 1,2}) are not supported; register several jobs instead.
 * Day of week runs 0..6 with 0 = Monday.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * CronSpec nightly = CronSpec.parse("@daily");      // same as "0 0 * * *"
 * CronSpec monday = CronSpec.parse("30 9 * * 0");   // Mondays at 09:30
 * }</pre>
 */
public final class CronSpec {
    private static final String WILDCARD = "*";
    private static final int FIELD_COUNT = 5;
    private static final Splitter FIELD_SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
    private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

    private final String expression;
    private final CronField minute;
    private final CronField hour;
    private final CronField dayOfMonth;
    private final CronField month;
    private final CronField dayOfWeek;

    private CronSpec(String expression, CronField minute, CronField hour, CronField dayOfMonth,
                     CronField month, CronField dayOfWeek) {
        this.expression = expression;
        this.minute = minute;
        this.hour = hour;
        this.dayOfMonth = dayOfMonth;
        this.month = month;
        this.dayOfWeek = dayOfWeek;
    }

    /**
     * Parses an expression or alias.
     *
     * @param expression 5 whitespace-separated fields, or an alias such as {@code @hourly}
     * @return the parsed spec
     * @throws CronParseException if the expression is malformed, out of range or can never match
     */
    public static @NotNull CronSpec parse(@Nullable String expression) throws CronParseException {
        if (expression == null || expression.isBlank()) {
            throw new CronParseException(Reason.FIELD_COUNT_MISMATCH, expression, "Cron expression is empty");
        }
        String raw = expression.trim();
        String canonical = raw;

        Optional<CronAlias> alias = CronAlias.lookup(raw);
        if (alias.isPresent()) {
            if (!alias.get().isSupported()) {
                throw new CronParseException(Reason.UNSUPPORTED_ALIAS, expression,
                        "Alias " + raw + " is reserved and has no schedule");
            }
            canonical = alias.get().getExpansion();
        }

        List<String> tokens = FIELD_SPLITTER.splitToList(canonical);
        if (tokens.size() != FIELD_COUNT) {
            throw new CronParseException(Reason.FIELD_COUNT_MISMATCH, expression,
                    "Cron must have exactly " + FIELD_COUNT + " fields, got " + tokens.size() + ": " + raw);
        }

        CronField minute = parseField(tokens.get(0), CronFieldType.MINUTE, expression);
        CronField hour = parseField(tokens.get(1), CronFieldType.HOUR, expression);
        CronField dayOfMonth = parseField(tokens.get(2), CronFieldType.DAY_OF_MONTH, expression);
        CronField month = parseField(tokens.get(3), CronFieldType.MONTH, expression);
        CronField dayOfWeek = parseField(tokens.get(4), CronFieldType.DAY_OF_WEEK, expression);

        if (!dayOfMonth.isWildcard() && !month.isWildcard()
                && dayOfMonth.getValue() > Month.of(month.getValue()).maxLength()) {
            throw new CronParseException(Reason.UNSATISFIABLE, expression,
                    "Day " + dayOfMonth.getValue() + " never occurs in " + Month.of(month.getValue()) + ": " + raw);
        }

        return new CronSpec(raw, minute, hour, dayOfMonth, month, dayOfWeek);
    }

    private static CronField parseField(String token, CronFieldType type, String expression) throws CronParseException {
        if (WILDCARD.equals(token)) {
            return CronField.wildcard();
        }
        if (!DIGITS.matchesAllOf(token)) {
            throw new CronParseException(Reason.INVALID_FIELD, expression,
                    "Unsupported " + type.getLabel() + " field '" + token + "': only '*' or digits are allowed");
        }
        int value;
        try {
            value = Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new CronParseException(Reason.VALUE_OUT_OF_RANGE, expression,
                    "Value '" + token + "' of " + type.getLabel() + " is too large", e);
        }
        if (!type.inRange(value)) {
            throw new CronParseException(Reason.VALUE_OUT_OF_RANGE, expression,
                    "Value " + value + " of " + type.getLabel() + " is out of range "
                            + type.getMin() + ".." + type.getMax());
        }
        return CronField.of(value);
    }

    /**
     * Field-by-field check ignoring the "strictly after now" rule of {@link TickResolver}.
     */
    public boolean matches(@NotNull LocalDateTime tick) {
        return minute.matches(tick.getMinute())
                && hour.matches(tick.getHour())
                && dayOfMonth.matches(tick.getDayOfMonth())
                && month.matches(tick.getMonthValue())
                && dayOfWeek.matches(dayOfWeekIndex(tick));
    }

    /**
     * Weekday numbering used by schedules: 0 = Monday .. 6 = Sunday.
     */
    static int dayOfWeekIndex(@NotNull LocalDateTime dateTime) {
        return dateTime.getDayOfWeek().getValue() - 1;
    }

    public boolean isAllWildcard() {
        return minute.isWildcard() && hour.isWildcard() && dayOfMonth.isWildcard()
                && month.isWildcard() && dayOfWeek.isWildcard();
    }

    /**
     * The text this spec was parsed from, trimmed; an alias stays as written.
     */
    public @NotNull String getExpression() {
        return expression;
    }

    public @NotNull CronField getMinute() {
        return minute;
    }

    public @NotNull CronField getHour() {
        return hour;
    }

    public @NotNull CronField getDayOfMonth() {
        return dayOfMonth;
    }

    public @NotNull CronField getMonth() {
        return month;
    }

    public @NotNull CronField getDayOfWeek() {
        return dayOfWeek;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CronSpec that = (CronSpec) o;
        return minute.equals(that.minute)
                && hour.equals(that.hour)
                && dayOfMonth.equals(that.dayOfMonth)
                && month.equals(that.month)
                && dayOfWeek.equals(that.dayOfWeek);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minute, hour, dayOfMonth, month, dayOfWeek);
    }

    @Override
    public String toString() {
        return minute + " " + hour + " " + dayOfMonth + " " + month + " " + dayOfWeek;
    }
}
