package io.github.byzatic.minicron.cron;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Next-tick computation for a {@link CronSpec}.
 * <p>
 * All methods are pure. Ticks are wall-clock {@link LocalDateTime} values aligned to the minute;
 * the caller decides which zone they live in.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Candidate construction: from {@code now}, step back to the target weekday (if any), then
 *       overwrite month, day, hour and minute with their targets in that order. A component moved
 *       forward resets the finer ones to their minimum, so the candidate is never later than the
 *       earliest match.</li>
 *   <li>Forward validation: starting at the later of the candidate and the minute after {@code now},
 *       move forward until every constrained field matches. Whole months, days and hours that cannot
 *       match are skipped in one step.</li>
 * </ol>
 */
public final class TickResolver {
    /**
     * Upper bound for the forward scan. Any spec accepted by {@link CronSpec#parse} matches well within it
     * (February 29th on a fixed weekday recurs in under 40 years).
     */
    static final int SEARCH_HORIZON_YEARS = 50;

    private TickResolver() {
    }

    /**
     * Earliest tick strictly after {@code now} that satisfies every constrained field of {@code spec}.
     *
     * @throws IllegalStateException if nothing matches within the search horizon
     */
    public static @NotNull LocalDateTime nextTick(@NotNull CronSpec spec, @NotNull LocalDateTime now) {
        LocalDateTime earliest = truncate(now).plusMinutes(1);
        LocalDateTime candidate = candidate(spec, now);
        LocalDateTime tick = candidate.isAfter(earliest) ? candidate : earliest;
        LocalDateTime limit = earliest.plusYears(SEARCH_HORIZON_YEARS);

        while (!isValidTick(spec, tick, now)) {
            if (tick.isAfter(limit)) {
                throw new IllegalStateException("No tick for '" + spec + "' within "
                        + SEARCH_HORIZON_YEARS + " years after " + now);
            }
            tick = advance(spec, tick);
        }
        return tick;
    }

    /**
     * First-guess tick built by overwriting the constrained components of {@code now}.
     * Never later than the earliest matching tick after {@code now}; may be earlier than {@code now}.
     */
    public static @NotNull LocalDateTime candidate(@NotNull CronSpec spec, @NotNull LocalDateTime now) {
        LocalDateTime dt = truncate(now);

        CronField dayOfWeek = spec.getDayOfWeek();
        if (!dayOfWeek.isWildcard()) {
            // weekday cannot be set directly, only searched for
            while (CronSpec.dayOfWeekIndex(dt) != dayOfWeek.getValue()) {
                dt = dt.minusDays(1);
            }
        }

        CronField month = spec.getMonth();
        if (!month.isWildcard() && month.getValue() != dt.getMonthValue()) {
            if (month.getValue() > dt.getMonthValue()) {
                dt = dt.withMonth(month.getValue()).withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS);
            } else {
                dt = dt.withMonth(month.getValue());
            }
        }

        CronField day = spec.getDayOfMonth();
        if (!day.isWildcard() && day.getValue() != dt.getDayOfMonth()) {
            if (day.getValue() < dt.getDayOfMonth()) {
                dt = dt.withDayOfMonth(day.getValue());
            } else if (day.getValue() <= dt.toLocalDate().lengthOfMonth()) {
                dt = dt.withDayOfMonth(day.getValue()).truncatedTo(ChronoUnit.DAYS);
            }
            // a day missing from this month is left to the forward scan
        }

        CronField hour = spec.getHour();
        if (!hour.isWildcard() && hour.getValue() != dt.getHour()) {
            if (hour.getValue() > dt.getHour()) {
                dt = dt.withHour(hour.getValue()).withMinute(0);
            } else {
                dt = dt.withHour(hour.getValue());
            }
        }

        CronField minute = spec.getMinute();
        if (!minute.isWildcard()) {
            dt = dt.withMinute(minute.getValue());
        }
        return dt;
    }

    /**
     * A tick is valid when every constrained field matches and it lies strictly after {@code now}.
     */
    public static boolean isValidTick(@NotNull CronSpec spec, @NotNull LocalDateTime tick, @NotNull LocalDateTime now) {
        return spec.matches(tick) && tick.isAfter(now);
    }

    /**
     * Zeroes seconds and sub-second components.
     */
    public static @NotNull LocalDateTime truncate(@NotNull LocalDateTime dateTime) {
        return dateTime.truncatedTo(ChronoUnit.MINUTES);
    }

    /**
     * Time left until {@code nextTick}, measured from the freshly sampled {@code liveNow}.
     * A tick already reached yields {@link Duration#ZERO}: fire immediately.
     */
    public static @NotNull Duration sleepInterval(@NotNull LocalDateTime nextTick, @NotNull ZonedDateTime liveNow) {
        Duration wait = Duration.between(liveNow, nextTick.atZone(liveNow.getZone()));
        return wait.isNegative() ? Duration.ZERO : wait;
    }

    private static LocalDateTime advance(CronSpec spec, LocalDateTime tick) {
        if (!spec.getMonth().matches(tick.getMonthValue())) {
            return tick.plusMonths(1).withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS);
        }
        if (!spec.getDayOfMonth().matches(tick.getDayOfMonth())
                || !spec.getDayOfWeek().matches(CronSpec.dayOfWeekIndex(tick))) {
            return tick.plusDays(1).truncatedTo(ChronoUnit.DAYS);
        }
        if (!spec.getHour().matches(tick.getHour())) {
            return tick.plusHours(1).truncatedTo(ChronoUnit.HOURS);
        }
        return tick.plusMinutes(1);
    }
}
