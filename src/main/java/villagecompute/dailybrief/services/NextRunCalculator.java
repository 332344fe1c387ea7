package villagecompute.dailybrief.services;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import villagecompute.dailybrief.data.models.BriefPreference;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Computes the next instant at which a user's daily brief should run.
 *
 * <p>
 * The calculation happens in the preference's local wall-clock time and is converted back to UTC at the end, so the
 * same local delivery time maps to different UTC offsets across daylight saving transitions.
 *
 * <p>
 * <b>Frequencies:</b>
 * <ul>
 * <li>{@code daily} - today at the configured time, or tomorrow if that time has already passed</li>
 * <li>{@code weekly} - the next occurrence of {@code day_of_week} (0 = Sunday) at the configured time; today counts
 * only if the time has not passed</li>
 * <li>{@code custom} - no distinct cadence exists yet; treated as daily</li>
 * </ul>
 *
 * <p>
 * Invalid preferences produce a {@link NextRunResult} carrying an error message rather than an exception. Callers skip
 * the user for the current sweep and log the message.
 *
 * <p>
 * Results are always aligned to whole seconds; the sub-second part of "now" never leaks into the computed instant.
 * The result is never before "now": when a wall time repeats during a fall-back transition and its first occurrence
 * has passed, the next period's occurrence is returned.
 */
@ApplicationScoped
public class NextRunCalculator {

    private static final Logger LOG = Logger.getLogger(NextRunCalculator.class);

    /**
     * Computes the next run for a preference relative to {@code now}.
     *
     * @param preference
     *            the user's recurrence preference; null fields fall back to the documented defaults
     * @param now
     *            the reference instant
     * @return the next run instant, or a validation error
     */
    public NextRunResult computeNextRun(BriefPreference preference, Instant now) {
        if (preference == null) {
            return NextRunResult.invalid("Preference is missing");
        }
        if (now == null) {
            return NextRunResult.invalid("Reference instant is missing");
        }

        String timeOfDay = preference.effectiveTimeOfDay();
        Optional<TimeOfDay> parsed = TimeOfDay.parse(timeOfDay);
        if (parsed.isEmpty()) {
            return NextRunResult.invalid("Invalid time_of_day: " + timeOfDay);
        }
        TimeOfDay time = parsed.get();

        ZoneId zone;
        try {
            zone = ZoneId.of(preference.effectiveTimezone());
        } catch (DateTimeException e) {
            return NextRunResult.invalid("Invalid timezone: " + preference.effectiveTimezone());
        }

        LocalDateTime nowLocal = LocalDateTime.ofInstant(now, zone);
        LocalDateTime candidate = nowLocal.toLocalDate().atTime(time.hour(), time.minute(), time.second());

        String frequency = preference.effectiveFrequency();
        LocalDateTime target;
        switch (frequency) {
            case BriefPreference.FREQUENCY_DAILY:
            case BriefPreference.FREQUENCY_CUSTOM:
                target = candidate.isBefore(nowLocal) ? candidate.plusDays(1) : candidate;
                break;

            case BriefPreference.FREQUENCY_WEEKLY:
                Integer dayOfWeek = preference.dayOfWeek;
                if (dayOfWeek == null) {
                    return NextRunResult.invalid("day_of_week is required for weekly frequency");
                }
                if (dayOfWeek < 0 || dayOfWeek > 6) {
                    return NextRunResult.invalid("Invalid day_of_week: " + dayOfWeek);
                }
                int currentDayOfWeek = nowLocal.getDayOfWeek().getValue() % 7;
                int daysUntilTarget = dayOfWeek - currentDayOfWeek;
                if (daysUntilTarget < 0 || (daysUntilTarget == 0 && candidate.isBefore(nowLocal))) {
                    daysUntilTarget += 7;
                }
                target = candidate.plusDays(daysUntilTarget);
                break;

            default:
                return NextRunResult.invalid("Unknown frequency: " + frequency);
        }

        Instant nextRun = ZonedDateTime.of(target, zone).toInstant();
        if (nextRun.isBefore(now)) {
            // Fall-back overlap: the local time is still ahead but its first occurrence has passed
            target = target.plusDays(BriefPreference.FREQUENCY_WEEKLY.equals(frequency) ? 7 : 1);
            nextRun = ZonedDateTime.of(target, zone).toInstant();
        }
        LOG.debugf("Next %s run for user %s at %s (local %s %s)", frequency, preference.userId, nextRun, target, zone);
        return NextRunResult.of(nextRun);
    }

    /**
     * Collects every field-level problem of a preference.
     *
     * <p>
     * Unlike {@link #computeNextRun}, which stops at the first problem, this reports all of them so that the owning
     * application can show a complete list. Absent fields are valid because they fall back to defaults, except
     * {@code day_of_week} on a weekly preference.
     *
     * @param preference
     *            the preference to check
     * @return error messages, empty when the preference is valid
     */
    public List<String> validatePreference(BriefPreference preference) {
        List<String> errors = new ArrayList<>();
        if (preference == null) {
            errors.add("Preference is missing");
            return errors;
        }

        String frequency = preference.effectiveFrequency();
        if (!BriefPreference.FREQUENCY_DAILY.equals(frequency) && !BriefPreference.FREQUENCY_WEEKLY.equals(frequency)
                && !BriefPreference.FREQUENCY_CUSTOM.equals(frequency)) {
            errors.add("Invalid frequency. Must be daily, weekly, or custom");
        }

        String[] parts = preference.effectiveTimeOfDay().split(":");
        if (parts.length < 2) {
            errors.add("Invalid time_of_day format. Expected HH:MM:SS");
        } else {
            if (!inRange(parts[0], 23)) {
                errors.add("Invalid hours in time_of_day");
            }
            if (!inRange(parts[1], 59)) {
                errors.add("Invalid minutes in time_of_day");
            }
            if (parts.length > 2 && !inRange(parts[2], 59)) {
                errors.add("Invalid seconds in time_of_day");
            }
        }

        Integer dayOfWeek = preference.dayOfWeek;
        if (dayOfWeek != null && (dayOfWeek < 0 || dayOfWeek > 6)) {
            errors.add("Invalid day_of_week. Must be between 0 (Sunday) and 6 (Saturday)");
        } else if (dayOfWeek == null && BriefPreference.FREQUENCY_WEEKLY.equals(frequency)) {
            errors.add("day_of_week is required for weekly frequency");
        }

        try {
            ZoneId.of(preference.effectiveTimezone());
        } catch (DateTimeException e) {
            errors.add("Invalid timezone: " + preference.effectiveTimezone());
        }

        return errors;
    }

    private static boolean inRange(String component, int max) {
        Integer value = parseComponent(component);
        return value != null && value <= max;
    }

    /**
     * Parses a non-negative decimal component. Signs, whitespace and other characters are rejected.
     */
    private static Integer parseComponent(String component) {
        if (component == null || component.isEmpty() || component.length() > 2) {
            return null;
        }
        for (int i = 0; i < component.length(); i++) {
            char c = component.charAt(i);
            if (c < '0' || c > '9') {
                return null;
            }
        }
        return Integer.parseInt(component);
    }

    /**
     * Validated wall-clock delivery time.
     */
    record TimeOfDay(int hour, int minute, int second) {

        /**
         * Parses {@code HH:MM[:SS]}. Parts beyond the seconds are ignored.
         */
        static Optional<TimeOfDay> parse(String value) {
            if (value == null) {
                return Optional.empty();
            }
            String[] parts = value.split(":");
            if (parts.length < 2) {
                return Optional.empty();
            }
            Integer hour = parseComponent(parts[0]);
            Integer minute = parseComponent(parts[1]);
            Integer second = parts.length > 2 ? parseComponent(parts[2]) : Integer.valueOf(0);
            if (hour == null || minute == null || second == null || hour > 23 || minute > 59 || second > 59) {
                return Optional.empty();
            }
            return Optional.of(new TimeOfDay(hour, minute, second));
        }
    }

    /**
     * Outcome of {@link #computeNextRun}: exactly one of {@code nextRun} and {@code error} is non-null.
     */
    public record NextRunResult(Instant nextRun, String error) {

        public static NextRunResult of(Instant nextRun) {
            return new NextRunResult(nextRun, null);
        }

        public static NextRunResult invalid(String error) {
            return new NextRunResult(null, error);
        }

        public boolean isValid() {
            return nextRun != null;
        }
    }
}
