package villagecompute.dailybrief.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Panache entity for a user's daily brief recurrence preference.
 *
 * <p>
 * Rows are created and updated by the user-facing application. The scheduler only reads them, once per sweep, and
 * never schedules a preference whose {@code is_active} flag is false.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK) - Primary identifier</li>
 * <li>{@code user_id} (UUID) - Owning user</li>
 * <li>{@code frequency} (TEXT) - {@code daily}, {@code weekly} or {@code custom}; null means daily</li>
 * <li>{@code time_of_day} (TEXT) - Local delivery time {@code HH:MM:SS}; null means 09:00:00</li>
 * <li>{@code timezone} (TEXT) - IANA zone id; null means UTC</li>
 * <li>{@code day_of_week} (SMALLINT) - 0 = Sunday .. 6 = Saturday, weekly only</li>
 * <li>{@code is_active} (BOOLEAN) - Whether briefs are scheduled at all</li>
 * <li>{@code created_at}, {@code updated_at} (TIMESTAMPTZ)</li>
 * </ul>
 *
 * @see villagecompute.dailybrief.services.NextRunCalculator
 */
@Entity
@Table(
        name = "user_brief_preferences")
public class BriefPreference extends PanacheEntityBase {

    public static final String FREQUENCY_DAILY = "daily";
    public static final String FREQUENCY_WEEKLY = "weekly";
    public static final String FREQUENCY_CUSTOM = "custom";

    public static final String DEFAULT_FREQUENCY = FREQUENCY_DAILY;
    public static final String DEFAULT_TIME_OF_DAY = "09:00:00";
    public static final String DEFAULT_TIMEZONE = "UTC";

    @Id
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "user_id")
    public UUID userId;

    @Column(
            name = "frequency")
    public String frequency;

    @Column(
            name = "time_of_day")
    public String timeOfDay;

    @Column(
            name = "timezone")
    public String timezone;

    @Column(
            name = "day_of_week")
    public Integer dayOfWeek;

    @Column(
            name = "is_active",
            nullable = false)
    public boolean isActive;

    @Column(
            name = "created_at")
    public Instant createdAt;

    @Column(
            name = "updated_at")
    public Instant updatedAt;

    /**
     * Finds all preferences with {@code is_active = true}.
     *
     * @return active preferences in no particular order
     */
    public static List<BriefPreference> findActive() {
        return list("isActive", true);
    }

    /**
     * Finds the preference row for a user.
     *
     * @param userId
     *            the user
     * @return the preference if the user has one
     */
    public static Optional<BriefPreference> findByUserId(UUID userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return find("userId", userId).firstResultOptional();
    }

    /**
     * Returns the configured frequency or {@link #DEFAULT_FREQUENCY} when unset.
     */
    public String effectiveFrequency() {
        return frequency == null || frequency.isBlank() ? DEFAULT_FREQUENCY : frequency.trim();
    }

    /**
     * Returns the configured time of day or {@link #DEFAULT_TIME_OF_DAY} when unset.
     */
    public String effectiveTimeOfDay() {
        return timeOfDay == null || timeOfDay.isBlank() ? DEFAULT_TIME_OF_DAY : timeOfDay.trim();
    }

    /**
     * Returns the configured timezone or {@link #DEFAULT_TIMEZONE} when unset.
     */
    public String effectiveTimezone() {
        return timezone == null || timezone.isBlank() ? DEFAULT_TIMEZONE : timezone.trim();
    }
}
