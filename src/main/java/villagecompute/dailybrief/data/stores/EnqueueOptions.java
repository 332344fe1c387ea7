package villagecompute.dailybrief.data.stores;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Placement options for {@link BriefJobQueue#enqueue}.
 *
 * @param priority
 *            1 = immediate, 10 = scheduled (lower runs first)
 * @param scheduledFor
 *            earliest execution instant
 * @param dedupKey
 *            key identifying the logical job
 * @param briefDate
 *            brief date in the user's timezone, used by {@link BriefJobQueue#cancelForUserAndDate}
 */
public record EnqueueOptions(int priority, Instant scheduledFor, String dedupKey, LocalDate briefDate) {

    public EnqueueOptions {
        Objects.requireNonNull(scheduledFor, "scheduledFor is required");
        Objects.requireNonNull(dedupKey, "dedupKey is required");
    }
}
