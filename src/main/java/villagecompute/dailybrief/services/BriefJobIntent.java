package villagecompute.dailybrief.services;

import villagecompute.dailybrief.jobs.JobType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

/**
 * A job the dispatcher is about to place on the queue. Owned by this service only until the queue store accepts it.
 *
 * @param jobType
 *            job type, always {@link JobType#GENERATE_DAILY_BRIEF} today
 * @param userId
 *            owning user
 * @param briefDate
 *            brief date in the user's timezone
 * @param timezone
 *            IANA zone the brief date was derived in
 * @param payload
 *            job metadata
 * @param priority
 *            1 = immediate, 10 = scheduled
 * @param scheduledFor
 *            earliest execution instant
 * @param dedupKey
 *            key identifying the logical job
 * @param immediate
 *            whether existing jobs for the same user and date are cancelled before enqueueing
 */
public record BriefJobIntent(JobType jobType, UUID userId, LocalDate briefDate, String timezone,
        Map<String, Object> payload, int priority, Instant scheduledFor, String dedupKey, boolean immediate) {
}
