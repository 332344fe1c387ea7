package villagecompute.dailybrief.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.dailybrief.data.stores.EngagementFactsStore;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Decides whether a scheduled daily brief should actually be sent, based on how long the user has been inactive.
 *
 * <p>
 * <b>Backoff Bands</b> (whole days since last login):
 * <ul>
 * <li><b>0-2:</b> active user, always send</li>
 * <li><b>3:</b> cooling off, skip</li>
 * <li><b>4:</b> first re-engagement pulse, sent only if the last brief is at least 2 days old</li>
 * <li><b>5-9:</b> first backoff period, skip</li>
 * <li><b>10:</b> second re-engagement pulse, sent only if the last brief is at least 6 days old</li>
 * <li><b>11-30:</b> second backoff period, skip</li>
 * <li><b>31+:</b> recurring re-engagement, sent only if the last brief is at least 31 days old</li>
 * </ul>
 *
 * <p>
 * The bands are exhaustive and mutually exclusive. A returning user falls back into the active band automatically; no
 * backoff state is persisted, every sweep re-derives the decision from the last visit and the last completed brief.
 *
 * <p>
 * <b>Failure Policy:</b> Any failure to read engagement facts results in a send. Over-sending to an inactive user is
 * preferred to silently dropping a brief for an active one.
 */
@ApplicationScoped
public class EngagementBackoffService {

    private static final Logger LOG = Logger.getLogger(EngagementBackoffService.class);

    static final int ACTIVE_MAX_DAYS = 2;
    static final int FIRST_PULSE_DAY = 4;
    static final int FIRST_PULSE_MIN_GAP_DAYS = 2;
    static final int SECOND_PULSE_DAY = 10;
    static final int SECOND_PULSE_MIN_GAP_DAYS = 6;
    static final int RECURRING_START_DAY = 31;
    static final int RECURRING_MIN_GAP_DAYS = 31;

    /**
     * Days since last notification used when the user has never received a brief.
     */
    public static final int NEVER_NOTIFIED = Integer.MAX_VALUE;

    static final String REASON_NO_LAST_VISIT = "No last visit recorded";
    static final String REASON_FAIL_OPEN = "Engagement check failed, defaulting to send";

    @Inject
    EngagementFactsStore factsStore;

    /**
     * Classifies a user into a backoff band.
     *
     * @param daysSinceLastLogin
     *            whole days since the user's last visit; negative values are treated as 0
     * @param daysSinceLastNotification
     *            whole days since the last completed brief, {@link #NEVER_NOTIFIED} if none
     * @return the send decision
     */
    public BackoffDecision decide(int daysSinceLastLogin, int daysSinceLastNotification) {
        int login = Math.max(0, daysSinceLastLogin);
        int notified = Math.max(0, daysSinceLastNotification);

        if (login <= ACTIVE_MAX_DAYS) {
            return BackoffDecision.send(false, login, "User is active (logged in within 2 days)");
        }
        if (login < FIRST_PULSE_DAY) {
            return BackoffDecision.skip(login, "Cooling off period (3 days inactive)");
        }
        if (login == FIRST_PULSE_DAY) {
            if (notified >= FIRST_PULSE_MIN_GAP_DAYS) {
                return BackoffDecision.send(true, login, "4-day re-engagement email");
            }
            return BackoffDecision.skip(login, "4-day re-engagement skipped (" + describeGap(notified) + ")");
        }
        if (login < SECOND_PULSE_DAY) {
            return BackoffDecision.skip(login, "First backoff period (5-9 days)");
        }
        if (login == SECOND_PULSE_DAY) {
            if (notified >= SECOND_PULSE_MIN_GAP_DAYS) {
                return BackoffDecision.send(true, login, "10-day re-engagement email");
            }
            return BackoffDecision.skip(login, "10-day re-engagement skipped (" + describeGap(notified) + ")");
        }
        if (login < RECURRING_START_DAY) {
            return BackoffDecision.skip(login, "Second backoff period (11-30 days)");
        }
        if (notified >= RECURRING_MIN_GAP_DAYS) {
            return BackoffDecision.send(true, login, "31+ day re-engagement email (" + login + " days inactive)");
        }
        return BackoffDecision.skip(login, "Waiting for 31-day interval (" + describeGap(notified) + ")");
    }

    /**
     * Resolves the decision for a single user from the engagement facts store.
     *
     * <p>
     * A user without a recorded visit is treated as brand new and always receives a standard brief. Read failures fail
     * open.
     *
     * @param userId
     *            the user to evaluate
     * @param now
     *            the reference instant
     * @return the send decision, never null
     */
    public BackoffDecision evaluate(UUID userId, Instant now) {
        try {
            Optional<Instant> lastActivity = factsStore.getLastActivity(userId);
            if (lastActivity.isEmpty()) {
                return BackoffDecision.newUser();
            }
            Optional<Instant> lastNotification = factsStore.getLastNotification(userId);
            return resolve(lastActivity.get(), lastNotification.orElse(null), now);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Engagement check failed for user %s, defaulting to send", userId);
            return BackoffDecision.failOpen();
        }
    }

    /**
     * Resolves decisions for many users with two bulk reads.
     *
     * <p>
     * If either bulk read fails, every user is resolved individually through {@link #evaluate}, which in turn fails
     * open per user.
     *
     * @param userIds
     *            users to evaluate
     * @param now
     *            the reference instant
     * @return a decision for every requested user, in request order
     */
    public Map<UUID, BackoffDecision> evaluateBatch(Collection<UUID> userIds, Instant now) {
        Map<UUID, BackoffDecision> decisions = new LinkedHashMap<>();
        if (userIds == null || userIds.isEmpty()) {
            return decisions;
        }

        Map<UUID, Instant> lastActivity;
        Map<UUID, Instant> lastNotification;
        try {
            lastActivity = factsStore.getLastActivityBatch(userIds);
            lastNotification = factsStore.getLastNotificationBatch(userIds);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Batch engagement lookup failed for %d users, falling back to per-user checks",
                    userIds.size());
            for (UUID userId : userIds) {
                decisions.put(userId, evaluate(userId, now));
            }
            return decisions;
        }

        for (UUID userId : userIds) {
            Instant activity = lastActivity.get(userId);
            if (activity == null) {
                decisions.put(userId, BackoffDecision.newUser());
            } else {
                decisions.put(userId, resolve(activity, lastNotification.get(userId), now));
            }
        }
        LOG.debugf("Resolved engagement decisions for %d users with bulk reads", decisions.size());
        return decisions;
    }

    private BackoffDecision resolve(Instant lastActivity, Instant lastNotification, Instant now) {
        int daysSinceLastLogin = wholeDaysBetween(lastActivity, now);
        int daysSinceLastNotification = lastNotification == null ? NEVER_NOTIFIED
                : wholeDaysBetween(lastNotification, now);
        return decide(daysSinceLastLogin, daysSinceLastNotification);
    }

    /**
     * Returns the number of complete 24-hour periods between two instants, clamped at 0 for future timestamps.
     */
    static int wholeDaysBetween(Instant from, Instant now) {
        long days = Duration.between(from, now).toDays();
        if (days <= 0) {
            return 0;
        }
        return days >= Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) days;
    }

    private static String describeGap(int daysSinceLastNotification) {
        return "last brief " + daysSinceLastNotification + (daysSinceLastNotification == 1 ? " day" : " days")
                + " ago";
    }

    /**
     * Outcome of a backoff evaluation.
     *
     * @param shouldSend
     *            whether the brief should be queued this sweep
     * @param isReengagement
     *            whether the send is a re-engagement pulse; always false when {@code shouldSend} is false
     * @param daysSinceLastLogin
     *            whole days since the last visit, 0 for new users
     * @param reason
     *            human-readable band label
     */
    public record BackoffDecision(boolean shouldSend, boolean isReengagement, int daysSinceLastLogin, String reason) {

        static BackoffDecision send(boolean reengagement, int daysSinceLastLogin, String reason) {
            return new BackoffDecision(true, reengagement, daysSinceLastLogin, reason);
        }

        static BackoffDecision skip(int daysSinceLastLogin, String reason) {
            return new BackoffDecision(false, false, daysSinceLastLogin, reason);
        }

        static BackoffDecision newUser() {
            return new BackoffDecision(true, false, 0, REASON_NO_LAST_VISIT);
        }

        static BackoffDecision failOpen() {
            return new BackoffDecision(true, false, 0, REASON_FAIL_OPEN);
        }
    }
}
