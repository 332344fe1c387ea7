package villagecompute.dailybrief.data.stores;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.PersistenceException;
import org.jboss.logging.Logger;
import villagecompute.dailybrief.data.models.DailyBrief;
import villagecompute.dailybrief.data.models.UserActivity;
import villagecompute.dailybrief.exceptions.DataFetchException;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link EngagementFactsStore} backed by the {@code users} and {@code daily_briefs} tables.
 *
 * <p>
 * The batch methods issue exactly one query each regardless of the number of users.
 */
@ApplicationScoped
public class PanacheEngagementFactsStore implements EngagementFactsStore {

    private static final Logger LOG = Logger.getLogger(PanacheEngagementFactsStore.class);

    @Override
    public Optional<Instant> getLastActivity(UUID userId) {
        try {
            Optional<UserActivity> activity = UserActivity.findByIdOptional(userId);
            return activity.map(a -> a.lastVisit);
        } catch (PersistenceException e) {
            throw new DataFetchException("Failed to load last visit for user " + userId, e);
        }
    }

    @Override
    public Optional<Instant> getLastNotification(UUID userId) {
        try {
            return DailyBrief.findLatestCompletion(userId);
        } catch (PersistenceException e) {
            throw new DataFetchException("Failed to load latest brief for user " + userId, e);
        }
    }

    @Override
    public Map<UUID, Instant> getLastActivityBatch(Collection<UUID> userIds) {
        try {
            Map<UUID, Instant> lastVisits = new HashMap<>();
            for (UserActivity activity : UserActivity.findByIds(userIds)) {
                if (activity.lastVisit != null) {
                    lastVisits.put(activity.id, activity.lastVisit);
                }
            }
            LOG.debugf("Loaded last visit for %d of %d users", lastVisits.size(), userIds.size());
            return lastVisits;
        } catch (PersistenceException e) {
            throw new DataFetchException("Failed to batch load last visits for " + userIds.size() + " users", e);
        }
    }

    @Override
    public Map<UUID, Instant> getLastNotificationBatch(Collection<UUID> userIds) {
        try {
            return DailyBrief.findLatestCompletions(userIds);
        } catch (PersistenceException e) {
            throw new DataFetchException("Failed to batch load latest briefs for " + userIds.size() + " users", e);
        }
    }

    @Override
    public boolean userExists(UUID userId) {
        try {
            return UserActivity.count("id", userId) > 0;
        } catch (PersistenceException e) {
            throw new DataFetchException("Failed to look up user " + userId, e);
        }
    }
}
