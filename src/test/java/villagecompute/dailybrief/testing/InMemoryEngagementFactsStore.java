package villagecompute.dailybrief.testing;

import villagecompute.dailybrief.data.stores.EngagementFactsStore;
import villagecompute.dailybrief.exceptions.DataFetchException;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Engagement facts held in maps. Bulk reads can be switched to fail independently of single-user reads.
 */
public class InMemoryEngagementFactsStore implements EngagementFactsStore {

    private final Map<UUID, Instant> lastActivity = new HashMap<>();
    private final Map<UUID, Instant> lastNotification = new HashMap<>();
    private final Set<UUID> users = new HashSet<>();
    private boolean failBatch;
    private int batchCalls;
    private int singleCalls;

    @Override
    public Optional<Instant> getLastActivity(UUID userId) {
        singleCalls++;
        return Optional.ofNullable(lastActivity.get(userId));
    }

    @Override
    public Optional<Instant> getLastNotification(UUID userId) {
        singleCalls++;
        return Optional.ofNullable(lastNotification.get(userId));
    }

    @Override
    public Map<UUID, Instant> getLastActivityBatch(Collection<UUID> userIds) {
        batchCalls++;
        if (failBatch) {
            throw new DataFetchException("users query timed out");
        }
        return select(lastActivity, userIds);
    }

    @Override
    public Map<UUID, Instant> getLastNotificationBatch(Collection<UUID> userIds) {
        batchCalls++;
        if (failBatch) {
            throw new DataFetchException("daily_briefs query timed out");
        }
        return select(lastNotification, userIds);
    }

    @Override
    public boolean userExists(UUID userId) {
        return users.contains(userId);
    }

    /**
     * Registers a user row without a recorded visit.
     */
    public UUID addUser(UUID userId) {
        users.add(userId);
        return userId;
    }

    public void setLastActivity(UUID userId, Instant lastVisit) {
        users.add(userId);
        lastActivity.put(userId, lastVisit);
    }

    public void setLastNotification(UUID userId, Instant completedAt) {
        lastNotification.put(userId, completedAt);
    }

    public void failBatch() {
        failBatch = true;
    }

    public int getBatchCalls() {
        return batchCalls;
    }

    public int getSingleCalls() {
        return singleCalls;
    }

    private static Map<UUID, Instant> select(Map<UUID, Instant> source, Collection<UUID> userIds) {
        Map<UUID, Instant> result = new HashMap<>();
        for (UUID userId : userIds) {
            Instant value = source.get(userId);
            if (value != null) {
                result.put(userId, value);
            }
        }
        return result;
    }
}
