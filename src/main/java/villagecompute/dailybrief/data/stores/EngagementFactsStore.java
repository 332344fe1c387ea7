package villagecompute.dailybrief.data.stores;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Read access to the two facts engagement backoff is derived from: the user's last visit and the last brief that was
 * successfully generated for them.
 *
 * <p>
 * Implementations throw {@link villagecompute.dailybrief.exceptions.DataFetchException} when the backing store is
 * unavailable. A missing fact is not an error and is reported as an empty value.
 *
 * @see PanacheEngagementFactsStore
 */
public interface EngagementFactsStore {

    Optional<Instant> getLastActivity(UUID userId);

    Optional<Instant> getLastNotification(UUID userId);

    /**
     * Bulk form of {@link #getLastActivity(UUID)}. Users without a recorded visit are absent from the map.
     */
    Map<UUID, Instant> getLastActivityBatch(Collection<UUID> userIds);

    /**
     * Bulk form of {@link #getLastNotification(UUID)}. Users who never received a brief are absent from the map.
     */
    Map<UUID, Instant> getLastNotificationBatch(Collection<UUID> userIds);

    /**
     * Returns whether the user has a row in {@code users}, visit recorded or not.
     */
    boolean userExists(UUID userId);
}
