package villagecompute.dailybrief.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Read-only view of the {@code users} table exposing the last-visit timestamp used for engagement backoff.
 *
 * <p>
 * The users table is owned by the application; this mapping only covers the two columns the scheduler reads.
 */
@Entity
@Immutable
@Table(
        name = "users")
public class UserActivity extends PanacheEntityBase {

    @Id
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "last_visit")
    public Instant lastVisit;

    /**
     * Loads the activity rows for a set of users in one query. Users without a row are absent from the result.
     */
    public static List<UserActivity> findByIds(Collection<UUID> userIds) {
        if (userIds == null || userIds.isEmpty()) {
            return List.of();
        }
        return list("id IN ?1", userIds);
    }
}
