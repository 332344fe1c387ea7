package villagecompute.dailybrief.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only view of generated briefs, used to find when a user last received one.
 *
 * <p>
 * Rows are written by the brief generation workers. Only completed generations ({@code generation_completed_at} set)
 * count as a delivered notification.
 */
@Entity
@Immutable
@Table(
        name = "daily_briefs")
public class DailyBrief extends PanacheEntityBase {

    @Id
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "user_id",
            nullable = false)
    public UUID userId;

    @Column(
            name = "brief_date",
            nullable = false)
    public LocalDate briefDate;

    @Column(
            name = "generation_completed_at")
    public Instant generationCompletedAt;

    /**
     * Returns the most recent completion timestamp for a user.
     */
    public static Optional<Instant> findLatestCompletion(UUID userId) {
        Optional<DailyBrief> latest = find(
                "userId = ?1 AND generationCompletedAt IS NOT NULL ORDER BY generationCompletedAt DESC", userId)
                .firstResultOptional();
        return latest.map(brief -> brief.generationCompletedAt);
    }

    /**
     * Returns the most recent completion timestamp per user in a single grouped query. Users who never received a
     * brief are absent from the map.
     */
    public static Map<UUID, Instant> findLatestCompletions(Collection<UUID> userIds) {
        Map<UUID, Instant> latest = new HashMap<>();
        if (userIds == null || userIds.isEmpty()) {
            return latest;
        }
        List<Object[]> rows = getEntityManager()
                .createQuery("SELECT b.userId, MAX(b.generationCompletedAt) FROM DailyBrief b "
                        + "WHERE b.userId IN :userIds AND b.generationCompletedAt IS NOT NULL GROUP BY b.userId",
                        Object[].class)
                .setParameter("userIds", userIds).getResultList();
        for (Object[] row : rows) {
            latest.put((UUID) row[0], (Instant) row[1]);
        }
        return latest;
    }
}
