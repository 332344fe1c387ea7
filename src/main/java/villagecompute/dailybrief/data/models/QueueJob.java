package villagecompute.dailybrief.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import villagecompute.dailybrief.jobs.JobType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Panache entity for rows of the shared {@code queue_jobs} table.
 *
 * <p>
 * The table is owned by the queue store; worker processes claim and execute rows. This service inserts rows, looks up
 * active rows for duplicate suppression, and cancels rows for a user and brief date.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK) - Primary identifier</li>
 * <li>{@code queue_job_id} (TEXT) - Human-readable job identifier used in logs</li>
 * <li>{@code user_id} (UUID) - Owning user</li>
 * <li>{@code job_type} (TEXT) - JobType wire name, e.g. {@code generate_daily_brief}</li>
 * <li>{@code status} (TEXT) - PENDING, PROCESSING, COMPLETED, FAILED, CANCELLED</li>
 * <li>{@code priority} (INT) - 1 = immediate, 10 = scheduled (lower runs first)</li>
 * <li>{@code scheduled_for} (TIMESTAMPTZ) - Earliest execution time</li>
 * <li>{@code brief_date} (DATE) - Brief date in the user's timezone</li>
 * <li>{@code dedup_key} (TEXT) - Unique among non-terminal rows</li>
 * <li>{@code metadata} (JSONB) - Job payload</li>
 * <li>{@code created_at}, {@code updated_at} (TIMESTAMPTZ)</li>
 * </ul>
 */
@Entity
@Table(
        name = "queue_jobs")
public class QueueJob extends PanacheEntityBase {

    @Id
    @GeneratedValue(
            strategy = GenerationType.UUID)
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "queue_job_id",
            nullable = false)
    public String queueJobId;

    @Column(
            name = "user_id",
            nullable = false)
    public UUID userId;

    @Column(
            name = "job_type",
            nullable = false)
    @Convert(
            converter = JobTypeConverter.class)
    public JobType jobType;

    @Column(
            name = "status",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public JobStatus status;

    @Column(
            name = "priority",
            nullable = false)
    public int priority;

    @Column(
            name = "scheduled_for",
            nullable = false)
    public Instant scheduledFor;

    @Column(
            name = "brief_date")
    public LocalDate briefDate;

    @Column(
            name = "dedup_key",
            nullable = false)
    public String dedupKey;

    @Column(
            name = "metadata",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> metadata;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Job lifecycle statuses.
     */
    public enum JobStatus {
        /**
         * Job created, awaiting a worker.
         */
        PENDING,

        /**
         * Job claimed by a worker.
         */
        PROCESSING,

        /**
         * Job completed successfully.
         */
        COMPLETED,

        /**
         * Job failed after exhausting retries.
         */
        FAILED,

        /**
         * Job cancelled before completion (superseded by a forced regenerate).
         */
        CANCELLED;

        /**
         * Returns whether the job still occupies its dedup key.
         */
        public boolean isActive() {
            return this == PENDING || this == PROCESSING;
        }
    }

    /**
     * Finds the non-terminal job holding a dedup key.
     *
     * @param dedupKey
     *            the dedup key
     * @return the active job if one exists
     */
    public static Optional<QueueJob> findActiveByDedupKey(String dedupKey) {
        return find("dedupKey = ?1 AND status IN ?2", dedupKey, List.of(JobStatus.PENDING, JobStatus.PROCESSING))
                .firstResultOptional();
    }

    /**
     * Finds jobs for one user whose {@code scheduled_for} lies in {@code [from, to]}.
     */
    public static List<QueueJob> findForUserInWindow(UUID userId, JobType jobType, Collection<JobStatus> statuses,
            Instant from, Instant to) {
        return list("userId = ?1 AND jobType = ?2 AND status IN ?3 AND scheduledFor >= ?4 AND scheduledFor <= ?5",
                userId, jobType, statuses, from, to);
    }

    /**
     * Finds jobs for a set of users in a single query.
     */
    public static List<QueueJob> findForUsers(Collection<UUID> userIds, JobType jobType,
            Collection<JobStatus> statuses) {
        if (userIds == null || userIds.isEmpty()) {
            return List.of();
        }
        return list("userId IN ?1 AND jobType = ?2 AND status IN ?3", userIds, jobType, statuses);
    }

    /**
     * Cancels every pending or processing job of a type for a user and brief date in one UPDATE statement.
     *
     * @return number of rows cancelled
     */
    public static int cancelForUserAndDate(UUID userId, JobType jobType, LocalDate briefDate, Instant now) {
        return update(
                "status = ?1, updatedAt = ?2 WHERE userId = ?3 AND jobType = ?4 AND briefDate = ?5 AND status IN ?6",
                JobStatus.CANCELLED, now, userId, jobType, briefDate,
                List.of(JobStatus.PENDING, JobStatus.PROCESSING));
    }
}
