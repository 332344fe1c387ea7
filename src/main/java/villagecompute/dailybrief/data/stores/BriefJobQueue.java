package villagecompute.dailybrief.data.stores;

import villagecompute.dailybrief.data.models.QueueJob.JobStatus;
import villagecompute.dailybrief.jobs.JobType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Primitives of the shared job queue store consumed by the dispatcher.
 *
 * <p>
 * The store guarantees that {@link #enqueue} is atomic and that at most one non-terminal job holds a given dedup key:
 * enqueueing a key that is already held returns the existing job instead of inserting a second one. Every method
 * throws {@link villagecompute.dailybrief.exceptions.DispatchException} when the store is unavailable.
 *
 * @see PanacheBriefJobQueue
 */
public interface BriefJobQueue {

    JobHandle enqueue(JobType jobType, UUID userId, Map<String, Object> payload, EnqueueOptions options);

    /**
     * Finds a user's jobs of one type and status set whose {@code scheduled_for} lies in {@code [from, to]}.
     */
    List<JobHandle> findJobs(UUID userId, JobType jobType, Collection<JobStatus> statuses, Instant from, Instant to);

    /**
     * Finds jobs of one type and status set for many users in a single read.
     */
    List<JobHandle> findActiveJobs(Collection<UUID> userIds, JobType jobType, Collection<JobStatus> statuses);

    /**
     * Atomically cancels every pending or processing brief job for a user and brief date.
     *
     * @return number of jobs cancelled
     */
    int cancelForUserAndDate(UUID userId, LocalDate briefDate);
}
