package villagecompute.dailybrief.data.stores;

import villagecompute.dailybrief.data.models.QueueJob;
import villagecompute.dailybrief.data.models.QueueJob.JobStatus;
import villagecompute.dailybrief.jobs.JobType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Snapshot of a queue job as returned by the queue store.
 */
public record JobHandle(UUID id, String queueJobId, UUID userId, JobType jobType, JobStatus status, int priority,
        Instant scheduledFor, LocalDate briefDate, String dedupKey) {

    public static JobHandle from(QueueJob job) {
        return new JobHandle(job.id, job.queueJobId, job.userId, job.jobType, job.status, job.priority,
                job.scheduledFor, job.briefDate, job.dedupKey);
    }
}
