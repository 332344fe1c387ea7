package villagecompute.dailybrief.testing;

import villagecompute.dailybrief.data.models.QueueJob.JobStatus;
import villagecompute.dailybrief.data.stores.BriefJobQueue;
import villagecompute.dailybrief.data.stores.EnqueueOptions;
import villagecompute.dailybrief.data.stores.JobHandle;
import villagecompute.dailybrief.exceptions.DispatchException;
import villagecompute.dailybrief.jobs.JobType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Queue store backed by a list, with the same dedup-key behavior as the Panache store and switches for failure
 * injection.
 */
public class InMemoryBriefJobQueue implements BriefJobQueue {

    private final List<JobHandle> jobs = new ArrayList<>();
    private final Map<UUID, Map<String, Object>> payloads = new HashMap<>();
    private final Set<UUID> failingUsers = new HashSet<>();
    private boolean failBulkLookup;
    private int enqueueCalls;
    private int findJobsCalls;
    private int findActiveJobsCalls;

    @Override
    public JobHandle enqueue(JobType jobType, UUID userId, Map<String, Object> payload, EnqueueOptions options) {
        enqueueCalls++;
        if (failingUsers.contains(userId)) {
            throw new DispatchException("Queue unavailable for user " + userId);
        }
        for (JobHandle job : jobs) {
            if (job.status().isActive() && options.dedupKey().equals(job.dedupKey())) {
                return job;
            }
        }
        JobHandle job = new JobHandle(UUID.randomUUID(), jobType.getWireName() + "_" + UUID.randomUUID(), userId,
                jobType, JobStatus.PENDING, options.priority(), options.scheduledFor(), options.briefDate(),
                options.dedupKey());
        jobs.add(job);
        payloads.put(job.id(), payload);
        return job;
    }

    @Override
    public List<JobHandle> findJobs(UUID userId, JobType jobType, Collection<JobStatus> statuses, Instant from,
            Instant to) {
        findJobsCalls++;
        List<JobHandle> result = new ArrayList<>();
        for (JobHandle job : jobs) {
            if (job.userId().equals(userId) && job.jobType() == jobType && statuses.contains(job.status())
                    && !job.scheduledFor().isBefore(from) && !job.scheduledFor().isAfter(to)) {
                result.add(job);
            }
        }
        return result;
    }

    @Override
    public List<JobHandle> findActiveJobs(Collection<UUID> userIds, JobType jobType, Collection<JobStatus> statuses) {
        findActiveJobsCalls++;
        if (failBulkLookup) {
            throw new DispatchException("Bulk lookup unavailable");
        }
        List<JobHandle> result = new ArrayList<>();
        for (JobHandle job : jobs) {
            if (userIds.contains(job.userId()) && job.jobType() == jobType && statuses.contains(job.status())) {
                result.add(job);
            }
        }
        return result;
    }

    @Override
    public int cancelForUserAndDate(UUID userId, LocalDate briefDate) {
        int cancelled = 0;
        for (int i = 0; i < jobs.size(); i++) {
            JobHandle job = jobs.get(i);
            if (job.userId().equals(userId) && briefDate.equals(job.briefDate()) && job.status().isActive()) {
                jobs.set(i, withStatus(job, JobStatus.CANCELLED));
                cancelled++;
            }
        }
        return cancelled;
    }

    /**
     * Seeds an existing job, as if another instance or an earlier tick had queued it.
     */
    public JobHandle seed(UUID userId, Instant scheduledFor, LocalDate briefDate, JobStatus status, String dedupKey) {
        JobHandle job = new JobHandle(UUID.randomUUID(), "generate_daily_brief_" + UUID.randomUUID(), userId,
                JobType.GENERATE_DAILY_BRIEF, status, 10, scheduledFor, briefDate, dedupKey);
        jobs.add(job);
        return job;
    }

    public void failEnqueueFor(UUID userId) {
        failingUsers.add(userId);
    }

    public void failBulkLookup() {
        failBulkLookup = true;
    }

    public List<JobHandle> getJobs() {
        return List.copyOf(jobs);
    }

    public List<JobHandle> getJobs(UUID userId) {
        List<JobHandle> result = new ArrayList<>();
        for (JobHandle job : jobs) {
            if (job.userId().equals(userId)) {
                result.add(job);
            }
        }
        return result;
    }

    public List<JobHandle> getActiveJobs(UUID userId) {
        List<JobHandle> result = new ArrayList<>();
        for (JobHandle job : getJobs(userId)) {
            if (job.status().isActive()) {
                result.add(job);
            }
        }
        return result;
    }

    public Map<String, Object> getPayload(JobHandle job) {
        return payloads.get(job.id());
    }

    public int getEnqueueCalls() {
        return enqueueCalls;
    }

    public int getFindJobsCalls() {
        return findJobsCalls;
    }

    public int getFindActiveJobsCalls() {
        return findActiveJobsCalls;
    }

    private static JobHandle withStatus(JobHandle job, JobStatus status) {
        return new JobHandle(job.id(), job.queueJobId(), job.userId(), job.jobType(), status, job.priority(),
                job.scheduledFor(), job.briefDate(), job.dedupKey());
    }
}
