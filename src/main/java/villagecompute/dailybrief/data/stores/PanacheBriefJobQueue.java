package villagecompute.dailybrief.data.stores;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.PersistenceException;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.dailybrief.data.models.QueueJob;
import villagecompute.dailybrief.data.models.QueueJob.JobStatus;
import villagecompute.dailybrief.exceptions.DispatchException;
import villagecompute.dailybrief.jobs.JobType;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link BriefJobQueue} backed by the shared {@code queue_jobs} table.
 *
 * <p>
 * Dedup-key uniqueness among non-terminal rows is enforced by a partial unique index on {@code dedup_key}. Within a
 * transaction, {@link #enqueue} returns the existing holder of a key instead of inserting.
 */
@ApplicationScoped
public class PanacheBriefJobQueue implements BriefJobQueue {

    private static final Logger LOG = Logger.getLogger(PanacheBriefJobQueue.class);

    @Inject
    Clock clock;

    @Override
    @Transactional
    public JobHandle enqueue(JobType jobType, UUID userId, Map<String, Object> payload, EnqueueOptions options) {
        try {
            Optional<QueueJob> existing = QueueJob.findActiveByDedupKey(options.dedupKey());
            if (existing.isPresent()) {
                LOG.debugf("Dedup key %s already held by job %s", options.dedupKey(), existing.get().queueJobId);
                return JobHandle.from(existing.get());
            }

            Instant now = clock.instant();
            QueueJob job = new QueueJob();
            job.queueJobId = jobType.getWireName() + "_" + UUID.randomUUID();
            job.userId = userId;
            job.jobType = jobType;
            job.status = JobStatus.PENDING;
            job.priority = options.priority();
            job.scheduledFor = options.scheduledFor();
            job.briefDate = options.briefDate();
            job.dedupKey = options.dedupKey();
            job.metadata = payload == null ? new HashMap<>() : new HashMap<>(payload);
            job.createdAt = now;
            job.updatedAt = now;
            job.persist();

            LOG.infof("Added %s job %s for user %s", jobType.getWireName(), job.queueJobId, userId);
            return JobHandle.from(job);
        } catch (PersistenceException e) {
            throw new DispatchException("Failed to add " + jobType.getWireName() + " job for user " + userId, e);
        }
    }

    @Override
    public List<JobHandle> findJobs(UUID userId, JobType jobType, Collection<JobStatus> statuses, Instant from,
            Instant to) {
        try {
            return QueueJob.findForUserInWindow(userId, jobType, statuses, from, to).stream().map(JobHandle::from)
                    .toList();
        } catch (PersistenceException e) {
            throw new DispatchException("Failed to look up jobs for user " + userId, e);
        }
    }

    @Override
    public List<JobHandle> findActiveJobs(Collection<UUID> userIds, JobType jobType, Collection<JobStatus> statuses) {
        try {
            return QueueJob.findForUsers(userIds, jobType, statuses).stream().map(JobHandle::from).toList();
        } catch (PersistenceException e) {
            throw new DispatchException("Failed to look up jobs for " + userIds.size() + " users", e);
        }
    }

    @Override
    @Transactional
    public int cancelForUserAndDate(UUID userId, LocalDate briefDate) {
        try {
            int count = QueueJob.cancelForUserAndDate(userId, JobType.GENERATE_DAILY_BRIEF, briefDate, clock.instant());
            if (count > 0) {
                LOG.infof("Cancelled %d brief job(s) for user %s on %s", count, userId, briefDate);
            }
            return count;
        } catch (PersistenceException e) {
            throw new DispatchException("Failed to cancel brief jobs for user " + userId + " on " + briefDate, e);
        }
    }
}
