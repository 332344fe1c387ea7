package villagecompute.dailybrief.services;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.dailybrief.config.BriefSchedulerConfig;
import villagecompute.dailybrief.data.models.QueueJob.JobStatus;
import villagecompute.dailybrief.data.stores.BriefJobQueue;
import villagecompute.dailybrief.data.stores.BriefPreferenceStore;
import villagecompute.dailybrief.data.stores.EngagementFactsStore;
import villagecompute.dailybrief.data.stores.EnqueueOptions;
import villagecompute.dailybrief.data.stores.JobHandle;
import villagecompute.dailybrief.exceptions.ValidationException;
import villagecompute.dailybrief.jobs.JobType;
import villagecompute.dailybrief.observability.LoggingConfig;
import villagecompute.dailybrief.observability.SchedulerMetrics;
import villagecompute.dailybrief.services.EngagementBackoffService.BackoffDecision;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Places daily brief jobs on the shared queue, at most once per user and brief time.
 *
 * <p>
 * <b>Duplicate Suppression:</b> Before enqueueing, the dispatcher looks for pending or processing jobs of the same
 * type for the same user whose {@code scheduled_for} lies within the configured tolerance (default ±30 minutes, both
 * ends inclusive) of the candidate instant. Any hit means the brief is already covered and nothing is enqueued. The
 * queue store additionally refuses a second active job with the same dedup key.
 *
 * <p>
 * <b>Priority:</b> Jobs due within the immediate threshold (default 1 minute) get priority 1, everything else 10.
 *
 * <p>
 * <b>Immediate and Forced Jobs:</b> Existing queued or processing jobs for the same user and brief date are cancelled
 * first, then a fresh job is enqueued with priority 1 and a timestamp-suffixed dedup key so it is never mistaken for
 * the job it replaced.
 *
 * @see BriefSchedulingSweep for the hourly caller
 */
@ApplicationScoped
public class BriefJobDispatcher {

    private static final Logger LOG = Logger.getLogger(BriefJobDispatcher.class);

    public static final int PRIORITY_IMMEDIATE = 1;
    public static final int PRIORITY_SCHEDULED = 10;

    static final List<JobStatus> ACTIVE_STATUSES = List.of(JobStatus.PENDING, JobStatus.PROCESSING);

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    @Inject
    BriefJobQueue jobQueue;

    @Inject
    BriefPreferenceStore preferenceStore;

    @Inject
    EngagementFactsStore factsStore;

    @Inject
    BriefSchedulerConfig config;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    SchedulerMetrics metrics;

    @Inject
    Tracer tracer;

    /**
     * Builds the intent for a scheduled brief.
     *
     * @param userId
     *            owning user
     * @param scheduledFor
     *            computed run instant
     * @param timezone
     *            the user's timezone, used to derive the brief date
     * @param engagement
     *            backoff decision when the engagement gate ran, otherwise null
     * @param now
     *            the reference instant
     * @return the intent
     */
    public BriefJobIntent buildIntent(UUID userId, Instant scheduledFor, String timezone, BackoffDecision engagement,
            Instant now) {
        ZoneId zone = resolveZone(timezone);
        LocalDate briefDate = LocalDate.ofInstant(scheduledFor, zone);
        boolean immediate = Duration.between(now, scheduledFor).compareTo(config.getImmediateThreshold()) < 0;

        BriefJobPayload payload = new BriefJobPayload(userId.toString(), briefDate.toString(), zone.getId(),
                engagement == null ? null : engagement.isReengagement(),
                engagement == null ? null : engagement.daysSinceLastLogin(), null);

        String dedupKey = dedupKey(userId, briefDate);
        return new BriefJobIntent(JobType.GENERATE_DAILY_BRIEF, userId, briefDate, zone.getId(), toMap(payload),
                immediate ? PRIORITY_IMMEDIATE : PRIORITY_SCHEDULED, scheduledFor,
                immediate ? dedupKey + "-" + now.toEpochMilli() : dedupKey, immediate);
    }

    /**
     * Enqueues an intent unless an equivalent job is already queued.
     *
     * @param intent
     *            the job to place
     * @param now
     *            the reference instant
     * @return the new job, or empty if an active job already covers the intent
     * @throws villagecompute.dailybrief.exceptions.DispatchException
     *             if the queue store is unavailable
     */
    public Optional<JobHandle> dispatch(BriefJobIntent intent, Instant now) {
        Duration tolerance = config.getDedupTolerance();
        List<JobHandle> existing = jobQueue.findJobs(intent.userId(), intent.jobType(), ACTIVE_STATUSES,
                intent.scheduledFor().minus(tolerance), intent.scheduledFor().plus(tolerance));
        if (hasConflict(existing, intent.scheduledFor(), tolerance)) {
            LOG.infof("Brief already scheduled for user %s near %s", intent.userId(), intent.scheduledFor());
            return Optional.empty();
        }
        return Optional.of(place(intent, now));
    }

    /**
     * Dispatches a batch of intents with a single lookup of existing jobs.
     *
     * <p>
     * Each intent is placed independently; a failure for one user is logged and recorded in its outcome without
     * affecting the others. If the bulk lookup fails, intents are dispatched one by one through {@link #dispatch}.
     *
     * @param intents
     *            jobs to place
     * @param now
     *            the reference instant
     * @return one outcome per intent, in input order
     */
    public List<DispatchOutcome> dispatchAll(List<BriefJobIntent> intents, Instant now) {
        List<DispatchOutcome> outcomes = new ArrayList<>();
        if (intents.isEmpty()) {
            return outcomes;
        }

        Span span = tracer.spanBuilder("brief.dispatch").setAttribute("intents", intents.size()).startSpan();
        try (Scope ignored = span.makeCurrent()) {
            Map<UUID, List<JobHandle>> existingByUser = loadExistingJobs(intents);
            Duration tolerance = config.getDedupTolerance();

            for (BriefJobIntent intent : intents) {
                LoggingConfig.setUserId(intent.userId());
                try {
                    Optional<JobHandle> job;
                    if (existingByUser == null) {
                        job = dispatch(intent, now);
                    } else if (hasConflict(existingByUser.getOrDefault(intent.userId(), List.of()),
                            intent.scheduledFor(), tolerance)) {
                        LOG.infof("Brief already scheduled for user %s near %s", intent.userId(),
                                intent.scheduledFor());
                        job = Optional.empty();
                    } else {
                        job = Optional.of(place(intent, now));
                    }
                    outcomes.add(job.map(handle -> DispatchOutcome.queued(intent, handle))
                            .orElseGet(() -> DispatchOutcome.alreadyQueued(intent)));
                } catch (RuntimeException e) {
                    LOG.errorf(e, "Failed to queue brief for user %s", intent.userId());
                    span.recordException(e);
                    outcomes.add(DispatchOutcome.failed(intent, e));
                } finally {
                    LoggingConfig.clearUserContext();
                }
            }

            span.setAttribute("queued", outcomes.stream().filter(o -> o.status() == DispatchStatus.QUEUED).count());
            return outcomes;
        } finally {
            span.end();
        }
    }

    /**
     * Queues a brief on demand, outside the hourly sweep.
     *
     * <p>
     * Forced requests (immediate or regenerate) cancel any queued or processing job for the same user and brief date,
     * then enqueue a fresh job to run now with priority 1. Other requests go through the regular duplicate check.
     *
     * @param userId
     *            the user
     * @param request
     *            request options
     * @param now
     *            the reference instant
     * @return the queued job, or empty if a non-forced request was already covered
     * @throws ValidationException
     *             if the user id is missing, the user does not exist or the timezone is unknown
     */
    public Optional<JobHandle> forceGenerate(UUID userId, BriefRequest request, Instant now) {
        if (userId == null) {
            throw new ValidationException("userId is required");
        }
        Objects.requireNonNull(request, "request is required");
        if (!factsStore.userExists(userId)) {
            throw new ValidationException("User not found: " + userId);
        }

        String timezone = request.timezone();
        if (timezone == null || timezone.isBlank()) {
            timezone = preferenceStore.findByUserId(userId).map(pref -> pref.effectiveTimezone()).orElse("UTC");
        }
        ZoneId zone = resolveZone(timezone);

        if (!request.isForced()) {
            LoggingConfig.setUserId(userId);
            try {
                Instant scheduledFor = request.scheduledFor() != null ? request.scheduledFor() : now;
                BriefJobIntent intent = buildIntent(userId, scheduledFor, zone.getId(), null, now);
                if (request.briefDate() != null && !request.briefDate().equals(intent.briefDate())) {
                    intent = withBriefDate(intent, request.briefDate(), now);
                }
                return dispatch(intent, now);
            } finally {
                LoggingConfig.clearUserContext();
            }
        }

        Span span = tracer.spanBuilder("brief.force_generate").setAttribute("user_id", userId.toString())
                .setAttribute("force_regenerate", request.forceRegenerate()).startSpan();
        try (Scope ignored = span.makeCurrent()) {
            LoggingConfig.setUserId(userId);
            LocalDate briefDate = request.briefDate() != null ? request.briefDate() : LocalDate.ofInstant(now, zone);

            BriefJobPayload payload = new BriefJobPayload(userId.toString(), briefDate.toString(), zone.getId(), null,
                    null, request.forceRegenerate() ? Boolean.TRUE : null);
            BriefJobIntent intent = new BriefJobIntent(JobType.GENERATE_DAILY_BRIEF, userId, briefDate, zone.getId(),
                    toMap(payload), PRIORITY_IMMEDIATE, now, dedupKey(userId, briefDate) + "-" + now.toEpochMilli(),
                    true);

            JobHandle job = place(intent, now);
            metrics.incrementQueued("forced");
            span.setAttribute("job_id", job.queueJobId());
            LOG.infof("Forced brief queued for user %s on %s (regenerate=%b)", userId, briefDate,
                    request.forceRegenerate());
            return Optional.of(job);
        } finally {
            LoggingConfig.clearUserContext();
            span.end();
        }
    }

    /**
     * Returns the deterministic dedup key of the scheduled brief for a user and date.
     */
    public static String dedupKey(UUID userId, LocalDate briefDate) {
        return "brief-" + userId + "-" + briefDate;
    }

    private JobHandle place(BriefJobIntent intent, Instant now) {
        if (intent.immediate()) {
            int cancelled = jobQueue.cancelForUserAndDate(intent.userId(), intent.briefDate());
            if (cancelled > 0) {
                LOG.infof("Cancelled %d existing brief job(s) for user %s on %s", cancelled, intent.userId(),
                        intent.briefDate());
            }
        }

        JobHandle job = jobQueue.enqueue(intent.jobType(), intent.userId(), intent.payload(), new EnqueueOptions(
                intent.priority(), intent.scheduledFor(), intent.dedupKey(), intent.briefDate()));

        LoggingConfig.setJobId(job.queueJobId());
        LOG.infof("Queued %s brief for user %s: briefDate=%s, scheduledFor=%s, priority=%d, job=%s",
                intent.immediate() ? "immediate" : "scheduled", intent.userId(), intent.briefDate(),
                intent.scheduledFor(), intent.priority(), job.queueJobId());
        return job;
    }

    private BriefJobIntent withBriefDate(BriefJobIntent intent, LocalDate briefDate, Instant now) {
        Map<String, Object> payload = new HashMap<>(intent.payload());
        payload.put("briefDate", briefDate.toString());
        String dedupKey = dedupKey(intent.userId(), briefDate);
        return new BriefJobIntent(intent.jobType(), intent.userId(), briefDate, intent.timezone(), payload,
                intent.priority(), intent.scheduledFor(),
                intent.immediate() ? dedupKey + "-" + now.toEpochMilli() : dedupKey, intent.immediate());
    }

    /**
     * Loads active jobs for every user in the batch, or returns null if the bulk read failed.
     */
    private Map<UUID, List<JobHandle>> loadExistingJobs(List<BriefJobIntent> intents) {
        Set<UUID> userIds = new LinkedHashSet<>();
        for (BriefJobIntent intent : intents) {
            userIds.add(intent.userId());
        }
        try {
            Map<UUID, List<JobHandle>> byUser = new HashMap<>();
            for (JobHandle job : jobQueue.findActiveJobs(userIds, JobType.GENERATE_DAILY_BRIEF, ACTIVE_STATUSES)) {
                byUser.computeIfAbsent(job.userId(), id -> new ArrayList<>()).add(job);
            }
            return byUser;
        } catch (RuntimeException e) {
            LOG.warnf(e, "Bulk lookup of existing brief jobs failed for %d users, checking individually",
                    userIds.size());
            return null;
        }
    }

    static boolean hasConflict(List<JobHandle> jobs, Instant scheduledFor, Duration tolerance) {
        Instant windowStart = scheduledFor.minus(tolerance);
        Instant windowEnd = scheduledFor.plus(tolerance);
        for (JobHandle job : jobs) {
            if (job.status() != null && !job.status().isActive()) {
                continue;
            }
            Instant jobTime = job.scheduledFor();
            if (jobTime != null && !jobTime.isBefore(windowStart) && !jobTime.isAfter(windowEnd)) {
                return true;
            }
        }
        return false;
    }

    private Map<String, Object> toMap(BriefJobPayload payload) {
        return objectMapper.convertValue(payload, PAYLOAD_TYPE);
    }

    private static ZoneId resolveZone(String timezone) {
        String zoneId = timezone == null || timezone.isBlank() ? "UTC" : timezone.trim();
        try {
            return ZoneId.of(zoneId);
        } catch (DateTimeException e) {
            throw new ValidationException("Invalid timezone: " + zoneId, e);
        }
    }

    /**
     * Result of placing one intent.
     */
    public enum DispatchStatus {
        QUEUED, ALREADY_QUEUED, FAILED
    }

    /**
     * Per-intent outcome of {@link #dispatchAll}.
     */
    public record DispatchOutcome(BriefJobIntent intent, DispatchStatus status, JobHandle job, Exception error) {

        static DispatchOutcome queued(BriefJobIntent intent, JobHandle job) {
            return new DispatchOutcome(intent, DispatchStatus.QUEUED, job, null);
        }

        static DispatchOutcome alreadyQueued(BriefJobIntent intent) {
            return new DispatchOutcome(intent, DispatchStatus.ALREADY_QUEUED, null, null);
        }

        static DispatchOutcome failed(BriefJobIntent intent, Exception error) {
            return new DispatchOutcome(intent, DispatchStatus.FAILED, null, error);
        }
    }
}
