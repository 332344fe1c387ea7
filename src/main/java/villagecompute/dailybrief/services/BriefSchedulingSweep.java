package villagecompute.dailybrief.services;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.dailybrief.config.BriefSchedulerConfig;
import villagecompute.dailybrief.data.models.BriefPreference;
import villagecompute.dailybrief.data.stores.BriefPreferenceStore;
import villagecompute.dailybrief.observability.LoggingConfig;
import villagecompute.dailybrief.observability.SchedulerMetrics;
import villagecompute.dailybrief.services.BriefJobDispatcher.DispatchOutcome;
import villagecompute.dailybrief.services.EngagementBackoffService.BackoffDecision;
import villagecompute.dailybrief.services.NextRunCalculator.NextRunResult;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One pass over all active brief preferences, queueing the briefs that fall due within the lookahead window.
 *
 * <p>
 * <b>Sweep Flow:</b>
 * <ol>
 * <li>Load every active preference</li>
 * <li>If engagement backoff is enabled, resolve all backoff decisions with bulk reads</li>
 * <li>Per preference: apply the backoff gate, compute the next run, keep it if
 * {@code now <= nextRun < now + lookahead}</li>
 * <li>Dispatch the collected intents as one batch</li>
 * </ol>
 *
 * <p>
 * <b>Error Isolation:</b> A bad preference or a failed enqueue affects only that user. Anything escaping the per-user
 * handling is caught at the top, logged and counted; the next tick starts from scratch.
 *
 * <p>
 * <b>Overlap:</b> Only one sweep runs at a time. A call that arrives while another sweep is running returns
 * immediately with {@link SweepSummary#skippedOverlap()} set.
 */
@ApplicationScoped
public class BriefSchedulingSweep {

    private static final Logger LOG = Logger.getLogger(BriefSchedulingSweep.class);

    static final String OUTCOME_COMPLETED = "completed";
    static final String OUTCOME_FAILED = "failed";
    static final String OUTCOME_OVERLAPPED = "overlapped";

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Inject
    BriefPreferenceStore preferenceStore;

    @Inject
    EngagementBackoffService backoffService;

    @Inject
    NextRunCalculator nextRunCalculator;

    @Inject
    BriefJobDispatcher dispatcher;

    @Inject
    BriefSchedulerConfig config;

    @Inject
    SchedulerMetrics metrics;

    @Inject
    Tracer tracer;

    @PostConstruct
    void init() {
        metrics.bindSweepState(running);
    }

    /**
     * Runs one sweep relative to {@code now}.
     *
     * @param now
     *            the reference instant
     * @return counts of what happened to each preference; never throws
     */
    public SweepSummary runSweep(Instant now) {
        if (!running.compareAndSet(false, true)) {
            LOG.warn("Previous brief scheduling sweep still running, skipping this tick");
            metrics.recordSweep(OUTCOME_OVERLAPPED, null);
            return SweepSummary.overlapped();
        }

        long startNanos = System.nanoTime();
        String sweepId = UUID.randomUUID().toString();
        SweepCounter counter = new SweepCounter();

        Span span = tracer.spanBuilder("brief.sweep").setAttribute("sweep.id", sweepId)
                .setAttribute("engagement_backoff.enabled", config.isEngagementBackoffEnabled()).startSpan();
        try (Scope ignored = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setSweepId(sweepId);
            LoggingConfig.setRequestOrigin("BriefSchedulingSweep");

            sweep(now, counter);

            span.setAttribute("preferences.loaded", counter.loaded);
            span.setAttribute("briefs.queued", counter.queued);
            span.setAttribute("briefs.failed", counter.failed);
            span.setStatus(StatusCode.OK);
            metrics.recordSweep(OUTCOME_COMPLETED, Duration.ofNanos(System.nanoTime() - startNanos));

            LOG.infof(
                    "Brief sweep complete: loaded=%d, queued=%d, alreadyQueued=%d, notDue=%d, backoff=%d, invalid=%d, failed=%d",
                    counter.loaded, counter.queued, counter.alreadyQueued, counter.notDue, counter.skippedBackoff,
                    counter.invalid, counter.failed);
            return counter.toSummary(false);
        } catch (Exception e) {
            LOG.errorf(e, "Brief scheduling sweep %s failed", sweepId);
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            metrics.recordSweep(OUTCOME_FAILED, Duration.ofNanos(System.nanoTime() - startNanos));
            return counter.toSummary(false);
        } finally {
            span.end();
            LoggingConfig.clearMDC();
            running.set(false);
        }
    }

    /**
     * Whether a sweep is currently in progress.
     */
    public boolean isRunning() {
        return running.get();
    }

    private void sweep(Instant now, SweepCounter counter) {
        List<BriefPreference> preferences = preferenceStore.listActivePreferences();
        counter.loaded = preferences.size();
        if (preferences.isEmpty()) {
            LOG.debug("No active brief preferences");
            return;
        }
        LOG.infof("Evaluating %d active brief preferences", preferences.size());

        Map<UUID, BackoffDecision> decisions = Map.of();
        boolean backoffEnabled = config.isEngagementBackoffEnabled();
        if (backoffEnabled) {
            Set<UUID> userIds = new LinkedHashSet<>();
            for (BriefPreference preference : preferences) {
                if (preference.userId != null) {
                    userIds.add(preference.userId);
                }
            }
            decisions = backoffService.evaluateBatch(userIds, now);
        }

        Instant windowEnd = now.plus(config.getLookahead());
        List<BriefJobIntent> intents = new ArrayList<>();

        for (BriefPreference preference : preferences) {
            if (preference.userId == null) {
                LOG.warnf("Skipping brief preference %s without a user", preference.id);
                counter.invalid++;
                metrics.incrementSkipped("invalid_preference");
                continue;
            }
            LoggingConfig.setUserId(preference.userId);
            try {
                BackoffDecision decision = null;
                if (backoffEnabled) {
                    decision = decisions.get(preference.userId);
                    if (decision == null) {
                        decision = backoffService.evaluate(preference.userId, now);
                    }
                    if (!decision.shouldSend()) {
                        LOG.debugf("Skipping brief for user %s: %s", preference.userId, decision.reason());
                        counter.skippedBackoff++;
                        metrics.incrementSkipped("backoff");
                        continue;
                    }
                }

                NextRunResult result = nextRunCalculator.computeNextRun(preference, now);
                if (!result.isValid()) {
                    LOG.warnf("Invalid brief preference for user %s: %s", preference.userId, result.error());
                    counter.invalid++;
                    metrics.incrementSkipped("invalid_preference");
                    continue;
                }

                Instant nextRun = result.nextRun();
                if (nextRun.isBefore(now) || !nextRun.isBefore(windowEnd)) {
                    counter.notDue++;
                    metrics.incrementSkipped("not_due");
                    continue;
                }

                intents.add(dispatcher.buildIntent(preference.userId, nextRun, preference.effectiveTimezone(),
                        decision, now));
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to evaluate brief preference for user %s", preference.userId);
                counter.failed++;
                metrics.incrementDispatchErrors();
            } finally {
                LoggingConfig.clearUserContext();
            }
        }

        if (intents.isEmpty()) {
            return;
        }

        for (DispatchOutcome outcome : dispatcher.dispatchAll(intents, now)) {
            switch (outcome.status()) {
                case QUEUED:
                    counter.queued++;
                    metrics.incrementQueued(queuedType(outcome.intent()));
                    break;
                case ALREADY_QUEUED:
                    counter.alreadyQueued++;
                    metrics.incrementSkipped("already_queued");
                    break;
                case FAILED:
                default:
                    counter.failed++;
                    metrics.incrementDispatchErrors();
                    break;
            }
        }
    }

    private static String queuedType(BriefJobIntent intent) {
        if (intent.immediate()) {
            return "immediate";
        }
        Object reengagement = intent.payload().get("isReengagement");
        return Boolean.TRUE.equals(reengagement) ? "reengagement" : "standard";
    }

    private static final class SweepCounter {
        int loaded;
        int skippedBackoff;
        int invalid;
        int notDue;
        int alreadyQueued;
        int queued;
        int failed;

        SweepSummary toSummary(boolean overlapped) {
            return new SweepSummary(loaded, skippedBackoff, invalid, notDue, alreadyQueued, queued, failed,
                    overlapped);
        }
    }

    /**
     * Counts of one sweep.
     */
    public record SweepSummary(int preferencesLoaded, int skippedByBackoff, int invalidPreferences, int notDue,
            int alreadyQueued, int queued, int failed, boolean skippedOverlap) {

        static SweepSummary overlapped() {
            return new SweepSummary(0, 0, 0, 0, 0, 0, 0, true);
        }
    }
}
