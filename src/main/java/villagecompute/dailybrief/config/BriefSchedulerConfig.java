package villagecompute.dailybrief.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;

/**
 * Scheduling windows and feature toggles for the daily brief sweep.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code dailybrief.engagement-backoff.enabled} - Apply the engagement backoff gate (default: false, env
 * {@code ENGAGEMENT_BACKOFF_ENABLED})</li>
 * <li>{@code dailybrief.lookahead} - Horizon within which a computed next run is due (default: PT1H)</li>
 * <li>{@code dailybrief.dedup-tolerance} - Half-width of the window used to find an already queued job (default:
 * PT30M)</li>
 * <li>{@code dailybrief.immediate-threshold} - Jobs due sooner than this get immediate priority (default: PT1M)</li>
 * </ul>
 *
 * <p>
 * The default lookahead is wider than the dedup tolerance. A job computed as due 31-60 minutes ahead can be enqueued a
 * second time on a later tick if the first job's {@code scheduled_for} no longer falls within the tolerance of the
 * recomputed run time. Setting both values equal closes the gap.
 */
@ApplicationScoped
public class BriefSchedulerConfig {

    @ConfigProperty(
            name = "dailybrief.engagement-backoff.enabled",
            defaultValue = "false")
    boolean engagementBackoffEnabled;

    @ConfigProperty(
            name = "dailybrief.lookahead",
            defaultValue = "PT1H")
    Duration lookahead;

    @ConfigProperty(
            name = "dailybrief.dedup-tolerance",
            defaultValue = "PT30M")
    Duration dedupTolerance;

    @ConfigProperty(
            name = "dailybrief.immediate-threshold",
            defaultValue = "PT1M")
    Duration immediateThreshold;

    public boolean isEngagementBackoffEnabled() {
        return engagementBackoffEnabled;
    }

    public Duration getLookahead() {
        return lookahead;
    }

    public Duration getDedupTolerance() {
        return dedupTolerance;
    }

    public Duration getImmediateThreshold() {
        return immediateThreshold;
    }
}
