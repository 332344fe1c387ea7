package villagecompute.dailybrief.config;

import java.time.Duration;

/**
 * Builds {@link BriefSchedulerConfig} instances for unit tests without a running Quarkus container.
 */
public final class BriefSchedulerConfigFixtures {

    private BriefSchedulerConfigFixtures() {
    }

    /**
     * Production defaults: backoff off, 1h lookahead, ±30m tolerance, 1m immediate threshold.
     */
    public static BriefSchedulerConfig defaults() {
        return create(false, Duration.ofHours(1), Duration.ofMinutes(30), Duration.ofMinutes(1));
    }

    public static BriefSchedulerConfig withBackoff(boolean enabled) {
        return create(enabled, Duration.ofHours(1), Duration.ofMinutes(30), Duration.ofMinutes(1));
    }

    public static BriefSchedulerConfig create(boolean backoffEnabled, Duration lookahead, Duration dedupTolerance,
            Duration immediateThreshold) {
        BriefSchedulerConfig config = new BriefSchedulerConfig();
        config.engagementBackoffEnabled = backoffEnabled;
        config.lookahead = lookahead;
        config.dedupTolerance = dedupTolerance;
        config.immediateThreshold = immediateThreshold;
        return config;
    }
}
