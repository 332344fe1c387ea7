package villagecompute.dailybrief.jobs;

import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import io.quarkus.scheduler.Scheduler;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.dailybrief.services.BriefSchedulingSweep;
import villagecompute.dailybrief.services.BriefSchedulingSweep.SweepSummary;

import java.time.Clock;
import java.time.Instant;

/**
 * Hourly trigger for the daily brief scheduling sweep.
 *
 * <p>
 * <b>Schedule:</b> Hourly at top of the hour (cron: 0 0 * * * ?, override with {@code dailybrief.sweep.cron}), plus
 * one sweep shortly after startup ({@code dailybrief.sweep.startup-delay}, default 5s, {@code off} disables it).
 *
 * <p>
 * <b>Overlap:</b> Quarkus skips a trigger while the previous one is still executing; the sweep keeps its own guard as
 * well, which also covers the startup run landing on top of an hourly one.
 *
 * @see BriefSchedulingSweep
 * @see JobType#GENERATE_DAILY_BRIEF
 */
@ApplicationScoped
public class DailyBriefScheduler {

    private static final Logger LOG = Logger.getLogger(DailyBriefScheduler.class);

    static final String STARTUP_JOB_ID = "daily-brief-startup-sweep";
    static final String STARTUP_DELAY_OFF = "off";

    @Inject
    BriefSchedulingSweep sweep;

    @Inject
    Clock clock;

    @Inject
    Scheduler jobScheduler;

    @ConfigProperty(
            name = "dailybrief.sweep.startup-delay",
            defaultValue = "5s")
    String startupDelay;

    void onStart(@Observes StartupEvent event) {
        if (STARTUP_DELAY_OFF.equalsIgnoreCase(startupDelay.trim())) {
            LOG.info("Startup brief sweep disabled");
            return;
        }
        if (!jobScheduler.isRunning()) {
            LOG.debug("Scheduler is not running, skipping startup brief sweep");
            return;
        }
        // Programmatic jobs need an interval; the job removes itself after the first run
        jobScheduler.newJob(STARTUP_JOB_ID).setInterval("1h").setDelayed(startupDelay)
                .setConcurrentExecution(Scheduled.ConcurrentExecution.SKIP).setTask(execution -> runStartupSweep())
                .schedule();
        LOG.infof("Startup brief sweep scheduled in %s", startupDelay);
    }

    void runStartupSweep() {
        try {
            LOG.info("Running startup brief sweep");
            scheduleDailyBriefs();
        } finally {
            jobScheduler.unscheduleJob(STARTUP_JOB_ID);
        }
    }

    @Scheduled(
            identity = "daily-brief-sweep",
            cron = "${dailybrief.sweep.cron:0 0 * * * ?}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduleDailyBriefs() {
        try {
            SweepSummary summary = sweep.runSweep(Instant.now(clock));
            if (summary.skippedOverlap()) {
                LOG.info("Daily brief sweep skipped, previous sweep still running");
            }
        } catch (Exception e) {
            LOG.errorf(e, "Daily brief scheduler tick failed");
        }
    }
}
