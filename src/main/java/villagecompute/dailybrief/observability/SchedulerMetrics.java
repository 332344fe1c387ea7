package villagecompute.dailybrief.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registers the Micrometer meters exported by the brief scheduler.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Timer:</b> {@code dailybrief.sweep.duration} - Wall time of one sweep</li>
 * <li><b>Counter:</b> {@code dailybrief.sweep.runs.total{outcome}} - completed, failed, overlapped</li>
 * <li><b>Counter:</b> {@code dailybrief.briefs.queued.total{type}} - standard, reengagement, immediate, forced</li>
 * <li><b>Counter:</b> {@code dailybrief.briefs.skipped.total{reason}} - backoff, invalid_preference, not_due,
 * already_queued</li>
 * <li><b>Counter:</b> {@code dailybrief.dispatch.errors.total} - Per-user enqueue failures</li>
 * <li><b>Gauge:</b> {@code dailybrief.sweep.running} - 1 while a sweep is in progress</li>
 * </ul>
 *
 * <p>
 * Metrics are exported in Prometheus format at {@code /q/metrics}.
 */
@ApplicationScoped
public class SchedulerMetrics {

    private final MeterRegistry registry;

    @Inject
    public SchedulerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSweep(String outcome, Duration duration) {
        Counter.builder("dailybrief.sweep.runs.total").tag("outcome", outcome).register(registry).increment();
        if (duration != null) {
            Timer.builder("dailybrief.sweep.duration").register(registry).record(duration);
        }
    }

    public void incrementQueued(String type) {
        Counter.builder("dailybrief.briefs.queued.total").tag("type", type).register(registry).increment();
    }

    public void incrementSkipped(String reason) {
        Counter.builder("dailybrief.briefs.skipped.total").tag("reason", reason).register(registry).increment();
    }

    public void incrementDispatchErrors() {
        Counter.builder("dailybrief.dispatch.errors.total").register(registry).increment();
    }

    /**
     * Binds the running gauge to the sweep's state flag.
     */
    public void bindSweepState(AtomicBoolean running) {
        Gauge.builder("dailybrief.sweep.running", running, state -> state.get() ? 1.0 : 0.0)
                .description("1 while a brief scheduling sweep is in progress").register(registry);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
