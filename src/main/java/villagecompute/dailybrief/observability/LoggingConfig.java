package villagecompute.dailybrief.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

import java.util.UUID;

/**
 * Standard MDC field names and helpers for enriching scheduler logs with contextual metadata.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code sweep_id} - Identifier of the scheduling sweep that produced the entry</li>
 * <li>{@code user_id} - User whose preference is being evaluated</li>
 * <li>{@code request_origin} - Timer or entry point name (e.g., "DailyBriefScheduler")</li>
 * <li>{@code job_id} - Queue job identifier once a job has been placed</li>
 * </ul>
 *
 * <p>
 * <b>Usage in the sweep:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setSweepId(sweepId);
 * LoggingConfig.setRequestOrigin("BriefSchedulingSweep");
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Callers clear MDC in a
 * {@code finally} block so scheduler threads never carry stale fields into the next tick.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_SWEEP_ID = "sweep_id";

    public static final String MDC_USER_ID = "user_id";

    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    public static final String MDC_JOB_ID = "job_id";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Enriches MDC with trace_id and span_id from the current OpenTelemetry span. Without an active span the fields are
     * set to empty strings to keep the JSON schema stable.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    public static void setSweepId(String sweepId) {
        if (sweepId != null) {
            MDC.put(MDC_SWEEP_ID, sweepId);
        }
    }

    /**
     * Sets the user currently being evaluated. Passing null removes the field.
     */
    public static void setUserId(UUID userId) {
        if (userId != null) {
            MDC.put(MDC_USER_ID, userId.toString());
        } else {
            MDC.remove(MDC_USER_ID);
        }
    }

    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    public static void setJobId(String jobId) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId);
        }
    }

    /**
     * Removes the per-user fields while keeping sweep-level context.
     */
    public static void clearUserContext() {
        MDC.remove(MDC_USER_ID);
        MDC.remove(MDC_JOB_ID);
    }

    /**
     * Clears all observability-related MDC fields.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_SWEEP_ID);
        MDC.remove(MDC_USER_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
        MDC.remove(MDC_JOB_ID);
    }
}
