package villagecompute.dailybrief.services;

import java.time.Instant;
import java.time.LocalDate;

/**
 * On-demand brief request, e.g. a user pressing "generate now" or "regenerate" in the application.
 *
 * @param briefDate
 *            requested brief date; null means the date of the scheduled instant in the user's timezone
 * @param timezone
 *            requested timezone; null means the user's preference, then UTC
 * @param scheduledFor
 *            requested execution instant; ignored for forced requests, null means now
 * @param forceImmediate
 *            run now with immediate priority, replacing queued jobs for the date
 * @param forceRegenerate
 *            regenerate a brief for the date even if one is queued or done
 */
public record BriefRequest(LocalDate briefDate, String timezone, Instant scheduledFor, boolean forceImmediate,
        boolean forceRegenerate) {

    public static BriefRequest regenerate(LocalDate briefDate) {
        return new BriefRequest(briefDate, null, null, false, true);
    }

    public static BriefRequest immediate() {
        return new BriefRequest(null, null, null, true, false);
    }

    public boolean isForced() {
        return forceImmediate || forceRegenerate;
    }
}
