package villagecompute.dailybrief.jobs;

/**
 * Enumeration of the async job types this service places on the shared queue.
 *
 * <p>
 * The queue store persists the {@link #getWireName() wire name}, which is shared with the worker processes that
 * execute the jobs. Only the dispatch side lives in this service.
 *
 * @see villagecompute.dailybrief.services.BriefJobDispatcher
 */
public enum JobType {

    /**
     * Generates a user's daily brief for one calendar date in the user's timezone.
     * <p>
     * <b>Cadence:</b> Per user preference (daily, weekly, custom), evaluated hourly
     * <p>
     * <b>Dedup key:</b> {@code brief-{userId}-{briefDate}}
     */
    GENERATE_DAILY_BRIEF("generate_daily_brief", "Daily brief generation (per user preference)");

    private final String wireName;
    private final String description;

    JobType(String wireName, String description) {
        this.wireName = wireName;
        this.description = description;
    }

    /**
     * Returns the identifier stored in {@code queue_jobs.job_type}.
     */
    public String getWireName() {
        return wireName;
    }

    /**
     * Resolves a stored wire name.
     *
     * @throws IllegalArgumentException
     *             if no job type uses the name
     */
    public static JobType fromWireName(String wireName) {
        for (JobType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown job type: " + wireName);
    }

    /**
     * Returns a human-readable description including cadence.
     */
    public String getDescription() {
        return description;
    }
}
