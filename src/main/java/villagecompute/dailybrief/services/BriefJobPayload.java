package villagecompute.dailybrief.services;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Metadata stored with a {@code generate_daily_brief} job and read by the brief workers.
 *
 * <p>
 * <b>Payload Structure:</b>
 *
 * <pre>
 * {
 *   "userId": "4f1c...",
 *   "briefDate": "2025-10-01",
 *   "timezone": "America/New_York",
 *   "isReengagement": true,       // only when the engagement gate ran
 *   "daysSinceLastLogin": 10,     // only when the engagement gate ran
 *   "forceRegenerate": true       // only for forced requests
 * }
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BriefJobPayload(@JsonProperty("userId") String userId, @JsonProperty("briefDate") String briefDate,
        @JsonProperty("timezone") String timezone, @JsonProperty("isReengagement") Boolean isReengagement,
        @JsonProperty("daysSinceLastLogin") Integer daysSinceLastLogin,
        @JsonProperty("forceRegenerate") Boolean forceRegenerate) {
}
