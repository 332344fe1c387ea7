package villagecompute.dailybrief.exceptions;

/**
 * Exception thrown when a brief request fails input validation (e.g., unknown timezone, malformed brief date).
 *
 * <p>
 * Extends RuntimeException per project standards. Preference-level problems found during a sweep are reported as
 * {@link villagecompute.dailybrief.services.NextRunCalculator.NextRunResult} errors instead and never reach this type.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
