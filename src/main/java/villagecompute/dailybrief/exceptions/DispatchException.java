package villagecompute.dailybrief.exceptions;

/**
 * Exception thrown when the job queue store rejects or cannot complete an enqueue, lookup, or cancel operation.
 */
public class DispatchException extends RuntimeException {

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
