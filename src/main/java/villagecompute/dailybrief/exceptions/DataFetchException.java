package villagecompute.dailybrief.exceptions;

/**
 * Exception thrown when engagement facts (last visit, last completed brief) cannot be read from the backing store.
 *
 * <p>
 * Callers in the backoff path recover from this by failing open: a user whose facts cannot be read still receives a
 * brief.
 */
public class DataFetchException extends RuntimeException {

    public DataFetchException(String message) {
        super(message);
    }

    public DataFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
