package quest.gekko.trends.exception;

/**
 * The trend store could not be read or written. Fatal for the current cycle.
 */
public class StoreUnavailableException extends TrendEngineException {
    public StoreUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
