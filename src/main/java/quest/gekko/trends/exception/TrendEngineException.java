package quest.gekko.trends.exception;

/**
 * Base type for failures raised inside the trend pipeline.
 */
public class TrendEngineException extends RuntimeException {
    public TrendEngineException(final String message) {
        super(message);
    }

    public TrendEngineException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
