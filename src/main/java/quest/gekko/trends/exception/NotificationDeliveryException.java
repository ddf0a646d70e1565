package quest.gekko.trends.exception;

public class NotificationDeliveryException extends TrendEngineException {
    public NotificationDeliveryException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
