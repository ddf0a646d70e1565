package quest.gekko.trends.service.notification;

/**
 * Published by the engine once an alert is stored; delivery happens on the notification executor.
 */
public record AlertRaisedEvent(AlertNotification notification) {
}
