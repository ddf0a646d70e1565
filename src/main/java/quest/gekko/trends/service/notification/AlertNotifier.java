package quest.gekko.trends.service.notification;

import quest.gekko.trends.web.dto.TrendSummaryDTO;

public interface AlertNotifier {
    /** Channel name used in logs and the delivery log, e.g. "discord". */
    String channel();

    /** Notifiers without configuration stay registered but skip delivery. */
    default boolean isEnabled() { return true; }

    void send(AlertNotification notification);

    /** Periodic digest of the dashboard summary. */
    void sendSummary(TrendSummaryDTO summary);
}
