package quest.gekko.trends.service.notification;

import quest.gekko.trends.domain.AlertEvent;
import quest.gekko.trends.domain.EntityKind;
import quest.gekko.trends.domain.ViralityStage;

/**
 * What a notifier needs to render an alert: the event plus entity context at evaluation time.
 */
public record AlertNotification(AlertEvent event,
                                String displayName,
                                ViralityStage stage,
                                long viewCount) {

    public EntityKind kind() {
        return event.getRef().getKind();
    }

    /** Trigger rate as a percentage string, e.g. "900.0%". */
    public String ratePercent() {
        return String.format(java.util.Locale.ROOT, "%.1f%%", event.getTriggerRate() * 100);
    }
}
