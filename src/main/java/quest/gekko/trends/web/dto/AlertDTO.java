package quest.gekko.trends.web.dto;

import quest.gekko.trends.domain.AlertEvent;
import quest.gekko.trends.domain.AlertPriority;
import quest.gekko.trends.domain.EntityKind;

import java.time.Instant;

public record AlertDTO(EntityKind kind,
                       String externalId,
                       AlertPriority priority,
                       String window,
                       double rate,
                       Instant createdAt) {

    public static AlertDTO from(final AlertEvent e) {
        return new AlertDTO(e.getRef().getKind(), e.getRef().getExternalId(), e.getPriority(),
                e.getTriggerWindow().label(), e.getTriggerRate(), e.getCreatedAt());
    }
}
