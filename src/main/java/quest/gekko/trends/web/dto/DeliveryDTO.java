package quest.gekko.trends.web.dto;

import quest.gekko.trends.domain.AlertDelivery;

import java.time.Instant;

public record DeliveryDTO(Long alertId,
                          String subject,
                          String channel,
                          boolean success,
                          String errorMessage,
                          Instant attemptedAt) {

    public static DeliveryDTO from(final AlertDelivery d) {
        return new DeliveryDTO(d.getAlertId(), d.getSubject(), d.getChannel(), d.isSuccess(), d.getErrorMessage(), d.getAttemptedAt());
    }
}
