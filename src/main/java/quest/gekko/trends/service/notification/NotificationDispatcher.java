package quest.gekko.trends.service.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import quest.gekko.trends.config.NotifierConfig;
import quest.gekko.trends.domain.AlertDelivery;
import quest.gekko.trends.domain.AlertEvent;
import quest.gekko.trends.repository.AlertDeliveryRepository;
import quest.gekko.trends.web.dto.TrendSummaryDTO;

import java.time.Clock;
import java.util.List;
import java.util.function.Consumer;

/**
 * Fans alerts and summaries out to every enabled notifier and records one delivery row per channel.
 * A failing channel is logged and never reaches the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {
    static final String SUMMARY_SUBJECT = "summary";

    private final List<AlertNotifier> notifiers;
    private final AlertDeliveryRepository deliveryRepo;
    private final Clock clock;

    @Async(NotifierConfig.NOTIFICATION_EXECUTOR)
    @EventListener(AlertRaisedEvent.class)
    public void onAlertRaised(final AlertRaisedEvent event) {
        dispatch(event.notification());
    }

    public DeliveryOutcome dispatch(final AlertNotification notification) {
        final AlertEvent event = notification.event();
        return fanOut(event.getId(), event.getPriority() + " " + event.getRef(), n -> n.send(notification));
    }

    public DeliveryOutcome dispatchSummary(final TrendSummaryDTO summary) {
        final DeliveryOutcome outcome = fanOut(null, SUMMARY_SUBJECT, n -> n.sendSummary(summary));
        log.info("Summary delivered to {} of {} channels", outcome.delivered(), outcome.attempted());
        return outcome;
    }

    private DeliveryOutcome fanOut(final Long alertId, final String subject, final Consumer<AlertNotifier> delivery) {
        int attempted = 0;
        int delivered = 0;
        for (AlertNotifier notifier : notifiers) {
            if (!notifier.isEnabled()) continue;
            attempted++;
            String error = null;
            try {
                delivery.accept(notifier);
                delivered++;
            } catch (RuntimeException e) {
                error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                log.warn("Failed to deliver {} via {}: {}", subject, notifier.channel(), error);
            }
            record(alertId, subject, notifier.channel(), error);
        }
        return new DeliveryOutcome(attempted, delivered);
    }

    private void record(final Long alertId, final String subject, final String channel, final String error) {
        final AlertDelivery delivery = new AlertDelivery();
        delivery.setAlertId(alertId);
        delivery.setSubject(subject);
        delivery.setChannel(channel);
        delivery.setSuccess(error == null);
        delivery.setErrorMessage(error == null || error.length() <= AlertDelivery.MAX_ERROR_LENGTH
                ? error : error.substring(0, AlertDelivery.MAX_ERROR_LENGTH));
        delivery.setAttemptedAt(clock.instant());
        try {
            deliveryRepo.save(delivery);
        } catch (DataAccessException e) {
            // the delivery already happened; losing its log row must not fail the remaining channels
            log.error("Could not record {} delivery of {}: {}", channel, subject, e.getMessage(), e);
        }
    }
}
