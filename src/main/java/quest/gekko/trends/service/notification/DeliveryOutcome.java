package quest.gekko.trends.service.notification;

/**
 * @param attempted enabled channels a delivery was tried on
 * @param delivered channels that accepted it
 */
public record DeliveryOutcome(int attempted, int delivered) {
}
