package quest.gekko.trends.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * One delivery attempt of an alert or summary to one channel.
 */
@Entity
@Table(name = "alert_delivery", indexes = @Index(name = "idx_alert_delivery_time", columnList = "attempted_at"))
@Getter @Setter
public class AlertDelivery {
    public static final int MAX_ERROR_LENGTH = 500;

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    // null for summaries
    @Column(name = "alert_id")
    Long alertId;

    @Column(nullable = false, length = 128)
    String subject;

    @Column(nullable = false, length = 16)
    String channel;

    @Column(nullable = false)
    boolean success;

    @Column(name = "error_message", length = MAX_ERROR_LENGTH)
    String errorMessage;

    @Column(name = "attempted_at", nullable = false)
    Instant attemptedAt;
}
