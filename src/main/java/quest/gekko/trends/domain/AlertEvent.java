package quest.gekko.trends.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "alert_event", uniqueConstraints = @UniqueConstraint(columnNames = { "dedup_key" }))
@Getter @Setter
public class AlertEvent {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Embedded
    EntityRef ref;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    AlertPriority priority;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_window", nullable = false, length = 8)
    GrowthWindow triggerWindow;

    @Column(nullable = false)
    double triggerRate;

    @Column(name = "created_at", nullable = false)
    Instant createdAt;

    @Column(name = "dedup_key", nullable = false, length = 64)
    String dedupKey;
}
