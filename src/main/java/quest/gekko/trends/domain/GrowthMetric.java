package quest.gekko.trends.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "growth_metric", indexes = @Index(name = "idx_growth_entity_time", columnList = "entity_kind, external_id, computed_at"))
@Getter @Setter
public class GrowthMetric {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Embedded
    EntityRef ref;

    @Enumerated(EnumType.STRING)
    @Column(name = "growth_window", nullable = false, length = 8)
    GrowthWindow window;

    /** Ratio, not a percentage: 1.0 means the count doubled over the window. */
    @Column(nullable = false)
    double rate;

    // rate was clamped to zero after a downward count correction
    @Column(nullable = false)
    boolean corrected;

    @Column(name = "captured_at", nullable = false)
    Instant capturedAt;

    @Column(name = "computed_at", nullable = false)
    Instant computedAt;
}
