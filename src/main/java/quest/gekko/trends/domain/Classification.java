package quest.gekko.trends.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "classification", indexes = @Index(name = "idx_classification_entity", columnList = "entity_kind, external_id"))
@Getter @Setter
public class Classification {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Embedded
    EntityRef ref;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    ViralityStage stage;

    @Column(name = "classified_at", nullable = false)
    Instant classifiedAt;

    @Column(nullable = false)
    long viewCount;

    // the count went down since the previous snapshot
    @Column(nullable = false)
    boolean corrected;
}
