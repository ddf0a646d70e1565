package quest.gekko.trends.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * One observation of an entity. Rows are append-only.
 */
@Entity
@Table(name = "trend_snapshot", indexes = @Index(name = "idx_snapshot_entity_time", columnList = "entity_kind, external_id, captured_at"))
@Getter @Setter
public class Snapshot {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Embedded
    EntityRef ref;

    @Column(name = "captured_at", nullable = false)
    Instant capturedAt;

    @Column(nullable = false)
    long viewCount;

    Long likes;
    Long shares;
    Long videoCount;

    // name reported by the batch, used to register or refresh the TrackedEntity
    @Transient
    private String displayName;
}
