package quest.gekko.trends.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "tracked_entity", uniqueConstraints = @UniqueConstraint(columnNames = { "entity_kind", "external_id" }))
@Getter @Setter
public class TrackedEntity {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Embedded
    EntityRef ref;

    @Column(nullable = false)
    String displayName;

    @Column(nullable = false)
    Instant firstSeen = Instant.now();

    Instant lastSeen;
}
