package quest.gekko.trends.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Objects;

/**
 * Identity of a tracked object: {@code (kind, externalId)}.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class EntityRef {

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_kind", nullable = false, length = 16)
    private EntityKind kind;

    @Column(name = "external_id", nullable = false)
    private String externalId;

    private EntityRef(final EntityKind kind, final String externalId) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.externalId = Objects.requireNonNull(externalId, "externalId");
    }

    public static EntityRef of(final EntityKind kind, final String externalId) {
        return new EntityRef(kind, externalId);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + ":" + externalId;
    }
}
