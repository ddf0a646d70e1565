package quest.gekko.trends.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.trends.domain.EntityKind;
import quest.gekko.trends.domain.EntityRef;
import quest.gekko.trends.domain.TrackedEntity;

import java.util.Optional;

public interface TrackedEntityRepository extends JpaRepository<TrackedEntity, Long> {
    Optional<TrackedEntity> findByRefKindAndRefExternalId(final EntityKind kind, final String externalId);

    default Optional<TrackedEntity> findByRef(final EntityRef ref) {
        return findByRefKindAndRefExternalId(ref.getKind(), ref.getExternalId());
    }
}
