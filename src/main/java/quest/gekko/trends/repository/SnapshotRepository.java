package quest.gekko.trends.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.trends.domain.EntityKind;
import quest.gekko.trends.domain.EntityRef;
import quest.gekko.trends.domain.Snapshot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface SnapshotRepository extends JpaRepository<Snapshot, Long> {
    Optional<Snapshot> findFirstByRefKindAndRefExternalIdOrderByCapturedAtDesc(final EntityKind kind, final String externalId);

    Optional<Snapshot> findFirstByRefKindAndRefExternalIdAndCapturedAtLessThanEqualOrderByCapturedAtDesc(
            final EntityKind kind, final String externalId, final Instant at);

    List<Snapshot> findByRefKindAndRefExternalIdOrderByCapturedAtAsc(final EntityKind kind, final String externalId);

    default Optional<Snapshot> findLatest(final EntityRef ref) {
        return findFirstByRefKindAndRefExternalIdOrderByCapturedAtDesc(ref.getKind(), ref.getExternalId());
    }

    default Optional<Snapshot> findLatestAtOrBefore(final EntityRef ref, final Instant at) {
        return findFirstByRefKindAndRefExternalIdAndCapturedAtLessThanEqualOrderByCapturedAtDesc(
                ref.getKind(), ref.getExternalId(), at);
    }

    default List<Snapshot> findHistory(final EntityRef ref) {
        return findByRefKindAndRefExternalIdOrderByCapturedAtAsc(ref.getKind(), ref.getExternalId());
    }
}
