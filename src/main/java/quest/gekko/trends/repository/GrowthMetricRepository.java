package quest.gekko.trends.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.trends.domain.EntityKind;
import quest.gekko.trends.domain.EntityRef;
import quest.gekko.trends.domain.GrowthMetric;

import java.time.Instant;
import java.util.List;

public interface GrowthMetricRepository extends JpaRepository<GrowthMetric, Long> {
    List<GrowthMetric> findByRefKindAndRefExternalIdOrderByComputedAtAscIdAsc(final EntityKind kind, final String externalId);

    List<GrowthMetric> findByRefKindAndComputedAtAfterOrderByRateDesc(final EntityKind kind, final Instant since);

    default List<GrowthMetric> findHistory(final EntityRef ref) {
        return findByRefKindAndRefExternalIdOrderByComputedAtAscIdAsc(ref.getKind(), ref.getExternalId());
    }
}
