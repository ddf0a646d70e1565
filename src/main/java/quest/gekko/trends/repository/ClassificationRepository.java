package quest.gekko.trends.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import quest.gekko.trends.domain.Classification;
import quest.gekko.trends.domain.EntityKind;
import quest.gekko.trends.domain.EntityRef;

import java.util.List;

public interface ClassificationRepository extends JpaRepository<Classification, Long> {
    List<Classification> findByRefKindAndRefExternalIdOrderByClassifiedAtAscIdAsc(final EntityKind kind, final String externalId);

    // ids are assigned in append order, so the highest id per entity is its latest classification
    @Query("""
        select c from Classification c
        where c.id in (
            select max(c2.id) from Classification c2
            group by c2.ref.kind, c2.ref.externalId
        )
        """)
    List<Classification> findLatestPerEntity();

    default List<Classification> findHistory(final EntityRef ref) {
        return findByRefKindAndRefExternalIdOrderByClassifiedAtAscIdAsc(ref.getKind(), ref.getExternalId());
    }
}
