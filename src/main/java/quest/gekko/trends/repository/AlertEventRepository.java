package quest.gekko.trends.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.trends.domain.AlertEvent;

import java.time.Instant;
import java.util.List;

public interface AlertEventRepository extends JpaRepository<AlertEvent, Long> {
    boolean existsByDedupKey(final String dedupKey);

    List<AlertEvent> findByCreatedAtAfterOrderByCreatedAtDesc(final Instant since);

    long countByCreatedAtAfter(final Instant since);
}
