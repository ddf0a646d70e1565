package quest.gekko.trends.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.trends.domain.AlertDelivery;

import java.time.Instant;
import java.util.List;

public interface AlertDeliveryRepository extends JpaRepository<AlertDelivery, Long> {
    List<AlertDelivery> findByAttemptedAtAfterOrderByAttemptedAtDesc(final Instant since);
}
