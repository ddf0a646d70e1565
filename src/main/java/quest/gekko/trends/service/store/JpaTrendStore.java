package quest.gekko.trends.service.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import quest.gekko.trends.domain.AlertEvent;
import quest.gekko.trends.domain.Classification;
import quest.gekko.trends.domain.EntityRef;
import quest.gekko.trends.domain.GrowthMetric;
import quest.gekko.trends.domain.Snapshot;
import quest.gekko.trends.domain.TrackedEntity;
import quest.gekko.trends.exception.StoreUnavailableException;
import quest.gekko.trends.repository.AlertEventRepository;
import quest.gekko.trends.repository.ClassificationRepository;
import quest.gekko.trends.repository.GrowthMetricRepository;
import quest.gekko.trends.repository.SnapshotRepository;
import quest.gekko.trends.repository.TrackedEntityRepository;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

@Service
@RequiredArgsConstructor
@Slf4j
public class JpaTrendStore implements TrendStore {

    private final TrackedEntityRepository entityRepository;
    private final SnapshotRepository snapshotRepository;
    private final GrowthMetricRepository growthRepository;
    private final ClassificationRepository classificationRepository;
    private final AlertEventRepository alertRepository;

    @Override
    public TrackedEntity upsertEntity(final EntityRef ref, final String displayName, final Instant seenAt) {
        return guard("upsert entity " + ref, () -> entityRepository.findByRef(ref)
                .map(existing -> {
                    // identity never changes; only refresh the name and last sighting
                    if (displayName != null && !displayName.isBlank()) existing.setDisplayName(displayName);
                    existing.setLastSeen(seenAt);
                    return entityRepository.save(existing);
                })
                .orElseGet(() -> {
                    TrackedEntity entity = new TrackedEntity();
                    entity.setRef(ref);
                    entity.setDisplayName(displayName != null && !displayName.isBlank() ? displayName : ref.getExternalId());
                    entity.setFirstSeen(seenAt);
                    entity.setLastSeen(seenAt);
                    return entityRepository.save(entity);
                }));
    }

    @Override
    public Optional<Snapshot> getLatestSnapshot(final EntityRef ref) {
        return guard("read latest snapshot of " + ref, () -> snapshotRepository.findLatest(ref));
    }

    @Override
    public Optional<Snapshot> getSnapshotAtOrBefore(final EntityRef ref, final Instant at) {
        return guard("read snapshot of " + ref + " at " + at, () -> snapshotRepository.findLatestAtOrBefore(ref, at));
    }

    @Override
    public Snapshot appendSnapshot(final Snapshot snapshot) {
        return guard("append snapshot of " + snapshot.getRef(), () -> snapshotRepository.save(snapshot));
    }

    @Override
    public GrowthMetric appendGrowthMetric(final GrowthMetric metric) {
        return guard("append growth metric of " + metric.getRef(), () -> growthRepository.save(metric));
    }

    @Override
    public Classification appendClassification(final Classification classification) {
        return guard("append classification of " + classification.getRef(), () -> classificationRepository.save(classification));
    }

    @Override
    public boolean hasAlertWithKey(final String dedupKey) {
        return guard("look up alert " + dedupKey, () -> alertRepository.existsByDedupKey(dedupKey));
    }

    @Override
    public boolean appendAlert(final AlertEvent alert) {
        try {
            alertRepository.saveAndFlush(alert);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.info("Alert {} for {} already stored, skipping", alert.getDedupKey(), alert.getRef());
            return false;
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException("Store unavailable: append alert for " + alert.getRef(), e);
        }
    }

    private static <T> T guard(final String operation, final Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException("Store unavailable: " + operation, e);
        }
    }
}
