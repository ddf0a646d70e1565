package quest.gekko.trends.service.store;

import quest.gekko.trends.domain.AlertEvent;
import quest.gekko.trends.domain.Classification;
import quest.gekko.trends.domain.EntityRef;
import quest.gekko.trends.domain.GrowthMetric;
import quest.gekko.trends.domain.Snapshot;
import quest.gekko.trends.domain.TrackedEntity;

import java.time.Instant;
import java.util.Optional;

/**
 * Read/write contract the trend engine needs from persistence.
 * Every history is an append-only log keyed by (entity, time); nothing is updated in place
 * except the entity registry.
 * Implementations throw {@link quest.gekko.trends.exception.StoreUnavailableException} when the backing store fails.
 */
public interface TrendStore {

    /** Register the entity on first sighting, or refresh its display name. */
    TrackedEntity upsertEntity(EntityRef ref, String displayName, Instant seenAt);

    Optional<Snapshot> getLatestSnapshot(EntityRef ref);

    /** Most recent snapshot captured at or before {@code at}. */
    Optional<Snapshot> getSnapshotAtOrBefore(EntityRef ref, Instant at);

    Snapshot appendSnapshot(Snapshot snapshot);

    GrowthMetric appendGrowthMetric(GrowthMetric metric);

    Classification appendClassification(Classification classification);

    boolean hasAlertWithKey(String dedupKey);

    /**
     * @return {@code false} when an alert with the same dedup key was stored concurrently
     */
    boolean appendAlert(AlertEvent alert);
}
