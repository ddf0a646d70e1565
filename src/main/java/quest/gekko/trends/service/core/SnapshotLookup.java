package quest.gekko.trends.service.core;

import quest.gekko.trends.domain.EntityRef;
import quest.gekko.trends.domain.Snapshot;

import java.time.Instant;
import java.util.Optional;

@FunctionalInterface
public interface SnapshotLookup {
    Optional<Snapshot> atOrBefore(EntityRef ref, Instant at);
}
