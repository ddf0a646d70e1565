package quest.gekko.trends.service.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import quest.gekko.trends.domain.Snapshot;
import quest.gekko.trends.exception.OutOfOrderSnapshotException;

import java.time.Duration;
import java.util.Optional;

@Component
@Slf4j
public class HistoryReconciler {

    /**
     * Compare a new snapshot with the entity's most recent stored one.
     *
     * @param prior latest stored snapshot, or {@code null} for a first sighting
     * @return the delta, or empty when there is no prior snapshot
     * @throws OutOfOrderSnapshotException when the new capture is not strictly later than the prior one
     */
    public Optional<Delta> reconcile(final Snapshot current, final Snapshot prior) {
        if (prior == null) return Optional.empty();

        long elapsedSeconds = Duration.between(prior.getCapturedAt(), current.getCapturedAt()).getSeconds();
        if (elapsedSeconds <= 0) {
            throw new OutOfOrderSnapshotException(current.getRef(), current.getCapturedAt(), prior.getCapturedAt());
        }

        long viewDelta = current.getViewCount() - prior.getViewCount();
        boolean corrected = viewDelta < 0;
        if (corrected) {
            log.warn("View count of {} corrected downwards from {} to {}; no growth counted for this interval",
                    current.getRef(), prior.getViewCount(), current.getViewCount());
        }
        return Optional.of(new Delta(elapsedSeconds, viewDelta, corrected));
    }
}
