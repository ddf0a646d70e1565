package quest.gekko.trends.exception;

import lombok.Getter;
import quest.gekko.trends.domain.EntityRef;

import java.time.Instant;

/**
 * A snapshot was captured at or before the entity's latest stored capture.
 */
@Getter
public class OutOfOrderSnapshotException extends TrendEngineException {
    private final EntityRef ref;
    private final Instant capturedAt;
    private final Instant priorCapturedAt;

    public OutOfOrderSnapshotException(final EntityRef ref, final Instant capturedAt, final Instant priorCapturedAt) {
        super("Snapshot for " + ref + " captured at " + capturedAt + " is not after prior capture " + priorCapturedAt);
        this.ref = ref;
        this.capturedAt = capturedAt;
        this.priorCapturedAt = priorCapturedAt;
    }
}
