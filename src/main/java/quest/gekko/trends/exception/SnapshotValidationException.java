package quest.gekko.trends.exception;

/**
 * A raw discovery record could not be turned into a snapshot. The record is dropped; the batch goes on.
 */
public class SnapshotValidationException extends TrendEngineException {
    public SnapshotValidationException(final String message) {
        super(message);
    }
}
