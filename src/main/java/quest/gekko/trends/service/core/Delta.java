package quest.gekko.trends.service.core;

/**
 * Change between an entity's new snapshot and its previous one.
 *
 * @param corrected the platform lowered the count; the change contributes no growth
 */
public record Delta(long elapsedSeconds, long viewDelta, boolean corrected) {
}
