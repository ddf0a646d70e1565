package quest.gekko.trends.service.core;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one ingestion cycle.
 *
 * @param received  raw records in the batch
 * @param accepted  distinct snapshots left after validation and in-batch deduplication
 * @param processed snapshots that went through every stage
 * @param skipped   snapshots dropped as out of order or duplicates of stored history
 * @param failed    snapshots whose processing threw
 * @param alerts    alert events stored this cycle
 * @param aborted   true when the store became unavailable and the remaining entities were left for the next cycle
 */
public record CycleReport(int received,
                          int accepted,
                          int rejected,
                          int processed,
                          int skipped,
                          int failed,
                          int alerts,
                          boolean aborted,
                          List<NormalizationResult.RejectedRecord> rejections,
                          Instant startedAt,
                          Instant finishedAt) {
}
