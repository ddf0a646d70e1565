package quest.gekko.trends.service.core;

import quest.gekko.trends.domain.Snapshot;

import java.util.List;

/**
 * @param snapshots one snapshot per distinct entity, in order of first appearance in the batch
 * @param rejected  records dropped by validation
 */
public record NormalizationResult(List<Snapshot> snapshots, List<RejectedRecord> rejected) {

    public record RejectedRecord(int index, String reason) {}
}
