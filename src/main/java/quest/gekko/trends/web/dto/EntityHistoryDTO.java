package quest.gekko.trends.web.dto;

import quest.gekko.trends.domain.EntityKind;
import quest.gekko.trends.domain.ViralityStage;

import java.time.Instant;
import java.util.List;

/**
 * Full stored history of one entity, oldest first.
 */
public record EntityHistoryDTO(EntityKind kind,
                               String externalId,
                               String displayName,
                               Instant firstSeen,
                               Instant lastSeen,
                               List<SnapshotPoint> snapshots,
                               List<GrowthPoint> growth,
                               List<StagePoint> stages) {

    public record SnapshotPoint(Instant capturedAt, long viewCount, Long likes, Long shares, Long videoCount) {}

    public record GrowthPoint(String window, double rate, boolean corrected, Instant capturedAt) {}

    public record StagePoint(ViralityStage stage, long viewCount, boolean corrected, Instant classifiedAt) {}
}
