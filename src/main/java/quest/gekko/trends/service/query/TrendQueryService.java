package quest.gekko.trends.service.query;

import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;
import quest.gekko.trends.config.CacheConfig;
import quest.gekko.trends.domain.Classification;
import quest.gekko.trends.domain.EntityKind;
import quest.gekko.trends.domain.EntityRef;
import quest.gekko.trends.domain.GrowthMetric;
import quest.gekko.trends.domain.GrowthWindow;
import quest.gekko.trends.domain.Snapshot;
import quest.gekko.trends.domain.TrackedEntity;
import quest.gekko.trends.domain.ViralityStage;
import quest.gekko.trends.repository.AlertDeliveryRepository;
import quest.gekko.trends.repository.AlertEventRepository;
import quest.gekko.trends.repository.ClassificationRepository;
import quest.gekko.trends.repository.GrowthMetricRepository;
import quest.gekko.trends.repository.SnapshotRepository;
import quest.gekko.trends.repository.TrackedEntityRepository;
import quest.gekko.trends.web.dto.AlertDTO;
import quest.gekko.trends.web.dto.DeliveryDTO;
import quest.gekko.trends.web.dto.EntityHistoryDTO;
import quest.gekko.trends.web.dto.StageMemberDTO;
import quest.gekko.trends.web.dto.TopHashtagDTO;
import quest.gekko.trends.web.dto.TrendSummaryDTO;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only views over the stored histories for the dashboard.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TrendQueryService {
    static final int MAX_ALERT_HOURS = 24 * 30;
    private static final int SUMMARY_BREAKOUTS = 10;
    private static final int SUMMARY_HASHTAGS = 10;

    private final TrackedEntityRepository entityRepo;
    private final SnapshotRepository snapshotRepo;
    private final GrowthMetricRepository growthRepo;
    private final ClassificationRepository classificationRepo;
    private final AlertEventRepository alertRepo;
    private final AlertDeliveryRepository deliveryRepo;
    private final Clock clock;

    @Cacheable(CacheConfig.TREND_SUMMARY)
    public TrendSummaryDTO summary() {
        Map<ViralityStage, Long> counts = new EnumMap<>(ViralityStage.class);
        for (ViralityStage stage : ViralityStage.values()) counts.put(stage, 0L);
        classificationRepo.findLatestPerEntity().forEach(c -> counts.merge(c.getStage(), 1L, Long::sum));

        Instant now = clock.instant();
        Instant since = now.minus(Duration.ofHours(24));
        List<AlertDTO> breakouts = alertRepo.findByCreatedAtAfterOrderByCreatedAtDesc(since).stream()
                .limit(SUMMARY_BREAKOUTS)
                .map(AlertDTO::from)
                .toList();

        return new TrendSummaryDTO(counts, entityRepo.count(), alertRepo.countByCreatedAtAfter(since), breakouts,
                topHashtags(since), now);
    }

    /**
     * Hashtags with the highest 24h rate computed since {@code since}, one entry per hashtag.
     */
    List<TopHashtagDTO> topHashtags(final Instant since) {
        Map<EntityRef, GrowthMetric> best = new LinkedHashMap<>();
        for (GrowthMetric metric : growthRepo.findByRefKindAndComputedAtAfterOrderByRateDesc(EntityKind.HASHTAG, since)) {
            if (metric.getWindow() != GrowthWindow.H24) continue;
            best.putIfAbsent(metric.getRef(), metric);
            if (best.size() == SUMMARY_HASHTAGS) break;
        }
        return best.values().stream()
                .map(m -> new TopHashtagDTO(
                        m.getRef().getExternalId(),
                        entityRepo.findByRef(m.getRef()).map(TrackedEntity::getDisplayName).orElse(m.getRef().getExternalId()),
                        m.getRate(),
                        snapshotRepo.findLatest(m.getRef()).map(Snapshot::getViewCount).orElse(0L)))
                .toList();
    }

    public EntityHistoryDTO history(final EntityKind kind, final String externalId) {
        EntityRef ref = EntityRef.of(kind, externalId);
        TrackedEntity entity = entityRepo.findByRef(ref)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown entity " + ref));

        var snapshots = snapshotRepo.findHistory(ref).stream()
                .map(s -> new EntityHistoryDTO.SnapshotPoint(s.getCapturedAt(), s.getViewCount(), s.getLikes(), s.getShares(), s.getVideoCount()))
                .toList();
        var growth = growthRepo.findHistory(ref).stream()
                .map(g -> new EntityHistoryDTO.GrowthPoint(g.getWindow().label(), g.getRate(), g.isCorrected(), g.getCapturedAt()))
                .toList();
        var stages = classificationRepo.findHistory(ref).stream()
                .map(c -> new EntityHistoryDTO.StagePoint(c.getStage(), c.getViewCount(), c.isCorrected(), c.getClassifiedAt()))
                .toList();

        return new EntityHistoryDTO(kind, externalId, entity.getDisplayName(), entity.getFirstSeen(), entity.getLastSeen(),
                snapshots, growth, stages);
    }

    /**
     * Entities whose latest classification is {@code stage}, largest view count first.
     */
    @Cacheable(value = CacheConfig.STAGE_MEMBERS, key = "#stage")
    public List<StageMemberDTO> byStage(final ViralityStage stage) {
        List<Classification> latest = classificationRepo.findLatestPerEntity().stream()
                .filter(c -> c.getStage() == stage)
                .sorted(Comparator.comparingLong(Classification::getViewCount).reversed())
                .toList();
        if (latest.isEmpty()) return List.of();

        Map<EntityRef, String> names = entityRepo.findAll().stream()
                .collect(Collectors.toMap(TrackedEntity::getRef, TrackedEntity::getDisplayName, (a, b) -> a));

        return latest.stream()
                .map(c -> new StageMemberDTO(c.getRef().getKind(), c.getRef().getExternalId(),
                        names.getOrDefault(c.getRef(), c.getRef().getExternalId()),
                        c.getStage(), c.getViewCount(), c.getClassifiedAt()))
                .toList();
    }

    public List<AlertDTO> recentAlerts(final int hours) {
        return alertRepo.findByCreatedAtAfterOrderByCreatedAtDesc(lookback(hours)).stream()
                .map(AlertDTO::from)
                .toList();
    }

    /**
     * Delivery attempts per channel, newest first.
     */
    public List<DeliveryDTO> recentDeliveries(final int hours) {
        return deliveryRepo.findByAttemptedAtAfterOrderByAttemptedAtDesc(lookback(hours)).stream()
                .map(DeliveryDTO::from)
                .toList();
    }

    private Instant lookback(final int hours) {
        if (hours < 1 || hours > MAX_ALERT_HOURS) {
            throw new IllegalArgumentException("hours must be between 1 and " + MAX_ALERT_HOURS);
        }
        return clock.instant().minus(Duration.ofHours(hours));
    }
}
