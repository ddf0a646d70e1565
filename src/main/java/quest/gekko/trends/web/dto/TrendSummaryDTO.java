package quest.gekko.trends.web.dto;

import quest.gekko.trends.domain.ViralityStage;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Dashboard overview: latest stage per entity, tracked totals, recent alert activity and the
 * fastest-growing hashtags of the last day.
 */
public record TrendSummaryDTO(Map<ViralityStage, Long> stageCounts,
                              long totalEntities,
                              long alertsLast24h,
                              List<AlertDTO> recentBreakouts,
                              List<TopHashtagDTO> topHashtags,
                              Instant generatedAt) {
}
