package quest.gekko.trends.web.dto;

import quest.gekko.trends.domain.EntityKind;
import quest.gekko.trends.domain.ViralityStage;

import java.time.Instant;

public record StageMemberDTO(EntityKind kind,
                             String externalId,
                             String displayName,
                             ViralityStage stage,
                             long viewCount,
                             Instant classifiedAt) {
}
