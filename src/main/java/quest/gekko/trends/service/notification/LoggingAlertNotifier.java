package quest.gekko.trends.service.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import quest.gekko.trends.web.dto.TopHashtagDTO;
import quest.gekko.trends.web.dto.TrendSummaryDTO;

import java.util.stream.Collectors;

@Component
@Slf4j
public class LoggingAlertNotifier implements AlertNotifier {

    @Override
    public String channel() { return "log"; }

    @Override
    public void send(final AlertNotification n) {
        log.info("[{}] {} {} '{}' grew {} over {} ({} views, stage {})",
                n.event().getPriority(), n.kind(), n.event().getRef().getExternalId(), n.displayName(),
                n.ratePercent(), n.event().getTriggerWindow().label(), n.viewCount(), n.stage().displayName());
    }

    @Override
    public void sendSummary(final TrendSummaryDTO s) {
        log.info("[SUMMARY] {} tracked, {} alerts in 24h, stages {}, top hashtags [{}]",
                s.totalEntities(), s.alertsLast24h(), s.stageCounts(),
                s.topHashtags().stream().map(TopHashtagDTO::tag).collect(Collectors.joining(", ")));
    }
}
