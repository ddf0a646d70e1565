package quest.gekko.trends.service.notification;

import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import quest.gekko.trends.config.TrendProperties;
import quest.gekko.trends.domain.ViralityStage;
import quest.gekko.trends.util.RateLimiter;
import quest.gekko.trends.web.dto.TrendSummaryDTO;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class SlackAlertNotifier extends WebhookAlertNotifier {

    public SlackAlertNotifier(final WebClient webhookClient, final RateLimiter rateLimiter, final TrendProperties.Notify notify) {
        super(webhookClient, rateLimiter, notify.slackWebhookUrl(), notify.timeout());
    }

    @Override
    public String channel() { return "slack"; }

    @Override
    protected Map<String, Object> payload(final AlertNotification n) {
        String text = headline(n);
        List<Map<String, Object>> blocks = List.of(
                Map.of("type", "header", "text", Map.of("type", "plain_text", "text", text)),
                Map.of("type", "section", "fields", List.of(
                        markdown("*Kind:*\n" + n.kind().name().toLowerCase()),
                        markdown("*Growth (" + n.event().getTriggerWindow().label() + "):*\n" + n.ratePercent()),
                        markdown("*Views:*\n" + String.format("%,d", n.viewCount())),
                        markdown("*Stage:*\n" + n.stage().displayName()))),
                Map.of("type", "context", "elements", List.of(
                        markdown("ID: " + n.event().getRef().getExternalId() + " | Detected: " + n.event().getCreatedAt()))));
        return Map.of("text", text, "blocks", blocks);
    }

    @Override
    protected Map<String, Object> summaryPayload(final TrendSummaryDTO s) {
        List<Map<String, Object>> stageFields = new ArrayList<>();
        for (ViralityStage stage : ViralityStage.values()) {
            stageFields.add(markdown("*" + stage.displayName() + ":*\n" + s.stageCounts().getOrDefault(stage, 0L)));
        }
        List<Map<String, Object>> blocks = List.of(
                Map.of("type", "header", "text", Map.of("type", "plain_text", "text", SUMMARY_TITLE)),
                Map.of("type", "section", "text", markdown(summaryLine(s))),
                Map.of("type", "section", "fields", stageFields),
                Map.of("type", "section", "text", markdown("*Top hashtags (24h):*\n" + hashtagLines(s))),
                Map.of("type", "context", "elements", List.of(markdown("Generated: " + s.generatedAt()))));
        return Map.of("text", SUMMARY_TITLE, "blocks", blocks);
    }

    private static Map<String, Object> markdown(final String text) {
        return Map.of("type", "mrkdwn", "text", text);
    }
}
