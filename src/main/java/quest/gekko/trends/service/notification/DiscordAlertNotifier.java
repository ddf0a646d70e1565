package quest.gekko.trends.service.notification;

import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import quest.gekko.trends.config.TrendProperties;
import quest.gekko.trends.domain.AlertPriority;
import quest.gekko.trends.domain.ViralityStage;
import quest.gekko.trends.util.RateLimiter;
import quest.gekko.trends.web.dto.TrendSummaryDTO;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class DiscordAlertNotifier extends WebhookAlertNotifier {

    public DiscordAlertNotifier(final WebClient webhookClient, final RateLimiter rateLimiter, final TrendProperties.Notify notify) {
        super(webhookClient, rateLimiter, notify.discordWebhookUrl(), notify.timeout());
    }

    @Override
    public String channel() { return "discord"; }

    @Override
    protected Map<String, Object> payload(final AlertNotification n) {
        Map<String, Object> embed = Map.of(
                "title", headline(n),
                "color", color(n.event().getPriority()),
                "fields", List.of(
                        field("Kind", n.kind().name().toLowerCase()),
                        field("Priority", n.event().getPriority().name()),
                        field("Window", n.event().getTriggerWindow().label()),
                        field("Growth", n.ratePercent()),
                        field("Views", String.format("%,d", n.viewCount())),
                        field("Stage", n.stage().displayName())),
                "timestamp", n.event().getCreatedAt().toString());
        return Map.of("username", "Trend Radar", "embeds", List.of(embed));
    }

    @Override
    protected Map<String, Object> summaryPayload(final TrendSummaryDTO s) {
        List<Map<String, Object>> fields = new ArrayList<>();
        for (ViralityStage stage : ViralityStage.values()) {
            fields.add(field(stage.displayName(), String.valueOf(s.stageCounts().getOrDefault(stage, 0L))));
        }
        fields.add(Map.of("name", "Top hashtags (24h)", "value", hashtagLines(s), "inline", false));
        Map<String, Object> embed = Map.of(
                "title", SUMMARY_TITLE,
                "description", summaryLine(s),
                "color", 0x00ff00,
                "fields", fields,
                "timestamp", s.generatedAt().toString());
        return Map.of("username", "Trend Radar", "embeds", List.of(embed));
    }

    private static Map<String, Object> field(final String name, final String value) {
        return Map.of("name", name, "value", value, "inline", true);
    }

    private static int color(final AlertPriority priority) {
        return switch (priority) {
            case HIGH -> 0xff0000;
            case MEDIUM -> 0xff9900;
            case LOW -> 0x0099ff;
        };
    }
}
