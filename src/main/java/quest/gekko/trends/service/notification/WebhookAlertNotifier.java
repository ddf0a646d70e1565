package quest.gekko.trends.service.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import quest.gekko.trends.util.RateLimiter;
import quest.gekko.trends.web.dto.TopHashtagDTO;
import quest.gekko.trends.web.dto.TrendSummaryDTO;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Posts a JSON payload to a chat webhook. Subclasses render the channel-specific body.
 */
@Slf4j
public abstract class WebhookAlertNotifier implements AlertNotifier {
    static final String SUMMARY_TITLE = "Daily Trends Summary";

    private final WebClient http;
    private final RateLimiter rateLimiter;
    private final String webhookUrl;
    private final Duration timeout;

    protected WebhookAlertNotifier(final WebClient http, final RateLimiter rateLimiter, final String webhookUrl, final Duration timeout) {
        this.http = http;
        this.rateLimiter = rateLimiter;
        this.webhookUrl = webhookUrl;
        this.timeout = timeout;
    }

    @Override
    public boolean isEnabled() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    @Override
    public void send(final AlertNotification notification) {
        post(payload(notification));
        log.debug("Delivered {} alert for {} to {}", notification.event().getPriority(), notification.event().getRef(), channel());
    }

    @Override
    public void sendSummary(final TrendSummaryDTO summary) {
        post(summaryPayload(summary));
        log.debug("Delivered summary to {}", channel());
    }

    private void post(final Map<String, Object> body) {
        rateLimiter.call(channel(), () -> http.post()
                .uri(webhookUrl)
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .block(timeout));
    }

    protected abstract Map<String, Object> payload(AlertNotification notification);

    protected abstract Map<String, Object> summaryPayload(TrendSummaryDTO summary);

    protected static String headline(final AlertNotification n) {
        return n.event().getPriority().name().charAt(0) + n.event().getPriority().name().substring(1).toLowerCase()
                + " priority breakout: " + n.displayName();
    }

    protected static String summaryLine(final TrendSummaryDTO s) {
        return "Tracked entities: " + s.totalEntities()
                + " | Alerts (24h): " + s.alertsLast24h()
                + " | Breakouts: " + s.recentBreakouts().size();
    }

    protected static String hashtagLines(final TrendSummaryDTO s) {
        if (s.topHashtags().isEmpty()) return "none";
        return s.topHashtags().stream().map(WebhookAlertNotifier::hashtagLine).collect(Collectors.joining("\n"));
    }

    /** e.g. "#dance +120.0% (48,000 views)" */
    protected static String hashtagLine(final TopHashtagDTO t) {
        return String.format(Locale.ROOT, "#%s +%.1f%% (%,d views)", t.tag(), t.growth24h() * 100, t.viewCount());
    }
}
