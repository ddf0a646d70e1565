package quest.gekko.trends.service.core;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import quest.gekko.trends.domain.AlertPriority;

import java.time.Duration;

/**
 * Minimum growth rate (as a ratio) per alert tier, and the dedup cooldown bucket.
 */
@ConfigurationProperties("trends.alerts")
public record AlertThresholds(
        @DefaultValue("2.0") double high,
        @DefaultValue("1.0") double medium,
        @DefaultValue("0.5") double low,
        @DefaultValue("1h") Duration cooldown
) {
    public AlertThresholds {
        if (cooldown == null || cooldown.getSeconds() < 1) {
            throw new IllegalArgumentException("Alert cooldown must be at least one second, got " + cooldown);
        }
    }

    public static AlertThresholds defaults() {
        return new AlertThresholds(2.0, 1.0, 0.5, Duration.ofHours(1));
    }

    public double minimumFor(final AlertPriority priority) {
        return switch (priority) {
            case HIGH -> high;
            case MEDIUM -> medium;
            case LOW -> low;
        };
    }
}
