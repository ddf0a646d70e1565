package quest.gekko.trends.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Configuration;
import quest.gekko.trends.domain.GrowthWindow;
import quest.gekko.trends.service.core.AlertThresholds;
import quest.gekko.trends.service.core.ClassifierThresholds;

import java.time.Duration;
import java.util.List;

/**
 * Configuration properties for the trend engine and its collaborators
 */
@Configuration
@EnableConfigurationProperties({
        ClassifierThresholds.class,
        AlertThresholds.class,
        TrendProperties.Engine.class,
        TrendProperties.Notify.class,
        TrendProperties.Security.class
})
public class TrendProperties {

    /**
     * @param parallelism worker count for one cycle; 1 processes entities on the calling thread
     * @param windows     growth windows computed each cycle
     */
    @ConfigurationProperties("trends.engine")
    public record Engine(@DefaultValue("1") int parallelism, List<GrowthWindow> windows) {
        public Engine {
            if (parallelism < 1) throw new IllegalArgumentException("trends.engine.parallelism must be >= 1");
            windows = windows == null || windows.isEmpty() ? List.of(GrowthWindow.values()) : List.copyOf(windows);
        }

        public static Engine defaults() {
            return new Engine(1, null);
        }
    }

    /**
     * @param maxConcurrentDeliveries webhook calls in flight at once, also the delivery worker count
     * @param deliveryQueueCapacity   alerts waiting for a delivery worker before new ones are dropped
     */
    @ConfigurationProperties("trends.notify")
    public record Notify(String discordWebhookUrl,
                         String slackWebhookUrl,
                         @DefaultValue("10s") Duration timeout,
                         @DefaultValue("3") int maxAttempts,
                         @DefaultValue("800ms") Duration retryBackoff,
                         @DefaultValue("5") int maxConcurrentDeliveries,
                         @DefaultValue("500") int deliveryQueueCapacity) {}

    @ConfigurationProperties("security.admin")
    public record Security(String username, String password) {}
}
