package quest.gekko.trends.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableAsync
@Slf4j
public class NotifierConfig {

    public static final String NOTIFICATION_EXECUTOR = "notificationExecutor";

    @Bean
    public WebClient webhookClient(final WebClient.Builder builder) {
        return builder.defaultHeader("Content-Type", "application/json").build();
    }

    /**
     * Delivery workers for alert notifications, so webhook latency never holds up an ingestion cycle.
     * A full queue drops the newest delivery with a warning; the alert itself is already stored.
     */
    @Bean(name = NOTIFICATION_EXECUTOR)
    public ThreadPoolTaskExecutor notificationExecutor(final TrendProperties.Notify notify) {
        final int workers = Math.max(notify.maxConcurrentDeliveries(), 1);
        final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(Math.max(notify.deliveryQueueCapacity(), 1));
        executor.setThreadNamePrefix("notify-");
        executor.setRejectedExecutionHandler((task, pool) ->
                log.warn("Notification queue full ({} waiting), dropping delivery", pool.getQueue().size()));
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
