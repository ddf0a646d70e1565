package quest.gekko.trends.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import quest.gekko.trends.service.core.AlertThresholds;

import java.time.Duration;
import java.time.Instant;

@Configuration
@EnableCaching
public class CacheConfig {

    public static final String TREND_SUMMARY = "trendSummary";
    public static final String STAGE_MEMBERS = "stageMembers";

    @Bean
    public Caffeine<Object, Object> caffeine() {
        return Caffeine.newBuilder().maximumSize(1_000).expireAfterWrite(Duration.ofMinutes(5));
    }

    @Bean
    public CacheManager cacheManager(final Caffeine<Object, Object> caffeine) {
        final CaffeineCacheManager cacheManager = new CaffeineCacheManager(TREND_SUMMARY, STAGE_MEMBERS);
        cacheManager.setCaffeine(caffeine);
        return cacheManager;
    }

    @Bean
    public Cache<String, Instant> recentAlertKeys(final AlertThresholds alertThresholds) {
        return Caffeine.newBuilder()
                .maximumSize(100_000)
                .expireAfterWrite(alertThresholds.cooldown())
                .build();
    }
}
