package quest.gekko.trends.util;

import org.junit.jupiter.api.Test;
import quest.gekko.trends.config.TrendProperties;
import quest.gekko.trends.exception.NotificationDeliveryException;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {

    private final RateLimiter limiter = new RateLimiter(
            new TrendProperties.Notify(null, null, Duration.ofSeconds(1), 3, Duration.ofMillis(1), 2, 10));

    @Test
    void retriesUntilCallSucceeds() {
        AtomicInteger attempts = new AtomicInteger();

        String result = limiter.call("discord", () -> {
            if (attempts.incrementAndGet() < 3) throw new IllegalStateException("503");
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(attempts).hasValue(3);
    }

    @Test
    void givesUpAfterMaxAttempts() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> limiter.call("slack", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("503");
        }))
                .isInstanceOf(NotificationDeliveryException.class)
                .hasMessageContaining("slack");
        assertThat(attempts).hasValue(3);
    }
}
