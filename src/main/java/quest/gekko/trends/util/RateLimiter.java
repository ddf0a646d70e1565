package quest.gekko.trends.util;

import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import quest.gekko.trends.config.TrendProperties;
import quest.gekko.trends.exception.NotificationDeliveryException;

import java.util.concurrent.Callable;
import java.util.concurrent.Semaphore;

/**
 * Bounds concurrent outbound deliveries and retries each one with a fixed backoff.
 */
@Component
public class RateLimiter {
    private final Semaphore sem;
    private final RetryTemplate retry;

    public RateLimiter(final TrendProperties.Notify notify) {
        this.sem = new Semaphore(Math.max(notify.maxConcurrentDeliveries(), 1));
        this.retry = RetryTemplate.builder()
                .maxAttempts(Math.max(notify.maxAttempts(), 1))
                .fixedBackoff(Math.max(notify.retryBackoff().toMillis(), 1L))
                .build();
    }

    public <T> T call(final String target, final Callable<T> c) {
        try {
            sem.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationDeliveryException("Interrupted waiting for a delivery slot to " + target, e);
        }
        try {
            return retry.execute(ctx -> c.call());
        } catch (Exception e) {
            throw new NotificationDeliveryException("Delivery to " + target + " failed", e);
        } finally {
            sem.release();
        }
    }
}
