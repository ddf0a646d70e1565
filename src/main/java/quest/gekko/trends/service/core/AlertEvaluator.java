package quest.gekko.trends.service.core;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;
import quest.gekko.trends.domain.AlertEvent;
import quest.gekko.trends.domain.AlertPriority;
import quest.gekko.trends.domain.EntityRef;
import quest.gekko.trends.service.store.TrendStore;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Decides whether an entity's growth warrants an alert and suppresses repeats of the same
 * tier inside one cooldown bucket.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AlertEvaluator {

    // dedup keys claimed by this process, expiring after one cooldown
    private final Cache<String, Instant> recentAlertKeys;

    /**
     * Highest tier whose trigger window has a defined rate at or above its minimum.
     */
    public Optional<AlertCandidate> decide(final GrowthRates rates, final AlertThresholds thresholds) {
        for (AlertPriority priority : AlertPriority.values()) {
            OptionalDouble rate = rates.rate(priority.triggerWindow());
            if (rate.isPresent() && rate.getAsDouble() >= thresholds.minimumFor(priority)) {
                return Optional.of(new AlertCandidate(priority, priority.triggerWindow(), rate.getAsDouble()));
            }
        }
        return Optional.empty();
    }

    /**
     * Hash of entity, tier and the cooldown bucket containing {@code at}.
     */
    public static String dedupKey(final EntityRef ref, final AlertPriority priority, final Instant at, final Duration cooldown) {
        long bucket = Math.floorDiv(at.getEpochSecond(), cooldown.getSeconds());
        String source = ref + "|" + priority.name() + "|" + bucket;
        return DigestUtils.md5DigestAsHex(source.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Evaluate one entity and, when an alert is due and not a duplicate, append it to the store.
     *
     * @param capturedAt capture time of the snapshot being evaluated; selects the dedup bucket
     * @param createdAt   wall-clock time stamped on the event
     * @return the stored event, or empty when no tier fired or the key was already used
     */
    public Optional<AlertEvent> evaluate(final EntityRef ref,
                                         final GrowthRates rates,
                                         final Instant capturedAt,
                                         final Instant createdAt,
                                         final AlertThresholds thresholds,
                                         final TrendStore store) {
        Optional<AlertCandidate> candidate = decide(rates, thresholds);
        if (candidate.isEmpty()) return Optional.empty();

        AlertCandidate fired = candidate.get();
        String key = dedupKey(ref, fired.priority(), capturedAt, thresholds.cooldown());

        // claim the key before touching the store so two workers cannot both emit it
        if (recentAlertKeys.asMap().putIfAbsent(key, createdAt) != null) {
            log.debug("Suppressing {} alert for {}: key {} already emitted in this process", fired.priority(), ref, key);
            return Optional.empty();
        }

        try {
            if (store.hasAlertWithKey(key)) {
                log.debug("Suppressing {} alert for {}: key {} already stored", fired.priority(), ref, key);
                return Optional.empty();
            }

            AlertEvent event = new AlertEvent();
            event.setRef(ref);
            event.setPriority(fired.priority());
            event.setTriggerWindow(fired.triggerWindow());
            event.setTriggerRate(fired.triggerRate());
            event.setCreatedAt(createdAt);
            event.setDedupKey(key);

            if (!store.appendAlert(event)) return Optional.empty();

            log.info("{} alert for {}: {} growth {}", fired.priority(), ref, fired.triggerWindow().label(), fired.triggerRate());
            return Optional.of(event);
        } catch (RuntimeException e) {
            // release the claim so the next cycle can retry this key
            recentAlertKeys.invalidate(key);
            throw e;
        }
    }
}
