package quest.gekko.trends.service.core;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import quest.gekko.trends.domain.AlertEvent;
import quest.gekko.trends.domain.AlertPriority;
import quest.gekko.trends.domain.EntityKind;
import quest.gekko.trends.domain.EntityRef;
import quest.gekko.trends.domain.GrowthWindow;
import quest.gekko.trends.exception.StoreUnavailableException;
import quest.gekko.trends.service.store.TrendStore;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static quest.gekko.trends.support.Records.T0;

@ExtendWith(MockitoExtension.class)
class AlertEvaluatorTest {

    private static final EntityRef REF = EntityRef.of(EntityKind.SOUND, "s1");
    private static final AlertThresholds THRESHOLDS = AlertThresholds.defaults();

    @Mock
    private TrendStore store;

    private Cache<String, Instant> recentKeys;
    private AlertEvaluator evaluator;

    @BeforeEach
    void setUp() {
        recentKeys = Caffeine.newBuilder().build();
        evaluator = new AlertEvaluator(recentKeys);
    }

    @Test
    void picksHighestTierThatFires() {
        GrowthRates rates = GrowthRates.of(Map.of(GrowthWindow.H1, 0.5, GrowthWindow.H6, 1.5, GrowthWindow.H24, 3.0));

        assertThat(evaluator.decide(rates, THRESHOLDS))
                .contains(new AlertCandidate(AlertPriority.MEDIUM, GrowthWindow.H6, 1.5));
        assertThat(evaluator.decide(GrowthRates.of(Map.of(GrowthWindow.H24, 0.49)), THRESHOLDS)).isEmpty();
        assertThat(evaluator.decide(GrowthRates.none(), THRESHOLDS)).isEmpty();
    }

    @Test
    void dedupKeyIsStableWithinOneCooldownBucket() {
        Duration hour = Duration.ofHours(1);
        String a = AlertEvaluator.dedupKey(REF, AlertPriority.HIGH, T0.plusSeconds(10), hour);
        String b = AlertEvaluator.dedupKey(REF, AlertPriority.HIGH, T0.plusSeconds(3599), hour);
        String nextBucket = AlertEvaluator.dedupKey(REF, AlertPriority.HIGH, T0.plusSeconds(3600), hour);
        String otherTier = AlertEvaluator.dedupKey(REF, AlertPriority.LOW, T0.plusSeconds(10), hour);

        assertThat(a).isEqualTo(b);
        assertThat(a).isNotEqualTo(nextBucket).isNotEqualTo(otherTier);
    }

    @Test
    void storesNewAlert() {
        when(store.hasAlertWithKey(anyString())).thenReturn(false);
        when(store.appendAlert(any())).thenReturn(true);

        Optional<AlertEvent> event = evaluator.evaluate(REF, GrowthRates.of(Map.of(GrowthWindow.H1, 9.0)),
                T0, T0.plusSeconds(5), THRESHOLDS, store);

        assertThat(event).hasValueSatisfying(e -> {
            assertThat(e.getPriority()).isEqualTo(AlertPriority.HIGH);
            assertThat(e.getTriggerRate()).isEqualTo(9.0);
            assertThat(e.getCreatedAt()).isEqualTo(T0.plusSeconds(5));
            assertThat(e.getDedupKey()).isEqualTo(AlertEvaluator.dedupKey(REF, AlertPriority.HIGH, T0, THRESHOLDS.cooldown()));
        });
    }

    @Test
    void bucketFollowsCaptureTimeNotEvaluationTime() {
        when(store.hasAlertWithKey(anyString())).thenReturn(false);
        when(store.appendAlert(any())).thenReturn(true);
        Instant evaluatedDaysLater = T0.plus(Duration.ofDays(3));

        Optional<AlertEvent> event = evaluator.evaluate(REF, GrowthRates.of(Map.of(GrowthWindow.H1, 9.0)),
                T0.plusSeconds(120), evaluatedDaysLater, THRESHOLDS, store);

        assertThat(event).hasValueSatisfying(e -> {
            assertThat(e.getDedupKey())
                    .isEqualTo(AlertEvaluator.dedupKey(REF, AlertPriority.HIGH, T0, THRESHOLDS.cooldown()))
                    .isNotEqualTo(AlertEvaluator.dedupKey(REF, AlertPriority.HIGH, evaluatedDaysLater, THRESHOLDS.cooldown()));
            assertThat(e.getCreatedAt()).isEqualTo(evaluatedDaysLater);
        });
    }

    @Test
    void keyAlreadyInStoreIsSuppressed() {
        when(store.hasAlertWithKey(anyString())).thenReturn(true);

        assertThat(evaluator.evaluate(REF, GrowthRates.of(Map.of(GrowthWindow.H1, 9.0)), T0, T0, THRESHOLDS, store)).isEmpty();
        verify(store, never()).appendAlert(any());
    }

    @Test
    void keyClaimedInProcessSkipsStore() {
        when(store.hasAlertWithKey(anyString())).thenReturn(false);
        when(store.appendAlert(any())).thenReturn(true);
        GrowthRates rates = GrowthRates.of(Map.of(GrowthWindow.H1, 9.0));

        assertThat(evaluator.evaluate(REF, rates, T0, T0, THRESHOLDS, store)).isPresent();
        assertThat(evaluator.evaluate(REF, rates, T0.plusSeconds(60), T0.plusSeconds(60), THRESHOLDS, store)).isEmpty();
        verify(store).appendAlert(any());
    }

    @Test
    void failedStoreReleasesClaim() {
        when(store.hasAlertWithKey(anyString())).thenThrow(new StoreUnavailableException("down", new RuntimeException()));

        assertThatThrownBy(() -> evaluator.evaluate(REF, GrowthRates.of(Map.of(GrowthWindow.H1, 9.0)), T0, T0, THRESHOLDS, store))
                .isInstanceOf(StoreUnavailableException.class);
        assertThat(recentKeys.asMap()).isEmpty();
    }
}
