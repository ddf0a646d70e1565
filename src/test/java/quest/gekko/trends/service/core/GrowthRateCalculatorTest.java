package quest.gekko.trends.service.core;

import org.junit.jupiter.api.Test;
import quest.gekko.trends.domain.EntityKind;
import quest.gekko.trends.domain.EntityRef;
import quest.gekko.trends.domain.GrowthMetric;
import quest.gekko.trends.domain.GrowthWindow;
import quest.gekko.trends.domain.Snapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static quest.gekko.trends.support.Records.T0;
import static quest.gekko.trends.support.Records.snapshot;

class GrowthRateCalculatorTest {

    private static final EntityRef REF = EntityRef.of(EntityKind.SOUND, "s1");

    private final GrowthRateCalculator calculator = new GrowthRateCalculator();

    @Test
    void eachWindowUsesLatestSnapshotAtOrBeforeItsHorizon() {
        Instant now = T0.plus(Duration.ofHours(24));
        List<Snapshot> history = List.of(
                snapshot(REF, 1_000, T0),
                snapshot(REF, 4_000, now.minus(Duration.ofHours(6))),
                snapshot(REF, 6_000, now.minus(Duration.ofMinutes(90))));

        List<GrowthMetric> metrics = calculator.calculate(snapshot(REF, 12_000, now), lookup(history), List.of(GrowthWindow.values()), now);

        assertThat(metrics).extracting(GrowthMetric::getWindow)
                .containsExactly(GrowthWindow.H1, GrowthWindow.H6, GrowthWindow.H24);
        assertThat(metrics.get(0).getRate()).isCloseTo(1.0, within(1e-9));
        assertThat(metrics.get(1).getRate()).isCloseTo(2.0, within(1e-9));
        assertThat(metrics.get(2).getRate()).isCloseTo(11.0, within(1e-9));
        assertThat(metrics).allSatisfy(m -> {
            assertThat(m.isCorrected()).isFalse();
            assertThat(m.getCapturedAt()).isEqualTo(now);
        });
    }

    @Test
    void windowWithoutReferenceIsLeftUndefined() {
        Instant now = T0.plus(Duration.ofHours(2));

        List<GrowthMetric> metrics = calculator.calculate(snapshot(REF, 300, now),
                lookup(List.of(snapshot(REF, 100, T0))), List.of(GrowthWindow.values()), now);

        assertThat(metrics).extracting(GrowthMetric::getWindow).containsExactly(GrowthWindow.H1);
    }

    @Test
    void negativeGrowthIsClampedAndFlagged() {
        Instant now = T0.plus(Duration.ofHours(1));

        List<GrowthMetric> metrics = calculator.calculate(snapshot(REF, 80, now),
                lookup(List.of(snapshot(REF, 100, T0))), List.of(GrowthWindow.H1), now);

        assertThat(metrics).singleElement().satisfies(m -> {
            assertThat(m.getRate()).isZero();
            assertThat(m.isCorrected()).isTrue();
        });
    }

    @Test
    void zeroReferenceCountsAsOneView() {
        assertThat(GrowthRateCalculator.rate(50, 0)).isEqualTo(50.0);
        assertThat(GrowthRateCalculator.rate(50_000, 5_000)).isEqualTo(9.0);
    }

    private static SnapshotLookup lookup(final List<Snapshot> history) {
        return (ref, at) -> history.stream()
                .filter(s -> s.getRef().equals(ref) && !s.getCapturedAt().isAfter(at))
                .max(Comparator.comparing(Snapshot::getCapturedAt));
    }
}
