package quest.gekko.trends.service.core;

import org.junit.jupiter.api.Test;
import quest.gekko.trends.domain.GrowthWindow;
import quest.gekko.trends.domain.ViralityStage;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ViralityClassifierTest {

    private final ViralityClassifier classifier = new ViralityClassifier();
    private final ClassifierThresholds thresholds = ClassifierThresholds.defaults();

    @Test
    void singleSnapshotIsAlwaysNew() {
        ClassificationInput input = new ClassificationInput(50_000_000, GrowthRates.none(), false);

        assertThat(classifier.classify(input, thresholds)).isEqualTo(ViralityStage.NEW);
        assertThat(classifier.decidingRule(input, thresholds)).isEqualTo("single-snapshot");
    }

    @Test
    void massiveFloorOverridesGrowth() {
        ClassificationInput input = new ClassificationInput(1_000_000, rates(GrowthWindow.H24, 0.0), true);

        assertThat(classifier.classify(input, thresholds)).isEqualTo(ViralityStage.MASSIVE);
    }

    @Test
    void earlyTractionNeedsHighGrowthInItsBracket() {
        assertThat(classifier.classify(new ClassificationInput(50_000, rates(GrowthWindow.H1, 2.0), true), thresholds))
                .isEqualTo(ViralityStage.EARLY_TRACTION);
        assertThat(classifier.classify(new ClassificationInput(50_000, rates(GrowthWindow.H6, 1.0), true), thresholds))
                .isEqualTo(ViralityStage.EARLY_TRACTION);
        assertThat(classifier.classify(new ClassificationInput(50_000, rates(GrowthWindow.H1, 1.9), true), thresholds))
                .isEqualTo(ViralityStage.NEW);
        assertThat(classifier.classify(new ClassificationInput(9_999, rates(GrowthWindow.H1, 50.0), true), thresholds))
                .isEqualTo(ViralityStage.NEW);
    }

    @Test
    void steadyNeedsModerateGrowthInItsBracket() {
        assertThat(classifier.classify(new ClassificationInput(500_000, rates(GrowthWindow.H24, 0.5), true), thresholds))
                .isEqualTo(ViralityStage.STEADY);
        assertThat(classifier.classify(new ClassificationInput(500_000, rates(GrowthWindow.H24, 0.4), true), thresholds))
                .isEqualTo(ViralityStage.NEW);
    }

    @Test
    void hourlyHighGrowthAboveSteadyFloorIsSteady() {
        ClassificationInput input = new ClassificationInput(500_000, rates(GrowthWindow.H1, 5.0), true);

        assertThat(classifier.classify(input, thresholds)).isEqualTo(ViralityStage.STEADY);
        assertThat(classifier.decidingRule(input, thresholds)).isEqualTo("steady-growth");
        assertThat(classifier.classify(new ClassificationInput(500_000, rates(GrowthWindow.H1, 0.3), true), thresholds))
                .isEqualTo(ViralityStage.NEW);
    }

    @Test
    void earlyTractionFloorIsInclusive() {
        assertThat(classifier.classify(new ClassificationInput(10_000, rates(GrowthWindow.H1, 2.0), true), thresholds))
                .isEqualTo(ViralityStage.EARLY_TRACTION);
        assertThat(classifier.classify(new ClassificationInput(9_999, rates(GrowthWindow.H1, 2.0), true), thresholds))
                .isEqualTo(ViralityStage.NEW);
    }

    @Test
    void steadyFloorIsInclusive() {
        assertThat(classifier.classify(new ClassificationInput(100_000, rates(GrowthWindow.H6, 0.5), true), thresholds))
                .isEqualTo(ViralityStage.STEADY);
        assertThat(classifier.classify(new ClassificationInput(99_999, rates(GrowthWindow.H6, 0.5), true), thresholds))
                .isEqualTo(ViralityStage.NEW);
        assertThat(classifier.classify(new ClassificationInput(99_999, rates(GrowthWindow.H6, 1.0), true), thresholds))
                .isEqualTo(ViralityStage.EARLY_TRACTION);
    }

    @Test
    void massiveFloorIsInclusive() {
        assertThat(classifier.classify(new ClassificationInput(999_999, rates(GrowthWindow.H24, 0.5), true), thresholds))
                .isEqualTo(ViralityStage.STEADY);
        assertThat(classifier.classify(new ClassificationInput(999_999, GrowthRates.none(), true), thresholds))
                .isEqualTo(ViralityStage.NEW);
        assertThat(classifier.classify(new ClassificationInput(1_000_000, GrowthRates.none(), true), thresholds))
                .isEqualTo(ViralityStage.MASSIVE);
    }

    @Test
    void undefinedRatesNeverSatisfyAGrowthCondition() {
        ClassificationInput input = new ClassificationInput(150_000, GrowthRates.none(), true);

        assertThat(classifier.classify(input, thresholds)).isEqualTo(ViralityStage.NEW);
        assertThat(classifier.decidingRule(input, thresholds)).isEqualTo("default-new");
    }

    @Test
    void identicalInputsGiveIdenticalStages() {
        ClassificationInput input = new ClassificationInput(75_000, rates(GrowthWindow.H6, 1.2), true);

        assertThat(classifier.classify(input, thresholds)).isEqualTo(classifier.classify(input, thresholds));
    }

    @Test
    void growthMinimumsAreConfigurable() {
        ClassifierThresholds strict = new ClassifierThresholds(10_000, 100_000, 1_000_000,
                Map.of(GrowthWindow.H1, 5.0), null);

        assertThat(classifier.classify(new ClassificationInput(50_000, rates(GrowthWindow.H1, 3.0), true), strict))
                .isEqualTo(ViralityStage.NEW);
        assertThat(strict.moderateGrowth()).isEqualTo(ClassifierThresholds.DEFAULT_MODERATE_GROWTH);
    }

    @Test
    void bracketsMustBeAscending() {
        assertThatThrownBy(() -> new ClassifierThresholds(100_000, 10_000, 1_000_000, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static GrowthRates rates(final GrowthWindow window, final double rate) {
        return GrowthRates.of(Map.of(window, rate));
    }
}
