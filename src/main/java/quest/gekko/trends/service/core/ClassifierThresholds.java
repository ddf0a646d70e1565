package quest.gekko.trends.service.core;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import quest.gekko.trends.domain.GrowthWindow;

import java.util.Map;

/**
 * View-count brackets and growth minimums for the virality classifier.
 *
 * @param earlyTractionFloor lowest view count eligible for EARLY_TRACTION
 * @param steadyFloor        lowest view count eligible for STEADY
 * @param massiveFloor       view count from which an entity is MASSIVE regardless of growth
 * @param highGrowth         per-window minimum rates; EARLY_TRACTION needs any one of them
 * @param moderateGrowth     per-window minimum rates; STEADY needs any one of them (or any high-growth one)
 */
@ConfigurationProperties("trends.classification")
public record ClassifierThresholds(
        @DefaultValue("10000") long earlyTractionFloor,
        @DefaultValue("100000") long steadyFloor,
        @DefaultValue("1000000") long massiveFloor,
        Map<GrowthWindow, Double> highGrowth,
        Map<GrowthWindow, Double> moderateGrowth
) {
    static final Map<GrowthWindow, Double> DEFAULT_HIGH_GROWTH = Map.of(GrowthWindow.H1, 2.0, GrowthWindow.H6, 1.0);
    static final Map<GrowthWindow, Double> DEFAULT_MODERATE_GROWTH = Map.of(GrowthWindow.H6, 0.5, GrowthWindow.H24, 0.5);

    public ClassifierThresholds {
        if (earlyTractionFloor < 0 || earlyTractionFloor >= steadyFloor || steadyFloor >= massiveFloor) {
            throw new IllegalArgumentException("View-count brackets must satisfy 0 <= earlyTraction < steady < massive, got "
                    + earlyTractionFloor + " / " + steadyFloor + " / " + massiveFloor);
        }
        highGrowth = highGrowth == null || highGrowth.isEmpty() ? DEFAULT_HIGH_GROWTH : Map.copyOf(highGrowth);
        moderateGrowth = moderateGrowth == null || moderateGrowth.isEmpty() ? DEFAULT_MODERATE_GROWTH : Map.copyOf(moderateGrowth);
    }

    public static ClassifierThresholds defaults() {
        return new ClassifierThresholds(10_000, 100_000, 1_000_000, null, null);
    }
}
