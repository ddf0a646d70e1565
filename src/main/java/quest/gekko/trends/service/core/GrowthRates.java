package quest.gekko.trends.service.core;

import quest.gekko.trends.domain.GrowthMetric;
import quest.gekko.trends.domain.GrowthWindow;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Growth rates available for one entity at classification time. A window without a reference
 * snapshot is absent, which is not the same as zero growth.
 */
public final class GrowthRates {

    private static final GrowthRates NONE = new GrowthRates(new EnumMap<>(GrowthWindow.class));

    private final Map<GrowthWindow, Double> rates;

    private GrowthRates(final EnumMap<GrowthWindow, Double> rates) {
        this.rates = Collections.unmodifiableMap(rates);
    }

    public static GrowthRates none() {
        return NONE;
    }

    public static GrowthRates of(final Map<GrowthWindow, Double> rates) {
        return rates.isEmpty() ? NONE : new GrowthRates(new EnumMap<>(rates));
    }

    public static GrowthRates of(final Collection<GrowthMetric> metrics) {
        EnumMap<GrowthWindow, Double> rates = new EnumMap<>(GrowthWindow.class);
        for (GrowthMetric metric : metrics) {
            rates.put(metric.getWindow(), metric.getRate());
        }
        return new GrowthRates(rates);
    }

    public OptionalDouble rate(final GrowthWindow window) {
        Double rate = rates.get(window);
        return rate == null ? OptionalDouble.empty() : OptionalDouble.of(rate);
    }

    /**
     * True when at least one window with a minimum has a defined rate at or above it.
     * Undefined windows never count.
     */
    public boolean meetsAny(final Map<GrowthWindow, Double> minimums) {
        return minimums.entrySet().stream()
                .anyMatch(min -> {
                    Double rate = rates.get(min.getKey());
                    return rate != null && rate >= min.getValue();
                });
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof GrowthRates other && rates.equals(other.rates);
    }

    @Override
    public int hashCode() {
        return rates.hashCode();
    }

    @Override
    public String toString() {
        return "GrowthRates" + rates;
    }
}
