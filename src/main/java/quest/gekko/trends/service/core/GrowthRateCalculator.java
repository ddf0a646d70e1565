package quest.gekko.trends.service.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import quest.gekko.trends.domain.GrowthMetric;
import quest.gekko.trends.domain.GrowthWindow;
import quest.gekko.trends.domain.Snapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Component
@Slf4j
public class GrowthRateCalculator {

    /**
     * Compute one metric per window that has a reference snapshot at or before
     * {@code current.capturedAt - window}. Windows without a reference are left out.
     */
    public List<GrowthMetric> calculate(final Snapshot current,
                                        final SnapshotLookup history,
                                        final Collection<GrowthWindow> windows,
                                        final Instant computedAt) {
        List<GrowthMetric> metrics = new ArrayList<>(windows.size());
        for (GrowthWindow window : windows) {
            Instant horizon = current.getCapturedAt().minus(window.duration());
            Optional<Snapshot> reference = history.atOrBefore(current.getRef(), horizon);
            if (reference.isEmpty()) {
                log.debug("No {} reference for {} at or before {}", window.label(), current.getRef(), horizon);
                continue;
            }
            metrics.add(toMetric(current, reference.get(), window, computedAt));
        }
        return metrics;
    }

    /**
     * Signed growth ratio; a zero reference count is treated as one view.
     */
    public static double rate(final long currentViews, final long referenceViews) {
        return (double) (currentViews - referenceViews) / Math.max(referenceViews, 1L);
    }

    private GrowthMetric toMetric(final Snapshot current, final Snapshot reference, final GrowthWindow window, final Instant computedAt) {
        double rate = rate(current.getViewCount(), reference.getViewCount());
        boolean corrected = rate < 0;
        if (corrected) {
            log.warn("{} growth of {} is negative ({} -> {} views), clamping to zero",
                    window.label(), current.getRef(), reference.getViewCount(), current.getViewCount());
            rate = 0.0;
        }

        GrowthMetric metric = new GrowthMetric();
        metric.setRef(current.getRef());
        metric.setWindow(window);
        metric.setRate(rate);
        metric.setCorrected(corrected);
        metric.setCapturedAt(current.getCapturedAt());
        metric.setComputedAt(computedAt);
        return metric;
    }
}
