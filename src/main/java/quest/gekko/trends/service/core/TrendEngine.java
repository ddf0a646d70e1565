package quest.gekko.trends.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import quest.gekko.trends.config.CacheConfig;
import quest.gekko.trends.config.TrendProperties;
import quest.gekko.trends.domain.AlertEvent;
import quest.gekko.trends.domain.Classification;
import quest.gekko.trends.domain.GrowthMetric;
import quest.gekko.trends.domain.Snapshot;
import quest.gekko.trends.domain.TrackedEntity;
import quest.gekko.trends.domain.ViralityStage;
import quest.gekko.trends.exception.OutOfOrderSnapshotException;
import quest.gekko.trends.exception.StoreUnavailableException;
import quest.gekko.trends.service.notification.AlertNotification;
import quest.gekko.trends.service.notification.AlertRaisedEvent;
import quest.gekko.trends.service.store.TrendStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one ingestion cycle: normalize the batch, then push every snapshot through
 * reconcile, growth, classification and alerting. Entities are independent of each other.
 * Stored alerts are published as {@link AlertRaisedEvent}s; delivery runs off the cycle thread.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrendEngine {
    private final SnapshotNormalizer normalizer;
    private final HistoryReconciler reconciler;
    private final GrowthRateCalculator growthCalculator;
    private final ViralityClassifier classifier;
    private final AlertEvaluator alertEvaluator;
    private final ApplicationEventPublisher events;
    private final TrendStore store;
    private final ClassifierThresholds classifierThresholds;
    private final AlertThresholds alertThresholds;
    private final TrendProperties.Engine engine;
    private final Clock clock;

    @CacheEvict(value = {CacheConfig.TREND_SUMMARY, CacheConfig.STAGE_MEMBERS}, allEntries = true)
    public CycleReport runCycle(final List<Map<String, Object>> records, final Instant batchCapturedAt) {
        final Instant startedAt = clock.instant();
        final NormalizationResult normalized = normalizer.normalize(records, batchCapturedAt == null ? startedAt : batchCapturedAt);
        final List<Snapshot> snapshots = normalized.snapshots();
        final CycleTally tally = new CycleTally();

        if (engine.parallelism() > 1 && snapshots.size() > 1) {
            runParallel(snapshots, tally);
        } else {
            for (Snapshot snapshot : snapshots) {
                if (tally.aborted.get()) break;
                processGuarded(snapshot, tally);
            }
        }

        final CycleReport report = new CycleReport(
                records.size(),
                snapshots.size(),
                normalized.rejected().size(),
                tally.processed.get(),
                tally.skipped.get(),
                tally.failed.get(),
                tally.alerts.get(),
                tally.aborted.get(),
                normalized.rejected(),
                startedAt,
                clock.instant());

        if (report.aborted()) {
            log.error("Cycle aborted after {} of {} entities: store unavailable", report.processed(), report.accepted());
        } else {
            log.info("Cycle finished: {} received, {} accepted, {} rejected, {} processed, {} skipped, {} failed, {} alerts",
                    report.received(), report.accepted(), report.rejected(), report.processed(),
                    report.skipped(), report.failed(), report.alerts());
        }
        return report;
    }

    private void runParallel(final List<Snapshot> snapshots, final CycleTally tally) {
        final ExecutorService pool = Executors.newFixedThreadPool(Math.min(engine.parallelism(), snapshots.size()));
        try {
            final List<CompletableFuture<Void>> futures = new ArrayList<>(snapshots.size());
            for (Snapshot snapshot : snapshots) {
                futures.add(CompletableFuture.runAsync(() -> {
                    if (!tally.aborted.get()) processGuarded(snapshot, tally);
                }, pool));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } finally {
            pool.shutdown();
        }
    }

    private void processGuarded(final Snapshot snapshot, final CycleTally tally) {
        try {
            if (process(snapshot, tally)) {
                tally.processed.incrementAndGet();
            } else {
                tally.skipped.incrementAndGet();
            }
        } catch (StoreUnavailableException e) {
            if (tally.aborted.compareAndSet(false, true)) {
                log.error("Store unavailable while processing {}: {}", snapshot.getRef(), e.getMessage(), e);
            }
        } catch (RuntimeException e) {
            tally.failed.incrementAndGet();
            log.error("Failed to process {}: {}", snapshot.getRef(), e.getMessage(), e);
        }
    }

    /**
     * @return false when the snapshot was skipped as out of order
     */
    private boolean process(final Snapshot snapshot, final CycleTally tally) {
        final Optional<Snapshot> prior = store.getLatestSnapshot(snapshot.getRef());
        final Optional<Delta> delta;
        try {
            delta = reconciler.reconcile(snapshot, prior.orElse(null));
        } catch (OutOfOrderSnapshotException e) {
            log.warn("Skipping {}: captured at {} but history already has {}",
                    e.getRef(), e.getCapturedAt(), e.getPriorCapturedAt());
            return false;
        }

        final TrackedEntity entity = store.upsertEntity(snapshot.getRef(), snapshot.getDisplayName(), snapshot.getCapturedAt());
        store.appendSnapshot(snapshot);

        final Instant now = clock.instant();
        final List<GrowthMetric> metrics = growthCalculator.calculate(snapshot, store::getSnapshotAtOrBefore, engine.windows(), now);
        metrics.forEach(store::appendGrowthMetric);
        final GrowthRates rates = GrowthRates.of(metrics);

        final ClassificationInput input = new ClassificationInput(snapshot.getViewCount(), rates, delta.isPresent());
        final ViralityStage stage = classifier.classify(input, classifierThresholds);
        final boolean corrected = delta.map(Delta::corrected).orElse(false);
        store.appendClassification(classification(snapshot, stage, corrected, now));
        log.debug("{} classified {} by rule {} ({} views, {}{})",
                snapshot.getRef(), stage, classifier.decidingRule(input, classifierThresholds), snapshot.getViewCount(), rates,
                delta.map(d -> ", " + d.viewDelta() + " views in " + d.elapsedSeconds() + "s").orElse(""));

        final Optional<AlertEvent> alert = alertEvaluator.evaluate(
                snapshot.getRef(), rates, snapshot.getCapturedAt(), now, alertThresholds, store);
        alert.ifPresent(event -> {
            tally.alerts.incrementAndGet();
            events.publishEvent(new AlertRaisedEvent(
                    new AlertNotification(event, entity.getDisplayName(), stage, snapshot.getViewCount())));
        });
        return true;
    }

    private static Classification classification(final Snapshot snapshot, final ViralityStage stage,
                                                  final boolean corrected, final Instant at) {
        final Classification classification = new Classification();
        classification.setRef(snapshot.getRef());
        classification.setStage(stage);
        classification.setClassifiedAt(at);
        classification.setViewCount(snapshot.getViewCount());
        classification.setCorrected(corrected);
        return classification;
    }

    private static final class CycleTally {
        final AtomicInteger processed = new AtomicInteger();
        final AtomicInteger skipped = new AtomicInteger();
        final AtomicInteger failed = new AtomicInteger();
        final AtomicInteger alerts = new AtomicInteger();
        final AtomicBoolean aborted = new AtomicBoolean();
    }
}
