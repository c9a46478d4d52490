package com.regulatory.conflict.analytics;

import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.core.model.ResolutionOutcome;
import com.regulatory.conflict.core.model.ResolutionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Aggregates terminal resolution outcomes into {@link StrategyOutcomeStat}s.
 *
 * <p>Writes are queued to a single writer thread that publishes a new
 * {@link AnalyticsSnapshot} per outcome. {@link #snapshot()} never blocks on a write.
 * {@code APPLIED} counts as a success; {@code FAILED} and {@code REVERTED} count as failures.</p>
 */
public class ResolutionAnalytics implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResolutionAnalytics.class);

    private final AtomicReference<AnalyticsSnapshot> current = new AtomicReference<>(AnalyticsSnapshot.empty());
    private final ExecutorService writer;
    private final Clock clock;

    public ResolutionAnalytics(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.writer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "resolution-analytics-writer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Returns the most recently committed snapshot.
     */
    public AnalyticsSnapshot snapshot() {
        return current.get();
    }

    /**
     * Queues a terminal record of {@code conflict} for aggregation.
     */
    public void recordOutcome(Conflict conflict, ResolutionRecord record) {
        StatKey key = new StatKey(conflict.getType(), JurisdictionBuckets.bucketOf(conflict), record.strategy());
        boolean success = record.outcome() == ResolutionOutcome.APPLIED;
        try {
            writer.execute(() -> merge(key, success));
        } catch (RejectedExecutionException e) {
            log.warn("analytics.dropped key={} outcome={} reason=writer shut down", key, record.outcome());
        }
    }

    private void merge(StatKey key, boolean success) {
        AnalyticsSnapshot before = current.get();
        Map<StatKey, StrategyOutcomeStat> stats = new HashMap<>(before.stats());
        StrategyOutcomeStat updated = stats.getOrDefault(key, StrategyOutcomeStat.empty(key))
                .plus(success, clock.instant());
        stats.put(key, updated);
        current.set(new AnalyticsSnapshot(stats, before.version() + 1, clock.instant()));
        log.debug("analytics.updated key={} success={} failure={} rate={}",
                key, updated.successCount(), updated.failureCount(), String.format("%.3f", updated.successRate()));
    }

    /**
     * Waits until every outcome queued before this call has been merged.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitQuiescence(Duration timeout) {
        try {
            Future<?> barrier = writer.submit(() -> { });
            barrier.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (RejectedExecutionException e) {
            return true;
        } catch (ExecutionException | TimeoutException e) {
            return false;
        }
    }

    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
