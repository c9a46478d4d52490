package com.regulatory.conflict.similarity;

import com.regulatory.conflict.core.model.NormativeProvision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounds every call to a delegate scorer by a timeout. A call that times out or throws is
 * reported as unavailable so detection never stalls on the scorer. A timed-out call is
 * cancelled with an interrupt so its worker thread is handed back to the executor.
 */
public class TimeBoundedSimilarityScorer implements SimilarityScorer {
    private static final Logger log = LoggerFactory.getLogger(TimeBoundedSimilarityScorer.class);

    private final SimilarityScorer delegate;
    private final ExecutorService executor;
    private final Duration timeout;

    public TimeBoundedSimilarityScorer(SimilarityScorer delegate, ExecutorService executor, Duration timeout) {
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        this.executor = Objects.requireNonNull(executor, "executor is required");
        this.timeout = Objects.requireNonNull(timeout, "timeout is required");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    @Override
    public Optional<SimilarityScore> score(NormativeProvision a, NormativeProvision b) {
        Future<Optional<SimilarityScore>> future = executor.submit(() -> delegate.score(a, b));
        try {
            Optional<SimilarityScore> result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : Optional.empty();
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("similarity.timeout pair={}<>{} timeoutMs={}", a.getId(), b.getId(), timeout.toMillis());
            return Optional.empty();
        } catch (ExecutionException e) {
            log.warn("similarity.failed pair={}<>{} error={}", a.getId(), b.getId(), e.getCause().getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return Optional.empty();
        }
    }
}
