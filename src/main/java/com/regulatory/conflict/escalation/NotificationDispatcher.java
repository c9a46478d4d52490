package com.regulatory.conflict.escalation;

import com.regulatory.conflict.metrics.MetricsService;
import com.regulatory.conflict.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Delivers notifications off the caller's thread with a per-attempt timeout and a bounded
 * number of attempts separated by a fixed delay.
 *
 * <p>The returned future completes with {@code true} once delivered and {@code false} when
 * all attempts failed. It never completes exceptionally.</p>
 */
public class NotificationDispatcher {
    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final NotificationService service;
    private final ExecutorService executor;
    private final int maxAttempts;
    private final Duration retryDelay;
    private final Duration timeout;
    private final MetricsService metrics;

    public NotificationDispatcher(NotificationService service, ExecutorService executor, int maxAttempts,
                                  Duration retryDelay, Duration timeout, MetricsService metrics) {
        this.service = Objects.requireNonNull(service, "service is required");
        this.executor = Objects.requireNonNull(executor, "executor is required");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay is required");
        this.timeout = Objects.requireNonNull(timeout, "timeout is required");
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    public CompletableFuture<Boolean> dispatch(String stakeholderRef, EscalationCase escalationCase) {
        if (stakeholderRef == null) {
            log.debug("notification.unrouted caseId={} level={}", escalationCase.getId(), escalationCase.getLevel());
            return CompletableFuture.completedFuture(false);
        }
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        attempt(stakeholderRef, escalationCase, 1, result);
        return result;
    }

    private void attempt(String stakeholderRef, EscalationCase escalationCase, int attempt,
                         CompletableFuture<Boolean> result) {
        CompletableFuture.runAsync(() -> service.notify(stakeholderRef, escalationCase), executor)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((ignored, error) -> {
                    if (error == null) {
                        log.debug("notification.sent stakeholder={} caseId={} attempt={}",
                                stakeholderRef, escalationCase.getId(), attempt);
                        result.complete(true);
                        return;
                    }
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause() : error;
                    if (attempt >= maxAttempts) {
                        metrics.incrementNotificationFailed();
                        log.warn("notification.failed stakeholder={} caseId={} attempts={} error={}",
                                stakeholderRef, escalationCase.getId(), attempt, cause.toString());
                        result.complete(false);
                        return;
                    }
                    log.debug("notification.retry stakeholder={} caseId={} attempt={} error={}",
                            stakeholderRef, escalationCase.getId(), attempt, cause.toString());
                    CompletableFuture.delayedExecutor(retryDelay.toMillis(), TimeUnit.MILLISECONDS, executor)
                            .execute(() -> attempt(stakeholderRef, escalationCase, attempt + 1, result));
                });
    }
}
