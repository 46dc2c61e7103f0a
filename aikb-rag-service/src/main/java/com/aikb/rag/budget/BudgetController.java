package com.aikb.rag.budget;

import com.aikb.rag.error.StageTimeoutException;
import com.aikb.rag.error.UpstreamException;
import com.aikb.rag.metrics.RagMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Enforces one wall-clock deadline across all stages of a request and bounds the
 * context handed to the model.
 * <p>
 * A stage that times out is detached, not aborted: the outbound HTTP call keeps running
 * on its worker thread until it settles, and its outcome is logged and counted but never
 * rethrown. The request itself fails exactly once, with {@link StageTimeoutException}.
 */
public class BudgetController {

    private static final Logger log = LoggerFactory.getLogger(BudgetController.class);

    private final Clock clock;
    private final long globalTimeoutMs;
    private final long minRemainingMs;
    private final Executor stageExecutor;
    private final RagMetrics metrics;

    public BudgetController(Clock clock, long globalTimeoutMs, long minRemainingMs,
                            Executor stageExecutor, RagMetrics metrics) {
        if (globalTimeoutMs <= 0) {
            throw new IllegalArgumentException("globalTimeoutMs must be positive, got " + globalTimeoutMs);
        }
        this.clock = clock;
        this.globalTimeoutMs = globalTimeoutMs;
        this.minRemainingMs = Math.max(1, minRemainingMs);
        this.stageExecutor = stageExecutor;
        this.metrics = metrics;
    }

    public RequestBudget open(int tokenCeiling) {
        return new RequestBudget(clock.instant().plusMillis(globalTimeoutMs), tokenCeiling);
    }

    /**
     * Milliseconds left until {@code deadline}, clamped to
     * {@code [minRemainingMs, globalTimeoutMs]}. Never zero or negative: many timeout
     * primitives read a non-positive timeout as "wait forever".
     */
    public long remainingBudget(Instant deadline) {
        Instant now = clock.instant();
        if (!deadline.isAfter(now)) {
            return minRemainingMs;
        }
        if (!deadline.isBefore(now.plusMillis(globalTimeoutMs))) {
            return globalTimeoutMs;
        }
        return Math.max(minRemainingMs, Duration.between(now, deadline).toMillis());
    }

    public boolean isExpired(RequestBudget budget) {
        return !clock.instant().isBefore(budget.deadline());
    }

    /**
     * Runs one pipeline stage with timeout {@code min(remainingBudget, stageMaxMs)}.
     * Short-circuits without starting the call when the deadline has already passed.
     *
     * @throws StageTimeoutException when the deadline has passed or the stage overruns
     */
    public <T> T runStage(String stage, RequestBudget budget, long stageMaxMs, Supplier<T> call) {
        if (isExpired(budget)) {
            log.warn("[BUDGET] Deadline passed before stage {} could start", stage);
            throw new StageTimeoutException(stage, 0, "request deadline already exceeded");
        }
        long timeoutMs = Math.min(remainingBudget(budget.deadline()), stageMaxMs);

        CompletableFuture<T> future = CompletableFuture.supplyAsync(call, stageExecutor);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            detach(stage, future);
            log.warn("[BUDGET] Stage {} exceeded timeout of {}ms", stage, timeoutMs);
            throw new StageTimeoutException(stage, timeoutMs, "exceeded timeout of " + timeoutMs + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new UpstreamException(stage + " failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            detach(stage, future);
            throw new StageTimeoutException(stage, timeoutMs, "interrupted while waiting");
        }
    }

    /**
     * Longest prefix of {@code text} whose estimated token count is at most
     * {@code tokenCeiling}.
     */
    public String truncateToTokenBudget(String text, int tokenCeiling) {
        if (text == null || text.isEmpty()) return text == null ? "" : text;
        if (TokenEstimator.estimate(text) <= tokenCeiling) return text;

        int cut = TokenEstimator.maxCharsFor(tokenCeiling);
        if (cut > 0 && Character.isHighSurrogate(text.charAt(cut - 1))) {
            cut--;
        }
        return text.substring(0, cut);
    }

    private void detach(String stage, CompletableFuture<?> future) {
        future.whenComplete((value, error) -> {
            metrics.recordLateSettlement(stage, error != null);
            if (error != null) {
                log.debug("[BUDGET] Discarded late failure of timed-out stage {}: {}", stage, error.toString());
            } else {
                log.debug("[BUDGET] Discarded late result of timed-out stage {}", stage);
            }
        });
    }
}
