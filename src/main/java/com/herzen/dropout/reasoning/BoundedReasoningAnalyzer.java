package com.herzen.dropout.reasoning;

import com.herzen.dropout.event.EventModels.AttemptHistory;
import com.herzen.dropout.features.SignalModels.ReasoningInsight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a delegate analyzer on its own executor under a time budget.
 *
 * <p>Timeouts, interruption and delegate failures are answered synchronously with the heuristic
 * result, marked as fallback. This class never throws from {@link #analyze}.
 */
public class BoundedReasoningAnalyzer implements ReasoningAnalyzer, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BoundedReasoningAnalyzer.class);

    private final ReasoningAnalyzer delegate;
    private final ReasoningAnalyzer fallback;
    private final long timeoutMs;
    private final ExecutorService executor;

    public BoundedReasoningAnalyzer(ReasoningAnalyzer delegate, ReasoningAnalyzer fallback, long timeoutMs, int threads) {
        this.delegate = delegate;
        this.fallback = fallback;
        this.timeoutMs = timeoutMs;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "reasoning-analyzer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public ReasoningInsight analyze(AttemptHistory history, String questionContext) {
        Future<ReasoningInsight> future;
        try {
            future = executor.submit(() -> delegate.analyze(history, questionContext));
        } catch (RejectedExecutionException e) {
            return degrade(history, questionContext, e);
        }
        try {
            ReasoningInsight insight = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (insight == null) {
                return degrade(history, questionContext, new IllegalStateException("analyzer returned no insight"));
            }
            return insight;
        } catch (TimeoutException e) {
            future.cancel(true);
            return degrade(history, questionContext, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return degrade(history, questionContext, e);
        } catch (ExecutionException e) {
            return degrade(history, questionContext, e.getCause() == null ? e : e.getCause());
        }
    }

    private ReasoningInsight degrade(AttemptHistory history, String questionContext, Throwable cause) {
        log.warn("Reasoning analysis for {}:{} fell back to heuristic: {}",
                history.studentId(), history.questionId(), cause.toString());
        return fallback.analyze(history, questionContext).asFallback();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
