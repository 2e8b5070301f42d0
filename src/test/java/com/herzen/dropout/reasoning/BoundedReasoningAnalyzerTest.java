package com.herzen.dropout.reasoning;

import com.herzen.dropout.event.EventModels.AttemptHistory;
import com.herzen.dropout.features.SignalModels.ReasoningInsight;
import com.herzen.dropout.support.Attempts;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoundedReasoningAnalyzerTest {
    private final HeuristicReasoningAnalyzer heuristic = new HeuristicReasoningAnalyzer();
    private final AttemptHistory history = Attempts.of("s1", "q1").add("a", false, 0).add("b", false, 30).build();

    @Test
    void passesThroughTimelyDelegateResult() {
        ReasoningInsight remote = new ReasoningInsight("gap", "summary", 0.8, List.of("p"), 5.0, false);
        try (BoundedReasoningAnalyzer analyzer = new BoundedReasoningAnalyzer((h, c) -> remote, heuristic, 1000, 1)) {
            assertEquals(remote, analyzer.analyze(history, null));
        }
    }

    @Test
    void slowDelegateFallsBackToHeuristic() {
        ReasoningAnalyzer slow = (h, c) -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new ReasoningInsight("late", "late", 0.9, List.of(), 0.0, false);
        };
        try (BoundedReasoningAnalyzer analyzer = new BoundedReasoningAnalyzer(slow, heuristic, 50, 1)) {
            long start = System.nanoTime();
            ReasoningInsight insight = analyzer.analyze(history, null);
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            assertTrue(insight.fallback());
            assertEquals("Persistent conceptual confusion", insight.conceptualGapDescription());
            assertTrue(elapsedMs < 2_000, "fallback took " + elapsedMs + " ms");
        }
    }

    @Test
    void failingDelegateFallsBackToHeuristic() {
        ReasoningAnalyzer broken = (h, c) -> {
            throw new IllegalStateException("connection refused");
        };
        try (BoundedReasoningAnalyzer analyzer = new BoundedReasoningAnalyzer(broken, heuristic, 1000, 1)) {
            ReasoningInsight insight = analyzer.analyze(history, "context");
            assertTrue(insight.fallback());
            assertEquals(heuristic.analyze(history, "context"), insight);
        }
    }

    @Test
    void closedExecutorStillAnswers() {
        BoundedReasoningAnalyzer analyzer = new BoundedReasoningAnalyzer(heuristic, heuristic, 1000, 1);
        analyzer.close();
        assertTrue(analyzer.analyze(history, null).fallback());
    }
}
