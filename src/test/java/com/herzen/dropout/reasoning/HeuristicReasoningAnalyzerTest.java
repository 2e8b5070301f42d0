package com.herzen.dropout.reasoning;

import com.herzen.dropout.features.SignalModels.ReasoningInsight;
import com.herzen.dropout.support.Attempts;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HeuristicReasoningAnalyzerTest {
    private final HeuristicReasoningAnalyzer analyzer = new HeuristicReasoningAnalyzer();

    @Test
    void noAttemptsHasZeroConfidence() {
        ReasoningInsight insight = analyzer.analyze(Attempts.of("s1", "q1").build(), null);
        assertEquals(0.0, insight.confidenceEstimate());
        assertTrue(insight.misconceptionPatterns().isEmpty());
    }

    @Test
    void firstAttemptSuccessHasNoGap() {
        ReasoningInsight insight = analyzer.analyze(Attempts.of("s1", "q1").add("42", true, 0).build(), "2 * 21");
        assertEquals("No gaps detected - solved on first attempt", insight.conceptualGapDescription());
        assertEquals(0.65, insight.confidenceEstimate(), 1e-9);
        assertEquals(-10.0, insight.confidenceVsCorrectnessGap());
        assertTrue(insight.fallback());
    }

    @Test
    void repeatedFailuresAccumulateMisconceptions() {
        ReasoningInsight two = analyzer.analyze(Attempts.of("s1", "q1")
                .add("a", false, 0).add("b", false, 30).build(), null);
        assertEquals("Persistent conceptual confusion", two.conceptualGapDescription());
        assertEquals(List.of(HeuristicReasoningAnalyzer.REPEATED_ERROR), two.misconceptionPatterns());

        ReasoningInsight four = analyzer.analyze(Attempts.of("s1", "q1")
                .add("a", false, 0).add("b", false, 30).add("c", false, 60).add("d", false, 90).build(), null);
        assertEquals("Fundamental misunderstanding - requires intervention", four.conceptualGapDescription());
        assertEquals(2, four.misconceptionPatterns().size());
        assertEquals(0.95, four.confidenceEstimate(), 1e-9);
        assertEquals(30.0, four.confidenceVsCorrectnessGap());
    }

    @Test
    void laterSuccessPointsAtApproachRatherThanConcept() {
        ReasoningInsight insight = analyzer.analyze(Attempts.of("s1", "q1")
                .add("a", false, 0).add("b", false, 30).add("c", true, 60).build(), null);
        assertEquals("Difficulty with problem-solving approach, not concept", insight.conceptualGapDescription());
        assertTrue(insight.misconceptionPatterns().isEmpty());
    }
}
