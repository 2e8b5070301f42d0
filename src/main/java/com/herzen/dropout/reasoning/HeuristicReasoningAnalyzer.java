package com.herzen.dropout.reasoning;

import com.herzen.dropout.event.EventModels.AttemptHistory;
import com.herzen.dropout.features.SignalModels.ReasoningInsight;

import java.util.ArrayList;
import java.util.List;

/** Deterministic analyzer driven only by attempt count and correctness. */
public class HeuristicReasoningAnalyzer implements ReasoningAnalyzer {
    static final String REPEATED_ERROR = "Repeated error pattern detected";
    static final String NO_CONVERGENCE = "No convergence toward a correct answer";

    @Override
    public ReasoningInsight analyze(AttemptHistory history, String questionContext) {
        int attempts = history.attemptCount();
        if (attempts == 0) {
            return new ReasoningInsight("No attempts recorded", "Student has not attempted this question",
                    0.0, List.of(), 0.0, true);
        }

        long correct = history.correctCount();
        boolean anyCorrect = correct > 0;

        List<String> misconceptions = new ArrayList<>();
        if (!anyCorrect && attempts >= 2) misconceptions.add(REPEATED_ERROR);
        if (!anyCorrect && attempts >= 3) misconceptions.add(NO_CONVERGENCE);

        StringBuilder summary = new StringBuilder()
                .append(attempts).append(" attempt(s), ")
                .append(correct).append(" correct.");
        if (!misconceptions.isEmpty()) {
            summary.append(" Concerns: ").append(String.join(", ", misconceptions));
        }

        return new ReasoningInsight(
                gapDescription(attempts, anyCorrect),
                summary.toString(),
                Math.min(0.95, 0.5 + attempts * 0.15),
                misconceptions,
                anyCorrect ? -10.0 : 30.0,
                true
        );
    }

    private static String gapDescription(int attempts, boolean anyCorrect) {
        if (attempts == 1) {
            return anyCorrect ? "No gaps detected - solved on first attempt"
                    : "Initial misconception or insufficient understanding";
        }
        if (attempts == 2) {
            return anyCorrect ? "Quick recovery suggests understanding refinement"
                    : "Persistent conceptual confusion";
        }
        return anyCorrect ? "Difficulty with problem-solving approach, not concept"
                : "Fundamental misunderstanding - requires intervention";
    }
}
