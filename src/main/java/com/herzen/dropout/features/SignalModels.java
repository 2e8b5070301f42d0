package com.herzen.dropout.features;

import java.time.Instant;
import java.util.List;

public class SignalModels {
    public enum ChangeType { SUPERFICIAL, CORRECTIVE, STRUCTURAL }

    public enum LearningState { PROGRESSING, PLATEAU, STALLED }

    public enum ReasoningContinuity { HIGH, MEDIUM, LOW }

    public record LearningProgressSignals(int attemptCount,
                                          double attemptFrequency,
                                          List<Double> timeSpentPerAttempt,
                                          double improvementScore,
                                          List<ChangeType> changeTypes,
                                          double semanticChangeScore,
                                          boolean noProgressFlag,
                                          LearningState learningState) {
        public static LearningProgressSignals empty() {
            return new LearningProgressSignals(0, 0.0, List.of(), 0.0, List.of(), 0.0, false, LearningState.PLATEAU);
        }
    }

    public record StagnationSignals(double stagnationDurationMinutes,
                                    int repeatAttemptCount,
                                    double conceptRevisitFrequency,
                                    boolean stalled,
                                    double stagnationSeverity) {
        public static StagnationSignals empty() {
            return new StagnationSignals(0.0, 0, 0.0, false, 0.0);
        }
    }

    public record IntegritySignals(double integrityScore,
                                   ReasoningContinuity reasoningContinuity,
                                   boolean suddenJumpFlag,
                                   double externalAssistanceLikelihood) {
        public static IntegritySignals empty() {
            return new IntegritySignals(100.0, ReasoningContinuity.HIGH, false, 0.0);
        }
    }

    /** Output of a reasoning analyzer; {@code fallback} marks heuristic or degraded output. */
    public record ReasoningInsight(String conceptualGapDescription,
                                   String learningSummary,
                                   double confidenceEstimate,
                                   List<String> misconceptionPatterns,
                                   double confidenceVsCorrectnessGap,
                                   boolean fallback) {
        public ReasoningInsight {
            misconceptionPatterns = misconceptionPatterns == null ? List.of() : List.copyOf(misconceptionPatterns);
        }

        public ReasoningInsight asFallback() {
            return fallback ? this : new ReasoningInsight(conceptualGapDescription, learningSummary, confidenceEstimate,
                    misconceptionPatterns, confidenceVsCorrectnessGap, true);
        }

        public static ReasoningInsight pending() {
            return new ReasoningInsight("Pending reasoning analysis", "Pending reasoning analysis", 0.0, List.of(), 0.0, true);
        }
    }

    public record CompetitionSignals(Integer latestRank,
                                     Integer previousRank,
                                     Integer rankDelta,
                                     double relativeProgressIndex,
                                     boolean competitionPressureFlag) {}

    public record BehavioralDisengagementSignals(List<Double> attemptGapSeconds,
                                                 List<Integer> dailyAttemptCounts,
                                                 double consistencyScore,
                                                 boolean averageGapIncreasing) {
        public static BehavioralDisengagementSignals empty() {
            return new BehavioralDisengagementSignals(List.of(), List.of(), 100.0, false);
        }
    }

    public record InterventionResponseSignals(boolean interventionTriggered,
                                              String interventionType,
                                              Instant interventionTimestamp,
                                              double postInterventionProgress,
                                              double recoveryScore,
                                              boolean interventionSuccess) {
        public static InterventionResponseSignals none() {
            return new InterventionResponseSignals(false, null, null, 0.0, 0.0, false);
        }
    }

    public record ComprehensiveFeatureSet(String studentId,
                                          String questionId,
                                          Instant asOf,
                                          LearningProgressSignals learningProgress,
                                          StagnationSignals stagnation,
                                          IntegritySignals integrity,
                                          ReasoningInsight reasoning,
                                          CompetitionSignals competition,
                                          BehavioralDisengagementSignals behavioral,
                                          InterventionResponseSignals interventionResponse) {
        public ComprehensiveFeatureSet withReasoning(ReasoningInsight insight) {
            return new ComprehensiveFeatureSet(studentId, questionId, asOf, learningProgress, stagnation, integrity,
                    insight, competition, behavioral, interventionResponse);
        }

        public ComprehensiveFeatureSet withInterventionResponse(InterventionResponseSignals signals) {
            return new ComprehensiveFeatureSet(studentId, questionId, asOf, learningProgress, stagnation, integrity,
                    reasoning, competition, behavioral, signals);
        }
    }
}
