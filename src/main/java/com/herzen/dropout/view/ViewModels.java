package com.herzen.dropout.view;

import com.herzen.dropout.classification.ClassificationModels.InterventionType;
import com.herzen.dropout.classification.ClassificationModels.Urgency;
import com.herzen.dropout.intervention.InterventionTracker.InterventionRecord;
import com.herzen.dropout.scoring.ScoringModels.RiskFactor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public class ViewModels {
    /** Common shape of what {@code analyze} returns for a role. */
    public interface AnalysisView {
        UserRole role();

        String studentId();

        String questionId();

        Instant generatedAt();
    }

    public enum SupportAction { OFFER_HINT, SUGGEST_RESOURCE, MOTIVATIONAL_CHECK_IN, CONCEPTUAL_SUPPORT }

    public record GrowthArea(String area, String message, SupportAction action) {}

    public record StudentFeedback(UserRole role,
                                  String studentId,
                                  String questionId,
                                  Instant generatedAt,
                                  List<String> strengths,
                                  List<GrowthArea> growthAreas,
                                  List<String> nextSteps,
                                  String difficultySuggestion,
                                  String encouragement,
                                  String progressSummary) implements AnalysisView {}

    public record StatusBlock(String status,
                              String message,
                              List<String> types,
                              String reason,
                              String confidence,
                              String lmi,
                              String drs) {}

    public record LmiBlock(double score, String status, String interpretation, String direction, double decayRate) {}

    public record DrsBlock(double score, String level, String interpretation, double confidence) {}

    public record ScoreBlock(LmiBlock lmi, DrsBlock drs) {}

    public record InterventionBlock(boolean shouldIntervene,
                                    String recommendation,
                                    InterventionType interventionType,
                                    Urgency urgency,
                                    int followUpInHours) {}

    public record Gauge(double value, List<Integer> thresholds, List<String> zones) {}

    public record Visualizations(Gauge lmiGauge, Gauge drsGauge, Map<String, Double> signalHeatmap) {}

    public record TeacherReport(UserRole role,
                                String studentId,
                                String questionId,
                                Instant generatedAt,
                                StatusBlock dropoutStatus,
                                Map<String, Map<String, Object>> signals,
                                ScoreBlock scores,
                                List<RiskFactor> riskFactors,
                                Map<String, Double> riskComponents,
                                InterventionBlock intervention,
                                List<InterventionRecord> interventionHistory,
                                String analyzerNote,
                                Visualizations visualizations) implements AnalysisView {}
}
