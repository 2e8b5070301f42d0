package com.herzen.dropout.view;

import com.herzen.dropout.classification.ClassificationModels.DropoutClassification;
import com.herzen.dropout.classification.ClassificationModels.DropoutType;
import com.herzen.dropout.classification.DropoutAssessment;
import com.herzen.dropout.features.SignalModels.*;
import com.herzen.dropout.intervention.InterventionTracker.InterventionRecord;
import com.herzen.dropout.scoring.ScoringModels.DropoutRiskScore;
import com.herzen.dropout.scoring.ScoringModels.LearningMomentumIndex;
import com.herzen.dropout.scoring.ScoringModels.RiskLevel;
import com.herzen.dropout.view.ViewModels.*;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Full diagnostic report for instructors. */
@Component
public class TeacherViewGenerator {

    public TeacherReport generate(DropoutAssessment assessment, List<InterventionRecord> interventionHistory) {
        return generate(assessment, interventionHistory, UserRole.TEACHER);
    }

    public TeacherReport generate(DropoutAssessment assessment, List<InterventionRecord> interventionHistory, UserRole role) {
        ComprehensiveFeatureSet features = assessment.features();
        DropoutRiskScore drs = assessment.drs();
        DropoutClassification classification = assessment.classification();

        Map<String, Double> components = new LinkedHashMap<>();
        drs.components().asMap().forEach((component, value) -> components.put(component.name(), value));

        return new TeacherReport(
                role,
                features.studentId(),
                features.questionId(),
                features.asOf(),
                status(assessment),
                signals(features),
                scores(assessment.lmi(), drs),
                drs.riskFactors(),
                components,
                new InterventionBlock(classification.shouldIntervene(), classification.recommendation(),
                        classification.interventionType(), classification.urgency(), followUpHours(drs)),
                interventionHistory == null ? List.of() : List.copyOf(interventionHistory),
                features.reasoning().fallback()
                        ? "Reasoning insight produced by the heuristic analyzer; treat the conceptual gap as indicative."
                        : null,
                visualizations(features, assessment.lmi(), drs)
        );
    }

    private StatusBlock status(DropoutAssessment assessment) {
        DropoutClassification c = assessment.classification();
        String confidence = percent(c.confidence());
        String lmi = fmt("%.1f/100", assessment.lmi().value());
        String drs = fmt("%.2f/1.0", assessment.drs().value());
        if (!c.dropoutDetected()) {
            return new StatusBlock("NO_DROPOUT", "Student appears to be on a healthy learning trajectory",
                    List.of(), c.reason(), confidence, lmi, drs);
        }
        List<String> types = c.dropoutTypes().stream().map(DropoutType::name).toList();
        return new StatusBlock("DROPOUT_DETECTED", "Dropout detected: " + String.join(", ", types),
                types, c.reason(), confidence, lmi, drs);
    }

    private Map<String, Map<String, Object>> signals(ComprehensiveFeatureSet f) {
        Map<String, Map<String, Object>> out = new LinkedHashMap<>();

        LearningProgressSignals p = f.learningProgress();
        Map<String, Object> progress = new LinkedHashMap<>();
        progress.put("attemptCount", p.attemptCount());
        progress.put("attemptFrequency", fmt("%.2f/min", p.attemptFrequency()));
        progress.put("improvementScore", fmt("%.1f%%", p.improvementScore()));
        progress.put("semanticChangeScore", fmt("%.1f%%", p.semanticChangeScore()));
        progress.put("changeTypes", p.changeTypes().stream().map(Enum::name).toList());
        progress.put("learningState", p.learningState().name());
        progress.put("noProgress", p.noProgressFlag());
        out.put("learningProgress", progress);

        StagnationSignals s = f.stagnation();
        Map<String, Object> stagnation = new LinkedHashMap<>();
        stagnation.put("durationMinutes", fmt("%.1f", s.stagnationDurationMinutes()));
        stagnation.put("repeatAttemptCount", s.repeatAttemptCount());
        stagnation.put("conceptRevisitFrequency", fmt("%.1f", s.conceptRevisitFrequency()));
        stagnation.put("stalled", s.stalled());
        stagnation.put("severity", fmt("%.1f%%", s.stagnationSeverity()));
        out.put("stagnation", stagnation);

        IntegritySignals i = f.integrity();
        Map<String, Object> integrity = new LinkedHashMap<>();
        integrity.put("integrityScore", fmt("%.1f%%", i.integrityScore()));
        integrity.put("reasoningContinuity", i.reasoningContinuity().name());
        integrity.put("suddenJump", i.suddenJumpFlag());
        integrity.put("externalAssistanceLikelihood", fmt("%.2f", i.externalAssistanceLikelihood()));
        out.put("integrity", integrity);

        ReasoningInsight r = f.reasoning();
        Map<String, Object> reasoning = new LinkedHashMap<>();
        reasoning.put("conceptualGap", r.conceptualGapDescription());
        reasoning.put("learningSummary", r.learningSummary());
        reasoning.put("analyzerConfidence", fmt("%.2f", r.confidenceEstimate()));
        reasoning.put("misconceptions", r.misconceptionPatterns());
        reasoning.put("confidenceVsCorrectnessGap", fmt("%.1f", r.confidenceVsCorrectnessGap()));
        reasoning.put("fallback", r.fallback());
        out.put("reasoning", reasoning);

        CompetitionSignals c = f.competition();
        Map<String, Object> competition = new LinkedHashMap<>();
        competition.put("latestRank", c.latestRank());
        competition.put("previousRank", c.previousRank());
        competition.put("rankDelta", c.rankDelta());
        competition.put("relativeProgress", fmt("%.1f%%", c.relativeProgressIndex()));
        competition.put("competitionPressure", c.competitionPressureFlag());
        out.put("competition", competition);

        BehavioralDisengagementSignals b = f.behavioral();
        Map<String, Object> behavioral = new LinkedHashMap<>();
        behavioral.put("consistencyScore", fmt("%.1f%%", b.consistencyScore()));
        behavioral.put("averageGapIncreasing", b.averageGapIncreasing());
        behavioral.put("attemptGapsSeconds", b.attemptGapSeconds().stream().map(g -> fmt("%.1f", g)).toList());
        behavioral.put("dailyAttemptCounts", b.dailyAttemptCounts());
        out.put("behavioral", behavioral);

        InterventionResponseSignals ir = f.interventionResponse();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("interventionTriggered", ir.interventionTriggered());
        response.put("interventionType", ir.interventionType());
        response.put("interventionTimestamp", ir.interventionTimestamp() == null ? null : ir.interventionTimestamp().toString());
        response.put("postInterventionProgress", fmt("%.1f%%", ir.postInterventionProgress()));
        response.put("recoveryScore", fmt("%.1f%%", ir.recoveryScore()));
        response.put("interventionSuccess", ir.interventionSuccess());
        out.put("interventionResponse", response);

        return out;
    }

    private ScoreBlock scores(LearningMomentumIndex lmi, DropoutRiskScore drs) {
        double value = lmi.value();
        String status;
        String interpretation;
        if (value > 70) {
            status = "HEALTHY";
            interpretation = "Learning momentum is strong. Student is progressing well.";
        } else if (value > 40) {
            status = "AT_RISK";
            interpretation = "Learning momentum is declining. Intervention may be helpful.";
        } else {
            status = "CRITICAL";
            interpretation = "Learning momentum is critically low. Urgent intervention needed.";
        }
        return new ScoreBlock(
                new LmiBlock(value, status, interpretation, lmi.direction().name(), lmi.decayRate()),
                new DrsBlock(drs.value(), drs.level().name(), interpretDrs(drs.level()), drs.confidence())
        );
    }

    private static String interpretDrs(RiskLevel level) {
        return switch (level) {
            case LOW -> "Low dropout risk. Continue regular monitoring.";
            case MEDIUM -> "Moderate dropout risk. Consider proactive support.";
            case HIGH -> "High dropout risk. Intervention recommended.";
            case CRITICAL -> "Critical dropout risk. Immediate intervention needed.";
        };
    }

    static int followUpHours(DropoutRiskScore drs) {
        if (drs.level() == RiskLevel.CRITICAL) return 1;
        if (drs.value() > 0.6) return 6;
        if (drs.value() > 0.3) return 24;
        return 72;
    }

    private Visualizations visualizations(ComprehensiveFeatureSet f, LearningMomentumIndex lmi, DropoutRiskScore drs) {
        Map<String, Double> heatmap = new LinkedHashMap<>();
        double consistency = Math.min(100.0, f.behavioral().consistencyScore());
        heatmap.put("learningProgress", f.learningProgress().improvementScore());
        heatmap.put("stagnation", Math.min(100.0, f.stagnation().stagnationSeverity()));
        heatmap.put("behavioral", consistency);
        heatmap.put("engagement", f.behavioral().averageGapIncreasing() ? 50.0 : 100.0 - consistency);
        return new Visualizations(
                new Gauge(lmi.value(), List.of(40, 70), List.of("Critical", "At-Risk", "Healthy")),
                new Gauge(drs.value() * 100, List.of(30, 60, 80), List.of("Low", "Medium", "High", "Critical")),
                heatmap
        );
    }

    private static String percent(double ratio) {
        return fmt("%.0f%%", ratio * 100);
    }

    private static String fmt(String pattern, double value) {
        return String.format(Locale.ROOT, pattern, value);
    }
}
