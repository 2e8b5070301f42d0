package com.herzen.dropout.scoring;

import com.herzen.dropout.config.DropoutProperties;
import com.herzen.dropout.features.SignalModels.*;
import com.herzen.dropout.scoring.ScoringModels.*;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Computes the Learning Momentum Index and the Dropout Risk Score from a validated feature set.
 * Both are pure functions of their inputs.
 */
@Service
public class ScoringEngine {
    private final DropoutProperties.Scoring config;

    public ScoringEngine(DropoutProperties properties) {
        this.config = properties.getScoring();
    }

    /**
     * @param priorLmi LMI values of earlier analyses of the same key, oldest first
     */
    public LearningMomentumIndex computeLmi(ComprehensiveFeatureSet features, List<Double> priorLmi) {
        validate(features);
        LearningProgressSignals progress = features.learningProgress();
        if (progress.attemptCount() == 0) {
            return new LearningMomentumIndex(config.getNeutralLmi(), MomentumDirection.STABLE, 0.05);
        }

        double base = progress.improvementScore() + progress.semanticChangeScore() / 100.0 * 15;
        double multiplier = switch (progress.learningState()) {
            case PROGRESSING -> 1.2;
            case PLATEAU -> 1.0;
            case STALLED -> 0.5;
        };

        StagnationSignals stagnation = features.stagnation();
        double penalty = 0.0;
        if (stagnation.stalled()) {
            penalty = config.getStalledPenalty();
        } else if (stagnation.stagnationDurationMinutes() > config.getLongStagnationMinutes()) {
            penalty = config.getLongStagnationPenalty();
        } else if (stagnation.stagnationDurationMinutes() > config.getShortStagnationMinutes()) {
            penalty = config.getShortStagnationPenalty();
        }

        double value = (base * multiplier - penalty)
                * features.integrity().integrityScore() / 100.0
                * features.reasoning().confidenceEstimate();

        double decay = 0.05 + Math.max(0, (progress.attemptCount() - 2) * 0.08);
        return new LearningMomentumIndex(clamp(value, 0, 100), direction(priorLmi), decay);
    }

    public DropoutRiskScore computeDrs(ComprehensiveFeatureSet features, LearningMomentumIndex lmi) {
        validate(features);
        if (features.learningProgress().attemptCount() == 0) {
            return new DropoutRiskScore(0.0, RiskLevel.LOW, 0.3, List.of(), RiskComponents.zero());
        }

        RiskComponents components = new RiskComponents(
                momentumRisk(lmi),
                stagnationRisk(features.stagnation()),
                behavioralRisk(features.behavioral()),
                integrityRisk(features.integrity()),
                competitionRisk(features.competition()),
                engagementRisk(features.learningProgress())
        );

        double drs = config.getLmiWeight() * components.momentum()
                + config.getStagnationWeight() * components.stagnation()
                + config.getBehavioralWeight() * components.behavioral()
                + config.getIntegrityWeight() * components.integrity()
                + config.getCompetitionWeight() * components.competition()
                + config.getEngagementWeight() * components.engagement();
        drs = clamp(drs, 0, 1);

        return new DropoutRiskScore(drs, level(drs), confidence(features), riskFactors(components), components);
    }

    public RiskLevel level(double drs) {
        if (drs < config.getLowRiskBelow()) return RiskLevel.LOW;
        if (drs < config.getMediumRiskBelow()) return RiskLevel.MEDIUM;
        if (drs < config.getHighRiskBelow()) return RiskLevel.HIGH;
        return RiskLevel.CRITICAL;
    }

    MomentumDirection direction(List<Double> priorLmi) {
        if (priorLmi == null || priorLmi.size() < 2) return MomentumDirection.STABLE;
        double delta = priorLmi.get(priorLmi.size() - 1) - priorLmi.get(priorLmi.size() - 2);
        if (delta > config.getTrendDelta()) return MomentumDirection.ACCELERATING;
        if (delta < -config.getTrendDelta()) return MomentumDirection.DECELERATING;
        return MomentumDirection.STABLE;
    }

    private double momentumRisk(LearningMomentumIndex lmi) {
        return clamp(1.0 - lmi.value() / 100.0, 0, 1);
    }

    private double stagnationRisk(StagnationSignals s) {
        if (s.stalled()) return 0.95;
        double duration = Math.min(1.0, s.stagnationDurationMinutes() / 60.0);
        double repeats = Math.min(1.0, s.repeatAttemptCount() / 5.0);
        return (duration + repeats) / 2;
    }

    private double behavioralRisk(BehavioralDisengagementSignals b) {
        double risk = 0.4 * (1.0 - b.consistencyScore() / 100.0);
        if (b.averageGapIncreasing()) risk += 0.3;
        List<Integer> daily = b.dailyAttemptCounts();
        if (!daily.isEmpty() && daily.get(daily.size() - 1) < 3) risk += 0.3;
        return Math.min(1.0, risk);
    }

    private double integrityRisk(IntegritySignals i) {
        double risk = i.suddenJumpFlag() ? 0.4 : 0.0;
        risk += 0.3 * i.externalAssistanceLikelihood();
        risk += switch (i.reasoningContinuity()) {
            case HIGH -> 0.0;
            case MEDIUM -> 0.2;
            case LOW -> 0.4;
        };
        return Math.min(1.0, risk);
    }

    private double competitionRisk(CompetitionSignals c) {
        double risk = c.competitionPressureFlag() ? 0.5 : 0.0;
        if (c.rankDelta() != null && c.rankDelta() > 0) {
            risk += Math.min(0.4, c.rankDelta() / 100.0);
        }
        risk += 0.3 * (1.0 - c.relativeProgressIndex() / 100.0);
        return Math.min(1.0, risk);
    }

    private double engagementRisk(LearningProgressSignals p) {
        double risk = p.noProgressFlag() ? 0.6 : 0.0;
        if (p.attemptFrequency() < 0.1) risk += 0.3;
        return Math.min(1.0, risk);
    }

    private double confidence(ComprehensiveFeatureSet features) {
        double confidence = 0.5
                + Math.min(0.3, features.learningProgress().attemptCount() * 0.05)
                + features.reasoning().confidenceEstimate() * 0.1;
        if (features.learningProgress().improvementScore() > 50 && features.stagnation().stalled()) {
            confidence -= 0.15;
        }
        return clamp(confidence, 0.3, 1.0);
    }

    private List<RiskFactor> riskFactors(RiskComponents components) {
        return components.asMap().entrySet().stream()
                .filter(e -> e.getValue() > config.getRiskFactorThreshold())
                .sorted(Map.Entry.<RiskComponent, Double>comparingByValue(Comparator.reverseOrder()))
                .limit(3)
                .map(e -> new RiskFactor(e.getKey(), e.getKey().label(), e.getValue()))
                .toList();
    }

    void validate(ComprehensiveFeatureSet f) {
        if (f == null) throw new InvalidFeatureStateException("feature set is missing");
        require(f.learningProgress() != null, "learning progress signals are missing");
        require(f.stagnation() != null, "stagnation signals are missing");
        require(f.integrity() != null, "integrity signals are missing");
        require(f.reasoning() != null, "reasoning insight is missing");
        require(f.competition() != null, "competition signals are missing");
        require(f.behavioral() != null, "behavioral signals are missing");
        require(f.interventionResponse() != null, "intervention response signals are missing");

        LearningProgressSignals p = f.learningProgress();
        require(p.attemptCount() >= 0, "attempt count is negative");
        require(p.learningState() != null, "learning state is missing");
        inRange(p.improvementScore(), 0, 100, "improvement score");
        inRange(p.semanticChangeScore(), 0, 100, "semantic change score");
        inRange(p.attemptFrequency(), 0, Double.MAX_VALUE, "attempt frequency");
        inRange(f.stagnation().stagnationDurationMinutes(), 0, Double.MAX_VALUE, "stagnation duration");
        inRange(f.integrity().integrityScore(), 0, 100, "integrity score");
        inRange(f.integrity().externalAssistanceLikelihood(), 0, 1, "external assistance likelihood");
        require(f.integrity().reasoningContinuity() != null, "reasoning continuity is missing");
        inRange(f.reasoning().confidenceEstimate(), 0, 1, "analyzer confidence");
        inRange(f.competition().relativeProgressIndex(), 0, 100, "relative progress index");
        inRange(f.behavioral().consistencyScore(), 0, 100, "consistency score");
    }

    private static void require(boolean condition, String message) {
        if (!condition) throw new InvalidFeatureStateException(message);
    }

    private static void inRange(double value, double min, double max, String field) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new InvalidFeatureStateException(field + " out of range [" + min + ", " + max + "]: " + value);
        }
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
