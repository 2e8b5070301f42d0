package com.herzen.dropout.classification;

import com.herzen.dropout.classification.ClassificationModels.*;
import com.herzen.dropout.features.SignalModels.ComprehensiveFeatureSet;
import com.herzen.dropout.scoring.ScoringModels.DropoutRiskScore;
import com.herzen.dropout.scoring.ScoringModels.LearningMomentumIndex;
import com.herzen.dropout.scoring.ScoringModels.RiskComponent;
import org.springframework.stereotype.Service;

import java.util.*;

/** Evaluates the rule table uniformly and derives reason, recommendation and confidence. */
@Service
public class DropoutClassifier {
    static final String HEALTHY_REASON = "Student showing healthy learning progression";
    static final String NO_ATTEMPTS_REASON = "No attempts recorded yet";
    static final String NO_ACTION = "Continue monitoring. No immediate intervention needed.";

    private final List<DropoutRule> rules;

    public DropoutClassifier() {
        this(DropoutRules.defaults());
    }

    DropoutClassifier(List<DropoutRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public DropoutClassification classify(ComprehensiveFeatureSet features, LearningMomentumIndex lmi, DropoutRiskScore drs) {
        RuleContext ctx = new RuleContext(features, lmi, drs);
        boolean noAttempts = features.learningProgress().attemptCount() == 0;

        Map<DropoutType, String> reasons = new EnumMap<>(DropoutType.class);
        if (!noAttempts) {
            for (DropoutRule rule : rules) {
                if (!reasons.containsKey(rule.type()) && rule.matches(ctx)) {
                    reasons.put(rule.type(), rule.reason(ctx));
                }
            }
        }

        List<DropoutType> types = List.copyOf(reasons.keySet());
        boolean dropout = !types.isEmpty();

        String reason;
        if (noAttempts) {
            reason = NO_ATTEMPTS_REASON;
        } else if (dropout) {
            reason = String.join(" | ", reasons.values());
        } else {
            reason = HEALTHY_REASON;
        }

        InterventionType interventionType = interventionType(drs);
        Urgency urgency = urgency(drs);
        String recommendation = dropout ? urgency.prefix() + interventionType.guidance() : NO_ACTION;
        boolean shouldIntervene = !noAttempts && (drs.value() >= 0.6 || lmi.value() < 40);

        return new DropoutClassification(dropout, types, reason, recommendation, interventionType, urgency,
                shouldIntervene, confidence(dropout, types, lmi, drs));
    }

    static InterventionType interventionType(DropoutRiskScore drs) {
        if (drs.hasFactor(RiskComponent.MOMENTUM)) return InterventionType.CONCEPTUAL_SUPPORT;
        if (drs.hasFactor(RiskComponent.STAGNATION)) return InterventionType.STRATEGIC_GUIDANCE;
        if (drs.hasFactor(RiskComponent.COMPETITION) || drs.hasFactor(RiskComponent.ENGAGEMENT)) {
            return InterventionType.MOTIVATIONAL_SUPPORT;
        }
        if (drs.hasFactor(RiskComponent.INTEGRITY)) return InterventionType.INTEGRITY_CHECK;
        return InterventionType.GENERAL_SUPPORT;
    }

    static Urgency urgency(DropoutRiskScore drs) {
        return switch (drs.level()) {
            case CRITICAL -> Urgency.URGENT;
            case HIGH -> Urgency.HIGH;
            case MEDIUM -> Urgency.MEDIUM;
            case LOW -> Urgency.LOW;
        };
    }

    private double confidence(boolean dropout, List<DropoutType> types, LearningMomentumIndex lmi, DropoutRiskScore drs) {
        double confidence = drs.confidence();
        if (types.size() >= 2) confidence += 0.1;
        boolean agreement = dropout
                ? lmi.value() < 40 && drs.value() > 0.6
                : lmi.value() > 70 && drs.value() < 0.3;
        if (agreement) confidence += 0.15;
        if (dropout && drs.value() < 0.5) confidence -= 0.1;
        return Math.max(0.3, Math.min(1.0, confidence));
    }
}
