package com.herzen.dropout.classification;

import com.herzen.dropout.features.SignalModels.ComprehensiveFeatureSet;
import com.herzen.dropout.scoring.ScoringModels.DropoutRiskScore;
import com.herzen.dropout.scoring.ScoringModels.LearningMomentumIndex;

import java.util.List;

public class ClassificationModels {
    public enum DropoutType { COGNITIVE, BEHAVIORAL, ENGAGEMENT, SILENT }

    public enum InterventionType {
        CONCEPTUAL_SUPPORT("Provide a step-by-step concept review with worked examples and address the root misconception."),
        STRATEGIC_GUIDANCE("Teach a problem-solving strategy, break the problem into steps and offer hints before full solutions."),
        MOTIVATIONAL_SUPPORT("Acknowledge the effort made, set achievable milestones and connect the topic to personal goals."),
        INTEGRITY_CHECK("Review how the answers were produced, give supportive feedback and adjust difficulty if needed."),
        GENERAL_SUPPORT("Offer general learning support and encouragement.");

        private final String guidance;

        InterventionType(String guidance) {
            this.guidance = guidance;
        }

        public String guidance() {
            return guidance;
        }
    }

    public enum Urgency {
        URGENT("URGENT: "),
        HIGH("HIGH PRIORITY: "),
        MEDIUM("MEDIUM: "),
        LOW("LOW: ");

        private final String prefix;

        Urgency(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }
    }

    /** Everything a rule may look at. */
    public record RuleContext(ComprehensiveFeatureSet features, LearningMomentumIndex lmi, DropoutRiskScore drs) {}

    public record DropoutClassification(boolean dropoutDetected,
                                        List<DropoutType> dropoutTypes,
                                        String reason,
                                        String recommendation,
                                        InterventionType interventionType,
                                        Urgency urgency,
                                        boolean shouldIntervene,
                                        double confidence) {}
}
