package com.herzen.dropout.scoring;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ScoringModels {
    public enum MomentumDirection { ACCELERATING, STABLE, DECELERATING }

    public enum RiskLevel { LOW, MEDIUM, HIGH, CRITICAL }

    public enum RiskComponent {
        MOMENTUM("Declining learning momentum"),
        STAGNATION("Stagnation on problem"),
        BEHAVIORAL("Reduced effort/consistency"),
        INTEGRITY("Authenticity concerns"),
        COMPETITION("Competition pressure"),
        ENGAGEMENT("Engagement declining");

        private final String label;

        RiskComponent(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    /** LMI in [0,100]; higher means healthier forward progress. */
    public record LearningMomentumIndex(double value, MomentumDirection direction, double decayRate) {}

    public record RiskComponents(double momentum,
                                 double stagnation,
                                 double behavioral,
                                 double integrity,
                                 double competition,
                                 double engagement) {
        public static RiskComponents zero() {
            return new RiskComponents(0, 0, 0, 0, 0, 0);
        }

        public Map<RiskComponent, Double> asMap() {
            Map<RiskComponent, Double> out = new LinkedHashMap<>();
            out.put(RiskComponent.MOMENTUM, momentum);
            out.put(RiskComponent.STAGNATION, stagnation);
            out.put(RiskComponent.BEHAVIORAL, behavioral);
            out.put(RiskComponent.INTEGRITY, integrity);
            out.put(RiskComponent.COMPETITION, competition);
            out.put(RiskComponent.ENGAGEMENT, engagement);
            return out;
        }
    }

    public record RiskFactor(RiskComponent component, String label, double score) {}

    /** DRS in [0,1]; higher means greater dropout risk. */
    public record DropoutRiskScore(double value,
                                   RiskLevel level,
                                   double confidence,
                                   List<RiskFactor> riskFactors,
                                   RiskComponents components) {
        public boolean hasFactor(RiskComponent component) {
            return riskFactors.stream().anyMatch(f -> f.component() == component);
        }
    }
}
