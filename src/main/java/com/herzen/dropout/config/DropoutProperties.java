package com.herzen.dropout.config;

import com.herzen.dropout.event.OrderingScope;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunable settings of the detection pipeline, bound from {@code dropout.*}.
 *
 * <p>Scoring weights and cut-offs are empirically chosen defaults; the DRS weights are expected
 * to sum to 1.0 but this is not enforced.
 */
@ConfigurationProperties(prefix = "dropout")
public class DropoutProperties {

    private final Events events = new Events();
    private final Scoring scoring = new Scoring();
    private final Reasoning reasoning = new Reasoning();

    public Events getEvents() {
        return events;
    }

    public Scoring getScoring() {
        return scoring;
    }

    public Reasoning getReasoning() {
        return reasoning;
    }

    public static class Events {
        /** Scope of the monotonic timestamp check on recorded events. */
        private OrderingScope orderingScope = OrderingScope.GLOBAL;

        public OrderingScope getOrderingScope() {
            return orderingScope;
        }

        public void setOrderingScope(OrderingScope orderingScope) {
            this.orderingScope = orderingScope;
        }
    }

    public static class Scoring {
        private double lmiWeight = 0.35;
        private double stagnationWeight = 0.25;
        private double behavioralWeight = 0.15;
        private double integrityWeight = 0.10;
        private double competitionWeight = 0.10;
        private double engagementWeight = 0.05;

        /** Stagnation beyond this many minutes costs the smaller LMI penalty. */
        private double shortStagnationMinutes = 15;
        /** Stagnation beyond this many minutes costs the larger LMI penalty. */
        private double longStagnationMinutes = 30;
        private double stalledPenalty = 40;
        private double longStagnationPenalty = 25;
        private double shortStagnationPenalty = 15;

        /** LMI reported when a key has no attempts yet. */
        private double neutralLmi = 50;
        private double trendDelta = 5;

        private double lowRiskBelow = 0.3;
        private double mediumRiskBelow = 0.6;
        private double highRiskBelow = 0.8;

        /** Component risks above this value are reported as risk factors. */
        private double riskFactorThreshold = 0.6;

        public double getLmiWeight() {
            return lmiWeight;
        }

        public void setLmiWeight(double lmiWeight) {
            this.lmiWeight = lmiWeight;
        }

        public double getStagnationWeight() {
            return stagnationWeight;
        }

        public void setStagnationWeight(double stagnationWeight) {
            this.stagnationWeight = stagnationWeight;
        }

        public double getBehavioralWeight() {
            return behavioralWeight;
        }

        public void setBehavioralWeight(double behavioralWeight) {
            this.behavioralWeight = behavioralWeight;
        }

        public double getIntegrityWeight() {
            return integrityWeight;
        }

        public void setIntegrityWeight(double integrityWeight) {
            this.integrityWeight = integrityWeight;
        }

        public double getCompetitionWeight() {
            return competitionWeight;
        }

        public void setCompetitionWeight(double competitionWeight) {
            this.competitionWeight = competitionWeight;
        }

        public double getEngagementWeight() {
            return engagementWeight;
        }

        public void setEngagementWeight(double engagementWeight) {
            this.engagementWeight = engagementWeight;
        }

        public double getShortStagnationMinutes() {
            return shortStagnationMinutes;
        }

        public void setShortStagnationMinutes(double shortStagnationMinutes) {
            this.shortStagnationMinutes = shortStagnationMinutes;
        }

        public double getLongStagnationMinutes() {
            return longStagnationMinutes;
        }

        public void setLongStagnationMinutes(double longStagnationMinutes) {
            this.longStagnationMinutes = longStagnationMinutes;
        }

        public double getStalledPenalty() {
            return stalledPenalty;
        }

        public void setStalledPenalty(double stalledPenalty) {
            this.stalledPenalty = stalledPenalty;
        }

        public double getLongStagnationPenalty() {
            return longStagnationPenalty;
        }

        public void setLongStagnationPenalty(double longStagnationPenalty) {
            this.longStagnationPenalty = longStagnationPenalty;
        }

        public double getShortStagnationPenalty() {
            return shortStagnationPenalty;
        }

        public void setShortStagnationPenalty(double shortStagnationPenalty) {
            this.shortStagnationPenalty = shortStagnationPenalty;
        }

        public double getNeutralLmi() {
            return neutralLmi;
        }

        public void setNeutralLmi(double neutralLmi) {
            this.neutralLmi = neutralLmi;
        }

        public double getTrendDelta() {
            return trendDelta;
        }

        public void setTrendDelta(double trendDelta) {
            this.trendDelta = trendDelta;
        }

        public double getLowRiskBelow() {
            return lowRiskBelow;
        }

        public void setLowRiskBelow(double lowRiskBelow) {
            this.lowRiskBelow = lowRiskBelow;
        }

        public double getMediumRiskBelow() {
            return mediumRiskBelow;
        }

        public void setMediumRiskBelow(double mediumRiskBelow) {
            this.mediumRiskBelow = mediumRiskBelow;
        }

        public double getHighRiskBelow() {
            return highRiskBelow;
        }

        public void setHighRiskBelow(double highRiskBelow) {
            this.highRiskBelow = highRiskBelow;
        }

        public double getRiskFactorThreshold() {
            return riskFactorThreshold;
        }

        public void setRiskFactorThreshold(double riskFactorThreshold) {
            this.riskFactorThreshold = riskFactorThreshold;
        }
    }

    public static class Reasoning {
        /** {@code heuristic} or {@code openai}. */
        private String provider = "heuristic";
        private long timeoutMs = 3000;
        private int threads = 2;
        private String baseUrl = "https://api.openai.com";
        private String apiKey;
        private String model = "gpt-4o-mini";

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }
    }
}
