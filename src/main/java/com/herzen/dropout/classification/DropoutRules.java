package com.herzen.dropout.classification;

import com.herzen.dropout.classification.ClassificationModels.DropoutType;
import com.herzen.dropout.classification.ClassificationModels.RuleContext;
import com.herzen.dropout.features.SignalModels.ComprehensiveFeatureSet;
import com.herzen.dropout.scoring.ScoringModels.MomentumDirection;

import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/** The default rule table. Rules of one type share a reason template. */
public final class DropoutRules {
    private static final Function<RuleContext, String> COGNITIVE_REASON = ctx -> {
        String gap = ctx.features().reasoning().conceptualGapDescription();
        return "Cognitive: " + (gap == null || gap.isBlank() ? "Conceptual understanding declining" : gap);
    };

    private static final Function<RuleContext, String> BEHAVIORAL_REASON = ctx -> String.format(Locale.ROOT,
            "Behavioral: Inconsistent engagement pattern (consistency: %.0f%%)",
            ctx.features().behavioral().consistencyScore());

    private static final Function<RuleContext, String> ENGAGEMENT_REASON = ctx -> {
        // pressure wording only when an actual rank drop is known
        Integer delta = ctx.features().competition().rankDelta();
        return delta != null && delta > 0
                ? "Engagement: Motivation declining under competition pressure"
                : "Engagement: Effort and focus declining over time";
    };

    private static final Function<RuleContext, String> SILENT_REASON = ctx -> String.format(Locale.ROOT,
            "Silent: Learning momentum collapsing despite steady activity (LMI: %.1f, trend: %s)",
            ctx.lmi().value(), ctx.lmi().direction());

    private DropoutRules() {}

    public static List<DropoutRule> defaults() {
        return List.of(
                new DropoutRule(DropoutType.COGNITIVE, "low-momentum-shallow-changes",
                        ctx -> ctx.lmi().value() < 40 && semantic(ctx) < 30, COGNITIVE_REASON),
                new DropoutRule(DropoutType.COGNITIVE, "repeated-misconceptions",
                        ctx -> f(ctx).reasoning().misconceptionPatterns().size() >= 2 && improvement(ctx) < 40,
                        COGNITIVE_REASON),
                new DropoutRule(DropoutType.COGNITIVE, "many-attempts-no-reasoning-change",
                        ctx -> attempts(ctx) >= 3 && semantic(ctx) < 20 && improvement(ctx) < 35, COGNITIVE_REASON),
                new DropoutRule(DropoutType.COGNITIVE, "stalled-low-analyzer-confidence",
                        ctx -> f(ctx).stagnation().stalled() && f(ctx).reasoning().confidenceEstimate() < 0.4,
                        COGNITIVE_REASON),

                new DropoutRule(DropoutType.BEHAVIORAL, "inconsistent-widening-gaps",
                        ctx -> consistency(ctx) < 40 && gapIncreasing(ctx), BEHAVIORAL_REASON),
                new DropoutRule(DropoutType.BEHAVIORAL, "assisted-and-inconsistent",
                        ctx -> f(ctx).integrity().externalAssistanceLikelihood() > 0.7 && consistency(ctx) < 50,
                        BEHAVIORAL_REASON),
                new DropoutRule(DropoutType.BEHAVIORAL, "long-absence",
                        ctx -> f(ctx).behavioral().attemptGapSeconds().stream().anyMatch(g -> g > 600),
                        BEHAVIORAL_REASON),

                new DropoutRule(DropoutType.ENGAGEMENT, "slow-and-inconsistent",
                        ctx -> f(ctx).learningProgress().attemptFrequency() < 0.2 && consistency(ctx) < 50,
                        ENGAGEMENT_REASON),
                new DropoutRule(DropoutType.ENGAGEMENT, "competition-pressure",
                        ctx -> f(ctx).competition().competitionPressureFlag() && improvement(ctx) < 40,
                        ENGAGEMENT_REASON),
                new DropoutRule(DropoutType.ENGAGEMENT, "no-progress",
                        ctx -> f(ctx).learningProgress().noProgressFlag() && consistency(ctx) < 60,
                        ENGAGEMENT_REASON),
                new DropoutRule(DropoutType.ENGAGEMENT, "widening-gaps",
                        ctx -> gapIncreasing(ctx) && attempts(ctx) >= 3, ENGAGEMENT_REASON),

                new DropoutRule(DropoutType.SILENT, "decelerating-while-active",
                        ctx -> ctx.lmi().direction() == MomentumDirection.DECELERATING
                                && ctx.lmi().value() < 50
                                && consistency(ctx) > 50
                                && !gapIncreasing(ctx)
                                && (semantic(ctx) < 25 || f(ctx).learningProgress().noProgressFlag()),
                        SILENT_REASON),
                new DropoutRule(DropoutType.SILENT, "low-momentum-high-risk-no-gaps",
                        ctx -> ctx.lmi().value() < 35 && ctx.drs().value() > 0.7
                                && f(ctx).behavioral().attemptGapSeconds().isEmpty(),
                        SILENT_REASON)
        );
    }

    private static ComprehensiveFeatureSet f(RuleContext ctx) {
        return ctx.features();
    }

    private static int attempts(RuleContext ctx) {
        return ctx.features().learningProgress().attemptCount();
    }

    private static double semantic(RuleContext ctx) {
        return ctx.features().learningProgress().semanticChangeScore();
    }

    private static double improvement(RuleContext ctx) {
        return ctx.features().learningProgress().improvementScore();
    }

    private static double consistency(RuleContext ctx) {
        return ctx.features().behavioral().consistencyScore();
    }

    private static boolean gapIncreasing(RuleContext ctx) {
        return ctx.features().behavioral().averageGapIncreasing();
    }
}
