package com.herzen.dropout.view;

import com.herzen.dropout.classification.DropoutAssessment;
import com.herzen.dropout.features.SignalModels.*;
import com.herzen.dropout.view.ViewModels.GrowthArea;
import com.herzen.dropout.view.ViewModels.StudentFeedback;
import com.herzen.dropout.view.ViewModels.SupportAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Supportive feedback for the learner. Scores, risk levels, classification labels and analyzer
 * wording never reach this view; stagnation, misconceptions and disengagement come out as
 * growth areas with fixed messages.
 */
@Component
public class StudentViewGenerator {
    static final List<String> ENCOURAGEMENTS = List.of(
            "Every attempt teaches you something new.",
            "You are building problem-solving skills that will last.",
            "Struggling with a problem is part of learning it.",
            "Your persistence is paying off. Keep it up!",
            "Learning is not a straight line, and setbacks are part of progress.",
            "Mastery takes time and effort, and you are putting in both.",
            "Trust the process. Your effort adds up."
    );

    static final String CONCEPT_REVIEW = "Let's revisit the key idea behind this problem. "
            + "Understanding it well will help with similar problems.";
    static final String PATTERN_REVIEW = "A few of your answers follow the same pattern. "
            + "Let's revisit the key idea behind this problem before the next try.";

    public StudentFeedback generate(DropoutAssessment assessment) {
        ComprehensiveFeatureSet features = assessment.features();
        LearningProgressSignals progress = features.learningProgress();
        StagnationSignals stagnation = features.stagnation();
        BehavioralDisengagementSignals behavioral = features.behavioral();
        ReasoningInsight reasoning = features.reasoning();

        List<String> strengths = new ArrayList<>();
        if (progress.improvementScore() > 60) {
            strengths.add("You are showing solid improvement on this topic!");
        }
        if (progress.attemptCount() > 1 && !stagnation.stalled()) {
            strengths.add("Great persistence: you keep working through the challenge.");
        }
        if (progress.attemptCount() > 0 && behavioral.consistencyScore() > 70) {
            strengths.add("Your work rhythm is steady and focused.");
        }

        List<GrowthArea> growthAreas = new ArrayList<>();
        if (stagnation.stalled()) {
            growthAreas.add(new GrowthArea("Try a Different Approach",
                    String.format(Locale.ROOT, "You have spent %.0f minutes on this problem. Stepping back and "
                            + "looking at it from another angle often helps. Would you like a hint?",
                            stagnation.stagnationDurationMinutes()),
                    SupportAction.OFFER_HINT));
        }
        if (!reasoning.misconceptionPatterns().isEmpty()) {
            growthAreas.add(new GrowthArea("Concept Reinforcement",
                    reasoning.misconceptionPatterns().size() >= 2 ? PATTERN_REVIEW : CONCEPT_REVIEW,
                    SupportAction.SUGGEST_RESOURCE));
        }
        if (behavioral.averageGapIncreasing()) {
            growthAreas.add(new GrowthArea("Stay Engaged",
                    "Your breaks between attempts are getting longer. Keep the momentum going, you are close!",
                    SupportAction.MOTIVATIONAL_CHECK_IN));
        }
        if (progress.semanticChangeScore() < 40 && progress.attemptCount() >= 3) {
            growthAreas.add(new GrowthArea("Deepen Your Understanding",
                    "Your answers are changing, so let's focus on the idea underneath them.",
                    SupportAction.CONCEPTUAL_SUPPORT));
        }

        return new StudentFeedback(
                UserRole.STUDENT,
                features.studentId(),
                features.questionId(),
                features.asOf(),
                List.copyOf(strengths),
                List.copyOf(growthAreas),
                growthAreas.stream().map(GrowthArea::message).toList(),
                difficultySuggestion(progress.learningState()),
                ENCOURAGEMENTS.get(progress.attemptCount() % ENCOURAGEMENTS.size()),
                progressSummary(progress)
        );
    }

    private static String difficultySuggestion(LearningState state) {
        return switch (state) {
            case PROGRESSING -> "You are ready for a challenge! Try the next problem level.";
            case PLATEAU -> "Keep practicing at this level and you will break through soon.";
            case STALLED -> "Let's review the fundamentals to build a stronger foundation.";
        };
    }

    private static String progressSummary(LearningProgressSignals progress) {
        if (progress.attemptCount() == 0) return "Ready when you are.";
        return switch (progress.learningState()) {
            case PROGRESSING -> "You are moving forward!";
            case PLATEAU -> "You are building strength.";
            case STALLED -> "Time for a new strategy.";
        };
    }
}
